package win.ixuni.nimbus.client.auth;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.nimbus.core.auth.CredentialsProvider;
import win.ixuni.nimbus.core.auth.SigningCredential;
import win.ixuni.nimbus.core.exception.SigningUnavailableException;
import win.ixuni.nimbus.core.signing.SigningKeys;
import win.ixuni.nimbus.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Service account key file credentials provider
 * <p>
 * The file is read on first use and the outcome is cached. A missing file yields empty;
 * a file that exists but cannot be used is an error.
 */
@Slf4j
public class KeyFileCredentialsProvider implements CredentialsProvider {

    private final Path keyFile;
    private final SigningKeys signingKeys;
    private final Mono<SigningCredential> credential;

    public KeyFileCredentialsProvider(Path keyFile, SigningKeys signingKeys) {
        this.keyFile = keyFile;
        this.signingKeys = signingKeys;
        this.credential = Mono.defer(this::load).cache();
    }

    @Override
    public Mono<SigningCredential> getCredential() {
        return credential;
    }

    @Override
    public String getDescription() {
        return "key-file(" + keyFile + ")";
    }

    private Mono<SigningCredential> load() {
        if (!Files.exists(keyFile)) {
            log.warn("Service account key file not found: {}", keyFile);
            return Mono.empty();
        }
        return Mono.fromCallable(this::readKeyFile)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(e -> log.warn("Unable to load service account key file {}: {}", keyFile, e.getMessage()));
    }

    private SigningCredential readKeyFile() {
        ServiceAccountKey key;
        try (InputStream in = Files.newInputStream(keyFile)) {
            key = JsonUtils.fromJson(in, ServiceAccountKey.class);
        } catch (IOException e) {
            throw new SigningUnavailableException("Failed to read service account key file: " + keyFile, e);
        }

        if (key == null || key.getClientEmail() == null || key.getClientEmail().isBlank()) {
            throw new SigningUnavailableException("Service account key file has no client_email: " + keyFile);
        }
        if (key.getPrivateKey() == null || key.getPrivateKey().isBlank()) {
            throw new SigningUnavailableException("Service account key file has no private_key: " + keyFile);
        }

        SigningCredential loaded = SigningCredential.builder()
                .issuer(key.getClientEmail())
                .privateKey(signingKeys.parse(key.getPrivateKey()))
                .build();
        log.info("Loaded service account {} (project {}) from {}", key.getClientEmail(), key.getProjectId(), keyFile);
        return loaded;
    }
}
