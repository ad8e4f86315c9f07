package win.ixuni.nimbus.client.auth;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.auth.CredentialsProvider;
import win.ixuni.nimbus.core.auth.SigningCredential;
import win.ixuni.nimbus.core.config.NimbusProperties;
import win.ixuni.nimbus.core.signing.SigningKeys;

/**
 * Configuration-based static credentials provider
 * <p>
 * Reads {@code nimbus.signing.issuer} and {@code nimbus.signing.private-key}; empty unless both are set.
 */
@RequiredArgsConstructor
public class StaticCredentialsProvider implements CredentialsProvider {

    private final NimbusProperties.SigningConfig signingConfig;
    private final SigningKeys signingKeys;

    @Override
    public Mono<SigningCredential> getCredential() {
        String issuer = signingConfig.getIssuer();
        String privateKey = signingConfig.getPrivateKey();
        if (issuer == null || issuer.isBlank() || privateKey == null || privateKey.isBlank()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> SigningCredential.builder()
                .issuer(issuer.trim())
                .privateKey(signingKeys.parse(privateKey))
                .build());
    }

    @Override
    public String getDescription() {
        return "static";
    }
}
