package win.ixuni.nimbus.client.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.auth.CredentialsProvider;
import win.ixuni.nimbus.core.auth.SigningCredential;
import win.ixuni.nimbus.core.exception.InvalidArgumentException;
import win.ixuni.nimbus.core.exception.SigningUnavailableException;
import win.ixuni.nimbus.core.signing.SignedUrlBuilder;
import win.ixuni.nimbus.core.signing.SignedUrlRequest;
import win.ixuni.nimbus.core.signing.SigningKeys;

import java.security.PrivateKey;

/**
 * Signed URL service
 * <p>
 * Resolves the signing credential, then hands off to {@link SignedUrlBuilder}.
 * Each part of the credential is taken from the request when present and from the ambient
 * {@link CredentialsProvider} otherwise:
 * <ul>
 *     <li>private key: {@code signingKey} &gt; {@code signingKeyPem} &gt; ambient key</li>
 *     <li>issuer: {@code issuer} &gt; ambient issuer</li>
 * </ul>
 * If either part is still missing the result is a {@link SigningUnavailableException}.
 */
@Slf4j
@RequiredArgsConstructor
public class SignedUrlService {

    private final SignedUrlBuilder signedUrlBuilder;
    private final CredentialsProvider credentialsProvider;
    private final SigningKeys signingKeys;

    /**
     * Generate a signed URL
     *
     * @param request bucket, path and signing options
     * @return the signed URL
     */
    public Mono<String> signedUrl(SignedUrlRequest request) {
        return resolveCredential(request)
                .map(credential -> signedUrlBuilder.build(request, credential));
    }

    /**
     * Generate a signed download URL (GET)
     *
     * @param bucket    Bucket 名称
     * @param path      对象路径
     * @param expiresIn expiration period (seconds)
     */
    public Mono<String> signedGetUrl(String bucket, String path, long expiresIn) {
        return signedUrl(SignedUrlRequest.builder()
                .bucket(bucket)
                .path(path)
                .expiresIn(expiresIn)
                .build());
    }

    /**
     * Generate a signed upload URL (PUT)
     *
     * @param bucket      Bucket 名称
     * @param path        对象路径
     * @param expiresIn   expiration period (seconds)
     * @param contentType 内容类型（可选）
     */
    public Mono<String> signedPutUrl(String bucket, String path, long expiresIn, String contentType) {
        return signedUrl(SignedUrlRequest.builder()
                .bucket(bucket)
                .path(path)
                .method("PUT")
                .expiresIn(expiresIn)
                .contentType(contentType)
                .build());
    }

    Mono<SigningCredential> resolveCredential(SignedUrlRequest request) {
        return Mono.defer(() -> {
            if (request == null) {
                return Mono.error(new InvalidArgumentException("Signed URL request must not be null"));
            }

            String issuer = hasText(request.getIssuer()) ? request.getIssuer().trim() : null;
            PrivateKey key = request.getSigningKey();
            if (key == null && request.getSigningKeyPem() != null) {
                key = signingKeys.parse(request.getSigningKeyPem());
            }

            if (issuer != null && key != null) {
                return Mono.just(SigningCredential.builder().issuer(issuer).privateKey(key).build());
            }

            String explicitIssuer = issuer;
            PrivateKey explicitKey = key;
            return credentialsProvider.getCredential()
                    .onErrorMap(e -> !(e instanceof SigningUnavailableException),
                            e -> new SigningUnavailableException("Ambient credential lookup failed: " + e.getMessage(), e))
                    .map(ambient -> SigningCredential.builder()
                            .issuer(explicitIssuer != null ? explicitIssuer : ambient.getIssuer())
                            .privateKey(explicitKey != null ? explicitKey : ambient.getPrivateKey())
                            .build())
                    .defaultIfEmpty(SigningCredential.builder()
                            .issuer(explicitIssuer)
                            .privateKey(explicitKey)
                            .build())
                    .flatMap(this::requireComplete);
        });
    }

    private Mono<SigningCredential> requireComplete(SigningCredential credential) {
        if (!hasText(credential.getIssuer())) {
            return Mono.error(new SigningUnavailableException(
                    "No issuer for signed URL: pass one explicitly or configure nimbus.signing.issuer / nimbus.signing.key-file"));
        }
        if (credential.getPrivateKey() == null) {
            return Mono.error(new SigningUnavailableException(
                    "No private key for signed URL: pass one explicitly or configure nimbus.signing.private-key / nimbus.signing.key-file"));
        }
        log.debug("Resolved signing credential for {}", credential.getIssuer());
        return Mono.just(credential);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
