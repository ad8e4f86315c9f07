package win.ixuni.nimbus.core.signing;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.security.PrivateKey;
import java.util.List;
import java.util.Map;

/**
 * Signed URL request
 * <p>
 * Everything a caller can say about the URL it wants. Only {@code bucket} and {@code path} are required.
 * <p>
 * Usage example:
 *
 * <pre>
 * SignedUrlRequest request = SignedUrlRequest.builder()
 *         .bucket("my-todo-app")
 *         .path("avatars/heidi/400x400.png")
 *         .method("PUT")
 *         .contentType("image/png")
 *         .expiresIn(300L)
 *         .header("x-goog-acl", List.of("private"))
 *         .build();
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class SignedUrlRequest {

    /**
     * Bucket name
     */
    String bucket;

    /**
     * Object path, may contain '/'
     */
    String path;

    /**
     * HTTP verb, GET when unset
     */
    @Builder.Default
    String method = "GET";

    /**
     * Seconds from now until the URL expires, the builder default when unset
     */
    Long expiresIn;

    /**
     * Content-Type the client must send
     */
    String contentType;

    /**
     * Base64 MD5 digest the client must send as Content-MD5
     */
    String contentMd5;

    /**
     * Request headers; only x-goog- extension headers are signed
     */
    @Singular
    Map<String, List<String>> headers;

    /**
     * Extra query parameters, appended in insertion order and NOT covered by the signature
     */
    @Singular("queryParameter")
    Map<String, String> query;

    /**
     * Explicit service account email, overrides the ambient credential
     */
    String issuer;

    /**
     * Explicit private key, overrides {@link #signingKeyPem} and the ambient credential
     */
    @ToString.Exclude
    PrivateKey signingKey;

    /**
     * Explicit PEM private key, parsed once before signing
     */
    @ToString.Exclude
    String signingKeyPem;
}
