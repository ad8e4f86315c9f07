package win.ixuni.nimbus.core.signing;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.nimbus.core.auth.SigningCredential;
import win.ixuni.nimbus.core.exception.InvalidArgumentException;
import win.ixuni.nimbus.core.exception.SigningUnavailableException;
import win.ixuni.nimbus.core.util.UriEncodingUtils;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.Set;

/**
 * Signed URL builder
 * <p>
 * Produces query-string signed URLs of the form
 * {@code {endpoint}/{bucket}/{path}?GoogleAccessId=..&Expires=..&Signature=..}.
 * The signature is SHA256withRSA over {@link SignableRequest#toCanonicalString()}, base64 encoded and
 * then percent-encoded.
 * <p>
 * Expiration is always relative: {@code expiresIn} seconds after the builder clock's current time.
 * A URL is built even if that lands in the past; the storage service rejects it on use.
 * <p>
 * Stateless and thread-safe.
 */
@Slf4j
public class SignedUrlBuilder {

    public static final String DEFAULT_ENDPOINT = "https://storage.googleapis.com";
    public static final long DEFAULT_EXPIRES = 300;

    private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

    private static final String PARAM_ACCESS_ID = "GoogleAccessId";
    private static final String PARAM_EXPIRES = "Expires";
    private static final String PARAM_SIGNATURE = "Signature";
    private static final Set<String> SIGNATURE_PARAMS = Set.of(PARAM_ACCESS_ID, PARAM_EXPIRES, PARAM_SIGNATURE);

    private final String endpoint;
    private final long defaultExpires;
    private final Clock clock;

    public SignedUrlBuilder() {
        this(DEFAULT_ENDPOINT, DEFAULT_EXPIRES, Clock.systemUTC());
    }

    public SignedUrlBuilder(String endpoint, long defaultExpires, Clock clock) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must not be blank");
        }
        if (defaultExpires <= 0) {
            throw new IllegalArgumentException("defaultExpires must be positive: " + defaultExpires);
        }
        this.endpoint = stripTrailingSlash(endpoint.trim());
        this.defaultExpires = defaultExpires;
        this.clock = clock;
    }

    /**
     * Build a signed URL
     *
     * @param request    what to sign
     * @param credential resolved issuer and private key
     * @return the signed URL
     * @throws SigningUnavailableException if the credential lacks an issuer or key, or signing fails
     * @throws InvalidArgumentException    if the request is malformed
     */
    public String build(SignedUrlRequest request, SigningCredential credential) {
        requireUsable(credential);
        SignableRequest signable = toSignableRequest(request);
        validateQuery(request.getQuery());

        String signature = sign(signable.toCanonicalString(), credential.getPrivateKey());

        StringBuilder url = new StringBuilder(endpoint)
                .append(signable.getResourcePath())
                .append('?').append(PARAM_ACCESS_ID).append('=').append(encode(credential.getIssuer()))
                .append('&').append(PARAM_EXPIRES).append('=').append(signable.getExpiration())
                .append('&').append(PARAM_SIGNATURE).append('=').append(encode(signature));

        // 额外的查询参数不参与签名
        if (request.getQuery() != null) {
            for (Map.Entry<String, String> entry : request.getQuery().entrySet()) {
                url.append('&').append(encode(entry.getKey()))
                        .append('=').append(encode(entry.getValue()));
            }
        }

        log.debug("Signed {} URL for {} as {}, expires at {}",
                signable.getMethod(), signable.getResourcePath(), credential.getIssuer(), signable.getExpiration());
        return url.toString();
    }

    /**
     * Validate a request and reduce it to its signable fields
     *
     * @throws InvalidArgumentException if the request is malformed
     */
    public SignableRequest toSignableRequest(SignedUrlRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("Signed URL request must not be null");
        }
        if (request.getBucket() == null || request.getBucket().isBlank()) {
            throw new InvalidArgumentException("Bucket name must not be empty");
        }
        if (request.getPath() == null || request.getPath().isEmpty()) {
            throw new InvalidArgumentException("Object path must not be empty");
        }

        SignedUrlMethod method = SignedUrlMethod.parse(request.getMethod());

        long expiresIn = request.getExpiresIn() != null ? request.getExpiresIn() : defaultExpires;
        if (expiresIn <= 0) {
            throw new InvalidArgumentException("Expiration must be a positive number of seconds: " + expiresIn);
        }

        long expiration;
        try {
            expiration = Math.addExact(clock.instant().getEpochSecond(), expiresIn);
        } catch (ArithmeticException e) {
            throw new InvalidArgumentException("Expiration is out of range: " + expiresIn + " seconds");
        }

        String resourcePath;
        try {
            resourcePath = "/" + UriEncodingUtils.encode(request.getBucket())
                    + "/" + UriEncodingUtils.encodePath(request.getPath());
        } catch (CharacterCodingException e) {
            throw new InvalidArgumentException("Object path cannot be URL-escaped: " + request.getPath());
        }

        return SignableRequest.builder()
                .method(method)
                .resourcePath(resourcePath)
                .expiration(expiration)
                .contentMd5(request.getContentMd5())
                .contentType(request.getContentType())
                .canonicalExtensionHeaders(ExtensionHeaders.canonicalize(request.getHeaders()))
                .build();
    }

    private void requireUsable(SigningCredential credential) {
        if (credential == null) {
            throw new SigningUnavailableException("No signing credential available");
        }
        if (credential.getIssuer() == null || credential.getIssuer().isBlank()) {
            throw new SigningUnavailableException("Signing credential has no issuer");
        }
        if (credential.getPrivateKey() == null) {
            throw new SigningUnavailableException("Signing credential has no private key");
        }
    }

    private void validateQuery(Map<String, String> query) {
        if (query == null) {
            return;
        }
        for (Map.Entry<String, String> entry : query.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new InvalidArgumentException("Query parameter name must not be empty");
            }
            if (SIGNATURE_PARAMS.contains(entry.getKey())) {
                throw new InvalidArgumentException("Query parameter is reserved for the signature: " + entry.getKey());
            }
        }
    }

    private String sign(String canonical, PrivateKey privateKey) {
        try {
            Signature signer = Signature.getInstance(SIGNATURE_ALGORITHM);
            signer.initSign(privateKey);
            signer.update(canonical.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new SigningUnavailableException("Failed to sign URL with the supplied private key", e);
        }
    }

    private String encode(String value) {
        if (value == null) {
            return "";
        }
        try {
            return UriEncodingUtils.encode(value);
        } catch (CharacterCodingException e) {
            throw new InvalidArgumentException("Value cannot be URL-escaped: " + value);
        }
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
