package win.ixuni.nimbus.core.signing;

import lombok.Builder;
import lombok.Value;

/**
 * The signable fields of a request, in the form the storage service verifies
 */
@Value
@Builder
public class SignableRequest {

    SignedUrlMethod method;

    /**
     * /bucket/escaped-object-path
     */
    String resourcePath;

    /**
     * Absolute expiration, Unix epoch seconds
     */
    long expiration;

    String contentMd5;

    String contentType;

    /**
     * Output of {@link ExtensionHeaders#canonicalize}, each line terminated by '\n'
     */
    String canonicalExtensionHeaders;

    /**
     * Build the string that gets signed
     * <p>
     * Fields are positional: an absent content MD5 or content type is an empty line, never dropped.
     */
    public String toCanonicalString() {
        return method.name() + "\n" +
                nullToEmpty(contentMd5) + "\n" +
                nullToEmpty(contentType) + "\n" +
                expiration + "\n" +
                nullToEmpty(canonicalExtensionHeaders) +
                resourcePath;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
