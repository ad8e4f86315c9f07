package win.ixuni.nimbus.core.signing;

import win.ixuni.nimbus.core.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * HTTP verbs the storage service accepts on a signed URL
 */
public enum SignedUrlMethod {
    GET,
    HEAD,
    PUT,
    DELETE;

    /**
     * Parse a verb case-insensitively
     *
     * @param method verb name, null means GET
     * @throws InvalidArgumentException for any other verb
     */
    public static SignedUrlMethod parse(String method) {
        if (method == null) {
            return GET;
        }
        try {
            return valueOf(method.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Unsupported HTTP method for signed URL: " + method);
        }
    }
}
