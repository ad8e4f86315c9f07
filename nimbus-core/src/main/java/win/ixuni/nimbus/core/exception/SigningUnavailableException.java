package win.ixuni.nimbus.core.exception;

/**
 * No usable signing credential could be resolved
 * <p>
 * Raised for a missing issuer, a missing private key, or key material that cannot be parsed.
 * Retrying with the same configuration cannot succeed.
 */
public class SigningUnavailableException extends NimbusException {

    public SigningUnavailableException(String message) {
        super("SigningUnavailable", message);
    }

    public SigningUnavailableException(String message, Throwable cause) {
        super("SigningUnavailable", message, cause);
    }
}
