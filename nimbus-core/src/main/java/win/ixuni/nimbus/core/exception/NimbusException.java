package win.ixuni.nimbus.core.exception;

import lombok.Getter;

/**
 * Nimbus base exception
 */
@Getter
public class NimbusException extends RuntimeException {

    private final String errorCode;

    public NimbusException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public NimbusException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
