package win.ixuni.nimbus.core.exception;

/**
 * Invalid signed URL argument exception
 */
public class InvalidArgumentException extends NimbusException {

    public InvalidArgumentException(String message) {
        super("InvalidArgument", message);
    }
}
