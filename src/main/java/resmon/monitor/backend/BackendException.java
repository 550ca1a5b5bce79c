package resmon.monitor.backend;

/**
 * Base class for failures talking to the batch system.
 */
public class BackendException extends Exception {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
