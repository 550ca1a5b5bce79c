package resmon.monitor.store;

/**
 * Failure of the persistent job store. Aborts the task that owns the record.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
