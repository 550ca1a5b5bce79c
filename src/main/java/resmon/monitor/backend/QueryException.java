package resmon.monitor.backend;

/**
 * A status or history query could not be answered. Treated as transient.
 */
public class QueryException extends BackendException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
