package resmon.monitor.backend;

/**
 * The batch system refused or failed to accept a job. Fatal for that job instance.
 */
public class SubmissionException extends BackendException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
