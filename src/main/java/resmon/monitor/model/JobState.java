package resmon.monitor.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a single probe job.
 */
public enum JobState {
    /** Built from a probe definition, not yet handed to the batch system */
    CREATED,
    /** Accepted by the batch system, cluster id assigned */
    SUBMITTED,
    /** Consuming the job's event log */
    MONITORING,
    /** Normal termination with return value 0 */
    TERMINATED_OK,
    /** Non-zero return value or killed by a signal */
    TERMINATED_FAIL,
    /** Aborted, held or removed by the batch system, or an unmodelled event */
    ABORTED,
    /** Deadline passed; we asked the batch system to remove the job */
    TIMED_OUT,
    /** Output artifact and accounting data collected */
    RESULTS_COLLECTED,
    /** Result record handed to the metrics sink */
    REPORTED;

    private static final Set<JobState> OUTCOMES = EnumSet.of(TERMINATED_OK, TERMINATED_FAIL, ABORTED, TIMED_OUT);

    /** True for the four states that end monitoring. */
    public boolean isOutcome() {
        return OUTCOMES.contains(this);
    }

    /** Check whether a transition from this state to {@code next} is allowed. */
    public boolean canMoveTo(JobState next) {
        return switch (this) {
            case CREATED -> next == SUBMITTED;
            case SUBMITTED -> next == MONITORING || next.isOutcome();
            case MONITORING -> next.isOutcome();
            case TERMINATED_OK, TERMINATED_FAIL, ABORTED, TIMED_OUT -> next == RESULTS_COLLECTED;
            case RESULTS_COLLECTED -> next == REPORTED;
            case REPORTED -> false;
        };
    }
}
