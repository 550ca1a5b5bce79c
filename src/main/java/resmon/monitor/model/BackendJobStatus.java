package resmon.monitor.model;

/**
 * HTCondor {@code JobStatus} attribute values.
 */
public enum BackendJobStatus {
    IDLE(1),
    RUNNING(2),
    REMOVED(3),
    COMPLETED(4),
    HELD(5),
    TRANSFERRING_OUTPUT(6),
    SUSPENDED(7),
    UNKNOWN(0);

    private final int code;

    BackendJobStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Job still sits in the queue and will produce further events. */
    public boolean isActive() {
        return this == IDLE || this == RUNNING || this == HELD
                || this == TRANSFERRING_OUTPUT || this == SUSPENDED;
    }

    public static BackendJobStatus fromCode(int code) {
        for (BackendJobStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        return UNKNOWN;
    }
}
