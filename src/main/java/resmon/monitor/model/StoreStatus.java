package resmon.monitor.model;

/**
 * Coarse job status as persisted in the {@code jobs.status} column.
 * The integer codes are part of the on-disk format.
 */
public enum StoreStatus {
    COMPLETED(1),
    SUBMITTED(2);

    private final int code;

    StoreStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static StoreStatus fromCode(int code) {
        for (StoreStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown store status code: " + code);
    }
}
