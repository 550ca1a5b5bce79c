package resmon.monitor.model;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of a job event log.
 *
 * @param clusterId  cluster the event belongs to
 * @param procId     process index inside the cluster
 * @param type       event type
 * @param attributes event specific values, e.g. {@code TerminatedNormally}, {@code ReturnValue}
 */
public record JobEvent(long clusterId, int procId, JobEventType type, Map<String, String> attributes) {

    public static final String TERMINATED_NORMALLY = "TerminatedNormally";
    public static final String RETURN_VALUE = "ReturnValue";
    public static final String TERMINATED_BY_SIGNAL = "TerminatedBySignal";
    /** Hold, abort or removal reason as written by the batch system. */
    public static final String REASON = "Reason";

    public JobEvent {
        Objects.requireNonNull(type, "type is required");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public JobEvent(long clusterId, int procId, JobEventType type) {
        this(clusterId, procId, type, Map.of());
    }

    public boolean terminatedNormally() {
        return Boolean.parseBoolean(attributes.get(TERMINATED_NORMALLY));
    }

    /** Reason of a hold, abort or removal, or null if none was given. */
    public String reason() {
        return attributes.get(REASON);
    }

    /** Return value of a normally terminated job, or -1 if unknown. */
    public int returnValue() {
        return intAttribute(RETURN_VALUE);
    }

    /** Signal number of an abnormally terminated job, or -1 if unknown. */
    public int terminatedBySignal() {
        return intAttribute(TERMINATED_BY_SIGNAL);
    }

    private int intAttribute(String key) {
        String value = attributes.get(key);
        if (value == null) {
            return -1;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
