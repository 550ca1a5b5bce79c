package resmon.condor;

import resmon.monitor.model.JobEvent;
import resmon.monitor.model.JobEventType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incremental parser for the HTCondor user event log. Each event is a block:
 *
 * <pre>
 * 005 (123.000.000) 2024-05-01 10:00:00 Job terminated.
 *     (1) Normal termination (return value 0)
 *     ...
 * ...
 * </pre>
 *
 * Feed it one line at a time; an event is returned when its closing {@code ...} line arrives.
 * Not thread-safe.
 */
public final class UserLogParser {

    static final String EVENT_END = "...";

    private static final Pattern HEADER = Pattern.compile("^(\\d{3}) \\((\\d+)\\.(\\d+)\\.(\\d+)\\) (.*)$");
    private static final Pattern NORMAL_TERMINATION =
            Pattern.compile("^\\(1\\) Normal termination \\(return value (-?\\d+)\\)");
    private static final Pattern ABNORMAL_TERMINATION =
            Pattern.compile("^\\(0\\) Abnormal termination \\(signal (\\d+)\\)");

    private Pending pending;

    /**
     * Consume one line (without line terminator).
     *
     * @return the completed event, if this line closed one
     */
    public Optional<JobEvent> feed(String line) {
        String trimmed = line.strip();

        if (pending == null) {
            Matcher m = HEADER.matcher(trimmed);
            if (m.matches()) {
                pending = new Pending(
                        Long.parseLong(m.group(2)),
                        Integer.parseInt(m.group(3)),
                        JobEventType.fromCode(Integer.parseInt(m.group(1))));
            }
            // Anything outside a block is noise from a partially written log
            return Optional.empty();
        }

        if (trimmed.equals(EVENT_END)) {
            JobEvent event = new JobEvent(pending.clusterId, pending.procId, pending.type, pending.attributes);
            pending = null;
            return Optional.of(event);
        }

        body(trimmed);
        return Optional.empty();
    }

    /** True while a block has been opened but not yet closed. */
    public boolean inEvent() {
        return pending != null;
    }

    private void body(String line) {
        if (line.isEmpty()) {
            return;
        }
        switch (pending.type) {
            case JOB_TERMINATED -> termination(line);
            case JOB_HELD, JOB_ABORTED, CLUSTER_REMOVE -> pending.attributes.putIfAbsent(JobEvent.REASON, line);
            default -> {
                // body of other events is not needed
            }
        }
    }

    private void termination(String line) {
        Matcher normal = NORMAL_TERMINATION.matcher(line);
        if (normal.find()) {
            pending.attributes.put(JobEvent.TERMINATED_NORMALLY, "true");
            pending.attributes.put(JobEvent.RETURN_VALUE, normal.group(1));
            return;
        }
        Matcher abnormal = ABNORMAL_TERMINATION.matcher(line);
        if (abnormal.find()) {
            pending.attributes.put(JobEvent.TERMINATED_NORMALLY, "false");
            pending.attributes.put(JobEvent.TERMINATED_BY_SIGNAL, abnormal.group(1));
        }
    }

    private static final class Pending {
        final long clusterId;
        final int procId;
        final JobEventType type;
        final Map<String, String> attributes = new LinkedHashMap<>();

        Pending(long clusterId, int procId, JobEventType type) {
            this.clusterId = clusterId;
            this.procId = procId;
            this.type = type;
        }
    }
}
