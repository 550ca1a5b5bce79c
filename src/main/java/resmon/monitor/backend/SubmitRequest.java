package resmon.monitor.backend;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Submit description handed to the batch system.
 *
 * @param attributes submit commands in insertion order, values may contain
 *                   batch system macros such as {@code $(Cluster)}
 * @param userLog    event log the batch system writes for this job
 */
public record SubmitRequest(Map<String, String> attributes, Path userLog) {

    public SubmitRequest {
        Objects.requireNonNull(userLog, "userLog is required");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String get(String key) {
        return attributes.get(key);
    }
}
