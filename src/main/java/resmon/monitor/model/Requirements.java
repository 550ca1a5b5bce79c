package resmon.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resources requested for a probe job.
 *
 * @param cpu          number of cores
 * @param memory       memory in MB
 * @param disk         disk in KB
 * @param gpu          accelerators, null when not requested
 * @param requirements batch system requirement expression, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Requirements(
        @JsonProperty("cpu") int cpu,
        @JsonProperty("memory") long memory,
        @JsonProperty("disk") long disk,
        @JsonProperty("gpu") Integer gpu,
        @JsonProperty("requirements") String requirements) {

    public Requirements {
        if (cpu <= 0) {
            cpu = 1;
        }
    }

    public static Requirements minimal() {
        return new Requirements(1, 0, 0, null, null);
    }

    public boolean hasGpu() {
        return gpu != null && gpu > 0;
    }

    public boolean hasExpression() {
        return requirements != null && !requirements.isBlank();
    }
}
