package resmon.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable job configuration of a probe.
 *
 * @param job          executable and file names
 * @param requirements requested resources
 * @param timeout      seconds after submission before the job is removed
 * @param site         target execution site, reported with every result
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobConfig(
        @JsonProperty("job") ExecutableSpec job,
        @JsonProperty("requirements") Requirements requirements,
        @JsonProperty("timeout") long timeout,
        @JsonProperty("site") String site) {

    public JobConfig {
        Objects.requireNonNull(job, "job is required");
        requirements = requirements == null ? Requirements.minimal() : requirements;
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        site = site == null ? "" : site;
    }
}
