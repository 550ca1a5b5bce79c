package resmon.monitor.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one named check inside a probe's output artifact.
 */
public record TestOutcome(
        @JsonProperty("name") @JsonAlias("test") String name,
        @JsonProperty("passed") boolean passed,
        @JsonProperty("message") String message) {
}
