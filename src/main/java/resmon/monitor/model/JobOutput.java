package resmon.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parsed output artifact of a probe job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobOutput(@JsonProperty("tests") List<TestOutcome> tests) {

    public JobOutput {
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    @JsonIgnore
    public boolean allPassed() {
        return tests.stream().allMatch(TestOutcome::passed);
    }

    @JsonIgnore
    public List<TestOutcome> failedTests() {
        return tests.stream().filter(t -> !t.passed()).toList();
    }
}
