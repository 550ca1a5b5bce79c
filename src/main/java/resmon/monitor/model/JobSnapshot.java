package resmon.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistable state of a job. Holds data only; the batch system handle and the
 * clock of a live job are re-acquired when a snapshot is restored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSnapshot(
        @JsonProperty("probe_name") String probeName,
        @JsonProperty("config") JobConfig config,
        @JsonProperty("config_dir") String configDir,
        @JsonProperty("work_dir") String workDir,
        @JsonProperty("submission_time_ms") long submissionTimeMs,
        @JsonProperty("cluster_id") long clusterId,
        @JsonProperty("state") JobState state,
        @JsonProperty("outcome") JobState outcome,
        @JsonProperty("last_event_type") JobEventType lastEventType,
        @JsonProperty("last_event_reason") String lastEventReason,
        @JsonProperty("succeeded") boolean succeeded,
        @JsonProperty("done_before_timeout") boolean doneBeforeTimeout,
        @JsonProperty("output") JobOutput output,
        @JsonProperty("runtime") long runtime,
        @JsonProperty("cpu_efficiency") double cpuEfficiency) {

    public JobSnapshot {
        Objects.requireNonNull(probeName, "probeName is required");
        Objects.requireNonNull(config, "config is required");
        state = state == null ? JobState.CREATED : state;
    }

    /** Job identifier as used in the store: {@code <probe>_<clusterId>}. */
    @JsonIgnore
    public String jobId() {
        return probeName + "_" + clusterId;
    }

    @JsonIgnore
    public Instant submissionTime() {
        return Instant.ofEpochMilli(submissionTimeMs);
    }
}
