package resmon.monitor.model;

import java.time.Instant;

/**
 * One row of the job store.
 */
public record StoreRecord(String jobId, StoreStatus status, Instant submissionTime, JobSnapshot snapshot) {
}
