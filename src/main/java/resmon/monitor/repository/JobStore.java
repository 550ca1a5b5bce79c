package resmon.monitor.repository;

import resmon.monitor.model.JobSnapshot;
import resmon.monitor.model.StoreRecord;
import resmon.monitor.model.StoreStatus;

import java.util.List;

/**
 * Durable map from job id to job snapshot and coarse status.
 * Every operation is its own transaction; failures surface as
 * {@link resmon.monitor.store.StoreException}.
 */
public interface JobStore {

    /**
     * Create the schema if absent and purge records older than the retention window.
     * Safe to call repeatedly.
     */
    void initialize();

    /**
     * Insert a new record.
     *
     * @param snapshot job snapshot, its job id is the key
     * @param status   initial status
     * @throws resmon.monitor.store.StoreException if the job id is already stored
     */
    void put(JobSnapshot snapshot, StoreStatus status);

    /**
     * Advance a record from SUBMITTED to {@code status}.
     *
     * @param jobId  job id
     * @param status target status, must not be SUBMITTED
     * @return true if a SUBMITTED record was advanced
     * @throws IllegalArgumentException if {@code status} is SUBMITTED
     */
    boolean updateStatus(String jobId, StoreStatus status);

    /**
     * All SUBMITTED records, oldest first. Rows whose snapshot cannot be decoded are skipped.
     */
    List<StoreRecord> listUnfinished();

    /**
     * All records, oldest first. Rows whose snapshot cannot be decoded are skipped.
     */
    List<StoreRecord> listAll();

    int countAll();

    /**
     * Delete records submitted more than {@code days} days ago.
     *
     * @return number of deleted records
     */
    int purgeOlderThan(int days);
}
