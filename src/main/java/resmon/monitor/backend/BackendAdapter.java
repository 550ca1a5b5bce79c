package resmon.monitor.backend;

import resmon.monitor.model.BackendJobStatus;
import resmon.monitor.model.HistoryRecord;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Operations the monitor needs from the batch system.
 * Implementations hold live connections and are never persisted.
 */
public interface BackendAdapter {

    /**
     * Submit a single job.
     *
     * @param request submit description
     * @return the assigned cluster id
     * @throws SubmissionException if the job was not accepted
     */
    long submit(SubmitRequest request) throws SubmissionException;

    /**
     * Open the event log a submitted job writes to.
     * Events of other jobs sharing the same log are included; callers filter.
     *
     * @param userLog path given as {@link SubmitRequest#userLog()}
     * @return a stream positioned at the start of the log
     */
    EventStream openEventStream(Path userLog);

    /**
     * Point query against the live queue.
     *
     * @param clusterId cluster id
     * @return the current status, empty if the queue has no such job
     * @throws QueryException if the queue could not be queried
     */
    Optional<BackendJobStatus> query(long clusterId) throws QueryException;

    /**
     * Look up a job that already left the queue.
     *
     * @param clusterId cluster id
     * @return the last history entry, empty if there is none
     * @throws QueryException if the history could not be read
     */
    Optional<HistoryRecord> history(long clusterId) throws QueryException;

    /**
     * Remove a job from the queue.
     *
     * @param clusterId cluster id
     * @throws BackendException if the removal request failed
     */
    void cancel(long clusterId) throws BackendException;
}
