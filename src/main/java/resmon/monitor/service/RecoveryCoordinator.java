package resmon.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.backend.BackendAdapter;
import resmon.monitor.job.Job;
import resmon.monitor.model.StoreRecord;
import resmon.monitor.repository.JobStore;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resumes jobs that were still SUBMITTED when the previous process stopped.
 * Every recovered job gets its own thread and runs alongside normal scheduling.
 */
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final JobStore store;
    private final BackendAdapter backend;
    private final JobRunner runner;
    private final InFlightRegistry inFlight;
    private final Clock clock;
    private final Duration pollSlice;

    public RecoveryCoordinator(JobStore store, BackendAdapter backend, JobRunner runner, InFlightRegistry inFlight,
            Clock clock, Duration pollSlice) {
        this.store = store;
        this.backend = backend;
        this.runner = runner;
        this.inFlight = inFlight;
        this.clock = clock;
        this.pollSlice = pollSlice;
    }

    /**
     * Start picking up all unfinished jobs.
     *
     * @return completes when every recovered job has finished; already complete if there were none
     */
    public CompletableFuture<Void> recover() {
        log.warn("Picking up jobs");
        dumpStore();

        List<StoreRecord> unfinished = store.listUnfinished();
        if (unfinished.isEmpty()) {
            log.info("No jobs to be picked up found in the database");
            return CompletableFuture.completedFuture(null);
        }
        log.info("Picking up {} jobs", unfinished.size());

        AtomicInteger counter = new AtomicInteger();
        ExecutorService threads = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "resmon-pickup-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        CompletableFuture<?>[] pickups = unfinished.stream()
                .map(record -> Job.restore(record.snapshot(), backend, clock))
                .map(job -> CompletableFuture.runAsync(() -> pickup(job), threads))
                .toArray(CompletableFuture[]::new);

        CompletableFuture<Void> all = CompletableFuture.allOf(pickups);
        all.whenComplete((v, e) -> threads.shutdown());
        return all;
    }

    /**
     * Bring one restored job to completion: monitor it if the queue still has it,
     * otherwise settle it from the history.
     */
    void pickup(Job job) {
        inFlight.add(job);
        try {
            if (job.isStillRunning()) {
                job.monitor(pollSlice);
            } else {
                job.resolveFromHistory();
            }
            runner.finish(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while picking up job {}", job.jobId());
        } catch (RuntimeException e) {
            log.error("Failed to pick up job {}", job.jobId(), e);
            throw e;
        } finally {
            inFlight.remove(job);
        }
    }

    private void dumpStore() {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Job database contents:");
        for (StoreRecord record : store.listAll()) {
            log.debug("    {} status={} submitted={} state={}", record.jobId(), record.status(),
                    record.submissionTime(), record.snapshot().state());
        }
    }
}
