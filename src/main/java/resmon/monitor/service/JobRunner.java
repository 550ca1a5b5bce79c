package resmon.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.backend.BackendAdapter;
import resmon.monitor.backend.BackendException;
import resmon.monitor.backend.SubmissionException;
import resmon.monitor.job.Job;
import resmon.monitor.metrics.MetricsEmitter;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.model.StoreStatus;
import resmon.monitor.model.TestResult;
import resmon.monitor.repository.JobStore;
import resmon.monitor.store.StoreException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Drives one job through its whole life: submit, persist, monitor, collect,
 * report, complete. The collect-to-complete tail is shared with recovery.
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final BackendAdapter backend;
    private final JobStore store;
    private final MetricsEmitter emitter;
    private final InFlightRegistry inFlight;
    private final Clock clock;
    private final Path configDir;
    private final Path workDir;
    private final Duration pollSlice;

    public JobRunner(BackendAdapter backend, JobStore store, MetricsEmitter emitter, InFlightRegistry inFlight,
            Clock clock, Path configDir, Path workDir, Duration pollSlice) {
        this.backend = backend;
        this.store = store;
        this.emitter = emitter;
        this.inFlight = inFlight;
        this.clock = clock;
        this.configDir = configDir;
        this.workDir = workDir;
        this.pollSlice = pollSlice;
    }

    /**
     * Run a fresh instance of a probe on the calling thread.
     * A refused submission drops the job. A store failure after submission removes
     * the job from the batch system and propagates.
     */
    public void run(ProbeDefinition probe) {
        log.info("Running job {}", probe.name());
        Job job = Job.create(probe, clock.instant(), configDir, workDir, backend, clock);
        inFlight.add(job);
        try {
            try {
                job.submit();
            } catch (SubmissionException e) {
                log.error("Failed to submit job {}: {}", probe.name(), e.getMessage(), e);
                return;
            }

            try {
                store.put(job.toSnapshot(), StoreStatus.SUBMITTED);
            } catch (StoreException e) {
                log.error("Could not persist job {}, removing it from the batch system", job.jobId());
                cancel(job);
                throw e;
            }

            job.monitor(pollSlice);
            finish(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while running job {}, it will be picked up on restart", job.jobId());
        } finally {
            inFlight.remove(job);
        }
    }

    /**
     * Tail of a job with a terminal outcome: collect results, clean up on pass,
     * emit the result record, mark the store record COMPLETED.
     */
    public void finish(Job job) {
        job.collectResults();
        log.info("Job runtime: {}", job.runtime());

        TestResult result = job.toResult(clock.instant());
        if (job.hasPassed()) {
            log.info("Job {} has passed", job.probeName());
            try {
                job.cleanupOutputs();
            } catch (IOException e) {
                log.warn("Could not clean up outputs of job {}: {}", job.jobId(), e.getMessage());
            }
        } else {
            log.info("Job {}: {}", job.jobId(), result.message());
        }

        try {
            emitter.emit(result);
        } catch (RuntimeException e) {
            log.error("Failed to emit result of job {}", job.jobId(), e);
        }

        job.markReported();
        store.updateStatus(job.jobId(), StoreStatus.COMPLETED);
    }

    private void cancel(Job job) {
        try {
            backend.cancel(job.clusterId());
        } catch (BackendException e) {
            log.warn("Failed to remove job {}: {}", job.clusterId(), e.getMessage());
        }
    }
}
