package resmon.monitor.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.backend.BackendAdapter;
import resmon.monitor.backend.BackendException;
import resmon.monitor.backend.EventStream;
import resmon.monitor.backend.QueryException;
import resmon.monitor.backend.SubmissionException;
import resmon.monitor.model.BackendJobStatus;
import resmon.monitor.model.HistoryRecord;
import resmon.monitor.model.JobConfig;
import resmon.monitor.model.JobEvent;
import resmon.monitor.model.JobEventType;
import resmon.monitor.model.JobOutput;
import resmon.monitor.model.JobSnapshot;
import resmon.monitor.model.JobState;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.model.TestOutcome;
import resmon.monitor.model.TestResult;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One execution of a probe on the batch system and the state machine driving it:
 * <pre>
 * CREATED -> SUBMITTED -> MONITORING -> {TERMINATED_OK | TERMINATED_FAIL | ABORTED | TIMED_OUT}
 *         -> RESULTS_COLLECTED -> REPORTED
 * </pre>
 * A job is driven by exactly one thread. Its persistable part is a {@link JobSnapshot};
 * the batch system handle and the clock are supplied again by {@link #restore}.
 */
public final class Job {

    private static final Logger log = LoggerFactory.getLogger(Job.class);

    /** Only the first process of a cluster is monitored. */
    static final int PRIMARY_PROC = 0;

    private final String probeName;
    private final JobConfig config;
    private final Instant submissionTime;
    private final JobWorkspace workspace;

    // Runtime handles, never persisted
    private final BackendAdapter backend;
    private final Clock clock;

    private volatile long clusterId = -1;
    private volatile JobState state = JobState.CREATED;
    private volatile JobEventType lastEventType;
    private String lastEventReason;
    private JobState outcome;
    private boolean succeeded;
    private boolean doneBeforeTimeout;
    private JobOutput output;
    private long runtime = -1;
    private double cpuEfficiency = -1;

    private Job(String probeName, JobConfig config, Instant submissionTime, JobWorkspace workspace,
            BackendAdapter backend, Clock clock) {
        this.probeName = Objects.requireNonNull(probeName, "probeName is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.submissionTime = Objects.requireNonNull(submissionTime, "submissionTime is required");
        this.workspace = Objects.requireNonNull(workspace, "workspace is required");
        this.backend = Objects.requireNonNull(backend, "backend is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Build a fresh job for a probe.
     *
     * @param probe          probe definition
     * @param submissionTime creation time, start of the timeout window
     * @param configDir      directory holding {@code <probe>/<executable>}
     * @param workDir        directory for logs and results
     */
    public static Job create(ProbeDefinition probe, Instant submissionTime, Path configDir, Path workDir,
            BackendAdapter backend, Clock clock) {
        JobWorkspace workspace = new JobWorkspace(configDir, workDir, probe.name(), probe.jobConfig().job());
        return new Job(probe.name(), probe.jobConfig(), submissionTime.truncatedTo(ChronoUnit.MILLIS),
                workspace, backend, clock);
    }

    /**
     * Rebuild a job from its persisted snapshot with freshly acquired handles.
     */
    public static Job restore(JobSnapshot snapshot, BackendAdapter backend, Clock clock) {
        JobWorkspace workspace = new JobWorkspace(Path.of(snapshot.configDir()), Path.of(snapshot.workDir()),
                snapshot.probeName(), snapshot.config().job());
        Job job = new Job(snapshot.probeName(), snapshot.config(), snapshot.submissionTime(), workspace,
                backend, clock);
        job.clusterId = snapshot.clusterId();
        job.state = snapshot.state();
        job.outcome = snapshot.outcome();
        job.lastEventType = snapshot.lastEventType();
        job.lastEventReason = snapshot.lastEventReason();
        job.succeeded = snapshot.succeeded();
        job.doneBeforeTimeout = snapshot.doneBeforeTimeout();
        job.output = snapshot.output();
        job.runtime = snapshot.runtime();
        job.cpuEfficiency = snapshot.cpuEfficiency();
        return job;
    }

    public JobSnapshot toSnapshot() {
        return new JobSnapshot(
                probeName,
                config,
                workspace.configDir().toString(),
                workspace.workDir().toString(),
                submissionTime.toEpochMilli(),
                clusterId,
                state,
                outcome,
                lastEventType,
                lastEventReason,
                succeeded,
                doneBeforeTimeout,
                output,
                runtime,
                cpuEfficiency);
    }

    // ---------- Lifecycle ----------

    /**
     * Hand the job to the batch system.
     *
     * @return the assigned cluster id
     * @throws SubmissionException if the workspace cannot be prepared or the job is refused
     */
    public long submit() throws SubmissionException {
        requireState(JobState.CREATED);
        try {
            workspace.prepare();
        } catch (IOException e) {
            throw new SubmissionException("Cannot prepare workspace for probe " + probeName, e);
        }
        long assigned = backend.submit(SubmitRequestBuilder.build(config, workspace));
        clusterId = assigned;
        moveTo(JobState.SUBMITTED);
        log.info("Submitted job {} with cluster id {} and a timeout of {} seconds",
                probeName, assigned, config.timeout());
        return assigned;
    }

    /**
     * Follow the job's event log until a terminal event or the deadline
     * {@code submissionTime + timeout}. On deadline the job is removed from the queue.
     *
     * @param pollSlice longest single wait on the event log
     * @return the terminal outcome
     * @throws InterruptedException if the monitoring thread is interrupted
     */
    public JobState monitor(Duration pollSlice) throws InterruptedException {
        if (state != JobState.MONITORING) {
            moveTo(JobState.MONITORING);
        }
        Instant deadline = deadline();

        try (EventStream events = backend.openEventStream(workspace.userLog())) {
            Instant now = clock.instant();
            while (now.isBefore(deadline)) {
                Duration remaining = Duration.between(now, deadline);
                Duration wait = remaining.compareTo(pollSlice) < 0 ? remaining : pollSlice;

                for (JobEvent event : events.poll(wait)) {
                    if (event.clusterId() != clusterId || event.procId() != PRIMARY_PROC) {
                        continue;
                    }
                    lastEventType = event.type();
                    lastEventReason = event.reason();
                    Optional<JobState> terminal = classify(event);
                    if (terminal.isPresent()) {
                        doneBeforeTimeout = true;
                        succeeded = terminal.get() == JobState.TERMINATED_OK;
                        return finishMonitoring(terminal.get());
                    }
                }
                now = clock.instant();
            }
        }

        log.info("Timed out waiting for job {} to finish! (Timeout {} seconds)", clusterId, config.timeout());
        try {
            backend.cancel(clusterId);
        } catch (BackendException e) {
            log.warn("Failed to remove timed out job {}: {}", clusterId, e.getMessage());
        }
        doneBeforeTimeout = false;
        succeeded = false;
        return finishMonitoring(JobState.TIMED_OUT);
    }

    /**
     * Recovery entry point: ask the live queue whether the job is still there.
     * A failed query is answered with {@code true} so the job is monitored again
     * rather than lost.
     */
    public boolean isStillRunning() {
        Optional<BackendJobStatus> status;
        try {
            status = backend.query(clusterId);
        } catch (QueryException e) {
            log.info("Could not get job status: {}, assuming job {} is still running.", e.getMessage(), clusterId);
            return true;
        }
        if (status.isEmpty()) {
            log.info("Job {} not found in the queue", clusterId);
            return false;
        }
        if (status.get().isActive()) {
            log.info("Job {} still in the queue with status {}", clusterId, status.get());
            return true;
        }
        log.info("Job {} is in the queue but no longer active ({})", clusterId, status.get());
        return false;
    }

    /**
     * Recovery entry point for a job that already left the queue: classify it by
     * its last history entry. Never throws; an unknown fate counts as failure.
     */
    public JobState resolveFromHistory() {
        JobState resolved;
        try {
            Optional<HistoryRecord> entry = backend.history(clusterId);
            if (entry.isPresent()) {
                BackendJobStatus last = entry.get().status();
                log.info("Job {} found in history with status {}", clusterId, last);
                resolved = last == BackendJobStatus.COMPLETED ? JobState.TERMINATED_OK : JobState.TERMINATED_FAIL;
            } else {
                log.warn("Job {} neither in the queue nor in the history, marking as failed", clusterId);
                resolved = JobState.TERMINATED_FAIL;
            }
        } catch (QueryException e) {
            log.warn("Could not get history of job {}, marking as failed: {}", clusterId, e.getMessage());
            resolved = JobState.TERMINATED_FAIL;
        }
        doneBeforeTimeout = true;
        succeeded = resolved == JobState.TERMINATED_OK;
        log.info("Job {} {}", clusterId, succeeded ? "finished successfully" : "did not finish successfully");
        return finishMonitoring(resolved);
    }

    /**
     * Read the output artifact and accounting data. A missing or unreadable artifact
     * is recorded as "no output" and makes the job fail; missing accounting data keeps
     * runtime and efficiency at -1.
     */
    public void collectResults() {
        if (!state.isOutcome()) {
            throw new IllegalStateException("Job " + jobId() + " has no outcome yet (state " + state + ")");
        }
        output = readOutput().orElse(null);

        try {
            Optional<HistoryRecord> entry = backend.history(clusterId);
            if (entry.isPresent()) {
                runtime = (long) entry.get().wallClockSeconds();
                cpuEfficiency = entry.get().cpuEfficiency();
            } else {
                log.info("No history entry for job {}, runtime unknown", clusterId);
            }
        } catch (QueryException e) {
            log.info("Could not get job history: {}", e.getMessage());
        }
        moveTo(JobState.RESULTS_COLLECTED);
    }

    public void markReported() {
        moveTo(JobState.REPORTED);
    }

    // ---------- Verdict ----------

    /** Passed iff finished in time, succeeded, produced output and every test passed. */
    public boolean hasPassed() {
        return doneBeforeTimeout && succeeded && output != null && output.allPassed();
    }

    public String message() {
        if (hasPassed()) {
            return "Job succeeded";
        }
        StringBuilder message = new StringBuilder("Job failed");
        if (!doneBeforeTimeout) {
            message.append(" - Job timed out before finishing");
        }
        if (!succeeded) {
            message.append(" - Job did not succeed on the batch system (last event type: ")
                    .append(lastEventType);
            if (lastEventReason != null) {
                message.append(", reason: ").append(lastEventReason);
            }
            message.append(")");
        }
        if (output == null) {
            message.append(" - Job did not produce any output");
        } else if (!output.allPassed()) {
            String failed = output.failedTests().stream()
                    .map(Job::describe)
                    .collect(Collectors.joining(", ", "[", "]"));
            message.append(" - Tests failed: ").append(failed);
        }
        return message.toString();
    }

    /**
     * Build the metrics record.
     *
     * @param now time the result is assembled, for the total test time
     */
    public TestResult toResult(Instant now) {
        long testtime = Duration.between(submissionTime, now).getSeconds();
        return new TestResult(probeName, clusterId, hasPassed(), message(), runtime, cpuEfficiency,
                testtime, config.site(), submissionTime);
    }

    /** Remove log and result files of this cluster. */
    public void cleanupOutputs() throws IOException {
        int removed = workspace.cleanup(clusterId);
        log.info("Cleaned up {} files for job {}", removed, clusterId);
    }

    /** Log the job's current state; queries the live queue only at DEBUG. */
    public void report() {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("    Job: {}", probeName);
        log.debug("    Cluster ID: {}", clusterId);
        log.debug("    State: {} (last event: {})", state, lastEventType);
        if (clusterId < 0) {
            return;
        }
        try {
            log.debug("    Batch system status: {}", backend.query(clusterId).map(Enum::name).orElse("None"));
        } catch (QueryException e) {
            log.debug("    Could not get job status: {}", e.getMessage());
        }
    }

    // ---------- Accessors ----------

    public String probeName() {
        return probeName;
    }

    public long clusterId() {
        return clusterId;
    }

    /** Store key, {@code <probe>_<clusterId>}. */
    public String jobId() {
        return probeName + "_" + clusterId;
    }

    public JobState state() {
        return state;
    }

    public Optional<JobState> outcome() {
        return Optional.ofNullable(outcome);
    }

    public Instant submissionTime() {
        return submissionTime;
    }

    public Instant deadline() {
        return submissionTime.plusSeconds(config.timeout());
    }

    public JobConfig config() {
        return config;
    }

    public JobWorkspace workspace() {
        return workspace;
    }

    public JobEventType lastEventType() {
        return lastEventType;
    }

    public Optional<String> lastEventReason() {
        return Optional.ofNullable(lastEventReason);
    }

    public boolean succeeded() {
        return succeeded;
    }

    public boolean doneBeforeTimeout() {
        return doneBeforeTimeout;
    }

    public Optional<JobOutput> output() {
        return Optional.ofNullable(output);
    }

    public long runtime() {
        return runtime;
    }

    public double cpuEfficiency() {
        return cpuEfficiency;
    }

    // ---------- Helpers ----------

    private Optional<JobState> classify(JobEvent event) {
        JobEventType type = event.type();
        if (type == JobEventType.JOB_TERMINATED) {
            if (event.terminatedNormally()) {
                log.info("Job {} terminated normally with return value {}.", clusterId, event.returnValue());
                return Optional.of(event.returnValue() == 0 ? JobState.TERMINATED_OK : JobState.TERMINATED_FAIL);
            }
            log.info("Job {} terminated on signal {}.", clusterId, event.terminatedBySignal());
            return Optional.of(JobState.TERMINATED_FAIL);
        }
        if (type.isAbnormalEnd()) {
            log.info("Job {} aborted, held, or removed ({}).", clusterId, type);
            return Optional.of(JobState.ABORTED);
        }
        if (!type.isBenign()) {
            log.warn("Job {} had unexpected event: {}!", clusterId, type);
            return Optional.of(JobState.ABORTED);
        }
        return Optional.empty();
    }

    private JobState finishMonitoring(JobState terminal) {
        outcome = terminal;
        moveTo(terminal);
        return terminal;
    }

    private Optional<JobOutput> readOutput() {
        Optional<Path> artifact;
        try {
            artifact = workspace.findOutput(clusterId);
        } catch (IOException e) {
            log.warn("Could not list results folder {}: {}", workspace.resultsFolder(), e.getMessage());
            return Optional.empty();
        }
        if (artifact.isEmpty()) {
            log.info("Could not find results file for {} in {}", clusterId, workspace.resultsFolder());
            return Optional.empty();
        }
        try {
            return Optional.of(OutputParser.parse(artifact.get()));
        } catch (IOException e) {
            log.warn("Could not parse results file {}: {}", artifact.get(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String describe(TestOutcome test) {
        return test.message() == null || test.message().isBlank()
                ? test.name()
                : test.name() + ": " + test.message();
    }

    private void requireState(JobState expected) {
        if (state != expected) {
            throw new IllegalStateException("Job " + jobId() + " is " + state + ", expected " + expected);
        }
    }

    private void moveTo(JobState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Job " + jobId() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    @Override
    public String toString() {
        return "Job{probe='" + probeName + "', clusterId=" + clusterId + ", state=" + state + "}";
    }
}
