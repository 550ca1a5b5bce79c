package resmon.monitor.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.model.StoreStatus;
import resmon.monitor.model.TestResult;
import resmon.monitor.store.StoreException;
import resmon.monitor.support.FakeBackend;
import resmon.monitor.support.InMemoryJobStore;
import resmon.monitor.support.MutableClock;
import resmon.monitor.support.Probes;
import resmon.monitor.support.RecordingEmitter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static resmon.monitor.support.FakeBackend.terminated;

class JobRunnerTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tmp;

    private MutableClock clock;
    private FakeBackend backend;
    private InMemoryJobStore store;
    private RecordingEmitter emitter;
    private InFlightRegistry inFlight;
    private JobRunner runner;
    private ProbeDefinition probe;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        backend = new FakeBackend(clock);
        store = new InMemoryJobStore();
        emitter = new RecordingEmitter();
        inFlight = new InFlightRegistry();
        runner = new JobRunner(backend, store, emitter, inFlight, clock,
                tmp.resolve("config"), tmp.resolve("work"), Duration.ofSeconds(10));
        probe = Probes.probe("ping", 600, 300);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void passingJobIsReportedAndCompleted() throws Exception {
        long cluster = backend.peekNextClusterId();
        Path artifact = Probes.writeOutput(tmp.resolve("work"), "ping", cluster, Probes.ALL_PASSED);
        backend.emit(terminated(cluster, 0));
        backend.completedInHistory(cluster, 30, 15, 0);

        runner.run(probe);

        assertEquals(1, backend.submitted.size());
        assertEquals(StoreStatus.COMPLETED, store.statusOf("ping_" + cluster));
        assertEquals(1, emitter.results.size());
        TestResult result = emitter.results.get(0);
        assertTrue(result.passed());
        assertEquals("Job succeeded", result.message());
        assertEquals(30, result.runtime());
        assertEquals(0.5, result.cpuEfficiency(), 1e-9);
        assertEquals(0, inFlight.size());

        // Passed jobs leave no files behind
        assertFalse(Files.exists(artifact));
    }

    @Test
    void failingJobKeepsItsFiles() throws Exception {
        long cluster = backend.peekNextClusterId();
        Path artifact = Probes.writeOutput(tmp.resolve("work"), "ping", cluster, Probes.ONE_FAILED);
        backend.emit(terminated(cluster, 0));

        runner.run(probe);

        assertFalse(emitter.results.get(0).passed());
        assertEquals(StoreStatus.COMPLETED, store.statusOf("ping_" + cluster));
        assertTrue(Files.exists(artifact));
    }

    @Test
    void submissionFailureDropsJob() {
        backend.failSubmit = true;

        runner.run(probe);

        assertEquals(0, store.countAll());
        assertTrue(emitter.results.isEmpty());
        assertEquals(0, inFlight.size());
    }

    @Test
    void storeFailureCancelsSubmittedJob() {
        long cluster = backend.peekNextClusterId();
        store.failPut = true;

        assertThrows(StoreException.class, () -> runner.run(probe));

        assertEquals(1, backend.cancelled.size());
        assertEquals(cluster, backend.cancelled.get(0));
        assertEquals(0, backend.streamsOpened.get());
        assertEquals(0, inFlight.size());
    }

    @Test
    void emitterFailureStillCompletesRecord() {
        long cluster = backend.peekNextClusterId();
        backend.emit(terminated(cluster, 0));
        emitter.fail = true;

        runner.run(probe);

        assertEquals(StoreStatus.COMPLETED, store.statusOf("ping_" + cluster));
    }

    @Test
    void timedOutJobIsReportedAsFailure() {
        long cluster = backend.peekNextClusterId();

        runner.run(probe);

        assertEquals(cluster, backend.cancelled.get(0));
        TestResult result = emitter.results.get(0);
        assertFalse(result.passed());
        assertTrue(result.message().contains("timed out"));
        assertEquals(300, result.testtime());
        assertEquals(StoreStatus.COMPLETED, store.statusOf("ping_" + cluster));
    }

    @Test
    void interruptedRunLeavesRecordSubmitted() {
        long cluster = backend.peekNextClusterId();
        Thread.currentThread().interrupt();

        runner.run(probe);

        assertTrue(Thread.currentThread().isInterrupted());
        assertEquals(StoreStatus.SUBMITTED, store.statusOf("ping_" + cluster));
        assertTrue(emitter.results.isEmpty());
        assertEquals(0, inFlight.size());
    }
}
