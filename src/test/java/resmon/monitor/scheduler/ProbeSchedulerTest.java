package resmon.monitor.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import resmon.monitor.model.JobSnapshot;
import resmon.monitor.model.JobState;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.model.StoreStatus;
import resmon.monitor.service.InFlightRegistry;
import resmon.monitor.store.StoreException;
import resmon.monitor.support.InMemoryJobStore;
import resmon.monitor.support.MutableClock;
import resmon.monitor.support.Probes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProbeSchedulerTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryJobStore store;
    private List<String> dispatched;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryJobStore();
        dispatched = Collections.synchronizedList(new ArrayList<>());
    }

    private ProbeScheduler scheduler(List<ProbeDefinition> probes) {
        return new ProbeScheduler(probes, store, new InFlightRegistry(),
                probe -> dispatched.add(probe.name()), () -> 0, clock, Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Pool size is 1 + sum of ceil(timeout / interval)")
    void requiredWorkers() {
        List<ProbeDefinition> probes = List.of(
                Probes.probe("a", 60, 300),
                Probes.probe("b", 100, 450));

        // 1 + 5 + 5
        assertEquals(11, ProbeScheduler.requiredWorkers(probes));
        assertEquals(2, ProbeScheduler.requiredWorkers(List.of(Probes.probe("c", 600, 300))));
    }

    @Test
    void firstRunDispatchesEveryProbe() {
        ProbeScheduler scheduler = scheduler(List.of(
                Probes.probe("a", 600, 300),
                Probes.probe("b", 3600, 300)));

        scheduler.tick();

        assertEquals(List.of("a", "b"), dispatched);
    }

    @Test
    void firstRunSurvivesFailingStore() {
        ProbeScheduler scheduler = scheduler(List.of(
                Probes.probe("a", 600, 300),
                Probes.probe("b", 3600, 300)));

        store.failCount = true;
        assertThrows(StoreException.class, scheduler::tick);
        assertTrue(dispatched.isEmpty());

        store.failCount = false;
        clock.advance(Duration.ofSeconds(10));
        scheduler.tick();

        assertEquals(List.of("a", "b"), dispatched);
    }

    @Test
    void nonEmptyStoreWaitsForInterval() {
        store.put(new JobSnapshot("old", Probes.probe("old", 60, 30).jobConfig(), "/c", "/w",
                START.toEpochMilli(), 1, JobState.SUBMITTED, null, null, null, false, false, null, -1, -1),
                StoreStatus.COMPLETED);
        ProbeScheduler scheduler = scheduler(List.of(
                Probes.probe("a", 60, 300),
                Probes.probe("b", 120, 300)));

        scheduler.tick();
        assertTrue(dispatched.isEmpty());

        clock.advance(Duration.ofSeconds(50));
        scheduler.tick();
        assertTrue(dispatched.isEmpty());

        clock.advance(Duration.ofSeconds(10));
        scheduler.tick();
        assertEquals(List.of("a"), dispatched);

        clock.advance(Duration.ofSeconds(60));
        scheduler.tick();
        assertEquals(List.of("a", "a", "b"), dispatched);
    }

    @Test
    @DisplayName("After the first run, probes recur at their own interval")
    void recurringAfterFirstRun() {
        ProbeScheduler scheduler = scheduler(List.of(Probes.probe("a", 30, 300)));

        scheduler.tick();
        assertEquals(1, dispatched.size());

        // Same instant, nothing new
        scheduler.tick();
        assertEquals(1, dispatched.size());

        // Overlapping instances are allowed
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofSeconds(30));
            scheduler.tick();
        }
        assertEquals(4, dispatched.size());
    }

    @Test
    void startAndStop() throws Exception {
        ProbeScheduler scheduler = scheduler(List.of(Probes.probe("a", 600, 300)));

        scheduler.start();
        assertTrue(scheduler.isRunning());

        // First tick runs immediately on the scheduler thread
        long deadline = System.currentTimeMillis() + 5000;
        while (dispatched.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertEquals(List.of("a"), dispatched);
    }
}
