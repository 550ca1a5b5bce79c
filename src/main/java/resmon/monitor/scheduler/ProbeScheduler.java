package resmon.monitor.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.job.Job;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.repository.JobStore;
import resmon.monitor.service.InFlightRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.IntSupplier;

/**
 * Dispatches recurring probes at their own intervals.
 *
 * On the first tick every probe is dispatched at once if the store is empty
 * (very first run of the tool). After that a probe is dispatched whenever its
 * interval has elapsed since its previous dispatch, counting from scheduler start.
 * Instances of the same probe may overlap.
 *
 * Uses a single-threaded executor for the ticks; the jobs themselves run on the
 * {@link WorkerPool} behind the dispatcher.
 */
public class ProbeScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProbeScheduler.class);

    private final List<ProbeState> probes;
    private final JobStore store;
    private final InFlightRegistry inFlight;
    private final Consumer<ProbeDefinition> dispatcher;
    private final IntSupplier queued;
    private final Clock clock;
    private final Duration tick;
    private final ScheduledExecutorService executor;

    private volatile boolean running = false;
    private boolean started = false;

    /**
     * @param probes     enabled probes
     * @param store      consulted once to detect the first run
     * @param inFlight   reported every tick
     * @param dispatcher hands a probe to the workers, must not block
     * @param queued     number of dispatched probes waiting for a worker
     * @param clock      time source
     * @param tick       period of the dispatch loop
     */
    public ProbeScheduler(List<ProbeDefinition> probes, JobStore store, InFlightRegistry inFlight,
            Consumer<ProbeDefinition> dispatcher, IntSupplier queued, Clock clock, Duration tick) {
        this.probes = new ArrayList<>();
        for (ProbeDefinition probe : probes) {
            this.probes.add(new ProbeState(probe));
        }
        this.store = store;
        this.inFlight = inFlight;
        this.dispatcher = dispatcher;
        this.queued = queued;
        this.clock = clock;
        this.tick = tick;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "resmon-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Workers needed so that no probe instance waits for a free thread:
     * one plus, for each probe, the number of instances that can overlap.
     */
    public static int requiredWorkers(List<ProbeDefinition> probes) {
        long overlap = probes.stream().mapToLong(ProbeDefinition::maxOverlap).sum();
        return Math.toIntExact(1 + overlap);
    }

    /**
     * Start ticking immediately and then every {@code tick}.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        executor.scheduleAtFixedRate(
                wrapRunnable("dispatcher", this::tick),
                0,
                tick.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Scheduler started with {} probes, tick every {}ms", probes.size(), tick.toMillis());
    }

    /**
     * One pass of the dispatch loop. Called from the scheduler thread only.
     */
    public void tick() {
        Instant now = clock.instant();

        if (!started) {
            // A failing count leaves the first run to the next tick
            boolean firstRun = store.countAll() == 0;
            started = true;
            for (ProbeState state : probes) {
                state.lastDispatch = now;
            }
            if (firstRun) {
                log.info("First run, dispatching all {} probes", probes.size());
                for (ProbeState state : probes) {
                    dispatch(state, now);
                }
            }
        }

        for (ProbeState state : probes) {
            if (!now.isBefore(state.nextDue())) {
                dispatch(state, now);
            }
        }

        report();
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void dispatch(ProbeState state, Instant now) {
        log.info("Dispatching probe {}", state.probe.name());
        state.lastDispatch = now;
        dispatcher.accept(state.probe);
    }

    private void report() {
        log.info("{} jobs in flight, {} waiting for a worker", inFlight.size(), queued.getAsInt());
        if (log.isDebugEnabled()) {
            for (Job job : inFlight.snapshot()) {
                job.report();
            }
        }
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }

    private static final class ProbeState {
        final ProbeDefinition probe;
        Instant lastDispatch;

        ProbeState(ProbeDefinition probe) {
            this.probe = probe;
        }

        Instant nextDue() {
            return lastDispatch.plusSeconds(probe.intervalSeconds());
        }
    }
}
