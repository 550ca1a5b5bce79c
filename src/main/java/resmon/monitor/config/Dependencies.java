package resmon.monitor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.condor.CondorCliBackend;
import resmon.monitor.backend.BackendAdapter;
import resmon.monitor.metrics.InfluxMetricsEmitter;
import resmon.monitor.metrics.LoggingMetricsEmitter;
import resmon.monitor.metrics.MetricsEmitter;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.repository.JobStore;
import resmon.monitor.scheduler.ProbeScheduler;
import resmon.monitor.scheduler.WorkerPool;
import resmon.monitor.service.InFlightRegistry;
import resmon.monitor.service.JobRunner;
import resmon.monitor.service.RecoveryCoordinator;
import resmon.monitor.store.Database;
import resmon.monitor.store.JdbcJobStore;
import resmon.monitor.store.SnapshotCodec;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(config, probes);
 * deps.recovery().recover();
 * deps.scheduler().start();
 * // ... runs until shutdown ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final Database database;
    private final JobStore jobStore;
    private final MetricsEmitter emitter;
    private final InFlightRegistry inFlight;
    private final WorkerPool workerPool;
    private final RecoveryCoordinator recovery;
    private final ProbeScheduler scheduler;

    private Dependencies(MonitorConfig config, List<ProbeDefinition> probes, BackendAdapter backend,
            MetricsEmitter emitter, Clock clock) {
        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.jobStore = new JdbcJobStore(database, new SnapshotCodec(), clock, config.retentionDays());
        jobStore.initialize();
        this.emitter = emitter;

        // Services
        this.inFlight = new InFlightRegistry();
        JobRunner jobRunner = new JobRunner(backend, jobStore, emitter, inFlight, clock,
                config.configDir(), config.workDir(), config.pollSlice());
        this.recovery = new RecoveryCoordinator(jobStore, backend, jobRunner, inFlight, clock, config.pollSlice());

        // Scheduling
        int workers = ProbeScheduler.requiredWorkers(probes);
        log.info("Maximum number of required workers: {}", workers);
        this.workerPool = new WorkerPool(workers);
        this.scheduler = new ProbeScheduler(probes, jobStore, inFlight,
                probe -> workerPool.submit("job " + probe.name(), () -> jobRunner.run(probe)),
                workerPool::queued, clock, config.schedulerTick());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create production dependencies: HTCondor command line backend, and InfluxDB
     * unless disabled in the config.
     */
    public static Dependencies create(MonitorConfig config, List<ProbeDefinition> probes) throws IOException {
        MetricsEmitter emitter = config.influxEnabled()
                ? new InfluxMetricsEmitter(InfluxSettings.load(config.influxConfigFile()))
                : new LoggingMetricsEmitter();
        return create(config, probes, new CondorCliBackend(), emitter, Clock.systemUTC());
    }

    public static Dependencies create(MonitorConfig config, List<ProbeDefinition> probes, BackendAdapter backend,
            MetricsEmitter emitter, Clock clock) {
        return new Dependencies(config, probes, backend, emitter, clock);
    }

    // Getters
    public JobStore jobStore() {
        return jobStore;
    }

    public InFlightRegistry inFlight() {
        return inFlight;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public RecoveryCoordinator recovery() {
        return recovery;
    }

    public ProbeScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop dispatching first, then the workers
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            workerPool.shutdown(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Error stopping worker pool: {}", e.getMessage());
        }

        try {
            emitter.close();
        } catch (Exception e) {
            log.warn("Error closing metrics emitter: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
