package resmon.monitor.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the monitor.
 * Paths left unset are derived from the work and config directories.
 */
public final class MonitorConfig {

    // Directories
    private Path workDir = Path.of(".");
    private Path configDir = Path.of("job_configuration");

    // Files (null = derived)
    private Path configFile;
    private Path influxConfigFile;
    private Path jobDbFile;
    private Path logFile;

    // Database settings
    private int databasePoolSize = 4;
    private int retentionDays = 7;

    // Scheduling
    private Duration schedulerTick = Duration.ofSeconds(10);
    private Duration pollSlice = Duration.ofSeconds(10);

    // Metrics
    private boolean influxEnabled = true;

    private MonitorConfig() {
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig();
    }

    public static MonitorConfig fromEnv() {
        MonitorConfig config = new MonitorConfig();

        // Override from environment variables
        String workDir = System.getenv("RESMON_WORKDIR");
        if (workDir != null && !workDir.isBlank()) {
            config.workDir = Path.of(workDir);
        }

        String configDir = System.getenv("RESMON_CONFIGDIR");
        if (configDir != null && !configDir.isBlank()) {
            config.configDir = Path.of(configDir);
        }

        String retention = System.getenv("RESMON_RETENTION_DAYS");
        if (retention != null && !retention.isBlank()) {
            config.retentionDays = Integer.parseInt(retention);
        }

        String tick = System.getenv("RESMON_TICK_SECONDS");
        if (tick != null && !tick.isBlank()) {
            config.schedulerTick = Duration.ofSeconds(Long.parseLong(tick));
        }

        return config;
    }

    // Getters
    public Path workDir() {
        return workDir;
    }

    public Path configDir() {
        return configDir;
    }

    public Path configFile() {
        return configFile != null ? configFile : configDir.toAbsolutePath().resolve("config.yml");
    }

    public Path influxConfigFile() {
        return influxConfigFile != null ? influxConfigFile : configDir.toAbsolutePath().resolve("influxdb.ini");
    }

    public Path jobDbFile() {
        return jobDbFile != null ? jobDbFile : workDir.toAbsolutePath().resolve("jobs.sqlite3");
    }

    public Path logFile() {
        return logFile != null ? logFile : workDir.toAbsolutePath().resolve("remote-testsuite.log");
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int retentionDays() {
        return retentionDays;
    }

    public Duration schedulerTick() {
        return schedulerTick;
    }

    public Duration pollSlice() {
        return pollSlice;
    }

    public boolean influxEnabled() {
        return influxEnabled;
    }

    // Fluent setters for CLI and tests
    public MonitorConfig withWorkDir(Path dir) {
        this.workDir = dir;
        return this;
    }

    public MonitorConfig withConfigDir(Path dir) {
        this.configDir = dir;
        return this;
    }

    public MonitorConfig withConfigFile(Path file) {
        this.configFile = file;
        return this;
    }

    public MonitorConfig withInfluxConfigFile(Path file) {
        this.influxConfigFile = file;
        return this;
    }

    public MonitorConfig withJobDbFile(Path file) {
        this.jobDbFile = file;
        return this;
    }

    public MonitorConfig withLogFile(Path file) {
        this.logFile = file;
        return this;
    }

    public MonitorConfig withRetentionDays(int days) {
        this.retentionDays = days;
        return this;
    }

    public MonitorConfig withSchedulerTick(Duration tick) {
        this.schedulerTick = tick;
        return this;
    }

    public MonitorConfig withPollSlice(Duration slice) {
        this.pollSlice = slice;
        return this;
    }

    public MonitorConfig withInfluxEnabled(boolean enabled) {
        this.influxEnabled = enabled;
        return this;
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "workDir=" + workDir.toAbsolutePath() +
                ", configDir=" + configDir.toAbsolutePath() +
                ", jobDbFile=" + jobDbFile() +
                ", retentionDays=" + retentionDays +
                ", tick=" + schedulerTick +
                ", influx=" + influxEnabled +
                '}';
    }
}
