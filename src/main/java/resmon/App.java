package resmon;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.config.DefaultConfiguration;
import resmon.monitor.config.Dependencies;
import resmon.monitor.config.MonitorConfig;
import resmon.monitor.config.ProbeConfigLoader;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.scheduler.ProbeScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point. Runs until the process is terminated.
 */
public final class App {

    /** Read by logback.xml for the file appender. */
    public static final String LOG_FILE_PROPERTY = "resmon.logFile";

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("workdir").hasArg().argName("dir")
                .desc("Directory to store job results, job logs and job database (default .)").build());
        options.addOption(Option.builder().longOpt("configdir").hasArg().argName("dir")
                .desc("Directory with configuration files and job scripts (default job_configuration)").build());
        options.addOption(Option.builder().longOpt("config-file").hasArg().argName("file")
                .desc("Job configuration, default is configdir/config.yml").build());
        options.addOption(Option.builder().longOpt("influxdb-config-file").hasArg().argName("file")
                .desc("InfluxDB configuration, default is configdir/influxdb.ini").build());
        options.addOption(Option.builder().longOpt("job-db-file").hasArg().argName("file")
                .desc("Job database, default is workdir/jobs.sqlite3").build());
        options.addOption(Option.builder().longOpt("log-file").hasArg().argName("file")
                .desc("Log file, default is workdir/remote-testsuite.log").build());
        options.addOption(Option.builder().longOpt("initialize")
                .desc("Initialize the tool with default configuration").build());
        options.addOption(Option.builder().longOpt("check")
                .desc("Check if the given configuration is valid and exit").build());
        options.addOption(Option.builder().longOpt("no-influxdb")
                .desc("Do not write to InfluxDB, only run the jobs").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show this help").build());
        return options;
    }

    static MonitorConfig toConfig(CommandLine cmd) {
        MonitorConfig config = MonitorConfig.fromEnv();
        if (cmd.hasOption("workdir")) {
            config.withWorkDir(Path.of(cmd.getOptionValue("workdir")));
        }
        if (cmd.hasOption("configdir")) {
            config.withConfigDir(Path.of(cmd.getOptionValue("configdir")));
        }
        if (cmd.hasOption("config-file")) {
            config.withConfigFile(Path.of(cmd.getOptionValue("config-file")));
        }
        if (cmd.hasOption("influxdb-config-file")) {
            config.withInfluxConfigFile(Path.of(cmd.getOptionValue("influxdb-config-file")));
        }
        if (cmd.hasOption("job-db-file")) {
            config.withJobDbFile(Path.of(cmd.getOptionValue("job-db-file")));
        }
        if (cmd.hasOption("log-file")) {
            config.withLogFile(Path.of(cmd.getOptionValue("log-file")));
        }
        return config.withInfluxEnabled(!cmd.hasOption("no-influxdb"));
    }

    static int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printUsage(options);
            return 2;
        }
        if (cmd.hasOption("help")) {
            printUsage(options);
            return 0;
        }

        MonitorConfig config = toConfig(cmd);

        // Must be set before the first logger is created
        System.setProperty(LOG_FILE_PROPERTY, config.logFile().toString());
        Logger log = LoggerFactory.getLogger(App.class);

        try {
            if (cmd.hasOption("initialize")) {
                return DefaultConfiguration.install(config.configDir()) ? 0 : 1;
            }

            List<Path> required = new ArrayList<>();
            required.add(config.configFile());
            if (config.influxEnabled()) {
                required.add(config.influxConfigFile());
            }
            for (Path file : required) {
                if (!Files.exists(file)) {
                    log.error("Not able to find {}. Exiting.", file.toAbsolutePath());
                    return 1;
                }
            }
            Files.createDirectories(config.workDir());

            List<ProbeDefinition> probes = new ProbeConfigLoader().loadEnabled(config.configFile());
            if (cmd.hasOption("check")) {
                log.info("Maximum number of required workers: {}", ProbeScheduler.requiredWorkers(probes));
                log.info("Configuration check successful. Exiting.");
                return 0;
            }

            return serve(config, probes, log);
        } catch (IOException | RuntimeException e) {
            log.error("Startup failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private static int serve(MonitorConfig config, List<ProbeDefinition> probes, Logger log) throws IOException {
        Dependencies deps = Dependencies.create(config, probes);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            deps.close();
            shutdown.countDown();
        }, "resmon-shutdown"));

        deps.recovery().recover().whenComplete((v, e) -> {
            if (e != null) {
                log.error("Recovery of unfinished jobs failed", e);
            } else {
                log.info("Recovery of unfinished jobs done");
            }
        });
        deps.scheduler().start();

        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    private static void printUsage(Options options) {
        new HelpFormatter().printHelp("resmon", options, true);
    }
}
