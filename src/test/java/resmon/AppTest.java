package resmon;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import resmon.monitor.config.MonitorConfig;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path tmp;

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(App.buildOptions(), args);
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(0, App.run(new String[]{"--help"}));
    }

    @Test
    void unknownOptionIsAUsageError() {
        assertEquals(2, App.run(new String[]{"--frobnicate"}));
    }

    @Test
    void filesDeriveFromDirectories() throws Exception {
        MonitorConfig config = App.toConfig(parse("--workdir", tmp.toString(), "--configdir", tmp.resolve("cfg").toString()));

        assertEquals(tmp.resolve("cfg").toAbsolutePath().resolve("config.yml"), config.configFile());
        assertEquals(tmp.resolve("cfg").toAbsolutePath().resolve("influxdb.ini"), config.influxConfigFile());
        assertEquals(tmp.toAbsolutePath().resolve("jobs.sqlite3"), config.jobDbFile());
        assertEquals(tmp.toAbsolutePath().resolve("remote-testsuite.log"), config.logFile());
        assertTrue(config.influxEnabled());
    }

    @Test
    void explicitFilesWin() throws Exception {
        MonitorConfig config = App.toConfig(parse(
                "--config-file", "/etc/resmon/probes.yml",
                "--job-db-file", "/var/lib/resmon/jobs.db",
                "--no-influxdb"));

        assertEquals(Path.of("/etc/resmon/probes.yml"), config.configFile());
        assertEquals(Path.of("/var/lib/resmon/jobs.db"), config.jobDbFile());
        assertFalse(config.influxEnabled());
    }

    @Test
    void initializeThenCheck() {
        String configDir = tmp.resolve("job_configuration").toString();
        String workDir = tmp.resolve("work").toString();

        assertEquals(0, App.run(new String[]{"--initialize", "--configdir", configDir, "--workdir", workDir}));
        assertTrue(Files.exists(Path.of(configDir, "config.yml")));

        // A second initialize refuses to overwrite
        assertEquals(1, App.run(new String[]{"--initialize", "--configdir", configDir, "--workdir", workDir}));

        assertEquals(0, App.run(new String[]{"--check", "--configdir", configDir, "--workdir", workDir}));
    }

    @Test
    void missingConfigurationFails() {
        assertEquals(1, App.run(new String[]{"--check",
                "--configdir", tmp.resolve("nowhere").toString(),
                "--workdir", tmp.resolve("work").toString()}));
    }
}
