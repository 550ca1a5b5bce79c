package resmon.monitor.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.scheduler.ProbeScheduler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProbeConfigLoaderTest {

    @TempDir
    Path tmp;

    private final ProbeConfigLoader loader = new ProbeConfigLoader();

    private List<ProbeDefinition> loadResource(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/config/" + name)) {
            assertNotNull(in, "missing test resource " + name);
            return loader.load(in);
        }
    }

    @Test
    void loadsAllProbes() throws Exception {
        List<ProbeDefinition> probes = loadResource("probes.yml");

        assertEquals(3, probes.size());

        ProbeDefinition load = probes.get(0);
        assertEquals("gridka-load", load.name());
        assertTrue(load.enabled());
        assertEquals(60, load.intervalSeconds());
        assertEquals(300, load.timeoutSeconds());
        assertEquals("gridka", load.jobConfig().site());
        assertEquals("--load 4", load.jobConfig().job().arguments());
        // A single input file is accepted without list syntax
        assertEquals(List.of("payload.tar"), load.jobConfig().job().inputFiles());
        assertEquals(4, load.jobConfig().requirements().cpu());
        assertEquals("(TARGET.Machine =!= undefined)", load.jobConfig().requirements().requirements());

        ProbeDefinition gpu = probes.get(1);
        assertTrue(gpu.enabled());
        assertEquals("", gpu.jobConfig().site());
        assertEquals("job.log", gpu.jobConfig().job().log());
        assertTrue(gpu.jobConfig().requirements().hasGpu());
        assertEquals(1, gpu.jobConfig().requirements().cpu());

        assertFalse(probes.get(2).enabled());
    }

    @Test
    void disabledProbesAreFilteredOut() throws Exception {
        List<ProbeDefinition> enabled = ProbeConfigLoader.enabledOnly(loadResource("probes.yml"));

        assertEquals(List.of("gridka-load", "gpu-check"), enabled.stream().map(ProbeDefinition::name).toList());
        assertEquals(11, ProbeScheduler.requiredWorkers(enabled));
    }

    @Test
    void noEnabledProbeFails() throws Exception {
        List<ProbeDefinition> probes = loadResource("none-enabled.yml");

        assertThrows(IllegalStateException.class, () -> ProbeConfigLoader.enabledOnly(probes));
    }

    @Test
    void duplicateNamesAreRejected() throws Exception {
        Path file = tmp.resolve("dup.yml");
        Files.writeString(file, """
                jobs:
                  - name: a
                    parameters: {interval: 10, timeout: 10, job: {executable: a.sh, output_file: o}}
                  - name: a
                    parameters: {interval: 20, timeout: 10, job: {executable: a.sh, output_file: o}}
                """);

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }

    @Test
    void nonPositiveIntervalIsRejected() throws Exception {
        Path file = tmp.resolve("zero.yml");
        Files.writeString(file, """
                jobs:
                  - name: a
                    parameters: {interval: 0, timeout: 10, job: {executable: a.sh, output_file: o}}
                """);

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }

    @Test
    void missingTimeoutIsRejected() throws Exception {
        Path file = tmp.resolve("notimeout.yml");
        Files.writeString(file, """
                jobs:
                  - name: a
                    parameters: {interval: 10, job: {executable: a.sh, output_file: o}}
                """);

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }
}
