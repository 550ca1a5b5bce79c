package resmon.monitor.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProbeDefinitionTest {

    private static ProbeDefinition probe(long interval, long timeout) {
        ExecutableSpec spec = new ExecutableSpec("p.sh", null, null, null, "out.yaml", null, null, null);
        return ProbeDefinition.builder()
                .name("p")
                .intervalSeconds(interval)
                .jobConfig(new JobConfig(spec, null, timeout, null))
                .build();
    }

    @Test
    void overlapRoundsUp() {
        assertEquals(1, probe(600, 300).maxOverlap());
        assertEquals(1, probe(300, 300).maxOverlap());
        assertEquals(5, probe(60, 300).maxOverlap());
        assertEquals(5, probe(100, 450).maxOverlap());
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> probe(0, 300));
    }

    @Test
    void jobDefaultsAreFilledIn() {
        JobConfig config = probe(600, 300).jobConfig();

        assertEquals("vanilla", config.job().universe());
        assertEquals(List.of(), config.job().inputFiles());
        assertEquals("job.log", config.job().log());
        assertEquals(Requirements.minimal(), config.requirements());
        assertEquals("", config.site());
    }

    @Test
    void activeStatusesKeepJobInQueue() {
        assertTrue(BackendJobStatus.RUNNING.isActive());
        assertTrue(BackendJobStatus.HELD.isActive());
        assertFalse(BackendJobStatus.COMPLETED.isActive());
        assertFalse(BackendJobStatus.REMOVED.isActive());
        assertEquals(BackendJobStatus.UNKNOWN, BackendJobStatus.fromCode(42));
    }
}
