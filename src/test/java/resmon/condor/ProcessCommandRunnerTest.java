package resmon.condor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static Set<Long> liveChildren() {
        return ProcessHandle.current().children()
                .filter(ProcessHandle::isAlive)
                .map(ProcessHandle::pid)
                .collect(Collectors.toSet());
    }

    @Test
    void capturesExitCodeAndOutput() throws Exception {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err >&2; exit 3"),
                Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertFalse(result.succeeded());
        assertEquals("out", result.stdout().strip());
        assertEquals("err", result.stderr().strip());
    }

    @Test
    void slowCommandTimesOut() {
        IOException e = assertThrows(IOException.class,
                () -> runner.run(List.of("sleep", "30"), Duration.ofMillis(200)));
        assertTrue(e.getMessage().contains("did not finish"));
    }

    @Test
    void interruptedWaitKillsTheCommand() throws Exception {
        Set<Long> before = liveChildren();

        Thread.currentThread().interrupt();
        assertThrows(InterruptedException.class,
                () -> runner.run(List.of("sleep", "30"), Duration.ofSeconds(60)));
        Thread.interrupted();

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        Set<Long> started = liveChildren();
        started.removeAll(before);
        while (!started.isEmpty()) {
            if (System.nanoTime() > deadline) {
                fail("command still running: " + started);
            }
            Thread.sleep(20);
            started = liveChildren();
            started.removeAll(before);
        }
    }
}
