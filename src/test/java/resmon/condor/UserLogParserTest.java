package resmon.condor;

import org.junit.jupiter.api.Test;
import resmon.monitor.model.JobEvent;
import resmon.monitor.model.JobEventType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserLogParserTest {

    private static final String LOG = """
            000 (4711.000.000) 2024-05-01 10:00:00 Job submitted from host: <10.0.0.1:9618>
            ...
            001 (4711.000.000) 2024-05-01 10:00:05 Job executing on host: <10.0.0.7:9618>
            ...
            005 (4711.000.000) 2024-05-01 10:01:00 Job terminated.
            \t(1) Normal termination (return value 3)
            \t\tUsr 0 00:00:01, Sys 0 00:00:00  -  Run Remote Usage
            ...
            """;

    private static List<JobEvent> parse(UserLogParser parser, String text) {
        List<JobEvent> events = new ArrayList<>();
        for (String line : text.split("\n")) {
            parser.feed(line).ifPresent(events::add);
        }
        return events;
    }

    @Test
    void parsesSubmitExecuteAndTermination() {
        List<JobEvent> events = parse(new UserLogParser(), LOG);

        assertEquals(List.of(JobEventType.SUBMIT, JobEventType.EXECUTE, JobEventType.JOB_TERMINATED),
                events.stream().map(JobEvent::type).toList());

        JobEvent terminated = events.get(2);
        assertEquals(4711, terminated.clusterId());
        assertEquals(0, terminated.procId());
        assertTrue(terminated.terminatedNormally());
        assertEquals(3, terminated.returnValue());
    }

    @Test
    void abnormalTerminationCarriesSignal() {
        List<JobEvent> events = parse(new UserLogParser(), """
                005 (12.000.000) 2024-05-01 10:01:00 Job terminated.
                \t(0) Abnormal termination (signal 9)
                ...
                """);

        assertEquals(1, events.size());
        assertFalse(events.get(0).terminatedNormally());
        assertEquals(9, events.get(0).terminatedBySignal());
        assertEquals(-1, events.get(0).returnValue());
    }

    @Test
    void heldEventKeepsReason() {
        List<JobEvent> events = parse(new UserLogParser(), """
                012 (12.000.000) 2024-05-01 10:01:00 Job was held.
                \tError from slot1: out of memory
                \tCode 34 Subcode 0
                ...
                """);

        assertEquals(JobEventType.JOB_HELD, events.get(0).type());
        assertTrue(events.get(0).type().isAbnormalEnd());
        assertEquals("Error from slot1: out of memory", events.get(0).reason());
    }

    @Test
    void eventIsOnlyReturnedOnceClosed() {
        UserLogParser parser = new UserLogParser();

        assertTrue(parser.feed("005 (7.000.000) 2024-05-01 10:01:00 Job terminated.").isEmpty());
        assertTrue(parser.inEvent());
        assertTrue(parser.feed("\t(1) Normal termination (return value 0)").isEmpty());
        assertTrue(parser.feed("...").isPresent());
        assertFalse(parser.inEvent());
    }

    @Test
    void noiseOutsideBlocksIsIgnored() {
        List<JobEvent> events = parse(new UserLogParser(), """
                garbage from a truncated write
                ...
                999 (5.000.000) 2024-05-01 10:00:00 Something new
                ...
                """);

        assertEquals(1, events.size());
        assertEquals(JobEventType.UNKNOWN, events.get(0).type());
    }
}
