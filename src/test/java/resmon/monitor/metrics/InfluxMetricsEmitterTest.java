package resmon.monitor.metrics;

import org.influxdb.InfluxDB;
import org.influxdb.dto.Point;
import org.junit.jupiter.api.Test;
import resmon.monitor.model.TestResult;

import java.lang.reflect.Proxy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InfluxMetricsEmitterTest {

    private static final Instant SUBMITTED = Instant.parse("2024-05-01T10:00:00Z");

    private static TestResult result(boolean passed) {
        return new TestResult("ping", 12, passed, passed ? "All tests passed" : "Job timed out",
                42, 0.5, 60, "gridka", SUBMITTED);
    }

    @Test
    void pointCarriesAllFields() {
        String line = InfluxMetricsEmitter.toPoint(result(true), "submit01").lineProtocol();

        assertTrue(line.startsWith("testresults,test_name=ping "), line);
        assertTrue(line.contains("cluster-id=\"12\""), line);
        assertTrue(line.contains("result=1i"), line);
        assertTrue(line.contains("runtime=42i"), line);
        assertTrue(line.contains("cpu_efficiency=0.5"), line);
        assertTrue(line.contains("testtime=60i"), line);
        assertTrue(line.contains("site=\"gridka\""), line);
        assertTrue(line.contains("hostname=\"submit01\""), line);
        assertTrue(line.contains("message=\"All tests passed\""), line);
        // Point time is the submission time, written in nanoseconds
        assertTrue(line.endsWith(" " + SUBMITTED.toEpochMilli() * 1_000_000L), line);
    }

    @Test
    void failedResultIsZero() {
        String line = InfluxMetricsEmitter.toPoint(result(false), "submit01").lineProtocol();

        assertTrue(line.contains("result=0i"), line);
    }

    @Test
    void emitWritesOnePoint() {
        List<Point> written = new ArrayList<>();
        InfluxDB client = (InfluxDB) Proxy.newProxyInstance(
                InfluxDB.class.getClassLoader(),
                new Class<?>[]{InfluxDB.class},
                (proxy, method, args) -> {
                    if (method.getName().equals("write") && args != null && args.length == 1
                            && args[0] instanceof Point p) {
                        written.add(p);
                    }
                    return null;
                });

        new InfluxMetricsEmitter(client, "submit01").emit(result(true));

        assertEquals(1, written.size());
        assertTrue(written.get(0).lineProtocol().contains("test_name=ping"));
    }
}
