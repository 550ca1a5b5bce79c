package resmon.monitor.metrics;

import org.influxdb.InfluxDB;
import org.influxdb.InfluxDBFactory;
import org.influxdb.dto.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.config.InfluxSettings;
import resmon.monitor.model.TestResult;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.concurrent.TimeUnit;

/**
 * Writes one {@code testresults} point per finished job, stamped with the job's
 * submission time.
 */
public class InfluxMetricsEmitter implements MetricsEmitter {

    private static final Logger log = LoggerFactory.getLogger(InfluxMetricsEmitter.class);

    public static final String MEASUREMENT = "testresults";

    private final InfluxDB influxDB;
    private final String hostname;

    public InfluxMetricsEmitter(InfluxSettings settings) {
        this(connect(settings), localHostname());
        log.info("Connected to InfluxDB: {}", settings);
    }

    public InfluxMetricsEmitter(InfluxDB influxDB, String hostname) {
        this.influxDB = influxDB;
        this.hostname = hostname;
    }

    private static InfluxDB connect(InfluxSettings settings) {
        InfluxDB client = settings.hasCredentials()
                ? InfluxDBFactory.connect(settings.url(), settings.effectiveUsername(), settings.password())
                : InfluxDBFactory.connect(settings.url());
        client.setDatabase(settings.database());
        if (settings.retentionPolicy() != null) {
            client.setRetentionPolicy(settings.retentionPolicy());
        }
        return client;
    }

    @Override
    public void emit(TestResult result) {
        log.info("Writing data to influxdb: {}", result);
        influxDB.write(toPoint(result, hostname));
        log.info("Data written to influxdb");
    }

    /**
     * Build the point for a result.
     */
    public static Point toPoint(TestResult result, String hostname) {
        return Point.measurement(MEASUREMENT)
                .time(result.submissionTime().toEpochMilli(), TimeUnit.MILLISECONDS)
                .tag("test_name", result.name())
                .addField("cluster-id", String.valueOf(result.clusterId()))
                .addField("result", result.passed() ? 1L : 0L)
                .addField("message", result.message())
                .addField("runtime", result.runtime())
                .addField("cpu_efficiency", result.cpuEfficiency())
                .addField("testtime", result.testtime())
                .addField("site", result.site())
                .addField("hostname", hostname)
                .build();
    }

    static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            log.warn("Could not resolve local hostname ({}), using {}", e.getMessage(), env);
            return env != null ? env : "unknown";
        }
    }

    @Override
    public void close() {
        influxDB.close();
    }
}
