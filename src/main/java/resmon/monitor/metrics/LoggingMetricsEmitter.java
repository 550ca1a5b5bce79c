package resmon.monitor.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.model.TestResult;

/**
 * Used with {@code --no-influxdb}: results only go to the log.
 */
public final class LoggingMetricsEmitter implements MetricsEmitter {

    private static final Logger log = LoggerFactory.getLogger(LoggingMetricsEmitter.class);

    @Override
    public void emit(TestResult result) {
        log.info("Test result (not written to InfluxDB): {}", result);
    }
}
