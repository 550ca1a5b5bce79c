package resmon.monitor.metrics;

import resmon.monitor.model.TestResult;

/**
 * Sink for per-job result records.
 */
public interface MetricsEmitter extends AutoCloseable {

    /**
     * Emit one result. Failures surface as runtime exceptions; the caller decides
     * whether they matter.
     */
    void emit(TestResult result);

    @Override
    default void close() {
    }
}
