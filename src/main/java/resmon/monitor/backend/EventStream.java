package resmon.monitor.backend;

import resmon.monitor.model.JobEvent;

import java.time.Duration;
import java.util.List;

/**
 * Ordered stream of job events, read incrementally.
 */
public interface EventStream extends AutoCloseable {

    /**
     * Return the events that became available, waiting at most {@code maxWait}
     * for at least one. An empty list means nothing arrived in time.
     *
     * @param maxWait upper bound for the wait
     * @return new events in log order, never null
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    List<JobEvent> poll(Duration maxWait) throws InterruptedException;

    @Override
    void close();
}
