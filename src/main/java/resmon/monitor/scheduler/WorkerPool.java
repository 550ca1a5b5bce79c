package resmon.monitor.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads draining an unbounded FIFO queue.
 * Submitting never blocks; a failing task is logged and its worker carries on.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ThreadPoolExecutor executor;
    private final int size;

    public WorkerPool(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Worker pool needs at least one thread, got " + size);
        }
        this.size = size;
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "resmon-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        log.info("Worker pool started with {} workers", size);
    }

    /**
     * Queue a task.
     *
     * @param name used in the log if the task fails
     */
    public void submit(String name, Runnable task) {
        executor.execute(wrapRunnable(name, task));
    }

    public int size() {
        return size;
    }

    /** Tasks waiting for a free worker. */
    public int queued() {
        return executor.getQueue().size();
    }

    /** Workers currently running a task. */
    public int active() {
        return executor.getActiveCount();
    }

    /**
     * Stop accepting tasks and interrupt running ones after {@code grace}.
     */
    public void shutdown(Duration grace) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            } else {
                log.info("Worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    private static Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
