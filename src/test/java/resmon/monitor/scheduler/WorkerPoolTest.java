package resmon.monitor.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    @Test
    void failingTaskDoesNotStopWorkers() throws Exception {
        try (WorkerPool pool = new WorkerPool(1)) {
            CountDownLatch done = new CountDownLatch(1);

            pool.submit("boom", () -> {
                throw new IllegalStateException("boom");
            });
            pool.submit("after", done::countDown);

            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void runsUpToSizeTasksConcurrentlyAndQueuesTheRest() throws Exception {
        WorkerPool pool = new WorkerPool(2);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        AtomicInteger finished = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            pool.submit("task-" + i, () -> {
                threads.add(Thread.currentThread().getName());
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                finished.incrementAndGet();
            });
        }

        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(2, pool.active());
        assertEquals(1, pool.queued());

        release.countDown();
        pool.shutdown(Duration.ofSeconds(5));

        assertEquals(3, finished.get());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("resmon-worker-")));
    }

    @Test
    void rejectsEmptyPool() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0));
    }
}
