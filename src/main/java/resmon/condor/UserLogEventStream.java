package resmon.condor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.backend.EventStream;
import resmon.monitor.model.JobEvent;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Follows a user event log as it grows. The log is shared by all jobs of a probe,
 * so events of other clusters come through as well.
 */
public class UserLogEventStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(UserLogEventStream.class);

    static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(1);

    private final Path userLog;
    private final Duration checkInterval;
    private final UserLogParser parser = new UserLogParser();
    private final ByteArrayOutputStream partialLine = new ByteArrayOutputStream();
    private final ByteBuffer buffer = ByteBuffer.allocate(8192);

    private long position;
    private boolean closed;

    public UserLogEventStream(Path userLog) {
        this(userLog, DEFAULT_CHECK_INTERVAL);
    }

    public UserLogEventStream(Path userLog, Duration checkInterval) {
        this.userLog = userLog;
        this.checkInterval = checkInterval;
    }

    @Override
    public List<JobEvent> poll(Duration maxWait) throws InterruptedException {
        if (closed) {
            throw new IllegalStateException("Event stream for " + userLog + " is closed");
        }
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            List<JobEvent> events = readAvailable();
            if (!events.isEmpty()) {
                return events;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return events;
            }
            Thread.sleep(Math.max(1, Math.min(checkInterval.toMillis(), remaining / 1_000_000)));
        }
    }

    /**
     * Read whatever was appended since the last call and parse complete lines.
     */
    List<JobEvent> readAvailable() {
        List<JobEvent> events = new ArrayList<>();
        if (!Files.exists(userLog)) {
            return events;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(userLog)) {
            if (channel.size() < position) {
                log.warn("Event log {} shrank, reading it from the start", userLog);
                position = 0;
                partialLine.reset();
            }
            channel.position(position);
            int read;
            while ((read = channel.read(buffer.clear())) > 0) {
                position += read;
                consume(buffer.array(), read, events);
            }
        } catch (IOException e) {
            log.warn("Could not read event log {}: {}", userLog, e.getMessage());
        }
        return events;
    }

    private void consume(byte[] bytes, int length, List<JobEvent> events) {
        for (int i = 0; i < length; i++) {
            byte b = bytes[i];
            if (b == '\n') {
                String line = partialLine.toString(StandardCharsets.UTF_8);
                partialLine.reset();
                parser.feed(line).ifPresent(events::add);
            } else if (b != '\r') {
                partialLine.write(b);
            }
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
