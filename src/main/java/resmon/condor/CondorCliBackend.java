package resmon.condor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.backend.BackendAdapter;
import resmon.monitor.backend.BackendException;
import resmon.monitor.backend.EventStream;
import resmon.monitor.backend.QueryException;
import resmon.monitor.backend.SubmissionException;
import resmon.monitor.backend.SubmitRequest;
import resmon.monitor.model.BackendJobStatus;
import resmon.monitor.model.HistoryRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link BackendAdapter} driving the local schedd through the HTCondor command line tools.
 */
public class CondorCliBackend implements BackendAdapter {

    private static final Logger log = LoggerFactory.getLogger(CondorCliBackend.class);

    static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);

    /** {@code condor_submit -terse} prints the first and last job id: {@code 123.0 - 123.0}. */
    private static final Pattern TERSE_ID = Pattern.compile("^(\\d+)\\.(\\d+)\\s*-\\s*(\\d+)\\.(\\d+)");

    private static final String QUERY_ATTRIBUTES = "ClusterId,ProcId,JobStatus";
    private static final String HISTORY_ATTRIBUTES =
            "ClusterId,ProcId,JobStatus,RemoteWallClockTime,RemoteUserCpu,RemoteSysCpu";

    private final CommandRunner runner;
    private final ObjectMapper mapper;
    private final Duration commandTimeout;
    private final Duration logCheckInterval;

    public CondorCliBackend() {
        this(new ProcessCommandRunner(), DEFAULT_COMMAND_TIMEOUT, UserLogEventStream.DEFAULT_CHECK_INTERVAL);
    }

    public CondorCliBackend(CommandRunner runner, Duration commandTimeout, Duration logCheckInterval) {
        this.runner = runner;
        this.mapper = new ObjectMapper();
        this.commandTimeout = commandTimeout;
        this.logCheckInterval = logCheckInterval;
    }

    // ---------- Submit ----------

    @Override
    public long submit(SubmitRequest request) throws SubmissionException {
        Path description = null;
        try {
            description = Files.createTempFile("resmon-", ".sub");
            Files.writeString(description, toSubmitDescription(request), StandardCharsets.UTF_8);

            CommandResult result = runner.run(
                    List.of("condor_submit", "-terse", description.toString()), commandTimeout);
            if (!result.succeeded()) {
                throw new SubmissionException("condor_submit failed (exit " + result.exitCode() + "): "
                        + result.stderr().strip());
            }
            return parseClusterId(result.stdout());
        } catch (IOException e) {
            throw new SubmissionException("Could not run condor_submit: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubmissionException("Interrupted while submitting", e);
        } finally {
            deleteQuietly(description);
        }
    }

    /**
     * Render a submit description file, one {@code key = value} per line, ending with {@code queue 1}.
     */
    static String toSubmitDescription(SubmitRequest request) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : request.attributes().entrySet()) {
            sb.append(entry.getKey()).append(" = ").append(entry.getValue()).append('\n');
        }
        sb.append("queue 1\n");
        return sb.toString();
    }

    static long parseClusterId(String terseOutput) throws SubmissionException {
        for (String line : terseOutput.split("\\R")) {
            Matcher m = TERSE_ID.matcher(line.strip());
            if (m.find()) {
                return Long.parseLong(m.group(1));
            }
        }
        throw new SubmissionException("Unexpected condor_submit output: " + terseOutput.strip());
    }

    // ---------- Events ----------

    @Override
    public EventStream openEventStream(Path userLog) {
        return new UserLogEventStream(userLog, logCheckInterval);
    }

    // ---------- Queries ----------

    @Override
    public Optional<BackendJobStatus> query(long clusterId) throws QueryException {
        List<JsonNode> ads = runJson(List.of("condor_q", String.valueOf(clusterId),
                "-json", "-attributes", QUERY_ATTRIBUTES));
        return primary(ads).map(ad -> BackendJobStatus.fromCode(ad.path("JobStatus").asInt()));
    }

    @Override
    public Optional<HistoryRecord> history(long clusterId) throws QueryException {
        List<JsonNode> ads = runJson(List.of("condor_history", String.valueOf(clusterId),
                "-limit", "1", "-json", "-attributes", HISTORY_ATTRIBUTES));
        return primary(ads).map(ad -> new HistoryRecord(
                clusterId,
                BackendJobStatus.fromCode(ad.path("JobStatus").asInt()),
                ad.path("RemoteWallClockTime").asDouble(0),
                ad.path("RemoteUserCpu").asDouble(0),
                ad.path("RemoteSysCpu").asDouble(0)));
    }

    @Override
    public void cancel(long clusterId) throws BackendException {
        CommandResult result = execute(List.of("condor_rm", String.valueOf(clusterId)));
        if (!result.succeeded()) {
            throw new BackendException("condor_rm " + clusterId + " failed (exit " + result.exitCode() + "): "
                    + result.stderr().strip());
        }
        log.info("Removed job {} from the queue", clusterId);
    }

    // ---------- Helpers ----------

    private List<JsonNode> runJson(List<String> command) throws QueryException {
        CommandResult result = execute(command);
        if (!result.succeeded()) {
            throw new QueryException(command.get(0) + " failed (exit " + result.exitCode() + "): "
                    + result.stderr().strip());
        }
        String out = result.stdout().strip();
        List<JsonNode> ads = new ArrayList<>();
        if (out.isEmpty()) {
            return ads;
        }
        try {
            JsonNode root = mapper.readTree(out);
            if (root.isArray()) {
                root.forEach(ads::add);
            } else if (root.isObject()) {
                ads.add(root);
            }
        } catch (IOException e) {
            throw new QueryException("Unreadable " + command.get(0) + " output: " + e.getMessage(), e);
        }
        return ads;
    }

    /** The ad of process 0, or the first one if none carries a ProcId. */
    private static Optional<JsonNode> primary(List<JsonNode> ads) {
        return ads.stream()
                .filter(ad -> ad.path("ProcId").asInt(0) == 0)
                .findFirst();
    }

    private CommandResult execute(List<String> command) throws QueryException {
        try {
            return runner.run(command, commandTimeout);
        } catch (IOException e) {
            throw new QueryException("Could not run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryException("Interrupted while running " + command.get(0), e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
