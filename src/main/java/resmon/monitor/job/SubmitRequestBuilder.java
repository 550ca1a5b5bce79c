package resmon.monitor.job;

import resmon.monitor.backend.SubmitRequest;
import resmon.monitor.model.JobConfig;
import resmon.monitor.model.Requirements;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates a {@link JobConfig} into an HTCondor submit description.
 */
public final class SubmitRequestBuilder {

    static final String ACCOUNTING_GROUP = "sitetest";

    private SubmitRequestBuilder() {
    }

    public static SubmitRequest build(JobConfig config, JobWorkspace workspace) {
        var job = config.job();
        Map<String, String> sub = new LinkedHashMap<>();

        sub.put("executable", workspace.executable().toString());
        sub.put("arguments", job.arguments());
        sub.put("universe", job.universe());
        sub.put("accounting_group", ACCOUNTING_GROUP);

        // File transfer; the artifact comes back under a cluster specific name
        sub.put("should_transfer_files", "YES");
        sub.put("when_to_transfer_output", "ON_EXIT_OR_EVICT");
        if (!job.inputFiles().isEmpty()) {
            sub.put("transfer_input_files", workspace.inputFiles().stream()
                    .map(Path::toString)
                    .collect(Collectors.joining(",")));
        }
        sub.put("transfer_output_files", job.outputFile());
        sub.put("transfer_output_remaps", "\"" + job.outputFile() + " = " + workspace.resultFileTemplate() + "\"");

        sub.put("output", workspace.stdoutTemplate());
        sub.put("error", workspace.stderrTemplate());
        sub.put("log", workspace.userLog().toString());

        // Resources
        Requirements req = config.requirements();
        sub.put("request_cpus", String.valueOf(req.cpu()));
        if (req.memory() > 0) {
            sub.put("request_memory", String.valueOf(req.memory()));
        }
        if (req.disk() > 0) {
            sub.put("request_disk", String.valueOf(req.disk()));
        }
        if (req.hasGpu()) {
            sub.put("request_gpus", String.valueOf(req.gpu()));
        }
        if (req.hasExpression()) {
            sub.put("requirements", req.requirements());
        }

        // Bookkeeping only, the batch system does not enforce these
        sub.put("+ProbeTimeout", String.valueOf(config.timeout()));
        if (!config.site().isBlank()) {
            sub.put("+ProbeSite", "\"" + config.site() + "\"");
        }

        return new SubmitRequest(sub, workspace.userLog());
    }
}
