package resmon.monitor.job;

import resmon.monitor.model.ExecutableSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * On-disk layout of one probe:
 * <pre>
 * configDir/&lt;probe&gt;/           executable and input files
 * workDir/logs/&lt;probe&gt;/        stdout, stderr and the shared event log
 * workDir/results/&lt;probe&gt;/     output artifacts, id_&lt;cluster&gt;-&lt;proc&gt;-&lt;output_file&gt;
 * </pre>
 */
public final class JobWorkspace {

    private final Path configDir;
    private final Path workDir;
    private final String probeName;
    private final ExecutableSpec spec;

    public JobWorkspace(Path configDir, Path workDir, String probeName, ExecutableSpec spec) {
        this.configDir = configDir.toAbsolutePath();
        this.workDir = workDir.toAbsolutePath();
        this.probeName = probeName;
        this.spec = spec;
    }

    public Path configDir() {
        return configDir;
    }

    public Path workDir() {
        return workDir;
    }

    public Path jobDataFolder() {
        return configDir.resolve(probeName);
    }

    public Path logsFolder() {
        return workDir.resolve("logs").resolve(probeName);
    }

    public Path resultsFolder() {
        return workDir.resolve("results").resolve(probeName);
    }

    /** Create the log and result folders if missing. */
    public void prepare() throws IOException {
        Files.createDirectories(logsFolder());
        Files.createDirectories(resultsFolder());
    }

    public Path executable() {
        return jobDataFolder().resolve(spec.executable());
    }

    public List<Path> inputFiles() {
        return spec.inputFiles().stream().map(f -> jobDataFolder().resolve(f)).toList();
    }

    public Path userLog() {
        return logsFolder().resolve(spec.log());
    }

    /** Remap target for the output artifact, with batch system macros. */
    public String resultFileTemplate() {
        return resultsFolder().resolve(resultPrefix("$(Cluster)") + "$(Process)-" + spec.outputFile()).toString();
    }

    public String stdoutTemplate() {
        return logsFolder().resolve("$(Cluster)_" + spec.output()).toString();
    }

    public String stderrTemplate() {
        return logsFolder().resolve("$(Cluster)_" + spec.error()).toString();
    }

    /**
     * Find the output artifact written for a cluster.
     *
     * @param clusterId cluster id
     * @return the artifact path, empty if the job produced none
     */
    public Optional<Path> findOutput(long clusterId) throws IOException {
        Path folder = resultsFolder();
        if (!Files.isDirectory(folder)) {
            return Optional.empty();
        }
        String prefix = resultPrefix(String.valueOf(clusterId));
        try (Stream<Path> files = Files.list(folder)) {
            return files.filter(p -> p.getFileName().toString().startsWith(prefix))
                    .sorted()
                    .findFirst();
        }
    }

    /**
     * Delete stdout, stderr and result files belonging to a cluster.
     *
     * @return number of deleted files
     */
    public int cleanup(long clusterId) throws IOException {
        List<Path> deletions = new ArrayList<>();
        deletions.addAll(matching(logsFolder(), clusterId + "_"));
        deletions.addAll(matching(resultsFolder(), resultPrefix(String.valueOf(clusterId))));
        for (Path file : deletions) {
            Files.deleteIfExists(file);
        }
        return deletions.size();
    }

    private static List<Path> matching(Path folder, String prefix) throws IOException {
        if (!Files.isDirectory(folder)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(folder)) {
            return files.filter(p -> p.getFileName().toString().startsWith(prefix)).toList();
        }
    }

    private static String resultPrefix(String cluster) {
        return "id_" + cluster + "-";
    }
}
