package resmon.monitor.job;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import resmon.monitor.model.JobOutput;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the YAML artifact a probe writes:
 * <pre>
 * tests:
 *   - name: test1
 *     passed: true
 *     message: "test1 passed"
 * </pre>
 * A document without a {@code tests} key is not a result; {@code tests: []} is.
 */
public final class OutputParser {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private OutputParser() {
    }

    public static JobOutput parse(Path artifact) throws IOException {
        JsonNode root = YAML.readTree(artifact.toFile());
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IOException("Empty output artifact: " + artifact);
        }
        JsonNode tests = root.get("tests");
        if (tests == null || tests.isNull()) {
            throw new IOException("No tests in output artifact: " + artifact);
        }
        return YAML.treeToValue(root, JobOutput.class);
    }
}
