package resmon.monitor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.model.ExecutableSpec;
import resmon.monitor.model.JobConfig;
import resmon.monitor.model.ProbeDefinition;
import resmon.monitor.model.Requirements;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads probe definitions from {@code config.yml}:
 *
 * <pre>
 * jobs:
 *   - name: default
 *     parameters:
 *       enabled: true
 *       interval: 600
 *       timeout: 300
 *       site: ...
 *       job: { executable: ..., output_file: ..., ... }
 *       requirements: { cpu: 1, memory: 1024, disk: 100000 }
 * </pre>
 */
public final class ProbeConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ProbeConfigLoader.class);

    private final ObjectMapper mapper;

    public ProbeConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    /**
     * Load every probe, enabled or not.
     *
     * @throws IOException              if the file cannot be read or parsed
     * @throws IllegalArgumentException on missing values or duplicate names
     */
    public List<ProbeDefinition> load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public List<ProbeDefinition> load(InputStream in) throws IOException {
        ProbeFile parsed = mapper.readValue(in, ProbeFile.class);
        if (parsed == null || parsed.jobs() == null) {
            throw new IllegalArgumentException("No 'jobs' section in configuration");
        }

        List<ProbeDefinition> probes = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ProbeEntry entry : parsed.jobs()) {
            ProbeDefinition probe = toDefinition(entry);
            if (!names.add(probe.name())) {
                throw new IllegalArgumentException("Duplicate probe name: " + probe.name());
            }
            probes.add(probe);
        }
        return probes;
    }

    /**
     * Load the enabled probes only.
     *
     * @throws IllegalStateException if no probe is enabled
     */
    public List<ProbeDefinition> loadEnabled(Path file) throws IOException {
        return enabledOnly(load(file));
    }

    public static List<ProbeDefinition> enabledOnly(List<ProbeDefinition> probes) {
        List<ProbeDefinition> enabled = probes.stream().filter(ProbeDefinition::enabled).toList();
        if (enabled.isEmpty()) {
            throw new IllegalStateException("No jobs enabled in config");
        }
        log.info("Enabled jobs: {}", enabled.stream().map(ProbeDefinition::name).toList());
        return enabled;
    }

    private static ProbeDefinition toDefinition(ProbeEntry entry) {
        if (entry.name() == null || entry.name().isBlank()) {
            throw new IllegalArgumentException("Probe without a name");
        }
        Parameters p = entry.parameters();
        if (p == null) {
            throw new IllegalArgumentException("Probe " + entry.name() + " has no parameters");
        }
        if (p.job() == null) {
            throw new IllegalArgumentException("Probe " + entry.name() + " has no job section");
        }
        if (p.interval() == null || p.timeout() == null) {
            throw new IllegalArgumentException("Probe " + entry.name() + " needs interval and timeout");
        }
        return ProbeDefinition.builder()
                .name(entry.name())
                .enabled(p.enabled() == null || p.enabled())
                .intervalSeconds(p.interval())
                .jobConfig(new JobConfig(p.job(), p.requirements(), p.timeout(), p.site()))
                .build();
    }

    // ---------- File layout ----------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProbeFile(@JsonProperty("jobs") List<ProbeEntry> jobs) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProbeEntry(
            @JsonProperty("name") String name,
            @JsonProperty("parameters") Parameters parameters) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Parameters(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("interval") Long interval,
            @JsonProperty("timeout") Long timeout,
            @JsonProperty("site") String site,
            @JsonProperty("job") ExecutableSpec job,
            @JsonProperty("requirements") Requirements requirements) {
    }
}
