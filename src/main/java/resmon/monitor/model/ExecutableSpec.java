package resmon.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The {@code job} section of a probe: what to run and which files it produces.
 * File names are relative; the job workspace decides where they live.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutableSpec(
        @JsonProperty("executable") String executable,
        @JsonProperty("arguments") String arguments,
        @JsonProperty("universe") String universe,
        @JsonProperty("input_files") List<String> inputFiles,
        @JsonProperty("output_file") String outputFile,
        @JsonProperty("output") String output,
        @JsonProperty("error") String error,
        @JsonProperty("log") String log) {

    public ExecutableSpec {
        Objects.requireNonNull(executable, "executable is required");
        Objects.requireNonNull(outputFile, "output_file is required");
        arguments = arguments == null ? "" : arguments;
        universe = universe == null || universe.isBlank() ? "vanilla" : universe;
        inputFiles = inputFiles == null ? List.of() : List.copyOf(inputFiles);
        output = output == null ? "stdout.txt" : output;
        error = error == null ? "stderr.txt" : error;
        log = log == null ? "job.log" : log;
    }
}
