package resmon.monitor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Bundled starter configuration, copied into a fresh config directory by {@code --initialize}.
 */
public final class DefaultConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DefaultConfiguration.class);

    private static final String RESOURCE_ROOT = "/default_configuration/";

    /** Files shipped under {@code src/main/resources/default_configuration}. */
    static final List<String> FILES = List.of(
            "config.yml",
            "influxdb.ini",
            "default/default.sh");

    private DefaultConfiguration() {
    }

    /**
     * Copy the default files into {@code configDir}.
     *
     * @return false if the directory exists and is not empty; nothing is copied then
     */
    public static boolean install(Path configDir) throws IOException {
        Path target = configDir.toAbsolutePath();
        if (Files.isDirectory(target) && !isEmpty(target)) {
            log.error("Config directory {} already exists and is not empty.", target);
            return false;
        }
        log.info("Initializing tool for the first time, setting up a default config in {}", target);
        Files.createDirectories(target);

        for (String name : FILES) {
            Path file = target.resolve(name);
            Files.createDirectories(file.getParent());
            try (InputStream in = DefaultConfiguration.class.getResourceAsStream(RESOURCE_ROOT + name)) {
                if (in == null) {
                    throw new IOException("Missing bundled resource " + RESOURCE_ROOT + name);
                }
                Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
            }
            if (name.endsWith(".sh") && !file.toFile().setExecutable(true)) {
                log.warn("Could not make {} executable", file);
            }
        }

        log.info("Default configuration copied to {}", target);
        log.info("Please edit the configuration files to enable jobs and set parameters");
        return true;
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
