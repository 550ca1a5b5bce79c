package resmon.monitor.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InfluxSettingsTest {

    @TempDir
    Path tmp;

    @Test
    void tokenOnlyConfigurationAuthenticates() throws Exception {
        Path file = Path.of(getClass().getResource("/config/influxdb.ini").toURI());

        InfluxSettings settings = InfluxSettings.load(file);

        assertEquals("http://influx.example.org:8086", settings.url());
        assertEquals("sitetests", settings.database());
        assertEquals("s3cr3t", settings.password());
        assertEquals("kit", settings.org());
        assertNull(settings.username());
        assertTrue(settings.hasCredentials());
        assertEquals(InfluxSettings.TOKEN_USER, settings.effectiveUsername());
        assertNull(settings.retentionPolicy());
        assertFalse(settings.toString().contains("s3cr3t"));
    }

    @Test
    void fullSection() throws Exception {
        Path file = tmp.resolve("influx.ini");
        Files.writeString(file, """
                [INFLUXDB]
                url = http://localhost:8086
                database = resmon
                username = monitor
                password = pw
                retention_policy = autogen
                """);

        InfluxSettings settings = InfluxSettings.load(file);

        assertTrue(settings.hasCredentials());
        assertEquals("monitor", settings.effectiveUsername());
        assertNull(settings.org());
        assertEquals("autogen", settings.retentionPolicy());
    }

    @Test
    void missingSectionIsRejected() throws Exception {
        Path file = tmp.resolve("other.ini");
        Files.writeString(file, "[OTHER]\nurl = x\n");

        assertThrows(IllegalArgumentException.class, () -> InfluxSettings.load(file));
    }

    @Test
    void withoutPasswordOrTokenNoAuthentication() throws Exception {
        Path file = tmp.resolve("open.ini");
        Files.writeString(file, """
                [INFLUXDB]
                url = http://localhost:8086
                database = resmon
                username = monitor
                password =
                """);

        assertFalse(InfluxSettings.load(file).hasCredentials());
    }
}
