package resmon.monitor.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Connection settings of the InfluxDB metrics sink, read from the {@code [INFLUXDB]}
 * section of an INI file:
 *
 * <pre>
 * [INFLUXDB]
 * url = http://localhost:8086
 * database = resmon
 * username = monitor
 * password = secret
 * retention_policy = autogen
 * </pre>
 * An InfluxDB 2 server is addressed through its 1.x compatibility API with
 * {@code bucket}, {@code org} and {@code token} in place of {@code database} and
 * {@code password}. Credentials, org and retention policy are optional.
 */
public record InfluxSettings(String url, String username, String password, String database,
        String retentionPolicy, String org) {

    public static final String SECTION = "INFLUXDB";

    /** User name sent with a token when none is configured; InfluxDB 2 ignores it. */
    public static final String TOKEN_USER = "resmon";

    public InfluxSettings {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(database, "database is required");
    }

    /** True when a password or token is set; the connection then authenticates. */
    public boolean hasCredentials() {
        return password != null && !password.isBlank();
    }

    /** Configured user name, or {@link #TOKEN_USER} for token-only configurations. */
    public String effectiveUsername() {
        return username != null && !username.isBlank() ? username : TOKEN_USER;
    }

    public static InfluxSettings load(Path file) throws IOException {
        Ini ini = new Ini(file.toFile());
        Profile.Section section = ini.get(SECTION);
        if (section == null) {
            throw new IllegalArgumentException("No [" + SECTION + "] section in " + file);
        }

        String url = section.get("url");
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("[" + SECTION + "] url is missing in " + file);
        }
        String database = opt(section, "database", opt(section, "bucket", null));
        if (database == null) {
            throw new IllegalArgumentException("[" + SECTION + "] database is missing in " + file);
        }

        return new InfluxSettings(
                url.trim(),
                opt(section, "username", null),
                opt(section, "password", opt(section, "token", null)),
                database,
                opt(section, "retention_policy", null),
                opt(section, "org", null));
    }

    private static String opt(Profile.Section section, String key, String def) {
        String value = section.get(key);
        return value == null || value.isBlank() ? def : value.trim();
    }

    @Override
    public String toString() {
        return "InfluxSettings{url='" + url + "', database='" + database + "', org=" + org
                + ", user=" + username + ", authenticated=" + hasCredentials() + "}";
    }
}
