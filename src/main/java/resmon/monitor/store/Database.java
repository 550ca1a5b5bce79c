package resmon.monitor.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.config.MonitorConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection pool over the SQLite job database.
 * Connections are handed out with auto-commit off; callers commit explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    /** Milliseconds a writer waits for the file lock held by another connection. */
    private static final int BUSY_TIMEOUT_MS = 10_000;

    private final HikariDataSource dataSource;

    public Database(MonitorConfig config) {
        this(config.jobDbFile(), config.databasePoolSize());
    }

    public Database(Path dbFile, int poolSize) {
        this("jdbc:sqlite:" + dbFile.toAbsolutePath(), poolSize);
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(30000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("resmon-db-pool");
        hikariConfig.setAutoCommit(false);

        // SQLite specific settings
        hikariConfig.addDataSourceProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
