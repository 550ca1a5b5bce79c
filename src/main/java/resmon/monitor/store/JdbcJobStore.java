package resmon.monitor.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import resmon.monitor.model.JobSnapshot;
import resmon.monitor.model.StoreRecord;
import resmon.monitor.model.StoreStatus;
import resmon.monitor.repository.JobStore;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of JobStore over the {@code jobs} table:
 * <pre>
 * jobs(jobid TEXT, status INTEGER, submissiontime TIMESTAMP, object BLOB)
 * </pre>
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    public static final int DEFAULT_RETENTION_DAYS = 7;

    private final Database db;
    private final SnapshotCodec codec;
    private final Clock clock;
    private final int retentionDays;

    public JdbcJobStore(Database db) {
        this(db, new SnapshotCodec(), Clock.systemUTC(), DEFAULT_RETENTION_DAYS);
    }

    public JdbcJobStore(Database db, SnapshotCodec codec, Clock clock, int retentionDays) {
        this.db = db;
        this.codec = codec;
        this.clock = clock;
        this.retentionDays = retentionDays;
    }

    @Override
    public void initialize() {
        String sql = """
                    CREATE TABLE IF NOT EXISTS jobs (
                        jobid          TEXT,
                        status         INTEGER,
                        submissiontime TIMESTAMP,
                        object         BLOB
                    )
                """;

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {

            st.execute(sql);
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize job store", e);
        }

        int purged = purgeOlderThan(retentionDays);
        log.info("Job store initialized, purged {} records older than {} days", purged, retentionDays);
    }

    @Override
    public void put(JobSnapshot snapshot, StoreStatus status) {
        String sql = """
                    INSERT INTO jobs (jobid, status, submissiontime, object)
                    SELECT ?, ?, ?, ?
                    WHERE NOT EXISTS (SELECT 1 FROM jobs WHERE jobid = ?)
                """;
        String jobId = snapshot.jobId();
        byte[] object = codec.encode(snapshot);

        int inserted;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, status.code());
            ps.setTimestamp(3, Timestamp.from(snapshot.submissionTime()));
            ps.setBytes(4, object);
            ps.setString(5, jobId);

            inserted = ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to store job: " + jobId, e);
        }

        if (inserted == 0) {
            throw new StoreException("Job already stored: " + jobId);
        }
        log.debug("Stored job {} with status {}", jobId, status);
    }

    @Override
    public boolean updateStatus(String jobId, StoreStatus status) {
        if (status == StoreStatus.SUBMITTED) {
            throw new IllegalArgumentException("Job status cannot go back to " + status + ": " + jobId);
        }
        String sql = "UPDATE jobs SET status = ? WHERE jobid = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, status.code());
            ps.setString(2, jobId);
            ps.setInt(3, StoreStatus.SUBMITTED.code());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.warn("No submitted job {} to mark as {}", jobId, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update job status: " + jobId, e);
        }
    }

    @Override
    public List<StoreRecord> listUnfinished() {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY submissiontime, rowid";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, StoreStatus.SUBMITTED.code());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list unfinished jobs", e);
        }
    }

    @Override
    public List<StoreRecord> listAll() {
        String sql = "SELECT * FROM jobs ORDER BY submissiontime, rowid";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    @Override
    public int countAll() {
        String sql = "SELECT COUNT(*) FROM jobs";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs", e);
        }
    }

    @Override
    public int purgeOlderThan(int days) {
        String sql = "DELETE FROM jobs WHERE submissiontime < ?";
        Instant cutoff = clock.instant().minus(days, ChronoUnit.DAYS);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.info("Purged {} jobs submitted before {}", deleted, cutoff);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to purge jobs older than " + days + " days", e);
        }
    }

    // ---------- Helpers ----------

    private List<StoreRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<StoreRecord> records = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String jobId = rs.getString("jobid");
                try {
                    records.add(mapRow(rs));
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Skipping undecodable job record {}: {}", jobId, e.getMessage());
                }
            }
        }
        return records;
    }

    private StoreRecord mapRow(ResultSet rs) throws SQLException, IOException {
        Timestamp submitted = rs.getTimestamp("submissiontime");
        return new StoreRecord(
                rs.getString("jobid"),
                StoreStatus.fromCode(rs.getInt("status")),
                submitted != null ? submitted.toInstant() : null,
                codec.decode(rs.getBytes("object")));
    }
}
