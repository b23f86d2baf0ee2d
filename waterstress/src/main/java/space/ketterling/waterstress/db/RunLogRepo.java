package space.ketterling.waterstress.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

import com.zaxxer.hikari.HikariDataSource;

/**
 * Database access for pipeline run bookkeeping.
 */
public class RunLogRepo {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(RunLogRepo.class);

    private static final String DDL = """
            CREATE TABLE IF NOT EXISTS pipeline_run (
              run_id       UUID PRIMARY KEY,
              job_name     VARCHAR(128) NOT NULL,
              started_at   TIMESTAMP NOT NULL,
              finished_at  TIMESTAMP,
              status       VARCHAR(16) NOT NULL,
              row_count    INTEGER,
              notes        VARCHAR(4096)
            )""";

    private final HikariDataSource ds;

    /**
     * Creates a repo backed by the provided datasource.
     */
    public RunLogRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    public void ensureSchema() throws SQLException {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute(DDL);
        }
    }

    /**
     * Starts a new run and returns its unique ID.
     */
    public UUID startRun(String jobName) throws SQLException {
        UUID runId = UUID.randomUUID();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO pipeline_run (run_id, job_name, started_at, status) "
                                + "VALUES (?, ?, CURRENT_TIMESTAMP, 'RUNNING')")) {
            ps.setObject(1, runId);
            ps.setString(2, jobName);
            ps.executeUpdate();
        }
        log.debug("startRun: {} -> {}", jobName, runId);
        return runId;
    }

    /**
     * Marks a run as success or failure with notes.
     */
    public void finishRun(UUID runId, boolean success, Integer rowCount, String notes) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE pipeline_run SET finished_at=CURRENT_TIMESTAMP, status=?, row_count=?, notes=? "
                                + "WHERE run_id=?")) {
            ps.setString(1, success ? "SUCCESS" : "FAILED");
            if (rowCount == null)
                ps.setNull(2, java.sql.Types.INTEGER);
            else
                ps.setInt(2, rowCount);
            ps.setString(3, notes);
            ps.setObject(4, runId);
            ps.executeUpdate();
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Returns the status of a run, or null if unknown.
     */
    public String status(UUID runId) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT status FROM pipeline_run WHERE run_id=?")) {
            ps.setObject(1, runId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }
}
