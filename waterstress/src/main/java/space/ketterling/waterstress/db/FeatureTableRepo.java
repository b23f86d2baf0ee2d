package space.ketterling.waterstress.db;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.waterstress.features.FeatureRecord;
import space.ketterling.waterstress.impute.ImputedRecord;
import space.ketterling.waterstress.impute.ImputedValue;
import space.ketterling.waterstress.merge.MergedRecord;
import space.ketterling.waterstress.output.FeatureTableCsvWriter;
import space.ketterling.waterstress.series.RegionTimeSeriesRecord;

/**
 * Stores the feature table in {@code tws_feature_monthly}, one row per
 * (region_id, obs_month). Auxiliary columns are stored as a JSON object.
 */
public class FeatureTableRepo {
    private static final Logger log = LoggerFactory.getLogger(FeatureTableRepo.class);

    static final String TABLE = "tws_feature_monthly";

    private static final String DDL = """
            CREATE TABLE IF NOT EXISTS tws_feature_monthly (
              region_id        VARCHAR(128) NOT NULL,
              obs_month        DATE NOT NULL,
              country          VARCHAR(256),
              iso_a3           VARCHAR(16),
              tws_mean_cm      DOUBLE PRECISION,
              valid_aggregate  BOOLEAN NOT NULL,
              cell_count       INTEGER NOT NULL,
              tws_imputed      BOOLEAN NOT NULL,
              tws_fill_method  VARCHAR(32) NOT NULL,
              rolling_3        DOUBLE PRECISION,
              rolling_6        DOUBLE PRECISION,
              rolling_12       DOUBLE PRECISION,
              slope_6          DOUBLE PRECISION,
              z_score          DOUBLE PRECISION,
              month_of_year    INTEGER NOT NULL,
              drought_flag     BOOLEAN,
              stress_label     VARCHAR(64),
              aux_json         VARCHAR(8192),
              updated_at       TIMESTAMP NOT NULL,
              PRIMARY KEY (region_id, obs_month)
            )""";

    private static final String DELETE = "DELETE FROM tws_feature_monthly WHERE region_id=? AND obs_month=?";

    private static final String INSERT = "INSERT INTO tws_feature_monthly (region_id, obs_month, country, iso_a3, "
            + "tws_mean_cm, valid_aggregate, cell_count, tws_imputed, tws_fill_method, "
            + "rolling_3, rolling_6, rolling_12, slope_6, z_score, month_of_year, drought_flag, stress_label, "
            + "aux_json, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)";

    private static final int BATCH = 500;

    private final HikariDataSource ds;
    private final ObjectMapper om;

    /**
     * Creates a repo backed by the provided datasource and JSON mapper.
     */
    public FeatureTableRepo(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    /**
     * Creates the table when it does not exist yet.
     */
    public void ensureSchema() throws SQLException {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute(DDL);
        }
    }

    /**
     * Replaces the stored rows for every (region, month) in {@code rows} in a
     * single transaction; returns the number of rows written.
     */
    public int upsertAll(List<FeatureRecord> rows) throws SQLException {
        int written = 0;
        try (Connection c = ds.getConnection()) {
            boolean auto = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement del = c.prepareStatement(DELETE);
                    PreparedStatement ins = c.prepareStatement(INSERT)) {
                int pending = 0;
                for (FeatureRecord f : rows) {
                    RegionTimeSeriesRecord s = f.imputed().merged().series();
                    del.setString(1, s.regionId());
                    del.setDate(2, Date.valueOf(s.month().atDay(1)));
                    del.addBatch();
                    bind(ins, f);
                    ins.addBatch();
                    if (++pending == BATCH) {
                        del.executeBatch();
                        ins.executeBatch();
                        written += pending;
                        pending = 0;
                    }
                }
                if (pending > 0) {
                    del.executeBatch();
                    ins.executeBatch();
                    written += pending;
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(auto);
            }
        }
        log.info("Upserted {} rows into {}", written, TABLE);
        return written;
    }

    /**
     * Counts stored rows; used to report what the sink holds.
     */
    public int count() throws SQLException {
        try (Connection c = ds.getConnection();
                Statement st = c.createStatement();
                var rs = st.executeQuery("SELECT COUNT(*) FROM " + TABLE)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private void bind(PreparedStatement ps, FeatureRecord f) throws SQLException {
        ImputedRecord imp = f.imputed();
        MergedRecord m = imp.merged();
        RegionTimeSeriesRecord s = m.series();

        ps.setString(1, s.regionId());
        ps.setDate(2, Date.valueOf(s.month().atDay(1)));
        ps.setString(3, m.country());
        ps.setString(4, m.isoA3());
        setDouble(ps, 5, imp.tws().value());
        ps.setBoolean(6, s.valid());
        ps.setInt(7, s.cellCount());
        ps.setBoolean(8, imp.tws().imputed());
        ps.setString(9, imp.tws().method().name());
        setDouble(ps, 10, f.rolling3());
        setDouble(ps, 11, f.rolling6());
        setDouble(ps, 12, f.rolling12());
        setDouble(ps, 13, f.slope6());
        setDouble(ps, 14, f.zScore());
        ps.setInt(15, f.month());
        if (f.droughtFlag() == null)
            ps.setNull(16, Types.BOOLEAN);
        else
            ps.setBoolean(16, f.droughtFlag());
        ps.setString(17, f.stressLabel());
        ps.setString(18, auxJson(imp));
    }

    private String auxJson(ImputedRecord imp) throws SQLException {
        Map<String, Object> aux = new LinkedHashMap<>();
        for (Map.Entry<String, ImputedValue> e : imp.numeric().entrySet()) {
            aux.put(e.getKey(), e.getValue().value());
            aux.put(e.getKey() + FeatureTableCsvWriter.FILL_METHOD_SUFFIX, e.getValue().method().name());
        }
        aux.putAll(imp.merged().text());
        if (aux.isEmpty())
            return null;
        try {
            return om.writeValueAsString(aux);
        } catch (JsonProcessingException e) {
            throw new SQLException("Could not serialise auxiliary columns for " + imp.regionId(), e);
        }
    }

    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }
}
