package space.ketterling.waterstress;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.waterstress.config.AppConfig;
import space.ketterling.waterstress.pipeline.PipelineResult;

class MainTest {

    private static final String GRID = """
            {
              "dimensions": {"time": 3, "lat": 2, "lon": 4},
              "variables": {
                "time": {"shape": ["time"], "attributes": {"units": "days since 2002-01-01"},
                         "data": [15, 46, 74]},
                "lat": {"shape": ["lat"], "data": [-0.5, 0.5]},
                "lon": {"shape": ["lon"], "data": [0.5, 1.5, 358.5, 359.5]},
                "lwe_thickness": {"shape": ["time", "lat", "lon"],
                                  "attributes": {"_FillValue": -99999.0, "units": "cm"},
                                  "data": [[[1, 1, -8, -8], [1, 1, -8, -8]],
                                           [[2, 2, null, null], [2, 2, null, null]],
                                           [[3, 3, -6, -6], [3, 3, -6, -6]]]}
              }
            }""";

    private static final String REGIONS = """
            {"type": "FeatureCollection", "features": [
              {"type": "Feature", "properties": {"ADMIN": "Gabon", "ISO_A3": "GAB"},
               "geometry": {"type": "Polygon", "coordinates": [[[0,-1],[2,-1],[2,1],[0,1],[0,-1]]]}},
              {"type": "Feature", "properties": {"ADMIN": "Sao Tome and Principe", "ISO_A3": "-99"},
               "geometry": {"type": "Polygon", "coordinates": [[[-2,-1],[0,-1],[0,1],[-2,1],[-2,-1]]]}}
            ]}""";

    private static final String AQUEDUCT = """
            name,bws_score,bws_label
            Gabon,0.5,Low
            Sao Tome & Principe,4.2,Extremely High
            Atlantis,2.0,Medium-High
            """;

    @Test
    void runWritesTableSummaryAndDatabase(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("grid.json"), GRID);
        Files.writeString(dir.resolve("regions.geojson"), REGIONS);
        Files.writeString(dir.resolve("aqueduct.csv"), AQUEDUCT);

        Properties p = new Properties();
        p.setProperty("grid.path", dir.resolve("grid.json").toString());
        p.setProperty("regions.path", dir.resolve("regions.geojson").toString());
        p.setProperty("output.path", dir.resolve("out/features.csv").toString());
        p.setProperty("aux.tables", "aqueduct," + dir.resolve("aqueduct.csv") + ",name");
        p.setProperty("features.stressScoreColumn", "aqueduct_bws_score");
        p.setProperty("pipeline.workers", "2");
        AppConfig cfg = AppConfig.fromProperties(p);

        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl("jdbc:h2:mem:maintest;DB_CLOSE_DELAY=-1");
        hc.setUsername("sa");
        PipelineResult result;
        try (HikariDataSource ds = new HikariDataSource(hc)) {
            result = Main.run(cfg, new ObjectMapper(), ds);

            try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
                try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM tws_feature_monthly")) {
                    assertTrue(rs.next());
                    assertEquals(6, rs.getInt(1));
                }
                try (ResultSet rs = st.executeQuery("SELECT status, row_count FROM pipeline_run")) {
                    assertTrue(rs.next());
                    assertEquals("SUCCESS", rs.getString(1));
                    assertEquals(6, rs.getInt(2));
                }
            }
        }

        assertEquals(6, result.features().size());
        List<String> lines = Files.readAllLines(dir.resolve("out/features.csv"));
        assertEquals(7, lines.size());
        assertTrue(lines.get(0).endsWith(
                "stress_label,aqueduct_bws_score,aqueduct_bws_score_fill_method,aqueduct_bws_label"));
        assertTrue(lines.get(1).startsWith("GAB,Gabon,GAB,2002-01-01,1.0,true,4,false,OBSERVED,"), lines.get(1));
        assertTrue(lines.get(5).startsWith("STP,Sao Tome and Principe,STP,2002-02-01,-7.0,false,0,true,REGION_MEDIAN,"),
                lines.get(5));
        assertTrue(lines.get(4).contains("Extremely High (>80%),4.2,OBSERVED,"), lines.get(4));

        JsonNode summary = new ObjectMapper().readTree(dir.resolve("out/features.summary.json").toFile());
        assertEquals("2002-03", summary.path("latestMonth").asText());
        assertEquals(1, summary.path("regionsInDeficit").asInt());
        assertEquals("STP", summary.path("worstRegionId").asText());
        assertEquals(1, summary.path("issueCounts").path("JOIN_MISMATCH").asInt());
    }
}
