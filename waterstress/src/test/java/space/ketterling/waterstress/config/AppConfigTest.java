package space.ketterling.waterstress.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import space.ketterling.waterstress.config.AppConfig.AuxTableSpec;
import space.ketterling.waterstress.zonal.ContainmentRule;
import space.ketterling.waterstress.zonal.Statistic;

class AppConfigTest {

    private static Properties required() {
        Properties p = new Properties();
        p.setProperty("grid.path", "data/grace.json");
        p.setProperty("regions.path", "data/countries.geojson");
        p.setProperty("output.path", "out/features.csv");
        return p;
    }

    @Test
    void defaultsApply() {
        AppConfig cfg = AppConfig.fromProperties(required());
        assertEquals("lwe_thickness", cfg.gridVariable());
        assertEquals("out/features.summary.json", cfg.summaryPath());
        assertEquals(Statistic.MEAN, cfg.statistic());
        assertEquals(ContainmentRule.CENTER, cfg.containmentRule());
        assertEquals(-5.0, cfg.droughtThresholdCm());
        assertTrue(cfg.auxTables().isEmpty());
        assertTrue(cfg.workerThreads() >= 1);
        assertTrue(cfg.cacheAggregates());
        assertFalse(cfg.dbEnabled());
        assertFalse(cfg.stressLabelEnabled());
    }

    @Test
    void explicitValuesOverrideDefaults() {
        Properties p = required();
        p.setProperty("zonal.statistic", "area_weighted_mean");
        p.setProperty("zonal.rule", "overlap");
        p.setProperty("features.droughtThresholdCm", "-3.5");
        p.setProperty("features.stressScoreColumn", "aqueduct_bws_score");
        p.setProperty("aux.tables", "aqueduct,data/aqueduct.csv,name|fao,data/fao.csv.gz,Area");
        p.setProperty("pipeline.workers", "0");
        p.setProperty("db.jdbcUrl", "jdbc:postgresql://localhost/water");

        AppConfig cfg = AppConfig.fromProperties(p);

        assertEquals(Statistic.AREA_WEIGHTED_MEAN, cfg.statistic());
        assertEquals(ContainmentRule.OVERLAP, cfg.containmentRule());
        assertEquals(-3.5, cfg.droughtThresholdCm());
        assertTrue(cfg.stressLabelEnabled());
        assertEquals(List.of(new AuxTableSpec("aqueduct", "data/aqueduct.csv", "name"),
                new AuxTableSpec("fao", "data/fao.csv.gz", "Area")), cfg.auxTables());
        assertEquals(1, cfg.workerThreads());
        assertTrue(cfg.dbEnabled());
    }

    @Test
    void missingRequiredValueFails() {
        Properties p = required();
        p.remove("regions.path");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("regions.path"));
    }

    @Test
    void badAuxTableSpecFails() {
        assertThrows(IllegalStateException.class, () -> AppConfig.parseAuxTables("aqueduct,data/a.csv"));
        assertThrows(IllegalStateException.class,
                () -> AppConfig.parseAuxTables("a,x.csv,k|A,y.csv,k"));
    }

    @Test
    void unknownStatisticFails() {
        Properties p = required();
        p.setProperty("zonal.statistic", "max");
        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
    }

    @Test
    void nonNumericValuesNameTheirKey() {
        Properties p = required();
        p.setProperty("pipeline.workers", "four");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("pipeline.workers"));

        Properties q = required();
        q.setProperty("features.droughtThresholdCm", "-5cm");
        e = assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(q));
        assertTrue(e.getMessage().contains("features.droughtThresholdCm"));
        assertInstanceOf(NumberFormatException.class, e.getCause());

        Properties r = required();
        r.setProperty("db.poolMax", "");
        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(r));
    }
}
