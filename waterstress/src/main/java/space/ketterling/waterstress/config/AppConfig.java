package space.ketterling.waterstress.config;

import java.io.InputStream;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.waterstress.zonal.ContainmentRule;
import space.ketterling.waterstress.zonal.Statistic;

/**
 * Pipeline configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups the input/output locations, the zonal aggregation and
 * feature settings, the worker pool size and the optional database sink.
 * </p>
 */
public record AppConfig(
        // Inputs
        String gridPath,
        String gridVariable,
        String polygonPath,
        List<AuxTableSpec> auxTables,

        // Outputs
        String outputPath,
        String summaryPath,

        // Zonal aggregation
        Statistic statistic,
        ContainmentRule containmentRule,

        // Features
        double droughtThresholdCm,
        String stressScoreColumn, // blank = no stress label

        // Execution
        int workerThreads,
        boolean cacheAggregates,

        // Optional DB sink (blank URL = disabled)
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final double DEFAULT_DROUGHT_THRESHOLD_CM = -5.0;

    /**
     * One auxiliary CSV table: a short name used as column prefix, its path and
     * the column holding the country name or code.
     */
    public record AuxTableSpec(String name, String path, String keyColumn) {
    }

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            log.warn("Could not read application.properties, using env/system properties only: {}", e.getMessage());
        }
        return fromProperties(p);
    }

    /**
     * Builds a config from the given properties, still letting env vars and
     * -Dprop values override them.
     */
    public static AppConfig fromProperties(Properties p) {
        // Required
        String grid = requireNonBlank("grid.path", envOr(p, "GRID_PATH", "grid.path", ""));
        String polygons = requireNonBlank("regions.path", envOr(p, "REGIONS_PATH", "regions.path", ""));
        String output = requireNonBlank("output.path", envOr(p, "OUTPUT_PATH", "output.path", ""));

        String variable = envOr(p, "GRID_VARIABLE", "grid.variable", "lwe_thickness");
        List<AuxTableSpec> aux = parseAuxTables(envOr(p, "AUX_TABLES", "aux.tables", ""));
        String summary = envOr(p, "SUMMARY_PATH", "output.summaryPath", "");
        if (summary.isBlank())
            summary = defaultSummaryPath(output);

        Statistic statistic = Statistic.parse(envOr(p, "ZONAL_STATISTIC", "zonal.statistic", "mean"));
        ContainmentRule rule = ContainmentRule.parse(envOr(p, "ZONAL_RULE", "zonal.rule", "center"));

        double threshold = parseDouble("features.droughtThresholdCm", envOr(p, "DROUGHT_THRESHOLD_CM",
                "features.droughtThresholdCm", Double.toString(DEFAULT_DROUGHT_THRESHOLD_CM)));
        String stressColumn = envOr(p, "STRESS_SCORE_COLUMN", "features.stressScoreColumn", "");

        int workers = parseInt("pipeline.workers", envOr(p, "PIPELINE_WORKERS", "pipeline.workers",
                Integer.toString(Runtime.getRuntime().availableProcessors())));
        boolean cache = Boolean.parseBoolean(envOr(p, "PIPELINE_CACHE", "pipeline.cacheAggregates", "true"));

        // DB sink is optional
        String dbUrl = envOr(p, "DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", "");
        int dbPoolMax = parseInt("db.poolMax", envOr(p, "DB_POOL_MAX", "db.poolMax", "4"));

        return new AppConfig(
                grid,
                variable,
                polygons,
                aux,

                output,
                summary,

                statistic,
                rule,

                threshold,
                stressColumn,

                Math.max(1, workers),
                cache,

                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax);
    }

    /**
     * True when a JDBC URL is configured.
     */
    public boolean dbEnabled() {
        return dbJdbcUrl != null && !dbJdbcUrl.isBlank();
    }

    /**
     * True when a stress score column is configured for labelling.
     */
    public boolean stressLabelEnabled() {
        return stressScoreColumn != null && !stressScoreColumn.isBlank();
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Config value '" + key + "' is not an integer: '" + v + "'", e);
        }
    }

    private static double parseDouble(String key, String v) {
        double d;
        try {
            d = Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Config value '" + key + "' is not a number: '" + v + "'", e);
        }
        if (!Double.isFinite(d))
            throw new IllegalStateException("Config value '" + key + "' must be finite: '" + v + "'");
        return d;
    }

    private static String requireNonBlank(String key, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value '" + key + "' (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    /**
     * Parses auxiliary tables in the format "name,path,keyColumn|name,path,keyColumn".
     */
    static List<AuxTableSpec> parseAuxTables(String s) {
        if (s == null || s.isBlank())
            return List.of();
        List<AuxTableSpec> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (String part : s.split("\\|")) {
            if (part.isBlank())
                continue;
            String[] bits = part.trim().split(",");
            if (bits.length != 3) {
                throw new IllegalStateException("Bad aux.tables entry (expected name,path,keyColumn): " + part);
            }
            String name = bits[0].trim().toLowerCase(Locale.ROOT);
            if (!names.add(name)) {
                throw new IllegalStateException("Duplicate aux table name: " + name);
            }
            out.add(new AuxTableSpec(name, bits[1].trim(), bits[2].trim()));
        }
        return List.copyOf(out);
    }

    /**
     * Places the run summary next to the output table.
     */
    private static String defaultSummaryPath(String outputPath) {
        int dot = outputPath.lastIndexOf('.');
        int slash = Math.max(outputPath.lastIndexOf('/'), outputPath.lastIndexOf('\\'));
        String base = dot > slash ? outputPath.substring(0, dot) : outputPath;
        return base + ".summary.json";
    }
}
