/*
* Copyright 2025 Taylor Ketterling
* Command-line entry point for the water stress pipeline.
*
* Loads configuration, reads the grid, region and auxiliary inputs, runs the
* normalize/aggregate/assemble/merge/impute/feature stages and writes the
* feature table and run summary. When a JDBC URL is configured the table is
* also upserted into the database and the run is logged there.
*/

package space.ketterling.waterstress;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.waterstress.config.AppConfig;
import space.ketterling.waterstress.db.Database;
import space.ketterling.waterstress.db.FeatureTableRepo;
import space.ketterling.waterstress.db.RunLogRepo;
import space.ketterling.waterstress.output.FeatureTableCsvWriter;
import space.ketterling.waterstress.output.RunSummaryWriter;
import space.ketterling.waterstress.pipeline.PipelineResult;
import space.ketterling.waterstress.pipeline.PipelineSettings;
import space.ketterling.waterstress.pipeline.WaterStressPipeline;
import space.ketterling.waterstress.region.IsoA3Normalizer;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting water stress pipeline");
        AppConfig cfg = AppConfig.load();
        ObjectMapper om = new ObjectMapper();

        if (!cfg.dbEnabled()) {
            run(cfg, om, null);
            return;
        }

        try (HikariDataSource ds = Database.createSinkDataSource(cfg)) {
            run(cfg, om, ds);
        }
    }

    /**
     * Runs the pipeline once and writes every output; {@code ds} is null when
     * the database sink is disabled.
     */
    static PipelineResult run(AppConfig cfg, ObjectMapper om, HikariDataSource ds) throws Exception {
        RunLogRepo runLog = null;
        UUID runId = null;
        if (ds != null) {
            runLog = new RunLogRepo(ds);
            runLog.ensureSchema();
            runId = runLog.startRun("waterstress");
        }

        try (WaterStressPipeline pipeline = new WaterStressPipeline(PipelineSettings.from(cfg))) {
            PipelineResult result = pipeline.run(cfg, om, IsoA3Normalizer.fromClasspath());

            MDC.put("job", "write-output");
            try {
                new FeatureTableCsvWriter(result.numericColumns(), result.textColumns())
                        .write(Path.of(cfg.outputPath()), result.features());
                new RunSummaryWriter(om).write(Path.of(cfg.summaryPath()), result.summary());

                if (ds != null) {
                    FeatureTableRepo repo = new FeatureTableRepo(ds, om);
                    repo.ensureSchema();
                    repo.upsertAll(result.features());
                }
            } finally {
                MDC.remove("job");
            }

            if (runLog != null)
                runLog.finishRun(runId, true, result.features().size(), "issues=" + result.summary().issueCounts());
            log.info("Run complete: {} rows, latest month {}", result.features().size(),
                    result.summary().latestMonth());
            return result;
        } catch (Exception e) {
            log.error("Pipeline run failed", e);
            if (runLog != null) {
                try {
                    runLog.finishRun(runId, false, null, truncate(String.valueOf(e.getMessage()), 4000));
                } catch (SQLException logFailure) {
                    e.addSuppressed(logFailure);
                }
            }
            throw e;
        }
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
