/*
* Copyright 2025 Taylor Ketterling
* Stage orchestration for the water stress pipeline, including the worker
* pool used for per-slice aggregation and per-region features.
*/

package space.ketterling.waterstress.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.fasterxml.jackson.databind.ObjectMapper;

import space.ketterling.waterstress.config.AppConfig;
import space.ketterling.waterstress.config.AppConfig.AuxTableSpec;
import space.ketterling.waterstress.features.FeatureEngineer;
import space.ketterling.waterstress.features.FeatureRecord;
import space.ketterling.waterstress.grid.CoordinateNormalizer;
import space.ketterling.waterstress.grid.GridDataset;
import space.ketterling.waterstress.grid.GridJsonReader;
import space.ketterling.waterstress.grid.GridSlice;
import space.ketterling.waterstress.grid.MalformedGridException;
import space.ketterling.waterstress.impute.ImputedRecord;
import space.ketterling.waterstress.impute.Imputer;
import space.ketterling.waterstress.merge.AuxiliaryTable;
import space.ketterling.waterstress.merge.AuxiliaryTableReader;
import space.ketterling.waterstress.merge.DatasetMerger;
import space.ketterling.waterstress.merge.MergedTable;
import space.ketterling.waterstress.output.RunSummary;
import space.ketterling.waterstress.quality.DataQualityLog;
import space.ketterling.waterstress.region.IsoA3Normalizer;
import space.ketterling.waterstress.region.RegionPolygon;
import space.ketterling.waterstress.region.RegionReader;
import space.ketterling.waterstress.region.RegionSet;
import space.ketterling.waterstress.series.RegionTimeSeriesRecord;
import space.ketterling.waterstress.series.TimeSeriesAssembler;
import space.ketterling.waterstress.zonal.AggregateCache;
import space.ketterling.waterstress.zonal.ZonalAggregator;

/**
 * Runs the stages in order: normalize, aggregate, assemble, merge, impute,
 * engineer features.
 *
 * <p>
 * Every slice is normalized before any aggregation starts, so a malformed
 * grid fails the run without partial output. Slices are then aggregated in
 * parallel on a fixed pool and combined by month; features are computed per
 * region on the same pool. One instance may run several times; close it to
 * release the pool.
 * </p>
 */
public final class WaterStressPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WaterStressPipeline.class);

    private final PipelineSettings settings;
    private final ExecutorService pool;

    public WaterStressPipeline(PipelineSettings settings) {
        this.settings = settings;
        this.pool = Executors.newFixedThreadPool(Math.max(1, settings.workerThreads()),
                namedThreads("waterstress-worker"));
    }

    /**
     * Reads every configured input and runs the pipeline.
     */
    public PipelineResult run(AppConfig cfg, ObjectMapper om, IsoA3Normalizer iso) throws IOException {
        GridDataset grid;
        RegionSet regions;
        List<AuxiliaryTable> aux = new ArrayList<>();
        MDC.put("job", "read-inputs");
        try {
            grid = new GridJsonReader(om).read(Path.of(cfg.gridPath()), cfg.gridVariable());
            regions = new RegionReader(om, iso).read(Path.of(cfg.polygonPath()));
            AuxiliaryTableReader auxReader = new AuxiliaryTableReader(iso);
            for (AuxTableSpec spec : cfg.auxTables())
                aux.add(auxReader.read(spec));
        } finally {
            MDC.remove("job");
        }
        return run(grid, regions, aux);
    }

    /**
     * Runs every stage on already loaded inputs.
     *
     * @throws MalformedGridException if any slice has bad axes or two slices
     *                                share a month
     */
    public PipelineResult run(GridDataset grid, RegionSet regions, List<AuxiliaryTable> auxTables) {
        long t0 = System.currentTimeMillis();
        DataQualityLog quality = new DataQualityLog();
        log.info("Pipeline start: {} slices of '{}', {} regions, {} auxiliary tables", grid.size(),
                grid.variable(), regions.size(), auxTables.size());

        List<GridSlice> slices = stage("normalize", () -> normalize(grid));
        List<RegionTimeSeriesRecord> records = stage("aggregate", () -> aggregate(slices, regions, quality));

        List<String> regionIds = regions.regions().stream().map(RegionPolygon::id).toList();
        List<RegionTimeSeriesRecord> series = stage("assemble",
                () -> new TimeSeriesAssembler().assemble(records, regionIds, quality));

        MergedTable merged = stage("merge", () -> new DatasetMerger().merge(series, regions, auxTables, quality));
        checkStressColumn(merged);

        List<ImputedRecord> imputed = stage("impute", () -> new Imputer().impute(merged, quality));
        List<FeatureRecord> features = stage("features", () -> features(imputed));

        RunSummary summary = RunSummary.from(features, settings.droughtThresholdCm(), quality.counts());
        log.info("Pipeline done in {} ms: {} rows, issues {}", System.currentTimeMillis() - t0, features.size(),
                summary.issueCounts());
        return new PipelineResult(features, merged.numericColumns(), merged.textColumns(), summary, quality);
    }

    // ----------------------------
    // stages
    // ----------------------------
    private static List<GridSlice> normalize(GridDataset grid) {
        List<GridSlice> out = new ArrayList<>(grid.size());
        Set<YearMonth> months = new HashSet<>();
        for (GridSlice s : grid.slices()) {
            if (!months.add(s.month())) {
                throw new MalformedGridException("Two slices fall in month " + s.month());
            }
            out.add(CoordinateNormalizer.ensureSigned(s));
        }
        return out;
    }

    private List<RegionTimeSeriesRecord> aggregate(List<GridSlice> slices, RegionSet regions,
            DataQualityLog quality) {
        ZonalAggregator aggregator = new ZonalAggregator(settings.statistic(), settings.containmentRule());
        AggregateCache cache = settings.cacheAggregates() ? new AggregateCache() : null;

        Map<YearMonth, Future<List<RegionTimeSeriesRecord>>> futures = new TreeMap<>();
        for (GridSlice s : slices) {
            futures.put(s.month(), pool.submit(withJob("aggregate-" + s.month(),
                    () -> aggregator.aggregate(s, regions, cache, quality))));
        }

        List<RegionTimeSeriesRecord> out = new ArrayList<>(slices.size() * regions.size());
        for (var e : futures.entrySet())
            out.addAll(await(e.getValue(), "aggregate " + e.getKey()));

        if (cache != null) {
            log.info("Aggregate cache: {} entries, {} hits, {} misses", cache.size(), cache.hits(),
                    cache.misses());
        }
        return out;
    }

    private List<FeatureRecord> features(List<ImputedRecord> imputed) {
        FeatureEngineer engineer = new FeatureEngineer(settings.droughtThresholdCm(), settings.stressScoreColumn());
        Map<String, List<ImputedRecord>> byRegion = new LinkedHashMap<>();
        for (ImputedRecord r : imputed)
            byRegion.computeIfAbsent(r.regionId(), k -> new ArrayList<>()).add(r);

        Map<String, Future<List<FeatureRecord>>> futures = new LinkedHashMap<>();
        for (var e : byRegion.entrySet()) {
            List<ImputedRecord> series = e.getValue();
            futures.put(e.getKey(), pool.submit(withJob("features-" + e.getKey(),
                    () -> engineer.computeRegion(series))));
        }

        List<FeatureRecord> out = new ArrayList<>(imputed.size());
        for (var e : futures.entrySet())
            out.addAll(await(e.getValue(), "features " + e.getKey()));
        return out;
    }

    private void checkStressColumn(MergedTable merged) {
        String col = settings.stressScoreColumn();
        if (col != null && !merged.numericColumns().contains(col)) {
            throw new IllegalStateException("Stress score column '" + col
                    + "' is not a numeric auxiliary column; available: " + merged.numericColumns());
        }
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private static <T> T stage(String name, Callable<T> body) {
        MDC.put("job", name);
        long t0 = System.currentTimeMillis();
        try {
            T result = body.call();
            log.debug("Stage {} took {} ms", name, System.currentTimeMillis() - t0);
            return result;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Stage " + name + " failed", e);
        } finally {
            MDC.remove("job");
        }
    }

    private static <T> Callable<T> withJob(String job, Callable<T> body) {
        return () -> {
            MDC.put("job", job);
            try {
                return body.call();
            } finally {
                MDC.remove("job");
            }
        };
    }

    private static <T> T await(Future<T> f, String what) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw new IllegalStateException(what + " failed", cause);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
