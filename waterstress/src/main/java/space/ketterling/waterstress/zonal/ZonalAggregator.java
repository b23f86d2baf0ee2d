package space.ketterling.waterstress.zonal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.waterstress.grid.GridSlice;
import space.ketterling.waterstress.quality.DataQualityLog;
import space.ketterling.waterstress.quality.IssueKind;
import space.ketterling.waterstress.region.RegionPolygon;
import space.ketterling.waterstress.region.RegionSet;
import space.ketterling.waterstress.series.RegionTimeSeriesRecord;

/**
 * Computes one aggregate per region for a grid slice (zonal statistics).
 *
 * <p>
 * Cells are matched against each region with the configured
 * {@link ContainmentRule}; NaN and fill cells never contribute. Longitude is
 * circular: every cell is also tried at lon + 360 and lon - 360, which covers
 * polygons unwrapped past 180 and polygons stored in the 0..360 convention.
 * Instances hold no mutable state and can be shared across worker threads.
 * </p>
 */
public final class ZonalAggregator {
    private static final Logger log = LoggerFactory.getLogger(ZonalAggregator.class);

    private static final double[] LON_SHIFTS = { 0.0, 360.0, -360.0 };

    private final Statistic statistic;
    private final ContainmentRule rule;
    private final GeometryFactory gf = new GeometryFactory();

    public ZonalAggregator(Statistic statistic, ContainmentRule rule) {
        this.statistic = statistic;
        this.rule = rule;
    }

    /**
     * Aggregate value and number of contributing cells; value is null when no
     * valid cell fell inside the region.
     */
    public record RegionStat(Double value, int cellCount) {
    }

    /**
     * Aggregates every region for one slice. Regions with no valid cells get
     * an invalid record and a {@link IssueKind#MISSING_SLICE_DATA} issue.
     *
     * @param cache run-owned cache, or null to always compute
     */
    public List<RegionTimeSeriesRecord> aggregate(GridSlice slice, RegionSet regions, AggregateCache cache,
            DataQualityLog quality) {
        Map<String, RegionStat> stats = cache == null
                ? computeAll(slice, regions)
                : cache.computeIfAbsent(regions, slice, () -> computeAll(slice, regions));

        List<RegionTimeSeriesRecord> out = new ArrayList<>(regions.size());
        for (RegionPolygon region : regions.regions()) {
            RegionStat st = stats.get(region.id());
            if (st == null || st.value() == null) {
                quality.record(IssueKind.MISSING_SLICE_DATA, region.id(), slice.month(),
                        "no valid cells in slice " + slice.time());
                out.add(RegionTimeSeriesRecord.missing(region.id(), slice.month()));
            } else {
                out.add(RegionTimeSeriesRecord.observed(region.id(), slice.month(), st.value(), st.cellCount()));
            }
        }
        return out;
    }

    private Map<String, RegionStat> computeAll(GridSlice slice, RegionSet regions) {
        Map<String, RegionStat> out = new HashMap<>();
        for (RegionPolygon region : regions.regions())
            out.put(region.id(), aggregateRegion(slice, region));
        log.debug("Aggregated {} regions for slice {}", out.size(), slice.time());
        return out;
    }

    /**
     * Aggregates the valid cells of one region.
     */
    public RegionStat aggregateRegion(GridSlice slice, RegionPolygon region) {
        Envelope env = region.envelope();
        PreparedGeometry prepared = region.prepared();
        double halfLat = rule == ContainmentRule.OVERLAP ? spacing(slice.lats()) / 2.0 : 0.0;
        double halfLon = rule == ContainmentRule.OVERLAP ? spacing(slice.lons()) / 2.0 : 0.0;

        double[] values = new double[16];
        double[] weights = new double[16];
        int n = 0;

        for (int i = 0; i < slice.latCount(); i++) {
            double lat = slice.lat(i);
            if (lat + halfLat < env.getMinY() || lat - halfLat > env.getMaxY())
                continue;
            double weight = Math.max(0.0, Math.cos(Math.toRadians(lat)));

            for (int j = 0; j < slice.lonCount(); j++) {
                if (slice.isMissing(i, j))
                    continue;
                if (!inside(prepared, env, slice.lon(j), lat, halfLon, halfLat))
                    continue;
                if (n == values.length) {
                    values = Arrays.copyOf(values, n * 2);
                    weights = Arrays.copyOf(weights, n * 2);
                }
                values[n] = slice.value(i, j);
                weights[n] = weight;
                n++;
            }
        }

        if (n == 0)
            return new RegionStat(null, 0);
        return new RegionStat(statistic.apply(values, weights, n), n);
    }

    private boolean inside(PreparedGeometry prepared, Envelope env, double lon, double lat, double halfLon,
            double halfLat) {
        for (double shift : LON_SHIFTS) {
            double x = lon + shift;
            if (x + halfLon < env.getMinX() || x - halfLon > env.getMaxX())
                continue;
            boolean hit;
            if (rule == ContainmentRule.OVERLAP) {
                Envelope cell = new Envelope(x - halfLon, x + halfLon, lat - halfLat, lat + halfLat);
                hit = prepared.intersects(gf.toGeometry(cell));
            } else {
                hit = prepared.covers(gf.createPoint(new Coordinate(x, lat)));
            }
            if (hit)
                return true;
        }
        return false;
    }

    /**
     * Mean spacing of a regular axis; 0 for a single coordinate.
     */
    static double spacing(double[] axis) {
        if (axis.length < 2)
            return 0.0;
        return Math.abs(axis[axis.length - 1] - axis[0]) / (axis.length - 1);
    }
}
