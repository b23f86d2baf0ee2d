package space.ketterling.waterstress.series;

import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.waterstress.quality.DataQualityLog;
import space.ketterling.waterstress.quality.IssueKind;

/**
 * Stacks per-slice aggregates into one long-format table.
 *
 * <p>
 * The result holds exactly one record per (region, month) for every month
 * between the first and last observed month, sorted by region then month.
 * Months no slice covered are filled with invalid records.
 * </p>
 */
public final class TimeSeriesAssembler {
    private static final Logger log = LoggerFactory.getLogger(TimeSeriesAssembler.class);

    private record Key(String regionId, YearMonth month) {
    }

    /**
     * Assembles the table.
     *
     * @param records   per-slice records in any order
     * @param regionIds every region that must appear, even one without records
     * @throws IllegalStateException if two records share a (region, month) key
     */
    public List<RegionTimeSeriesRecord> assemble(Collection<RegionTimeSeriesRecord> records,
            Collection<String> regionIds, DataQualityLog quality) {
        Map<Key, RegionTimeSeriesRecord> byKey = new HashMap<>();
        Set<String> regions = new LinkedHashSet<>(regionIds);
        YearMonth first = null;
        YearMonth last = null;

        for (RegionTimeSeriesRecord r : records) {
            Key k = new Key(r.regionId(), r.month());
            if (byKey.putIfAbsent(k, r) != null) {
                throw new IllegalStateException("Duplicate record for region " + r.regionId() + " at " + r.month());
            }
            regions.add(r.regionId());
            if (first == null || r.month().isBefore(first))
                first = r.month();
            if (last == null || r.month().isAfter(last))
                last = r.month();
        }

        if (first == null) {
            log.warn("No aggregates to assemble");
            return List.of();
        }

        List<RegionTimeSeriesRecord> out = new ArrayList<>(
                regions.size() * (int) (first.until(last, ChronoUnit.MONTHS) + 1));
        int filled = 0;
        for (String region : regions) {
            for (YearMonth m = first; !m.isAfter(last); m = m.plusMonths(1)) {
                RegionTimeSeriesRecord r = byKey.get(new Key(region, m));
                if (r == null) {
                    quality.record(IssueKind.MISSING_SLICE_DATA, region, m, "no grid slice for month");
                    r = RegionTimeSeriesRecord.missing(region, m);
                    filled++;
                }
                out.add(r);
            }
        }
        out.sort(RegionTimeSeriesRecord.BY_REGION_AND_MONTH);

        log.info("Assembled {} records for {} regions, {} to {} ({} gap records)", out.size(), regions.size(),
                first, last, filled);
        return out;
    }
}
