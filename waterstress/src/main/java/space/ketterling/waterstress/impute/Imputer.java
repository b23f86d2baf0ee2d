package space.ketterling.waterstress.impute;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.waterstress.merge.MergedRecord;
import space.ketterling.waterstress.merge.MergedTable;
import space.ketterling.waterstress.quality.DataQualityLog;
import space.ketterling.waterstress.quality.IssueKind;

/**
 * Fills missing numeric values with a hierarchical median fallback.
 *
 * <p>
 * Per column and missing cell the first available of these wins: the
 * region's own median, the cross-region median for the same month, the
 * column's global median. Every median is taken over observed values only.
 * A cell with nothing to fall back on stays null and is reported as
 * {@link IssueKind#IMPUTATION_EXHAUSTED}.
 * </p>
 */
public final class Imputer {
    private static final Logger log = LoggerFactory.getLogger(Imputer.class);

    /** Column name of the primary aggregate. */
    public static final String PRIMARY_COLUMN = "tws_mean_cm";

    public List<ImputedRecord> impute(MergedTable table, DataQualityLog quality) {
        List<MergedRecord> rows = table.rows();

        List<ImputedValue> tws = imputeColumn(PRIMARY_COLUMN, rows, r -> r.series().value(), quality);
        Map<String, List<ImputedValue>> aux = new LinkedHashMap<>();
        for (String c : table.numericColumns())
            aux.put(c, imputeColumn(c, rows, r -> r.numeric().get(c), quality));

        List<ImputedRecord> out = new ArrayList<>(rows.size());
        for (int k = 0; k < rows.size(); k++) {
            Map<String, ImputedValue> numeric = new LinkedHashMap<>();
            for (var e : aux.entrySet())
                numeric.put(e.getKey(), e.getValue().get(k));
            out.add(new ImputedRecord(rows.get(k), tws.get(k), numeric));
        }
        return out;
    }

    /**
     * Imputes one column; the result is aligned with {@code rows}.
     */
    List<ImputedValue> imputeColumn(String column, List<MergedRecord> rows, Function<MergedRecord, Double> get,
            DataQualityLog quality) {
        Map<String, List<Double>> byRegion = new HashMap<>();
        Map<YearMonth, List<Double>> byMonth = new HashMap<>();
        List<Double> global = new ArrayList<>();
        for (MergedRecord r : rows) {
            Double v = get.apply(r);
            if (v == null || v.isNaN())
                continue;
            byRegion.computeIfAbsent(r.regionId(), k -> new ArrayList<>()).add(v);
            byMonth.computeIfAbsent(r.series().month(), k -> new ArrayList<>()).add(v);
            global.add(v);
        }
        Map<String, Double> regionMedian = medians(byRegion);
        Map<YearMonth, Double> monthMedian = medians(byMonth);
        Double globalMedian = median(global);

        int[] counts = new int[FillMethod.values().length];
        List<ImputedValue> out = new ArrayList<>(rows.size());
        for (MergedRecord r : rows) {
            Double v = get.apply(r);
            ImputedValue iv;
            if (v != null && !v.isNaN()) {
                iv = new ImputedValue(v, FillMethod.OBSERVED);
            } else if (regionMedian.containsKey(r.regionId())) {
                iv = new ImputedValue(regionMedian.get(r.regionId()), FillMethod.REGION_MEDIAN);
            } else if (monthMedian.containsKey(r.series().month())) {
                iv = new ImputedValue(monthMedian.get(r.series().month()), FillMethod.TIMESTAMP_MEDIAN);
            } else if (globalMedian != null) {
                iv = new ImputedValue(globalMedian, FillMethod.GLOBAL_MEDIAN);
            } else {
                quality.record(IssueKind.IMPUTATION_EXHAUSTED, r.regionId(), r.series().month(),
                        "column " + column + " has no observed values to fall back on");
                iv = ImputedValue.UNFILLED;
            }
            counts[iv.method().ordinal()]++;
            out.add(iv);
        }

        log.info("Imputed {}: observed={} region={} timestamp={} global={} unfilled={}", column,
                counts[FillMethod.OBSERVED.ordinal()], counts[FillMethod.REGION_MEDIAN.ordinal()],
                counts[FillMethod.TIMESTAMP_MEDIAN.ordinal()], counts[FillMethod.GLOBAL_MEDIAN.ordinal()],
                counts[FillMethod.UNFILLED.ordinal()]);
        return out;
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private static <K> Map<K, Double> medians(Map<K, List<Double>> groups) {
        Map<K, Double> out = new HashMap<>();
        for (var e : groups.entrySet())
            out.put(e.getKey(), median(e.getValue()));
        return out;
    }

    /**
     * Median of the values, or null when there are none.
     */
    static Double median(List<Double> values) {
        if (values.isEmpty())
            return null;
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        int mid = n / 2;
        return (n % 2 == 1) ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }
}
