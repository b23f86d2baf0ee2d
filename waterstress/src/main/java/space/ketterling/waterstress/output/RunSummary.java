package space.ketterling.waterstress.output;

import java.time.YearMonth;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import space.ketterling.waterstress.features.FeatureRecord;
import space.ketterling.waterstress.quality.IssueKind;

/**
 * Latest-month overview of a run, written next to the feature table.
 */
public record RunSummary(
        String firstMonth,
        String latestMonth,
        int regionsTracked,
        int rowCount,
        Double globalAverageCm,
        int regionsInDeficit,
        double droughtThresholdCm,
        String worstRegionId,
        String worstRegionName,
        Double worstRegionValueCm,
        Map<String, Long> issueCounts) {

    /**
     * Summarises the feature rows at their latest month.
     */
    public static RunSummary from(List<FeatureRecord> rows, double droughtThresholdCm, Map<IssueKind, Long> issues) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (var e : issues.entrySet())
            counts.put(e.getKey().name(), e.getValue());

        YearMonth first = null;
        YearMonth latest = null;
        Set<String> regions = new HashSet<>();
        for (FeatureRecord r : rows) {
            regions.add(r.regionId());
            if (first == null || r.yearMonth().isBefore(first))
                first = r.yearMonth();
            if (latest == null || r.yearMonth().isAfter(latest))
                latest = r.yearMonth();
        }

        double sum = 0.0;
        int n = 0;
        int deficit = 0;
        FeatureRecord worst = null;
        for (FeatureRecord r : rows) {
            if (!r.yearMonth().equals(latest) || r.value() == null)
                continue;
            sum += r.value();
            n++;
            if (Boolean.TRUE.equals(r.droughtFlag()))
                deficit++;
            if (worst == null || r.value() < worst.value())
                worst = r;
        }

        return new RunSummary(
                first == null ? null : first.toString(),
                latest == null ? null : latest.toString(),
                regions.size(),
                rows.size(),
                n == 0 ? null : sum / n,
                deficit,
                droughtThresholdCm,
                worst == null ? null : worst.regionId(),
                worst == null ? null : worst.imputed().merged().country(),
                worst == null ? null : worst.value(),
                counts);
    }
}
