package space.ketterling.waterstress.features;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import space.ketterling.waterstress.impute.FillMethod;
import space.ketterling.waterstress.impute.ImputedRecord;
import space.ketterling.waterstress.impute.ImputedValue;

/**
 * Derives per-region trend and anomaly features from the imputed primary
 * value.
 *
 * <p>
 * Every feature at month t reads only months up to and including t of the
 * same region. Rolling means and the slope need a full window with no
 * missing value; the z-score uses an expanding window over the non-missing
 * history, kept as running moments.
 * </p>
 *
 * <p>
 * The z-score is null until the history holds two values, since a sample
 * standard deviation needs at least two. The first month of every region
 * therefore has no z-score, even when its value equals the region mean.
 * </p>
 *
 * <p>
 * The stress label is derived only from an observed score. A score filled in
 * by the imputer leaves the label null; its fill method is still reported
 * with the auxiliary columns.
 * </p>
 */
public final class FeatureEngineer {

    public static final int[] ROLLING_WINDOWS = { 3, 6, 12 };
    public static final int SLOPE_WINDOW = 6;

    private static final double ZERO_STD = 1e-12;

    private final double droughtThresholdCm;
    private final String stressScoreColumn;

    /**
     * @param stressScoreColumn numeric column holding the 0-5 stress score, or
     *                          null for no label
     */
    public FeatureEngineer(double droughtThresholdCm, String stressScoreColumn) {
        this.droughtThresholdCm = droughtThresholdCm;
        this.stressScoreColumn = stressScoreColumn == null || stressScoreColumn.isBlank() ? null
                : stressScoreColumn;
    }

    /**
     * Computes features for a whole table, region by region, keeping the
     * input order.
     */
    public List<FeatureRecord> compute(List<ImputedRecord> rows) {
        Map<String, List<ImputedRecord>> byRegion = new LinkedHashMap<>();
        for (ImputedRecord r : rows)
            byRegion.computeIfAbsent(r.regionId(), k -> new ArrayList<>()).add(r);
        List<FeatureRecord> out = new ArrayList<>(rows.size());
        for (List<ImputedRecord> series : byRegion.values())
            out.addAll(computeRegion(series));
        return out;
    }

    /**
     * Computes features for one region's series.
     *
     * @throws IllegalArgumentException if the records span several regions or
     *                                  months are not strictly increasing
     */
    public List<FeatureRecord> computeRegion(List<ImputedRecord> series) {
        int n = series.size();
        Double[] v = new Double[n];
        YearMonth prev = null;
        String region = n == 0 ? null : series.get(0).regionId();
        for (int t = 0; t < n; t++) {
            ImputedRecord r = series.get(t);
            YearMonth m = r.merged().series().month();
            if (!r.regionId().equals(region)) {
                throw new IllegalArgumentException("Series mixes regions " + region + " and " + r.regionId());
            }
            if (prev != null && !m.isAfter(prev)) {
                throw new IllegalArgumentException("Region " + region + ": month " + m + " not after " + prev);
            }
            prev = m;
            v[t] = r.tws().value();
        }

        List<FeatureRecord> out = new ArrayList<>(n);
        RunningStats history = new RunningStats();
        for (int t = 0; t < n; t++) {
            ImputedRecord r = series.get(t);
            if (v[t] != null)
                history.add(v[t]);

            out.add(new FeatureRecord(
                    r,
                    rollingMean(v, t, ROLLING_WINDOWS[0]),
                    rollingMean(v, t, ROLLING_WINDOWS[1]),
                    rollingMean(v, t, ROLLING_WINDOWS[2]),
                    slope(v, t, SLOPE_WINDOW),
                    v[t] == null ? null : zScore(v[t], history),
                    r.merged().series().month().getMonthValue(),
                    v[t] == null ? null : v[t] < droughtThresholdCm,
                    stressLabel(r)));
        }
        return out;
    }

    // ----------------------------
    // features
    // ----------------------------
    static Double rollingMean(Double[] v, int t, int window) {
        if (t + 1 < window)
            return null;
        double sum = 0.0;
        for (int k = t - window + 1; k <= t; k++) {
            if (v[k] == null)
                return null;
            sum += v[k];
        }
        return sum / window;
    }

    /**
     * Least-squares slope per month over the trailing window.
     */
    static Double slope(Double[] v, int t, int window) {
        if (t + 1 < window)
            return null;
        double xMean = (window - 1) / 2.0;
        double yMean = 0.0;
        for (int k = t - window + 1; k <= t; k++) {
            if (v[k] == null)
                return null;
            yMean += v[k];
        }
        yMean /= window;
        double num = 0.0, den = 0.0;
        for (int x = 0; x < window; x++) {
            double dx = x - xMean;
            num += dx * (v[t - window + 1 + x] - yMean);
            den += dx * dx;
        }
        return num / den;
    }

    /**
     * Z-score against the expanding history, which includes {@code value}.
     */
    static Double zScore(double value, RunningStats history) {
        if (history.count() < 2)
            return null;
        double mean = history.mean();
        double std = history.sampleStd();
        // a constant history leaves only rounding noise in std
        if (std <= ZERO_STD * Math.max(1.0, Math.abs(mean)))
            return 0.0;
        return (value - mean) / std;
    }

    /**
     * Count, mean and sum of squared deviations, updated one value at a time
     * (Welford).
     */
    static final class RunningStats {
        private long count;
        private double mean;
        private double m2;

        void add(double x) {
            count++;
            double delta = x - mean;
            mean += delta / count;
            m2 += delta * (x - mean);
        }

        long count() {
            return count;
        }

        double mean() {
            return mean;
        }

        double sampleStd() {
            return count < 2 ? Double.NaN : Math.sqrt(m2 / (count - 1));
        }
    }

    private String stressLabel(ImputedRecord r) {
        if (stressScoreColumn == null)
            return null;
        ImputedValue score = r.numeric().get(stressScoreColumn);
        if (score == null || score.method() != FillMethod.OBSERVED)
            return null;
        WaterStressCategory c = WaterStressCategory.fromScore(score.value());
        return c == null ? null : c.label();
    }
}
