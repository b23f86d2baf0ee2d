package space.ketterling.waterstress.zonal;

import java.util.Arrays;
import java.util.Locale;

/**
 * Aggregate computed over the cells of one region.
 */
public enum Statistic {
    MEAN,
    MEDIAN,
    /** Mean weighted by cos(latitude), i.e. by cell area on a regular grid. */
    AREA_WEIGHTED_MEAN;

    /**
     * Parses "mean", "median" or "area_weighted_mean" (case-insensitive).
     */
    public static Statistic parse(String s) {
        String key = s == null ? "" : s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Statistic st : values()) {
            if (st.name().equals(key))
                return st;
        }
        throw new IllegalStateException("Unknown zonal statistic '" + s + "', expected one of "
                + Arrays.toString(values()).toLowerCase(Locale.ROOT));
    }

    /**
     * Applies the statistic to {@code n} values with matching weights.
     * Weights are ignored except for {@link #AREA_WEIGHTED_MEAN}.
     */
    double apply(double[] values, double[] weights, int n) {
        switch (this) {
            case MEDIAN:
                return median(values, n);
            case AREA_WEIGHTED_MEAN: {
                double sum = 0.0, wsum = 0.0;
                for (int k = 0; k < n; k++) {
                    sum += values[k] * weights[k];
                    wsum += weights[k];
                }
                if (wsum > 0.0)
                    return sum / wsum;
                // cells right at the poles carry no area; fall back to a plain mean
                return MEAN.apply(values, weights, n);
            }
            case MEAN:
            default: {
                double sum = 0.0;
                for (int k = 0; k < n; k++)
                    sum += values[k];
                return sum / n;
            }
        }
    }

    static double median(double[] values, int n) {
        double[] sorted = Arrays.copyOf(values, n);
        Arrays.sort(sorted);
        int mid = n / 2;
        return (n % 2 == 1) ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
