package space.ketterling.waterstress.impute;

/**
 * Where a value in the imputed table came from.
 */
public enum FillMethod {
    OBSERVED,
    /** Median of the region's own observed values. */
    REGION_MEDIAN,
    /** Median across regions at the same month. */
    TIMESTAMP_MEDIAN,
    /** Median of every observed value in the column. */
    GLOBAL_MEDIAN,
    /** Still missing after every fallback. */
    UNFILLED;

    public boolean imputed() {
        return this == REGION_MEDIAN || this == TIMESTAMP_MEDIAN || this == GLOBAL_MEDIAN;
    }
}
