package space.ketterling.waterstress.series;

import java.time.YearMonth;
import java.util.Comparator;
import java.util.Objects;

/**
 * Zonal aggregate of one region for one month.
 *
 * <p>
 * {@code value} is null exactly when {@code valid} is false: the region had
 * no usable cells that month, or no slice exists for the month.
 * </p>
 */
public record RegionTimeSeriesRecord(String regionId, YearMonth month, Double value, boolean valid, int cellCount) {

    /** Sort order every causal computation relies on. */
    public static final Comparator<RegionTimeSeriesRecord> BY_REGION_AND_MONTH = Comparator
            .comparing(RegionTimeSeriesRecord::regionId)
            .thenComparing(RegionTimeSeriesRecord::month);

    public RegionTimeSeriesRecord {
        Objects.requireNonNull(regionId, "regionId");
        Objects.requireNonNull(month, "month");
        if (valid != (value != null)) {
            throw new IllegalArgumentException("valid must be true exactly when value is present");
        }
    }

    public static RegionTimeSeriesRecord observed(String regionId, YearMonth month, double value, int cellCount) {
        return new RegionTimeSeriesRecord(regionId, month, value, true, cellCount);
    }

    public static RegionTimeSeriesRecord missing(String regionId, YearMonth month) {
        return new RegionTimeSeriesRecord(regionId, month, null, false, 0);
    }
}
