package space.ketterling.waterstress.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import space.ketterling.waterstress.series.RegionTimeSeriesRecord;

/**
 * A series record joined with the auxiliary columns of its region. Auxiliary
 * values are null when the region had no row in a table.
 */
public record MergedRecord(RegionTimeSeriesRecord series, String country, String isoA3,
        Map<String, Double> numeric, Map<String, String> text) {

    public MergedRecord {
        numeric = Collections.unmodifiableMap(new LinkedHashMap<>(numeric));
        text = Collections.unmodifiableMap(new LinkedHashMap<>(text));
    }

    public String regionId() {
        return series.regionId();
    }
}
