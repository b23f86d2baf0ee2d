package space.ketterling.waterstress.impute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import space.ketterling.waterstress.merge.MergedRecord;

/**
 * A merged record with every numeric column passed through the imputer.
 * Text columns are read from {@link #merged()} unchanged.
 */
public record ImputedRecord(MergedRecord merged, ImputedValue tws, Map<String, ImputedValue> numeric) {

    public ImputedRecord {
        numeric = Collections.unmodifiableMap(new LinkedHashMap<>(numeric));
    }

    public String regionId() {
        return merged.regionId();
    }
}
