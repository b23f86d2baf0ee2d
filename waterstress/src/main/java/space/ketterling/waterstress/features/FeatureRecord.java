package space.ketterling.waterstress.features;

import java.time.YearMonth;

import space.ketterling.waterstress.impute.ImputedRecord;

/**
 * One output row: the imputed record plus its derived features. Every
 * feature is null when it cannot be computed from the region's history.
 */
public record FeatureRecord(
        ImputedRecord imputed,
        Double rolling3,
        Double rolling6,
        Double rolling12,
        Double slope6,
        Double zScore,
        int month,
        Boolean droughtFlag,
        String stressLabel) {

    public String regionId() {
        return imputed.regionId();
    }

    public YearMonth yearMonth() {
        return imputed.merged().series().month();
    }

    /** Imputed primary value, null when unfilled. */
    public Double value() {
        return imputed.tws().value();
    }
}
