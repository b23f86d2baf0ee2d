package space.ketterling.waterstress.impute;

import static org.junit.jupiter.api.Assertions.*;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import space.ketterling.waterstress.merge.MergedRecord;
import space.ketterling.waterstress.merge.MergedTable;
import space.ketterling.waterstress.quality.DataQualityLog;
import space.ketterling.waterstress.quality.IssueKind;
import space.ketterling.waterstress.series.RegionTimeSeriesRecord;

class ImputerTest {

    private static final YearMonth M1 = YearMonth.of(2018, 1);
    private static final YearMonth M2 = YearMonth.of(2018, 2);
    private static final YearMonth M3 = YearMonth.of(2018, 3);

    private static MergedRecord row(String region, YearMonth m, Double tws, Double aux) {
        RegionTimeSeriesRecord s = tws == null ? RegionTimeSeriesRecord.missing(region, m)
                : RegionTimeSeriesRecord.observed(region, m, tws, 1);
        Map<String, Double> numeric = new LinkedHashMap<>();
        numeric.put("aux_x", aux);
        return new MergedRecord(s, region, region, numeric, Map.of());
    }

    private static MergedTable table(List<MergedRecord> rows) {
        return new MergedTable(List.of("aux_x"), List.of(), rows);
    }

    /** A: 1, -, 3 / B: all missing / C: 5, 7, - */
    private static List<MergedRecord> rows() {
        List<MergedRecord> rows = new ArrayList<>();
        rows.add(row("A", M1, 1.0, 10.0));
        rows.add(row("A", M2, null, null));
        rows.add(row("A", M3, 3.0, null));
        rows.add(row("B", M1, null, null));
        rows.add(row("B", M2, null, null));
        rows.add(row("B", M3, null, null));
        rows.add(row("C", M1, 5.0, null));
        rows.add(row("C", M2, 7.0, null));
        rows.add(row("C", M3, null, null));
        return rows;
    }

    @Test
    void observedValuesPassThrough() {
        List<ImputedRecord> out = new Imputer().impute(table(rows()), new DataQualityLog());
        assertEquals(new ImputedValue(1.0, FillMethod.OBSERVED), out.get(0).tws());
        assertFalse(out.get(0).tws().imputed());
    }

    @Test
    void regionMedianIsTriedFirst() {
        List<ImputedRecord> out = new Imputer().impute(table(rows()), new DataQualityLog());
        assertEquals(new ImputedValue(2.0, FillMethod.REGION_MEDIAN), out.get(1).tws());
        assertEquals(new ImputedValue(6.0, FillMethod.REGION_MEDIAN), out.get(8).tws());
        assertTrue(out.get(8).tws().imputed());
    }

    @Test
    void regionWithoutObservationsGetsContemporaneousMedian() {
        List<ImputedRecord> out = new Imputer().impute(table(rows()), new DataQualityLog());
        assertEquals(new ImputedValue(3.0, FillMethod.TIMESTAMP_MEDIAN), out.get(3).tws());
        assertEquals(new ImputedValue(7.0, FillMethod.TIMESTAMP_MEDIAN), out.get(4).tws());
        assertEquals(new ImputedValue(3.0, FillMethod.TIMESTAMP_MEDIAN), out.get(5).tws());
    }

    @Test
    void globalMedianWhenMonthHasNoObservations() {
        List<ImputedRecord> out = new Imputer().impute(table(rows()), new DataQualityLog());
        assertEquals(new ImputedValue(10.0, FillMethod.REGION_MEDIAN), out.get(1).numeric().get("aux_x"));
        assertEquals(new ImputedValue(10.0, FillMethod.TIMESTAMP_MEDIAN), out.get(3).numeric().get("aux_x"));
        assertEquals(new ImputedValue(10.0, FillMethod.GLOBAL_MEDIAN), out.get(4).numeric().get("aux_x"));
    }

    @Test
    void emptyColumnStaysUnfilled() {
        List<MergedRecord> rows = List.of(row("A", M1, null, null), row("B", M1, null, null));
        DataQualityLog quality = new DataQualityLog();
        List<ImputedRecord> out = new Imputer().impute(table(rows), quality);

        for (ImputedRecord r : out) {
            assertNull(r.tws().value());
            assertEquals(FillMethod.UNFILLED, r.tws().method());
            assertFalse(r.tws().imputed());
        }
        assertEquals(4, quality.count(IssueKind.IMPUTATION_EXHAUSTED));
    }

    @Test
    void medianOfEvenCountIsMidpoint() {
        assertEquals(2.5, Imputer.median(List.of(4.0, 1.0, 2.0, 3.0)));
        assertNull(Imputer.median(List.of()));
    }
}
