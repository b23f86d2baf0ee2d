package space.ketterling.waterstress.output;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import space.ketterling.waterstress.features.FeatureRecord;
import space.ketterling.waterstress.impute.FillMethod;
import space.ketterling.waterstress.impute.ImputedRecord;
import space.ketterling.waterstress.impute.ImputedValue;
import space.ketterling.waterstress.merge.MergedRecord;
import space.ketterling.waterstress.series.RegionTimeSeriesRecord;

class FeatureTableCsvWriterTest {

    static FeatureRecord feature(String region, YearMonth m, Double observed, ImputedValue tws, Boolean drought) {
        return feature(region, m, observed, tws, drought, new ImputedValue(2.5, FillMethod.OBSERVED));
    }

    static FeatureRecord feature(String region, YearMonth m, Double observed, ImputedValue tws, Boolean drought,
            ImputedValue score) {
        RegionTimeSeriesRecord s = observed == null ? RegionTimeSeriesRecord.missing(region, m)
                : RegionTimeSeriesRecord.observed(region, m, observed, 3);
        MergedRecord merged = new MergedRecord(s, "France", region, Map.of("risk_score", 2.5),
                Map.of("risk_label", "Medium, High"));
        ImputedRecord imp = new ImputedRecord(merged, tws,
                Map.of("risk_score", score));
        return new FeatureRecord(imp, null, null, null, null, null, m.getMonthValue(), drought, null);
    }

    private final FeatureTableCsvWriter writer = new FeatureTableCsvWriter(List.of("risk_score"),
            List.of("risk_label"));

    @Test
    void writesHeaderAndRowsInColumnOrder() throws Exception {
        YearMonth may = YearMonth.of(2020, 5);
        StringWriter out = new StringWriter();
        writer.write(out, List.of(
                feature("FRA", may, 1.5, new ImputedValue(1.5, FillMethod.OBSERVED), false),
                feature("FRA", may.plusMonths(1), null, new ImputedValue(1.5, FillMethod.REGION_MEDIAN), false)));

        String[] lines = out.toString().split("\n");
        assertEquals(3, lines.length);
        assertEquals("region_id,country,iso_a3,date,tws_mean_cm,valid_aggregate,cell_count,tws_imputed,"
                + "tws_fill_method,rolling_3,rolling_6,rolling_12,slope_6,z_score,month,drought_flag,stress_label,"
                + "risk_score,risk_score_fill_method,risk_label", lines[0]);
        assertEquals("FRA,France,FRA,2020-05-01,1.5,true,3,false,OBSERVED,,,,,,5,false,,2.5,OBSERVED,"
                + "\"Medium, High\"", lines[1]);
        assertEquals("FRA,France,FRA,2020-06-01,1.5,false,0,true,REGION_MEDIAN,,,,,,6,false,,2.5,OBSERVED,"
                + "\"Medium, High\"", lines[2]);
    }

    @Test
    void nullsAreEmptyCells() throws Exception {
        StringWriter out = new StringWriter();
        writer.write(out, List.of(feature("FRA", YearMonth.of(2020, 1), null, ImputedValue.UNFILLED, null)));
        String row = out.toString().split("\n")[1];
        assertTrue(row.startsWith("FRA,France,FRA,2020-01-01,,false,0,false,UNFILLED,"), row);
        assertTrue(row.contains(",1,,,2.5,OBSERVED,"), row);
    }

    @Test
    void imputedAuxiliaryValueCarriesItsFillMethod() throws Exception {
        StringWriter out = new StringWriter();
        writer.write(out, List.of(feature("DEU", YearMonth.of(2004, 1), 1.0,
                new ImputedValue(1.0, FillMethod.OBSERVED), false,
                new ImputedValue(4.5, FillMethod.TIMESTAMP_MEDIAN))));
        String row = out.toString().split("\n")[1];
        assertTrue(row.endsWith(",4.5,TIMESTAMP_MEDIAN,\"Medium, High\""), row);
    }

    @Test
    void createsParentDirectories(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("out/features.csv");
        writer.write(f, List.of());
        assertEquals(1, Files.readAllLines(f).size());
    }
}
