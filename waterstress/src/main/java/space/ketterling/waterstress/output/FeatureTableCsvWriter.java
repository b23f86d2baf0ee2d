package space.ketterling.waterstress.output;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVWriter;

import space.ketterling.waterstress.features.FeatureRecord;
import space.ketterling.waterstress.impute.ImputedRecord;
import space.ketterling.waterstress.impute.ImputedValue;
import space.ketterling.waterstress.merge.MergedRecord;
import space.ketterling.waterstress.series.RegionTimeSeriesRecord;

/**
 * Writes the feature table as CSV, one row per (region, month).
 *
 * <p>
 * Fixed columns come first, then the numeric and text auxiliary columns in
 * table order. Each numeric auxiliary column is followed by
 * {@code <column>_fill_method}, so imputed values stay distinguishable from
 * observed ones. Nulls are written as empty cells; dates are the first day of
 * the month.
 * </p>
 */
public class FeatureTableCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(FeatureTableCsvWriter.class);

    public static final List<String> FIXED_HEADERS = List.of(
            "region_id", "country", "iso_a3", "date",
            "tws_mean_cm", "valid_aggregate", "cell_count",
            "tws_imputed", "tws_fill_method",
            "rolling_3", "rolling_6", "rolling_12", "slope_6", "z_score",
            "month", "drought_flag", "stress_label");

    public static final String FILL_METHOD_SUFFIX = "_fill_method";

    private final List<String> numericColumns;
    private final List<String> textColumns;

    public FeatureTableCsvWriter(List<String> numericColumns, List<String> textColumns) {
        this.numericColumns = List.copyOf(numericColumns);
        this.textColumns = List.copyOf(textColumns);
    }

    public void write(Path path, List<FeatureRecord> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(w, rows);
        }
        log.info("Wrote {} feature rows to {}", rows.size(), path);
    }

    /**
     * Writes header and rows; the caller closes the writer.
     */
    public void write(Writer out, List<FeatureRecord> rows) throws IOException {
        CSVWriter csv = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
        csv.writeNext(header().toArray(new String[0]), false);
        for (FeatureRecord r : rows)
            csv.writeNext(toRow(r), false);
        csv.flush();
        if (csv.checkError()) {
            throw new IOException("CSV write failed");
        }
    }

    public List<String> header() {
        List<String> h = new ArrayList<>(FIXED_HEADERS);
        for (String c : numericColumns) {
            h.add(c);
            h.add(c + FILL_METHOD_SUFFIX);
        }
        h.addAll(textColumns);
        return h;
    }

    private String[] toRow(FeatureRecord f) {
        ImputedRecord imp = f.imputed();
        MergedRecord m = imp.merged();
        RegionTimeSeriesRecord s = m.series();

        List<String> row = new ArrayList<>(FIXED_HEADERS.size() + 2 * numericColumns.size() + textColumns.size());
        row.add(s.regionId());
        row.add(str(m.country()));
        row.add(str(m.isoA3()));
        row.add(s.month().atDay(1).toString());
        row.add(num(imp.tws().value()));
        row.add(Boolean.toString(s.valid()));
        row.add(Integer.toString(s.cellCount()));
        row.add(Boolean.toString(imp.tws().imputed()));
        row.add(imp.tws().method().name());
        row.add(num(f.rolling3()));
        row.add(num(f.rolling6()));
        row.add(num(f.rolling12()));
        row.add(num(f.slope6()));
        row.add(num(f.zScore()));
        row.add(Integer.toString(f.month()));
        row.add(f.droughtFlag() == null ? "" : f.droughtFlag().toString());
        row.add(str(f.stressLabel()));
        for (String c : numericColumns) {
            ImputedValue v = imp.numeric().get(c);
            row.add(v == null ? "" : num(v.value()));
            row.add(v == null ? "" : v.method().name());
        }
        for (String c : textColumns)
            row.add(str(m.text().get(c)));
        return row.toArray(new String[0]);
    }

    private static String str(String s) {
        return s == null ? "" : s;
    }

    private static String num(Double d) {
        return d == null ? "" : Double.toString(d);
    }
}
