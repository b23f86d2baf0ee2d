package space.ketterling.waterstress.merge;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import space.ketterling.waterstress.config.AppConfig.AuxTableSpec;
import space.ketterling.waterstress.io.InputFiles;
import space.ketterling.waterstress.merge.AuxiliaryTable.Column;
import space.ketterling.waterstress.merge.AuxiliaryTable.ColumnType;
import space.ketterling.waterstress.merge.AuxiliaryTable.Row;
import space.ketterling.waterstress.region.IsoA3Normalizer;

/**
 * Reads auxiliary CSV tables (country risk scores, efficiency metrics).
 *
 * <p>
 * The first row is the header. The key column holds a country name or code
 * and is normalized to ISO-A3. A column is numeric when every non-blank value
 * parses as a finite number; anything else is passed through as text.
 * </p>
 */
public class AuxiliaryTableReader {
    private static final Logger log = LoggerFactory.getLogger(AuxiliaryTableReader.class);

    private static final Set<String> BLANKS = Set.of("", "na", "n/a", "nan", "null", "-");

    private final IsoA3Normalizer iso;

    public AuxiliaryTableReader(IsoA3Normalizer iso) {
        this.iso = iso;
    }

    public AuxiliaryTable read(AuxTableSpec spec) throws IOException {
        log.info("Reading auxiliary table '{}' from {}", spec.name(), spec.path());
        try (BufferedReader r = InputFiles.openReader(Path.of(spec.path()))) {
            AuxiliaryTable t = read(spec.name(), spec.keyColumn(), r);
            log.info("Auxiliary table '{}': {} rows, {} columns, {} unresolved keys", t.name(), t.size(),
                    t.columns().size(), t.unresolvedKeys().size());
            return t;
        }
    }

    /**
     * Parses a table from an open reader; the caller closes it.
     *
     * @throws IllegalArgumentException if the key column is missing or two
     *                                  headers map to the same column name
     */
    public AuxiliaryTable read(String tableName, String keyColumn, Reader reader) throws IOException {
        List<String[]> rows = new ArrayList<>();
        String[] header;
        try (CSVReader csv = new CSVReader(reader)) {
            header = csv.readNext();
            if (header == null) {
                throw new IllegalArgumentException("Auxiliary table '" + tableName + "' is empty");
            }
            String[] row;
            while ((row = csv.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank())
                    continue;
                rows.add(row);
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in auxiliary table '" + tableName + "': " + e.getMessage(), e);
        }

        int keyIdx = -1;
        for (int c = 0; c < header.length; c++) {
            if (stripBom(header[c]).trim().equalsIgnoreCase(keyColumn.trim())) {
                keyIdx = c;
                break;
            }
        }
        if (keyIdx < 0) {
            throw new IllegalArgumentException(
                    "Auxiliary table '" + tableName + "' has no key column '" + keyColumn + "'");
        }

        // infer column types
        List<Column> columns = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int c = 0; c < header.length; c++) {
            if (c == keyIdx)
                continue;
            String source = stripBom(header[c]).trim();
            String name = columnName(tableName, source);
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Auxiliary table '" + tableName + "' has two columns named " + name);
            }
            columns.add(new Column(name, source, isNumeric(rows, c) ? ColumnType.NUMERIC : ColumnType.TEXT));
            indexes.add(c);
        }

        Map<String, Row> byIso = new LinkedHashMap<>();
        List<String> unresolved = new ArrayList<>();
        for (String[] row : rows) {
            String rawKey = cell(row, keyIdx);
            if (rawKey == null)
                continue;
            String code = iso.normalize(rawKey);
            if (IsoA3Normalizer.UNMATCHED.equals(code)) {
                unresolved.add(rawKey);
                continue;
            }
            if (byIso.containsKey(code)) {
                log.warn("Auxiliary table '{}': duplicate key {} ('{}'), keeping the first row", tableName, code,
                        rawKey);
                continue;
            }

            Map<String, Double> numeric = new LinkedHashMap<>();
            Map<String, String> text = new LinkedHashMap<>();
            for (int k = 0; k < columns.size(); k++) {
                Column col = columns.get(k);
                String v = cell(row, indexes.get(k));
                if (col.type() == ColumnType.NUMERIC) {
                    numeric.put(col.name(), v == null ? null : Double.parseDouble(v));
                } else {
                    text.put(col.name(), v);
                }
            }
            byIso.put(code, new Row(rawKey, numeric, text));
        }

        return new AuxiliaryTable(tableName, columns, byIso, unresolved);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    static String columnName(String table, String header) {
        String n = (table + "_" + header).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return n.replaceAll("^_+|_+$", "");
    }

    private static boolean isNumeric(List<String[]> rows, int c) {
        boolean any = false;
        for (String[] row : rows) {
            String v = cell(row, c);
            if (v == null)
                continue;
            if (!parses(v))
                return false;
            any = true;
        }
        return any;
    }

    private static boolean parses(String v) {
        try {
            return Double.isFinite(Double.parseDouble(v));
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Trimmed cell value, or null when absent or a blank marker.
     */
    private static String cell(String[] row, int c) {
        if (c >= row.length || row[c] == null)
            return null;
        String v = row[c].trim();
        return BLANKS.contains(v.toLowerCase(Locale.ROOT)) ? null : v;
    }

    private static String stripBom(String s) {
        return s != null && s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
