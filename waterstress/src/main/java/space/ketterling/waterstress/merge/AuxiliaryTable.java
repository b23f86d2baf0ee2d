package space.ketterling.waterstress.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A static auxiliary table keyed by ISO-A3 code.
 *
 * <p>
 * Column names are already prefixed with the table name. Keys that could not
 * be normalized are kept verbatim in {@link #unresolvedKeys()} so the merger
 * can report them.
 * </p>
 */
public final class AuxiliaryTable {

    public enum ColumnType {
        NUMERIC, TEXT
    }

    /**
     * Output column: prefixed name, header in the source file, inferred type.
     */
    public record Column(String name, String sourceName, ColumnType type) {
    }

    /**
     * One row. Either map may hold null for a blank cell.
     */
    public record Row(String rawKey, Map<String, Double> numeric, Map<String, String> text) {
    }

    private final String name;
    private final List<Column> columns;
    private final Map<String, Row> rowsByIso;
    private final List<String> unresolvedKeys;

    public AuxiliaryTable(String name, List<Column> columns, Map<String, Row> rowsByIso,
            List<String> unresolvedKeys) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rowsByIso = Collections.unmodifiableMap(new LinkedHashMap<>(rowsByIso));
        this.unresolvedKeys = List.copyOf(unresolvedKeys);
    }

    public String name() {
        return name;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames(ColumnType type) {
        return columns.stream().filter(c -> c.type() == type).map(Column::name).toList();
    }

    public Row row(String isoA3) {
        return rowsByIso.get(isoA3);
    }

    public Set<String> isoCodes() {
        return rowsByIso.keySet();
    }

    public List<String> unresolvedKeys() {
        return unresolvedKeys;
    }

    public int size() {
        return rowsByIso.size();
    }
}
