package space.ketterling.waterstress.merge;

import java.util.List;

/**
 * Merged rows plus the auxiliary column layout shared by every row.
 */
public record MergedTable(List<String> numericColumns, List<String> textColumns, List<MergedRecord> rows) {

    public MergedTable {
        numericColumns = List.copyOf(numericColumns);
        textColumns = List.copyOf(textColumns);
        rows = List.copyOf(rows);
    }
}
