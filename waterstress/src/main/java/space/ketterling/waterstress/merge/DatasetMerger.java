package space.ketterling.waterstress.merge;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.waterstress.merge.AuxiliaryTable.ColumnType;
import space.ketterling.waterstress.quality.DataQualityLog;
import space.ketterling.waterstress.quality.IssueKind;
import space.ketterling.waterstress.region.RegionPolygon;
import space.ketterling.waterstress.region.RegionSet;
import space.ketterling.waterstress.series.RegionTimeSeriesRecord;

/**
 * Left-joins the assembled series onto auxiliary tables by ISO-A3 code.
 *
 * <p>
 * Every series record survives the join in its original order. Auxiliary
 * keys with no matching region are reported as
 * {@link IssueKind#JOIN_MISMATCH}.
 * </p>
 */
public final class DatasetMerger {
    private static final Logger log = LoggerFactory.getLogger(DatasetMerger.class);

    public MergedTable merge(List<RegionTimeSeriesRecord> series, RegionSet regions, List<AuxiliaryTable> tables,
            DataQualityLog quality) {
        List<String> numericColumns = new ArrayList<>();
        List<String> textColumns = new ArrayList<>();
        for (AuxiliaryTable t : tables) {
            numericColumns.addAll(t.columnNames(ColumnType.NUMERIC));
            textColumns.addAll(t.columnNames(ColumnType.TEXT));
        }
        Set<String> all = new HashSet<>();
        for (String c : numericColumns)
            requireUnique(all, c);
        for (String c : textColumns)
            requireUnique(all, c);

        reportMismatches(regions, tables, quality);

        List<MergedRecord> out = new ArrayList<>(series.size());
        for (RegionTimeSeriesRecord r : series) {
            RegionPolygon region = regions.get(r.regionId());
            String country = region == null ? null : region.name();
            String iso = region == null ? null : region.isoA3();

            Map<String, Double> numeric = new LinkedHashMap<>();
            Map<String, String> text = new LinkedHashMap<>();
            for (AuxiliaryTable t : tables) {
                AuxiliaryTable.Row row = region != null && region.hasIsoCode() ? t.row(iso) : null;
                for (String c : t.columnNames(ColumnType.NUMERIC))
                    numeric.put(c, row == null ? null : row.numeric().get(c));
                for (String c : t.columnNames(ColumnType.TEXT))
                    text.put(c, row == null ? null : row.text().get(c));
            }
            out.add(new MergedRecord(r, country, iso, numeric, text));
        }

        log.info("Merged {} records with {} auxiliary tables ({} numeric, {} text columns)", out.size(),
                tables.size(), numericColumns.size(), textColumns.size());
        return new MergedTable(numericColumns, textColumns, out);
    }

    private static void reportMismatches(RegionSet regions, List<AuxiliaryTable> tables, DataQualityLog quality) {
        Set<String> codes = new HashSet<>();
        for (RegionPolygon r : regions.regions()) {
            if (r.hasIsoCode())
                codes.add(r.isoA3());
        }
        for (AuxiliaryTable t : tables) {
            for (String raw : t.unresolvedKeys()) {
                quality.record(IssueKind.JOIN_MISMATCH, null, null,
                        "table '" + t.name() + "': key '" + raw + "' does not map to an ISO-A3 code");
            }
            for (String code : t.isoCodes()) {
                if (!codes.contains(code)) {
                    quality.record(IssueKind.JOIN_MISMATCH, code, null,
                            "table '" + t.name() + "': no region for " + code + " ('" + t.row(code).rawKey() + "')");
                }
            }
        }
    }

    private static void requireUnique(Set<String> seen, String column) {
        if (!seen.add(column)) {
            throw new IllegalArgumentException("Auxiliary column " + column + " appears in more than one table");
        }
    }
}
