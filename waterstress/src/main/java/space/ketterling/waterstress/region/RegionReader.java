package space.ketterling.waterstress.region;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import space.ketterling.waterstress.io.InputFiles;

/**
 * Loads region polygons from a GeoJSON FeatureCollection.
 *
 * <p>
 * Each feature becomes one region keyed by its ISO-A3 code. Features that
 * share a code (e.g. overseas parts stored separately) are unioned. Features
 * whose code cannot be resolved keep an {@code UNMATCHED-<name>} id so they
 * are still aggregated but never joined.
 * </p>
 */
public class RegionReader {
    private static final Logger log = LoggerFactory.getLogger(RegionReader.class);

    static final List<String> NAME_PROPERTIES = List.of("ADMIN", "NAME", "NAME_LONG", "name", "country");
    static final List<String> CODE_PROPERTIES = List.of("ISO_A3", "ADM0_A3", "iso_a3", "ISO3");

    private final ObjectMapper om;
    private final IsoA3Normalizer iso;
    private final GeometryFactory gf = new GeometryFactory();

    /**
     * Creates a reader using the given JSON mapper and code table.
     */
    public RegionReader(ObjectMapper om, IsoA3Normalizer iso) {
        this.om = om;
        this.iso = iso;
    }

    /**
     * Reads the GeoJSON file at {@code path}.
     */
    public RegionSet read(Path path) throws IOException {
        log.info("Reading region polygons from {}", path);
        JsonNode root;
        try (InputStream in = InputFiles.open(path)) {
            root = om.readTree(in);
        }
        RegionSet set = parse(root);
        log.info("Loaded {} regions", set.size());
        return set;
    }

    /**
     * Builds regions from an already parsed FeatureCollection.
     */
    public RegionSet parse(JsonNode root) {
        if (!"FeatureCollection".equals(root.path("type").asText())) {
            throw new IllegalArgumentException("Region file is not a GeoJSON FeatureCollection");
        }

        Map<String, Pending> byId = new LinkedHashMap<>();
        int index = 0;
        int skipped = 0;
        for (JsonNode feature : root.path("features")) {
            index++;
            JsonNode props = feature.path("properties");
            String name = firstText(props, NAME_PROPERTIES);
            String code = resolveCode(props, name);

            Geometry geom = toGeometry(feature.path("geometry"));
            if (geom == null || geom.isEmpty()) {
                log.warn("Skipping feature #{} ({}): no polygon geometry", index, name);
                skipped++;
                continue;
            }
            if (!geom.isValid()) {
                log.debug("Repairing invalid geometry for feature #{} ({})", index, name);
                geom = GeometryFixer.fix(geom);
                if (geom.isEmpty()) {
                    log.warn("Skipping feature #{} ({}): geometry is empty after repair", index, name);
                    skipped++;
                    continue;
                }
            }

            String id;
            if (IsoA3Normalizer.UNMATCHED.equals(code)) {
                id = "UNMATCHED-" + slug(name == null ? "feature-" + index : name);
                log.warn("No ISO-A3 code for feature #{} ({}); keeping it as {}", index, name, id);
            } else {
                id = code;
            }

            Pending p = byId.get(id);
            if (p == null) {
                String display = name != null ? name : iso.displayName(code);
                byId.put(id, new Pending(id, display, code, geom));
            } else {
                log.info("Merging additional geometry into region {} (feature #{})", id, index);
                p.parts.add(geom);
            }
        }

        List<RegionPolygon> out = new ArrayList<>(byId.size());
        for (Pending p : byId.values()) {
            Geometry g = p.parts.size() == 1 ? p.parts.get(0) : UnaryUnionOp.union(p.parts);
            out.add(new RegionPolygon(p.id, p.name, p.code, g));
        }
        if (skipped > 0)
            log.warn("Skipped {} features without usable geometry", skipped);
        return new RegionSet(out);
    }

    /**
     * Uses the first code property that is a known code, else the name.
     */
    private String resolveCode(JsonNode props, String name) {
        for (String key : CODE_PROPERTIES) {
            String v = text(props, key);
            if (v != null && iso.isKnownCode(v))
                return v.trim().toUpperCase(Locale.ROOT);
        }
        return iso.normalize(name);
    }

    // ----------------------------
    // GeoJSON -> JTS
    // ----------------------------
    Geometry toGeometry(JsonNode g) {
        String type = g.path("type").asText("");
        JsonNode coords = g.path("coordinates");
        switch (type) {
            case "Polygon":
                return toPolygon(coords);
            case "MultiPolygon": {
                List<Polygon> polys = new ArrayList<>();
                for (JsonNode pc : coords) {
                    Polygon p = toPolygon(pc);
                    if (p != null)
                        polys.add(p);
                }
                if (polys.isEmpty())
                    return null;
                return gf.createMultiPolygon(polys.toArray(new Polygon[0]));
            }
            case "GeometryCollection": {
                List<Geometry> parts = new ArrayList<>();
                for (JsonNode child : g.path("geometries")) {
                    Geometry part = toGeometry(child);
                    if (part != null)
                        parts.add(part);
                }
                return parts.isEmpty() ? null : UnaryUnionOp.union(parts);
            }
            default:
                return null;
        }
    }

    /**
     * Builds one polygon; rings that jump across the antimeridian are
     * unwrapped so the shape stays contiguous.
     */
    private Polygon toPolygon(JsonNode rings) {
        List<Coordinate[]> raw = new ArrayList<>();
        for (JsonNode ring : rings) {
            Coordinate[] cs = toCoordinates(ring);
            if (cs != null)
                raw.add(cs);
        }
        if (raw.isEmpty())
            return null;

        Coordinate[] shellCs = unwrap(raw.get(0));
        raw.set(0, shellCs);
        double shellMin = Double.POSITIVE_INFINITY, shellMax = Double.NEGATIVE_INFINITY;
        for (Coordinate c : shellCs) {
            shellMin = Math.min(shellMin, c.x);
            shellMax = Math.max(shellMax, c.x);
        }
        for (int k = 1; k < raw.size(); k++)
            raw.set(k, alignHole(unwrap(raw.get(k)), shellMin, shellMax));

        LinearRing shell = gf.createLinearRing(raw.get(0));
        LinearRing[] holes = new LinearRing[raw.size() - 1];
        for (int k = 1; k < raw.size(); k++)
            holes[k - 1] = gf.createLinearRing(raw.get(k));
        return gf.createPolygon(shell, holes);
    }

    static boolean jumpsAntimeridian(Coordinate[] ring) {
        for (int k = 1; k < ring.length; k++) {
            if (isJump(ring[k - 1], ring[k]))
                return true;
        }
        return false;
    }

    /**
     * Unwraps a ring by carrying a running offset of 360 degrees across each
     * antimeridian jump, so only vertices after a jump move. Returns the ring
     * unchanged when the offset does not return to zero at the closing vertex.
     */
    static Coordinate[] unwrap(Coordinate[] ring) {
        if (!jumpsAntimeridian(ring))
            return ring;
        Coordinate[] out = new Coordinate[ring.length];
        out[0] = new Coordinate(ring[0]);
        double offset = 0.0;
        for (int k = 1; k < ring.length; k++) {
            if (isJump(ring[k - 1], ring[k]))
                offset += ring[k].x < ring[k - 1].x ? 360.0 : -360.0;
            out[k] = new Coordinate(ring[k].x + offset, ring[k].y);
        }
        if (offset != 0.0) {
            log.debug("Ring crosses the antimeridian an odd number of times; leaving it as read");
            return ring;
        }
        return out;
    }

    /**
     * A step of more than 180 degrees, unless both ends sit on the +/-180
     * seam: that edge runs along the map border, not across it.
     */
    private static boolean isJump(Coordinate a, Coordinate b) {
        if (Math.abs(b.x - a.x) <= 180.0)
            return false;
        return !(Math.abs(a.x) == 180.0 && Math.abs(b.x) == 180.0);
    }

    private static Coordinate[] alignHole(Coordinate[] hole, double shellMin, double shellMax) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (Coordinate c : hole) {
            min = Math.min(min, c.x);
            max = Math.max(max, c.x);
        }
        for (double shift : new double[] { 360.0, -360.0 }) {
            if ((min < shellMin || max > shellMax) && min + shift >= shellMin && max + shift <= shellMax) {
                Coordinate[] out = new Coordinate[hole.length];
                for (int k = 0; k < hole.length; k++)
                    out[k] = new Coordinate(hole[k].x + shift, hole[k].y);
                return out;
            }
        }
        return hole;
    }

    /**
     * Reads a closed ring, closing it if needed; returns null if too short.
     */
    private static Coordinate[] toCoordinates(JsonNode ring) {
        List<Coordinate> cs = new ArrayList<>();
        for (JsonNode pt : ring) {
            if (pt.size() < 2)
                continue;
            cs.add(new Coordinate(pt.get(0).asDouble(), pt.get(1).asDouble()));
        }
        if (!cs.isEmpty() && !cs.get(0).equals2D(cs.get(cs.size() - 1)))
            cs.add(new Coordinate(cs.get(0)));
        if (cs.size() < 4) {
            log.debug("Dropping degenerate ring with {} points", cs.size());
            return null;
        }
        return cs.toArray(new Coordinate[0]);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private static String firstText(JsonNode props, List<String> keys) {
        for (String k : keys) {
            String v = text(props, k);
            if (v != null)
                return v;
        }
        return null;
    }

    private static String text(JsonNode props, String key) {
        JsonNode v = props.path(key);
        if (v.isMissingNode() || v.isNull())
            return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    static String slug(String s) {
        String f = IsoA3Normalizer.fold(s).replace(' ', '-');
        return f.isEmpty() ? "unnamed" : f;
    }

    /**
     * Accumulates the parts of one region while reading.
     */
    private static final class Pending {
        final String id;
        final String name;
        final String code;
        final List<Geometry> parts = new ArrayList<>();

        Pending(String id, String name, String code, Geometry first) {
            this.id = id;
            this.name = name;
            this.code = code;
            parts.add(first);
        }
    }
}
