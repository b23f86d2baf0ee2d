package space.ketterling.waterstress.region;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.io.WKBWriter;

/**
 * The static set of regions for one run, in load order, with unique ids.
 */
public final class RegionSet {
    private final Map<String, RegionPolygon> byId;
    private final String fingerprint;

    public RegionSet(Collection<RegionPolygon> regions) {
        Map<String, RegionPolygon> m = new LinkedHashMap<>();
        for (RegionPolygon r : regions) {
            if (m.putIfAbsent(r.id(), r) != null) {
                throw new IllegalArgumentException("Duplicate region id: " + r.id());
            }
        }
        this.byId = m;
        this.fingerprint = computeFingerprint(m.values());
    }

    public List<RegionPolygon> regions() {
        return List.copyOf(byId.values());
    }

    public RegionPolygon get(String id) {
        return byId.get(id);
    }

    public int size() {
        return byId.size();
    }

    /**
     * Content hash over ids, codes and geometries; equal sets hash equal.
     */
    public String fingerprint() {
        return fingerprint;
    }

    private static String computeFingerprint(Collection<RegionPolygon> regions) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            WKBWriter wkb = new WKBWriter(2);
            for (RegionPolygon r : regions) {
                md.update(r.id().getBytes(StandardCharsets.UTF_8));
                md.update((byte) 0);
                md.update(r.isoA3().getBytes(StandardCharsets.UTF_8));
                md.update((byte) 0);
                md.update(wkb.write(r.geometry()));
            }
            return HexFormat.of().formatHex(md.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
