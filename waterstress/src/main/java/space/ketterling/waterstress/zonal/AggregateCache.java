package space.ketterling.waterstress.zonal;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import space.ketterling.waterstress.grid.GridSlice;
import space.ketterling.waterstress.region.RegionSet;
import space.ketterling.waterstress.zonal.ZonalAggregator.RegionStat;

/**
 * Content-addressed cache of per-region aggregates, keyed by region-set and
 * grid-slice fingerprints.
 *
 * <p>
 * One instance belongs to one pipeline run. The slice fingerprint covers the
 * axes and cell values but not the timestamp, so months with identical
 * content (e.g. fully masked slices) are aggregated once.
 * </p>
 */
public final class AggregateCache {

    /**
     * Cache key: which regions, which slice content.
     */
    public record Key(String regionSetFingerprint, String sliceFingerprint) {
    }

    private final Map<Key, Map<String, RegionStat>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Returns the cached aggregates or computes and stores them.
     */
    public Map<String, RegionStat> computeIfAbsent(RegionSet regions, GridSlice slice,
            Supplier<Map<String, RegionStat>> compute) {
        Key key = new Key(regions.fingerprint(), fingerprint(slice));
        Map<String, RegionStat> cached = entries.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        return entries.computeIfAbsent(key, k -> {
            misses.incrementAndGet();
            return Map.copyOf(compute.get());
        });
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public int size() {
        return entries.size();
    }

    /**
     * SHA-256 over the axes and values; every missing cell hashes as NaN.
     */
    public static String fingerprint(GridSlice slice) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            ByteBuffer buf = ByteBuffer.allocate(8 * Math.max(slice.lonCount(), 2) + 8);
            buf.putInt(slice.latCount()).putInt(slice.lonCount());
            md.update(buf.array(), 0, buf.position());
            for (double lat : slice.lats())
                md.update(bytes(buf, lat));
            for (double lon : slice.lons())
                md.update(bytes(buf, lon));
            for (int i = 0; i < slice.latCount(); i++) {
                buf.clear();
                for (int j = 0; j < slice.lonCount(); j++)
                    buf.putDouble(slice.isMissing(i, j) ? Double.NaN : slice.value(i, j));
                md.update(buf.array(), 0, buf.position());
            }
            return HexFormat.of().formatHex(md.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] bytes(ByteBuffer buf, double v) {
        buf.clear();
        buf.putDouble(v);
        byte[] out = new byte[8];
        buf.flip();
        buf.get(out);
        return out;
    }
}
