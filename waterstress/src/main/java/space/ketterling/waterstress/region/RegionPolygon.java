package space.ketterling.waterstress.region;

import java.util.Objects;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

/**
 * One region: stable id, display name, ISO-A3 code and boundary.
 *
 * <p>
 * The geometry is prepared once for repeated containment tests and is safe
 * to share between worker threads. Longitudes may extend past 180 for rings
 * that were unwrapped across the antimeridian.
 * </p>
 */
public final class RegionPolygon {
    private final String id;
    private final String name;
    private final String isoA3;
    private final Geometry geometry;
    private final PreparedGeometry prepared;
    private final Envelope envelope;

    public RegionPolygon(String id, String name, String isoA3, Geometry geometry) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.isoA3 = isoA3 == null ? IsoA3Normalizer.UNMATCHED : isoA3;
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.prepared = PreparedGeometryFactory.prepare(geometry);
        this.envelope = geometry.getEnvelopeInternal();
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String isoA3() {
        return isoA3;
    }

    public boolean hasIsoCode() {
        return !IsoA3Normalizer.UNMATCHED.equals(isoA3);
    }

    public Geometry geometry() {
        return geometry;
    }

    public PreparedGeometry prepared() {
        return prepared;
    }

    public Envelope envelope() {
        return envelope;
    }

    @Override
    public String toString() {
        return "RegionPolygon[" + id + ", " + name + ", " + isoA3 + "]";
    }
}
