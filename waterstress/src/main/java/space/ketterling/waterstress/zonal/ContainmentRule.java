package space.ketterling.waterstress.zonal;

import java.util.Locale;

/**
 * How a grid cell is assigned to a region.
 */
public enum ContainmentRule {
    /** The cell centre lies inside or on the boundary of the polygon. */
    CENTER,
    /** Any part of the cell rectangle touches the polygon. */
    OVERLAP;

    public static ContainmentRule parse(String s) {
        String key = s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
        if (key.equals("CENTRE"))
            key = "CENTER";
        for (ContainmentRule r : values()) {
            if (r.name().equals(key))
                return r;
        }
        throw new IllegalStateException("Unknown containment rule '" + s + "', expected center or overlap");
    }
}
