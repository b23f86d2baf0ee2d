package space.ketterling.waterstress.grid;

/**
 * Converts grid slices between the [0, 360) and [-180, 180) longitude
 * conventions.
 *
 * <p>
 * Both directions rotate the longitude axis so it stays sorted ascending and
 * move every value row with it. {@link #toUnsigned(GridSlice)} undoes
 * {@link #toSigned(GridSlice)} exactly for any axis whose values are
 * representable without rounding after a +/-360 shift (e.g. 0.25 or 0.5 degree
 * grids).
 * </p>
 */
public final class CoordinateNormalizer {

    /**
     * Utility class; no instances.
     */
    private CoordinateNormalizer() {
    }

    /**
     * Rewrites a [0, 360) longitude axis to [-180, 180).
     *
     * @throws MalformedGridException if either axis is not strictly monotonic or
     *                                longitudes fall outside [0, 360)
     */
    public static GridSlice toSigned(GridSlice slice) {
        double[] lons = slice.lons();
        validateLatitudes(slice);
        requireStrictlyIncreasing(lons, "longitude", slice);
        for (double lon : lons) {
            if (lon < 0.0 || lon >= 360.0) {
                throw new MalformedGridException(
                        "Slice " + slice.time() + ": longitude " + lon + " outside [0, 360)");
            }
        }
        int split = firstIndexAtLeast(lons, 180.0);
        return rotate(slice, split, -360.0, 0.0);
    }

    /**
     * Rewrites a [-180, 180) longitude axis back to [0, 360).
     *
     * @throws MalformedGridException if either axis is not strictly monotonic or
     *                                longitudes fall outside [-180, 180)
     */
    public static GridSlice toUnsigned(GridSlice slice) {
        validateSigned(slice);
        double[] lons = slice.lons();
        int split = firstIndexAtLeast(lons, 0.0);
        return rotate(slice, split, 0.0, 360.0);
    }

    /**
     * Returns a slice in the [-180, 180) convention: [0, 360) axes are
     * rotated, axes that already hold negative longitudes are validated and
     * returned unchanged.
     */
    public static GridSlice ensureSigned(GridSlice slice) {
        for (double lon : slice.lons()) {
            if (lon < 0.0) {
                validateSigned(slice);
                return slice;
            }
        }
        return toSigned(slice);
    }

    private static void validateSigned(GridSlice slice) {
        double[] lons = slice.lons();
        validateLatitudes(slice);
        requireStrictlyIncreasing(lons, "longitude", slice);
        for (double lon : lons) {
            if (lon < -180.0 || lon >= 180.0) {
                throw new MalformedGridException(
                        "Slice " + slice.time() + ": longitude " + lon + " outside [-180, 180)");
            }
        }
    }

    /**
     * Moves columns [split, n) in front of columns [0, split), adding
     * {@code tailShift} to the moved block and {@code headShift} to the rest.
     */
    private static GridSlice rotate(GridSlice slice, int split, double tailShift, double headShift) {
        int n = slice.lonCount();
        double[] src = slice.lons();
        double[] lons = new double[n];
        int tail = n - split;
        for (int j = 0; j < tail; j++) {
            lons[j] = src[split + j] + tailShift;
        }
        for (int j = 0; j < split; j++) {
            lons[tail + j] = src[j] + headShift;
        }
        // a shifted value can collide with an unshifted one (e.g. 0 and 360)
        requireStrictlyIncreasing(lons, "normalized longitude", slice);

        double[][] values = new double[slice.latCount()][];
        for (int i = 0; i < values.length; i++) {
            double[] row = slice.row(i);
            double[] out = new double[n];
            System.arraycopy(row, split, out, 0, tail);
            System.arraycopy(row, 0, out, tail, split);
            values[i] = out;
        }
        return slice.withLayout(slice.lats(), lons, values);
    }

    /**
     * Latitudes may run either way but must never repeat or turn around.
     */
    static void validateLatitudes(GridSlice slice) {
        double[] lats = slice.lats();
        if (lats.length < 2)
            return;
        boolean ascending = lats[1] > lats[0];
        for (int i = 1; i < lats.length; i++) {
            boolean ok = ascending ? lats[i] > lats[i - 1] : lats[i] < lats[i - 1];
            if (!ok) {
                throw new MalformedGridException("Slice " + slice.time()
                        + ": latitude axis not strictly monotonic at index " + i + " (" + lats[i] + ")");
            }
        }
    }

    private static void requireStrictlyIncreasing(double[] axis, String name, GridSlice slice) {
        for (int i = 0; i < axis.length; i++) {
            if (Double.isNaN(axis[i])) {
                throw new MalformedGridException("Slice " + slice.time() + ": NaN in " + name + " axis");
            }
            if (i > 0 && !(axis[i] > axis[i - 1])) {
                String why = axis[i] == axis[i - 1] ? "duplicate value" : "not ascending";
                throw new MalformedGridException("Slice " + slice.time() + ": " + name + " axis " + why
                        + " at index " + i + " (" + axis[i] + ")");
            }
        }
    }

    private static int firstIndexAtLeast(double[] sorted, double bound) {
        for (int j = 0; j < sorted.length; j++) {
            if (sorted[j] >= bound)
                return j;
        }
        return sorted.length;
    }
}
