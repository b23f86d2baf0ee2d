package space.ketterling.waterstress.grid;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.Objects;

/**
 * One time step of a gridded variable: values indexed [lat][lon].
 *
 * <p>
 * Instances are immutable. The constructor copies the coordinate axes and
 * takes ownership of the value matrix, so callers must not keep writing to it.
 * Missing cells are NaN or equal to the fill value.
 * </p>
 */
public final class GridSlice {
    private final LocalDate time;
    private final double[] lats;
    private final double[] lons;
    private final double[][] values;
    private final double fillValue;

    public GridSlice(LocalDate time, double[] lats, double[] lons, double[][] values, double fillValue) {
        this.time = Objects.requireNonNull(time, "time");
        this.lats = Objects.requireNonNull(lats, "lats").clone();
        this.lons = Objects.requireNonNull(lons, "lons").clone();
        this.values = Objects.requireNonNull(values, "values");
        this.fillValue = fillValue;
        if (values.length != lats.length) {
            throw new MalformedGridException(
                    "Slice " + time + ": " + values.length + " rows but " + lats.length + " latitudes");
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null || values[i].length != lons.length) {
                throw new MalformedGridException(
                        "Slice " + time + ": row " + i + " does not match " + lons.length + " longitudes");
            }
        }
    }

    public LocalDate time() {
        return time;
    }

    public YearMonth month() {
        return YearMonth.from(time);
    }

    public int latCount() {
        return lats.length;
    }

    public int lonCount() {
        return lons.length;
    }

    public double lat(int i) {
        return lats[i];
    }

    public double lon(int j) {
        return lons[j];
    }

    /**
     * Returns a copy of the latitude axis.
     */
    public double[] lats() {
        return lats.clone();
    }

    /**
     * Returns a copy of the longitude axis.
     */
    public double[] lons() {
        return lons.clone();
    }

    public double value(int i, int j) {
        return values[i][j];
    }

    public double fillValue() {
        return fillValue;
    }

    /**
     * True when the cell holds NaN or the fill sentinel.
     */
    public boolean isMissing(int i, int j) {
        double v = values[i][j];
        return Double.isNaN(v) || v == fillValue;
    }

    /**
     * Builds a slice with the same time and fill value but a new layout.
     */
    GridSlice withLayout(double[] newLats, double[] newLons, double[][] newValues) {
        return new GridSlice(time, newLats, newLons, newValues, fillValue);
    }

    /**
     * Copies row i of the value matrix.
     */
    double[] row(int i) {
        return values[i].clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GridSlice other))
            return false;
        return time.equals(other.time)
                && Double.compare(fillValue, other.fillValue) == 0
                && Arrays.equals(lats, other.lats)
                && Arrays.equals(lons, other.lons)
                && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(time, fillValue);
        h = 31 * h + Arrays.hashCode(lats);
        h = 31 * h + Arrays.hashCode(lons);
        return 31 * h + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "GridSlice[" + time + ", " + lats.length + "x" + lons.length + "]";
    }
}
