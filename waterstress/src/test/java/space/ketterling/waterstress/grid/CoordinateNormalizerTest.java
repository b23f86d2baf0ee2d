package space.ketterling.waterstress.grid;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class CoordinateNormalizerTest {

    private static GridSlice slice(double[] lats, double[] lons) {
        double[][] v = new double[lats.length][lons.length];
        for (int i = 0; i < lats.length; i++)
            for (int j = 0; j < lons.length; j++)
                v[i][j] = i * 100 + j;
        return new GridSlice(LocalDate.of(2010, 3, 16), lats, lons, v, -99999.0);
    }

    private static double[] halfDegreeLons() {
        double[] lons = new double[720];
        for (int j = 0; j < lons.length; j++)
            lons[j] = 0.25 + 0.5 * j;
        return lons;
    }

    @Test
    void toSignedRotatesAxisAndValues() {
        GridSlice s = slice(new double[] { -10, 10 }, new double[] { 0.5, 90.5, 180.5, 270.5 });

        GridSlice signed = CoordinateNormalizer.toSigned(s);

        assertArrayEquals(new double[] { -179.5, -89.5, 0.5, 90.5 }, signed.lons());
        assertArrayEquals(s.lats(), signed.lats());
        assertEquals(2.0, signed.value(0, 0));
        assertEquals(3.0, signed.value(0, 1));
        assertEquals(100.0, signed.value(1, 2));
        assertEquals(s.time(), signed.time());
    }

    @Test
    void roundTripRestoresLayoutAndValues() {
        double[] lats = new double[360];
        for (int i = 0; i < lats.length; i++)
            lats[i] = -89.75 + 0.5 * i;
        GridSlice s = slice(lats, halfDegreeLons());

        GridSlice back = CoordinateNormalizer.toUnsigned(CoordinateNormalizer.toSigned(s));

        assertEquals(s, back);
    }

    @Test
    void signedAxisIsAscendingInRange() {
        GridSlice signed = CoordinateNormalizer.toSigned(slice(new double[] { 0 }, halfDegreeLons()));
        double[] lons = signed.lons();
        assertEquals(-179.75, lons[0]);
        assertEquals(179.75, lons[lons.length - 1]);
        for (int j = 1; j < lons.length; j++)
            assertTrue(lons[j] > lons[j - 1]);
    }

    @Test
    void ensureSignedLeavesSignedGridUntouched() {
        GridSlice s = slice(new double[] { 0 }, new double[] { -90, 0, 90 });
        assertSame(s, CoordinateNormalizer.ensureSigned(s));
    }

    @Test
    void ensureSignedRotatesUnsignedGrid() {
        GridSlice s = slice(new double[] { 0 }, new double[] { 0, 90, 180, 270 });
        assertArrayEquals(new double[] { -180, -90, 0, 90 }, CoordinateNormalizer.ensureSigned(s).lons());
    }

    @Test
    void duplicateLongitudeIsMalformed() {
        GridSlice s = slice(new double[] { 0 }, new double[] { 0, 10, 10, 20 });
        MalformedGridException e = assertThrows(MalformedGridException.class,
                () -> CoordinateNormalizer.toSigned(s));
        assertTrue(e.getMessage().contains("duplicate"));
    }

    @Test
    void descendingLongitudeIsMalformed() {
        GridSlice s = slice(new double[] { 0 }, new double[] { 0, 20, 10 });
        assertThrows(MalformedGridException.class, () -> CoordinateNormalizer.toSigned(s));
    }

    @Test
    void longitudeOutsideSourceConventionIsMalformed() {
        assertThrows(MalformedGridException.class,
                () -> CoordinateNormalizer.toSigned(slice(new double[] { 0 }, new double[] { 0, 360 })));
        assertThrows(MalformedGridException.class,
                () -> CoordinateNormalizer.toUnsigned(slice(new double[] { 0 }, new double[] { 0, 180 })));
    }

    @Test
    void latitudesMayDescendButNotTurn() {
        GridSlice north = slice(new double[] { 10, 0, -10 }, new double[] { 0, 180 });
        assertArrayEquals(new double[] { 10, 0, -10 }, CoordinateNormalizer.toSigned(north).lats());

        GridSlice bad = slice(new double[] { 0, 10, 5 }, new double[] { 0, 180 });
        assertThrows(MalformedGridException.class, () -> CoordinateNormalizer.toSigned(bad));
    }
}
