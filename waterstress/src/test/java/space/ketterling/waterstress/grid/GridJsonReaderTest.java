package space.ketterling.waterstress.grid;

import static org.junit.jupiter.api.Assertions.*;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

class GridJsonReaderTest {

    private final ObjectMapper om = new ObjectMapper();
    private final GridJsonReader reader = new GridJsonReader(om);

    private static final String GRID = """
            {
              "dimensions": {"time": 2, "lat": 2, "lon": 3},
              "variables": {
                "time": {"shape": ["time"],
                         "attributes": {"units": "days since 2002-01-01 00:00:00"},
                         "data": [15.5, 45.0]},
                "lat": {"shape": ["lat"], "attributes": {"units": "degrees_north"}, "data": [-0.5, 0.5]},
                "lon": {"shape": ["lon"], "attributes": {"units": "degrees_east"}, "data": [0.5, 1.5, 2.5]},
                "lwe_thickness": {"shape": ["time", "lat", "lon"],
                                  "attributes": {"_FillValue": -99999.0, "units": "cm",
                                                 "scale_factor": 2.0, "add_offset": 1.0},
                                  "data": [[[1, 2, 3], [4, -99999.0, null]],
                                           [[0, 0, 0], [0, 0, 0]]]}
              }
            }""";

    @Test
    void parsesSlicesWithScaleOffsetAndFill() throws Exception {
        GridDataset ds = reader.parse(om.readTree(GRID), "lwe_thickness");

        assertEquals(2, ds.size());
        assertEquals("cm", ds.units());
        GridSlice first = ds.slices().get(0);
        assertEquals(LocalDate.of(2002, 1, 16), first.time());
        assertEquals(LocalDate.of(2002, 2, 15), ds.slices().get(1).time());
        assertArrayEquals(new double[] { -0.5, 0.5 }, first.lats());
        assertArrayEquals(new double[] { 0.5, 1.5, 2.5 }, first.lons());
        assertEquals(3.0, first.value(0, 0));
        assertEquals(9.0, first.value(1, 0));
        assertTrue(first.isMissing(1, 1));
        assertTrue(first.isMissing(1, 2));
        assertEquals(1.0, ds.slices().get(1).value(0, 0));
    }

    @Test
    void readsGzipFile(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("grace.json.gz");
        try (OutputStream out = new GzipCompressorOutputStream(Files.newOutputStream(f))) {
            out.write(GRID.getBytes(StandardCharsets.UTF_8));
        }
        assertEquals(2, reader.read(f, "lwe_thickness").size());
    }

    @Test
    void missingFileIsIoError(@TempDir Path dir) {
        assertThrows(java.io.IOException.class, () -> reader.read(dir.resolve("nope.json"), "lwe_thickness"));
    }

    @Test
    void unknownVariableIsMalformed() throws Exception {
        assertThrows(MalformedGridException.class, () -> reader.parse(om.readTree(GRID), "precip"));
    }

    @Test
    void shapeMismatchIsMalformed() throws Exception {
        String bad = GRID.replace("[[0, 0, 0], [0, 0, 0]]", "[[0, 0, 0]]");
        assertThrows(MalformedGridException.class, () -> reader.parse(om.readTree(bad), "lwe_thickness"));
    }

    @Test
    void twoSlicesInOneMonthAreMalformed() throws Exception {
        String bad = GRID.replace("[15.5, 45.0]", "[1.0, 20.0]");
        MalformedGridException e = assertThrows(MalformedGridException.class,
                () -> reader.parse(om.readTree(bad), "lwe_thickness"));
        assertTrue(e.getMessage().contains("2002-01"));
    }

    @Test
    void decreasingTimeIsMalformed() throws Exception {
        String bad = GRID.replace("[15.5, 45.0]", "[45.0, 15.5]");
        assertThrows(MalformedGridException.class, () -> reader.parse(om.readTree(bad), "lwe_thickness"));
    }

    @Test
    void declaredDimensionMustMatchCoordinate() throws Exception {
        String bad = GRID.replace("\"lon\": 3", "\"lon\": 4");
        assertThrows(MalformedGridException.class, () -> reader.parse(om.readTree(bad), "lwe_thickness"));
    }

    @Test
    void decodesCfTimeUnits() {
        assertEquals(LocalDate.of(2002, 4, 1), GridJsonReader.decodeTime(3, "months since 2002-01-01"));
        assertEquals(LocalDate.of(2002, 1, 2), GridJsonReader.decodeTime(36, "hours since 2002-01-01 00:00:00"));
        assertEquals(LocalDate.of(2002, 1, 2), GridJsonReader.decodeTime(86400, "seconds since 2002-1-1"));
        assertThrows(MalformedGridException.class, () -> GridJsonReader.decodeTime(1.5, "months since 2002-01-01"));
        assertThrows(MalformedGridException.class, () -> GridJsonReader.decodeTime(1, "fortnights since 2002-01-01"));
        assertThrows(MalformedGridException.class, () -> GridJsonReader.decodeTime(1, "2002-01-01"));
    }
}
