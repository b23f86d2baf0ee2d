package space.ketterling.waterstress.grid;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import space.ketterling.waterstress.io.InputFiles;

/**
 * Reads a gridded variable from an NCO JSON dump ({@code ncks --json}) of a
 * CF NetCDF file.
 *
 * <p>
 * Expected layout:
 *
 * <pre>
 * {
 *   "dimensions": {"time": 2, "lat": 180, "lon": 360},
 *   "variables": {
 *     "time": {"shape": ["time"], "attributes": {"units": "days since 2002-01-01"}, "data": [...]},
 *     "lat":  {"shape": ["lat"], "data": [...]},
 *     "lon":  {"shape": ["lon"], "data": [...]},
 *     "lwe_thickness": {"shape": ["time", "lat", "lon"],
 *                       "attributes": {"_FillValue": -99999.0, "units": "cm"},
 *                       "data": [[[...]]]}
 *   }
 * }
 * </pre>
 *
 * Attribute values may also use the verbose {"type": ..., "data": ...} form,
 * and data may be nested or flat with {@code null} for fill cells.
 * </p>
 */
public class GridJsonReader {
    private static final Logger log = LoggerFactory.getLogger(GridJsonReader.class);

    private static final Pattern CF_TIME = Pattern
            .compile("^\\s*(\\w+)\\s+since\\s+(\\d{1,4}-\\d{1,2}-\\d{1,2})(?:[T ](\\d{1,2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?))?.*$",
                    Pattern.CASE_INSENSITIVE);

    private static final Set<String> LAT_NAMES = Set.of("lat", "latitude", "y");
    private static final Set<String> LON_NAMES = Set.of("lon", "longitude", "x");

    private final ObjectMapper om;

    /**
     * Creates a reader that parses with the given JSON mapper.
     */
    public GridJsonReader(ObjectMapper om) {
        this.om = om;
    }

    /**
     * Loads every time step of {@code variable} from the file at {@code path}.
     *
     * @throws MalformedGridException if axes, shape or time metadata are
     *                                inconsistent
     */
    public GridDataset read(Path path, String variable) throws IOException {
        log.info("Reading grid variable {} from {}", variable, path);
        JsonNode root;
        try (InputStream in = InputFiles.open(path)) {
            root = om.readTree(in);
        }
        GridDataset ds = parse(root, variable);
        log.info("Loaded {} slices of {} ({} x {})", ds.size(), variable,
                ds.slices().isEmpty() ? 0 : ds.slices().get(0).latCount(),
                ds.slices().isEmpty() ? 0 : ds.slices().get(0).lonCount());
        return ds;
    }

    /**
     * Builds the dataset from an already parsed JSON tree.
     */
    public GridDataset parse(JsonNode root, String variable) {
        JsonNode vars = root.path("variables");
        JsonNode var = vars.path(variable);
        if (var.isMissingNode() || var.isNull()) {
            throw new MalformedGridException("Variable '" + variable + "' not found in grid file");
        }

        List<String> shape = new ArrayList<>();
        for (JsonNode d : var.path("shape"))
            shape.add(d.asText());
        if (shape.size() != 3) {
            throw new MalformedGridException(
                    "Variable '" + variable + "' must have 3 dimensions (time, lat, lon), got " + shape);
        }

        int tDim = -1, latDim = -1, lonDim = -1;
        for (int k = 0; k < shape.size(); k++) {
            String name = shape.get(k);
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.equals("time") || isTimeAxis(vars.path(name)))
                tDim = k;
            else if (LAT_NAMES.contains(lower))
                latDim = k;
            else if (LON_NAMES.contains(lower))
                lonDim = k;
        }
        if (tDim < 0 || latDim < 0 || lonDim < 0) {
            throw new MalformedGridException("Cannot identify time/lat/lon axes in shape " + shape);
        }

        double[] times = readAxis(vars, shape.get(tDim));
        double[] lats = readAxis(vars, shape.get(latDim));
        double[] lons = readAxis(vars, shape.get(lonDim));
        String timeUnits = attrText(vars.path(shape.get(tDim)).path("attributes"), "units");
        if (timeUnits == null) {
            throw new MalformedGridException("Time axis '" + shape.get(tDim) + "' has no units");
        }

        int[] sizes = new int[3];
        sizes[tDim] = times.length;
        sizes[latDim] = lats.length;
        sizes[lonDim] = lons.length;
        checkDeclaredDimensions(root.path("dimensions"), shape, sizes);

        JsonNode attrs = var.path("attributes");
        double fill = attrNumber(attrs, "_FillValue", Double.NaN);
        double missing = attrNumber(attrs, "missing_value", Double.NaN);
        double scale = attrNumber(attrs, "scale_factor", 1.0);
        double offset = attrNumber(attrs, "add_offset", 0.0);
        String units = attrText(attrs, "units");

        long expected = (long) sizes[0] * sizes[1] * sizes[2];
        double[] flat = new double[(int) Math.min(expected, Integer.MAX_VALUE)];
        int count = flatten(var.path("data"), flat, 0);
        if (count != expected) {
            throw new MalformedGridException("Variable '" + variable + "' has " + count
                    + " values, expected " + expected + " for shape " + shape);
        }

        int[] strides = new int[3];
        strides[2] = 1;
        strides[1] = sizes[2];
        strides[0] = sizes[1] * sizes[2];

        List<GridSlice> slices = new ArrayList<>(times.length);
        Set<YearMonth> months = new HashSet<>();
        LocalDate prev = null;
        for (int t = 0; t < times.length; t++) {
            LocalDate time = decodeTime(times[t], timeUnits);
            if (prev != null && !time.isAfter(prev)) {
                throw new MalformedGridException("Time axis not strictly increasing at index " + t + " (" + time
                        + " after " + prev + ")");
            }
            if (!months.add(YearMonth.from(time))) {
                throw new MalformedGridException("Two slices fall in month " + YearMonth.from(time));
            }
            prev = time;

            double[][] values = new double[lats.length][lons.length];
            for (int i = 0; i < lats.length; i++) {
                for (int j = 0; j < lons.length; j++) {
                    int[] at = new int[3];
                    at[tDim] = t;
                    at[latDim] = i;
                    at[lonDim] = j;
                    double raw = flat[at[0] * strides[0] + at[1] * strides[1] + at[2] * strides[2]];
                    if (Double.isNaN(raw) || raw == fill || raw == missing) {
                        values[i][j] = Double.NaN;
                    } else {
                        values[i][j] = raw * scale + offset;
                    }
                }
            }
            slices.add(new GridSlice(time, lats, lons, values, fill));
        }
        return new GridDataset(variable, units, slices);
    }

    /**
     * Decodes a CF time coordinate ("days since 2002-01-01 00:00:00") to a date.
     */
    static LocalDate decodeTime(double value, String units) {
        Matcher m = CF_TIME.matcher(units);
        if (!m.matches()) {
            throw new MalformedGridException("Unsupported time units: " + units);
        }
        String unit = m.group(1).toLowerCase(Locale.ROOT);
        LocalDate refDate = parseLenientDate(m.group(2));
        LocalDateTime ref = refDate.atStartOfDay();
        if (m.group(3) != null) {
            String[] hms = m.group(3).split(":");
            ref = ref.plusHours(Integer.parseInt(hms[0])).plusMinutes(Integer.parseInt(hms[1]));
            if (hms.length > 2)
                ref = ref.plusSeconds((long) Double.parseDouble(hms[2]));
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new MalformedGridException("Non-finite time value " + value);
        }
        switch (unit) {
            case "day", "days", "d":
                return ref.plusSeconds(Math.round(value * 86400.0)).toLocalDate();
            case "hour", "hours", "hr", "h":
                return ref.plusSeconds(Math.round(value * 3600.0)).toLocalDate();
            case "minute", "minutes", "min":
                return ref.plusSeconds(Math.round(value * 60.0)).toLocalDate();
            case "second", "seconds", "sec", "s":
                return ref.plusSeconds(Math.round(value)).toLocalDate();
            case "month", "months":
                if (value != Math.rint(value)) {
                    throw new MalformedGridException("Fractional month offsets are not supported: " + value);
                }
                return ref.plusMonths((long) value).toLocalDate();
            default:
                throw new MalformedGridException("Unsupported time unit '" + unit + "' in " + units);
        }
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private static LocalDate parseLenientDate(String s) {
        String[] parts = s.split("-");
        return LocalDate.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
    }

    private static boolean isTimeAxis(JsonNode coordVar) {
        String units = attrText(coordVar.path("attributes"), "units");
        return units != null && CF_TIME.matcher(units).matches();
    }

    private double[] readAxis(JsonNode vars, String name) {
        JsonNode axis = vars.path(name);
        if (axis.isMissingNode()) {
            throw new MalformedGridException("Coordinate variable '" + name + "' not found");
        }
        JsonNode data = axis.path("data");
        if (!data.isArray()) {
            throw new MalformedGridException("Coordinate variable '" + name + "' has no data array");
        }
        double[] out = new double[data.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode v = data.get(i);
            if (v == null || !v.isNumber()) {
                throw new MalformedGridException("Coordinate '" + name + "' has a non-numeric value at " + i);
            }
            out[i] = v.asDouble();
        }
        return out;
    }

    private static void checkDeclaredDimensions(JsonNode dims, List<String> shape, int[] sizes) {
        if (!dims.isObject())
            return;
        for (int k = 0; k < shape.size(); k++) {
            JsonNode declared = dims.path(shape.get(k));
            if (declared.isNumber() && declared.asInt() != sizes[k]) {
                throw new MalformedGridException("Dimension '" + shape.get(k) + "' declared as "
                        + declared.asInt() + " but its coordinate has " + sizes[k] + " values");
            }
        }
    }

    /**
     * Copies nested or flat arrays into {@code out} in row-major order.
     *
     * @return the next free index
     */
    private static int flatten(JsonNode node, double[] out, int pos) {
        if (node.isArray()) {
            for (JsonNode child : node)
                pos = flatten(child, out, pos);
            return pos;
        }
        if (pos >= out.length) {
            // keep counting so the caller can report the real size
            return pos + 1;
        }
        if (node.isNull() || node.isMissingNode()) {
            out[pos] = Double.NaN;
        } else if (node.isNumber()) {
            out[pos] = node.asDouble();
        } else {
            String text = node.asText().trim();
            out[pos] = text.equalsIgnoreCase("nan") || text.isEmpty() ? Double.NaN : parseNumber(text);
        }
        return pos + 1;
    }

    private static double parseNumber(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedGridException("Non-numeric grid value '" + text + "'", e);
        }
    }

    /**
     * Returns an attribute value, unwrapping the verbose {"type","data"} form.
     */
    private static JsonNode attr(JsonNode attrs, String name) {
        JsonNode a = attrs.path(name);
        if (a.isObject() && a.has("data"))
            a = a.get("data");
        if (a.isArray())
            a = a.size() > 0 ? a.get(0) : MissingNode.getInstance();
        return a;
    }

    private static double attrNumber(JsonNode attrs, String name, double def) {
        JsonNode a = attr(attrs, name);
        if (a.isNumber())
            return a.asDouble();
        if (a.isTextual()) {
            try {
                return Double.parseDouble(a.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric attribute {}={}", name, a.asText());
            }
        }
        return def;
    }

    private static String attrText(JsonNode attrs, String name) {
        JsonNode a = attr(attrs, name);
        if (a.isMissingNode() || a.isNull())
            return null;
        return a.asText();
    }
}
