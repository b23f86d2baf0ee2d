package space.ketterling.waterstress.region;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

/**
 * Maps country names and codes to ISO-A3 using an explicit lookup table.
 *
 * <p>
 * Rules are tried in order and the first hit wins:
 * <ol>
 * <li>{@link Rule#CODE}: the input already is a known three-letter code.</li>
 * <li>{@link Rule#ALIAS}: case-insensitive match on a name or alias.</li>
 * <li>{@link Rule#FOLDED_ALIAS}: match after stripping diacritics and
 * punctuation.</li>
 * <li>{@link Rule#STRIPPED_ALIAS}: as above after dropping parenthetical
 * qualifiers and a leading or trailing "the".</li>
 * </ol>
 * Anything else maps to {@link #UNMATCHED}. There is no fuzzy matching, so the
 * result for a given input and table never changes.
 * </p>
 */
public final class IsoA3Normalizer {
    private static final Logger log = LoggerFactory.getLogger(IsoA3Normalizer.class);

    /** Sentinel code for names the table cannot resolve. */
    public static final String UNMATCHED = "UNMATCHED";

    public static final String DEFAULT_TABLE = "iso_a3_countries.csv";

    private static final Pattern CODE = Pattern.compile("[A-Z]{3}");
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern PARENS = Pattern.compile("\\([^)]*\\)");

    /**
     * Which rule produced a match.
     */
    public enum Rule {
        CODE, ALIAS, FOLDED_ALIAS, STRIPPED_ALIAS, NONE
    }

    /**
     * Result of resolving one input.
     */
    public record Match(String code, Rule rule) {
        public boolean matched() {
            return rule != Rule.NONE;
        }
    }

    private final Map<String, String> names; // code -> display name
    private final Map<String, String> exact; // lower-case key -> code
    private final Map<String, String> folded; // folded key -> code

    private IsoA3Normalizer(Map<String, String> names, Map<String, String> exact, Map<String, String> folded) {
        this.names = Collections.unmodifiableMap(names);
        this.exact = Collections.unmodifiableMap(exact);
        this.folded = Collections.unmodifiableMap(folded);
    }

    /**
     * Loads the bundled table from the classpath.
     */
    public static IsoA3Normalizer fromClasspath() {
        InputStream in = IsoA3Normalizer.class.getClassLoader().getResourceAsStream(DEFAULT_TABLE);
        if (in == null) {
            throw new IllegalStateException("Country table " + DEFAULT_TABLE + " not found on classpath");
        }
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromCsv(r);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_TABLE, e);
        }
    }

    /**
     * Builds a normalizer from CSV rows of {@code iso_a3,name,aliases}, with
     * aliases separated by '|'.
     *
     * @throws IllegalStateException if two codes claim the same name or alias
     */
    public static IsoA3Normalizer fromCsv(Reader reader) throws IOException {
        Map<String, String> names = new HashMap<>();
        Map<String, String> exact = new HashMap<>();
        Map<String, String> folded = new HashMap<>();

        try (CSVReader csv = new CSVReaderBuilder(reader).withSkipLines(1).build()) {
            String[] row;
            while ((row = csv.readNext()) != null) {
                if (row.length < 2 || row[0].isBlank())
                    continue;
                String code = row[0].trim().toUpperCase(Locale.ROOT);
                if (!CODE.matcher(code).matches()) {
                    throw new IllegalStateException("Bad ISO-A3 code in country table: " + row[0]);
                }
                String name = row[1].trim();
                if (names.put(code, name) != null) {
                    throw new IllegalStateException("Duplicate ISO-A3 code in country table: " + code);
                }
                register(exact, folded, code, name);
                if (row.length > 2 && !row[2].isBlank()) {
                    for (String alias : row[2].split("\\|")) {
                        if (!alias.isBlank())
                            register(exact, folded, code, alias.trim());
                    }
                }
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed country table: " + e.getMessage(), e);
        }
        log.debug("Loaded {} ISO-A3 codes, {} aliases", names.size(), exact.size());
        return new IsoA3Normalizer(names, exact, folded);
    }

    /**
     * Returns the ISO-A3 code for a name or code, or {@link #UNMATCHED}.
     */
    public String normalize(String input) {
        return resolve(input).code();
    }

    /**
     * Resolves an input and reports which rule matched.
     */
    public Match resolve(String input) {
        if (input == null || input.isBlank())
            return new Match(UNMATCHED, Rule.NONE);

        String trimmed = input.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (CODE.matcher(upper).matches() && names.containsKey(upper))
            return new Match(upper, Rule.CODE);

        String hit = exact.get(exactKey(trimmed));
        if (hit != null)
            return new Match(hit, Rule.ALIAS);

        hit = folded.get(fold(trimmed));
        if (hit != null)
            return new Match(hit, Rule.FOLDED_ALIAS);

        String stripped = strip(trimmed);
        if (!stripped.isEmpty()) {
            hit = folded.get(stripped);
            if (hit != null)
                return new Match(hit, Rule.STRIPPED_ALIAS);
        }
        return new Match(UNMATCHED, Rule.NONE);
    }

    /**
     * True when the code is one of the table's ISO-A3 codes.
     */
    public boolean isKnownCode(String code) {
        return code != null && names.containsKey(code.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the table's display name for a code, or null.
     */
    public String displayName(String code) {
        return code == null ? null : names.get(code);
    }

    public int size() {
        return names.size();
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private static void register(Map<String, String> exact, Map<String, String> folded, String code, String text) {
        putUnique(exact, exactKey(text), code, text);
        String f = fold(text);
        if (!f.isEmpty())
            putUnique(folded, f, code, text);
    }

    private static void putUnique(Map<String, String> map, String key, String code, String text) {
        String prev = map.putIfAbsent(key, code);
        if (prev != null && !prev.equals(code)) {
            throw new IllegalStateException(
                    "Country table maps '" + text + "' to both " + prev + " and " + code);
        }
    }

    static String exactKey(String s) {
        return SPACES.matcher(s.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Lower-cases, removes diacritics, turns '&amp;' into "and" and collapses
     * every other non-alphanumeric run into one space.
     */
    static String fold(String s) {
        String n = Normalizer.normalize(s, Normalizer.Form.NFD);
        n = MARKS.matcher(n).replaceAll("");
        n = n.toLowerCase(Locale.ROOT).replace("&", " and ");
        n = NON_ALNUM.matcher(n).replaceAll(" ");
        return n.trim();
    }

    private static String strip(String s) {
        String f = fold(PARENS.matcher(s).replaceAll(" "));
        if (f.startsWith("the "))
            f = f.substring(4);
        if (f.endsWith(" the"))
            f = f.substring(0, f.length() - 4);
        return f.trim();
    }
}
