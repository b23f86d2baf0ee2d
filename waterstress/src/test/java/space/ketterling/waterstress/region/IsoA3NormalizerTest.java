package space.ketterling.waterstress.region;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringReader;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import space.ketterling.waterstress.region.IsoA3Normalizer.Rule;

class IsoA3NormalizerTest {

    private static IsoA3Normalizer iso;

    @BeforeAll
    static void load() {
        iso = IsoA3Normalizer.fromClasspath();
    }

    @Test
    void bundledTableIsLoaded() {
        assertTrue(iso.size() > 240);
        assertEquals("France", iso.displayName("FRA"));
    }

    @Test
    void knownCodesResolveToThemselves() {
        assertEquals(new IsoA3Normalizer.Match("USA", Rule.CODE), iso.resolve("USA"));
        assertEquals(new IsoA3Normalizer.Match("FRA", Rule.CODE), iso.resolve(" fra "));
    }

    @Test
    void namesAndAliasesResolve() {
        assertEquals(new IsoA3Normalizer.Match("USA", Rule.ALIAS), iso.resolve("United States of America"));
        assertEquals("USA", iso.normalize("  united   STATES "));
        assertEquals("TUR", iso.normalize("Turkey"));
        assertEquals("TUR", iso.normalize("Türkiye"));
        assertEquals("COD", iso.normalize("Dem. Rep. Congo"));
        assertEquals("GBR", iso.normalize("UK"));
    }

    @Test
    void diacriticsAndPunctuationAreFolded() {
        IsoA3Normalizer.Match m = iso.resolve("COTE D IVOIRE");
        assertEquals("CIV", m.code());
        assertEquals(Rule.FOLDED_ALIAS, m.rule());
        assertEquals("CIV", iso.normalize("Côte d'Ivoire"));
        assertEquals("BHS", iso.normalize("bahamas the"));
    }

    @Test
    void parentheticalQualifierIsStripped() {
        IsoA3Normalizer.Match m = iso.resolve("France (Republic)");
        assertEquals("FRA", m.code());
        assertEquals(Rule.STRIPPED_ALIAS, m.rule());
    }

    @Test
    void unknownAndBlankNamesAreUnmatched() {
        assertEquals(IsoA3Normalizer.UNMATCHED, iso.normalize("Atlantis"));
        assertEquals(IsoA3Normalizer.UNMATCHED, iso.normalize("ZZZ"));
        assertEquals(IsoA3Normalizer.UNMATCHED, iso.normalize(""));
        assertEquals(IsoA3Normalizer.UNMATCHED, iso.normalize(null));
        assertFalse(iso.resolve("Atlantis").matched());
    }

    @Test
    void resolutionIsDeterministic() {
        for (String s : new String[] { "Korea, Rep.", "South Korea", "Ivory Coast", "U.S." })
            assertEquals(iso.normalize(s), iso.normalize(s));
        assertEquals("KOR", iso.normalize("Korea, Rep."));
    }

    @Test
    void conflictingAliasIsRejected() {
        String csv = """
                iso_a3,name,aliases
                AAA,Alpha,Common
                BBB,Beta,Common
                """;
        assertThrows(IllegalStateException.class, () -> IsoA3Normalizer.fromCsv(new StringReader(csv)));
    }

    @Test
    void badCodeIsRejected() {
        String csv = "iso_a3,name,aliases\nAB,Alpha,\n";
        assertThrows(IllegalStateException.class, () -> IsoA3Normalizer.fromCsv(new StringReader(csv)));
    }
}
