package xyz.jphil.pdf_annotate.tools.ordering;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NaturalKeyTest {

    private static List<String> sorted(String... stems) {
        var list = new ArrayList<>(List.of(stems));
        list.sort((a, b) -> NaturalKey.of(a).compareTo(NaturalKey.of(b)));
        return list;
    }

    @Test
    void numbersCompareNumerically() {
        assertEquals(List.of("item2", "item10", "item100"), sorted("item100", "item10", "item2"));
    }

    @Test
    void prefixesCompareAsWordsThenNumbers() {
        assertEquals(List.of("D1", "L1", "L2", "L10"), sorted("L10", "L2", "D1", "L1"));
    }

    @Test
    void separatorsAreInterchangeable() {
        assertEquals(NaturalKey.of("a-b_c d"), NaturalKey.of("a b-c__d"));
        assertEquals(NaturalKey.of("a-b").hashCode(), NaturalKey.of("a  b").hashCode());
    }

    @Test
    void wordEndingSegmentSortsBeforeContinuedOne() {
        // "a" closes its segment with a boundary, which sorts below any integer
        assertTrue(NaturalKey.of("a").compareTo(NaturalKey.of("a1")) < 0);
        assertTrue(NaturalKey.of("a-b").compareTo(NaturalKey.of("ab")) < 0);
    }

    @Test
    void shorterPrefixSortsFirst() {
        assertTrue(NaturalKey.of("1").compareTo(NaturalKey.of("1-2")) < 0);
        assertTrue(NaturalKey.of("L1").compareTo(NaturalKey.of("L1-VENDOR")) < 0);
    }

    @Test
    void adjacentIntegersAreKeptApart() {
        var tokens = NaturalKey.of("1-2").tokens();
        assertEquals(3, tokens.size());
        assertEquals(NaturalKey.Kind.INTEGER, tokens.get(0).kind());
        assertEquals(NaturalKey.Kind.STRING, tokens.get(1).kind());
        assertEquals("", tokens.get(1).text());
        assertEquals(NaturalKey.Kind.INTEGER, tokens.get(2).kind());
    }

    @Test
    void integersBeyondLongRange() {
        assertEquals(List.of("x99999999999999999999", "x100000000000000000000"),
            sorted("x100000000000000000000", "x99999999999999999999"));
    }

    @Test
    void leadingZerosCompareEqualToTheirValue() {
        assertEquals(0, NaturalKey.of("p007").compareTo(NaturalKey.of("p7")));
    }

    @Test
    void emptyAndSeparatorOnlyStemsGiveEmptyKey() {
        assertTrue(NaturalKey.of("").isEmpty());
        assertTrue(NaturalKey.of(null).isEmpty());
        assertTrue(NaturalKey.of("--__ ").isEmpty());
        assertTrue(NaturalKey.EMPTY.compareTo(NaturalKey.of("a")) < 0);
    }

    @Test
    void comparisonIsATotalOrder() {
        var stems = List.of("", "a", "A", "a1", "a01", "a-1", "a_1b", "a1b", "ab", "a b", "1", "12", "1-2",
            "1_2a", "D1", "D10", "L1-VENDOR", "L1", "x-", "-x", "é2", "e2");
        var keys = stems.stream().map(NaturalKey::of).toList();
        for (NaturalKey a : keys) {
            assertEquals(0, a.compareTo(a));
            for (NaturalKey b : keys) {
                assertEquals(Integer.signum(a.compareTo(b)), -Integer.signum(b.compareTo(a)), a + " vs " + b);
                for (NaturalKey c : keys) {
                    if (a.compareTo(b) <= 0 && b.compareTo(c) <= 0) {
                        assertTrue(a.compareTo(c) <= 0, a + " <= " + b + " <= " + c);
                    }
                }
            }
        }
    }

    @Test
    void pathsSortByStem() {
        var paths = new ArrayList<>(List.of(Path.of("x/L10.pdf"), Path.of("y/L9.pdf"), Path.of("L9a.pdf")));
        paths.sort(Stems.byNaturalStem());
        assertEquals(List.of(Path.of("y/L9.pdf"), Path.of("L9a.pdf"), Path.of("x/L10.pdf")), paths);
    }
}
