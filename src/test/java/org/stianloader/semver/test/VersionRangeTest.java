package org.stianloader.semver.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.stianloader.semver.version.SemanticVersion;
import org.stianloader.semver.version.VersionFormatException;
import org.stianloader.semver.version.VersionRange;

public class VersionRangeTest {

    private static void assertRange(@NotNull String string, @Nullable String min, boolean minInclusive, @Nullable String max, boolean maxInclusive) {
        VersionRange range = VersionRange.parse(string);
        assertEquals(min == null ? null : SemanticVersion.parseLoose(min), range.getMin(), string);
        assertEquals(minInclusive, range.isMinInclusive(), string);
        assertEquals(max == null ? null : SemanticVersion.parseLoose(max), range.getMax(), string);
        assertEquals(maxInclusive, range.isMaxInclusive(), string);
    }

    private static boolean satisfies(@NotNull String range, @NotNull String version) {
        return VersionRange.parse(range).satisfies(SemanticVersion.parseLoose(version));
    }

    @Test
    public void testIntervalParsing() {
        assertRange("(1.2.3.4, 3.2)", "1.2.3.4", false, "3.2", false);
        assertRange("(1.2.3.4, 3.2]", "1.2.3.4", false, "3.2", true);
        assertRange("[1.2, 3.2.5)", "1.2", true, "3.2.5", false);
        assertRange("[2.3.7, 3.2.4.5]", "2.3.7", true, "3.2.4.5", true);
        assertRange("(, 3.2.4.5]", null, false, "3.2.4.5", true);
        assertRange("(1.6, ]", "1.6", false, null, true);
        assertRange("(1.6)", "1.6", false, "1.6", false);
        assertRange("[2.7]", "2.7", true, "2.7", true);
        assertRange("  [1.0-beta,2.0)  ", "1.0-beta", true, "2.0", false);
    }

    @Test
    public void testBareVersionIsMinimum() {
        assertRange("1.0.0", "1.0.0", true, null, false);
        assertRange(" 2.5-rc ", "2.5-rc", true, null, false);

        assertTrue(satisfies("1.0.0", "1.0.0"));
        assertTrue(satisfies("1.0.0", "1.0"));
        assertTrue(satisfies("1.0.0", "1.0.1"));
        assertTrue(satisfies("1.0.0", "17.3"));
        assertFalse(satisfies("1.0.0", "0.9.9.9"));
        assertFalse(satisfies("1.0.0", "1.0.0-rc"));
    }

    @Test
    public void testInvalidRanges() {
        for (String invalid : Arrays.asList("(,)", "[,]", "[,)", "(,]", "(,1.3..2]", "(1.2.3.4.5,1.2]",
                "", "[]", "1", "[1.0", "1.0]", "{1.0,2.0}", "[1.0,2.0,3.0]", "[1.0;2.0]", "[a,b]")) {
            assertNull(VersionRange.tryParse(invalid), invalid);
            VersionFormatException e = assertThrows(VersionFormatException.class, () -> VersionRange.parse(invalid), invalid);
            assertEquals(invalid, e.getInput());
        }
    }

    @Test
    public void testNullInput() {
        assertThrows(NullPointerException.class, () -> VersionRange.tryParse(null));
    }

    @Test
    public void testSatisfies() {
        assertTrue(satisfies("[1.2, 3.2.5)", "2.0.0"));
        assertTrue(satisfies("[1.2, 3.2.5)", "1.2"));
        assertFalse(satisfies("[1.2, 3.2.5)", "3.2.5"));
        assertFalse(satisfies("[1.2, 3.2.5)", "1.1.9"));
        assertTrue(satisfies("[1.2, 3.2.5)", "3.2.5-beta"));

        assertFalse(satisfies("(4.0.2,4.0.4]", "4.0.2"));
        assertTrue(satisfies("(4.0.2,4.0.4]", "4.0.3"));
        assertTrue(satisfies("(4.0.2,4.0.4]", "4.0.4"));
        assertFalse(satisfies("(4.0.2,4.0.4]", "4.0.5"));

        assertTrue(satisfies("[2.7]", "2.7.0.0"));
        assertFalse(satisfies("[2.7]", "2.7.0.1"));
        assertFalse(satisfies("[2.7]", "2.7-rc"));
        assertFalse(satisfies("(1.6)", "1.6"));
    }

    @Test
    public void testUnboundedSides() {
        assertTrue(satisfies("(1.6, ]", "1000.0"));
        assertFalse(satisfies("(1.6, ]", "1.6"));
        assertTrue(satisfies("[1.6,)", "1.6"));

        assertTrue(satisfies("(,2.0]", "0.0"));
        assertTrue(satisfies("(,2.0]", "2.0"));
        assertFalse(satisfies("(,2.0)", "2.0"));
        assertTrue(satisfies("[,2.0)", "2.0-alpha"));

        VersionRange everything = new VersionRange(null, false, null, false);
        assertTrue(everything.satisfies(SemanticVersion.parseLoose("0.0")));
        assertEquals("(, )", everything.toBracketString());
        assertEquals("", everything.toMathString());
    }

    @Test
    public void testBracketString() {
        assertEquals("1.0", VersionRange.parse("1.0").toBracketString());
        assertEquals("1.0", VersionRange.atLeast(SemanticVersion.parseLoose("1.0")).toString());
        assertEquals("[2.7]", VersionRange.parse("[2.7]").toBracketString());
        assertEquals("[2.7]", new VersionRange(SemanticVersion.parseLoose("2.7")).toBracketString());
        assertEquals("[1.2, 3.2.5)", VersionRange.parse("[1.2,3.2.5)").toBracketString());
        assertEquals("(1.6, ]", VersionRange.parse("(1.6,]").toBracketString());
        assertEquals("(, 3.2.4.5]", VersionRange.parse("(,3.2.4.5]").toBracketString());
        assertEquals("1.6", VersionRange.parse("[1.6,)").toBracketString());
        assertEquals("(1.6, 1.6)", VersionRange.parse("(1.6)").toBracketString());

        for (String range : Arrays.asList("1.0", "[2.7]", "[1.2, 3.2.5)", "(1.6, ]", "(, 3.2.4.5]", "(1.0-beta, 2.0-rc]")) {
            assertEquals(VersionRange.parse(range), VersionRange.parse(VersionRange.parse(range).toBracketString()), range);
        }
    }

    @Test
    public void testMathString() {
        assertEquals("(≥ 1.0)", VersionRange.parse("1.0").toMathString());
        assertEquals("(= 2.7)", VersionRange.parse("[2.7]").toMathString());
        assertEquals("(≥ 1.2 && < 3.2.5)", VersionRange.parse("[1.2, 3.2.5)").toMathString());
        assertEquals("(> 1.2.3.4 && ≤ 3.2)", VersionRange.parse("(1.2.3.4, 3.2]").toMathString());
        assertEquals("(≤ 3.2.4.5)", VersionRange.parse("(, 3.2.4.5]").toMathString());
        assertEquals("(< 3.2)", VersionRange.parse("(, 3.2)").toMathString());
        assertEquals("(> 1.6)", VersionRange.parse("(1.6, ]").toMathString());
        assertEquals("(≥ 1.6)", VersionRange.parse("[1.6, ]").toMathString());
    }

    @Test
    public void testEquality() {
        assertEquals(VersionRange.parse("[1.0, 2.0)"), VersionRange.parse("[1.0.0, 2.0.0.0)"));
        assertEquals(VersionRange.parse("[1.0, 2.0)").hashCode(), VersionRange.parse("[1.0.0, 2.0.0.0)").hashCode());
        assertEquals(VersionRange.parse("[1.5]"), new VersionRange(new SemanticVersion(1, 5, 0)));
        assertFalse(VersionRange.parse("[1.0, 2.0)").equals(VersionRange.parse("[1.0, 2.0]")));
        assertEquals(VersionRange.parse("1.0"), VersionRange.parse("[1.0,)"));
        assertFalse(VersionRange.parse("1.0").equals(VersionRange.parse("[1.0,]")));
    }

    @Test
    public void testNullVersionAgainstBoundedRange() {
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse("[1.0, 2.0)").satisfies(null));
    }
}
