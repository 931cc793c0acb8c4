package org.stianloader.picoversion.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.picoversion.MalformedVersionLiteralException;
import org.stianloader.picoversion.Version;
import org.stianloader.picoversion.range.VersionRange;

public class VersionRangeTest {

    private static boolean contains(@NotNull String range, @NotNull String version) {
        return VersionRange.parse(range).containsVersion(Version.parse(version));
    }

    @Test
    public void testOperators() {
        assertFalse(contains(">= v4.0.2", "v4.0.1"));
        assertTrue(contains(">= v4.0.2", "v4.0.2"));
        assertTrue(contains(">= v4.0.2", "v4.0.3"));

        assertFalse(contains("> v4.0.2", "v4.0.2"));
        assertTrue(contains("> v4.0.2", "v4.0.2.1"));

        assertTrue(contains("<= 1.2", "1.2"));
        assertTrue(contains("<= 1.2", "v1.200.0"));
        assertFalse(contains("<= 1.2", "1.201"));

        assertFalse(contains("< 1.2", "1.2"));
        assertTrue(contains("< 1.2", "1.199"));
        // An alpha release precedes the release it names
        assertTrue(contains("< 1.2", "1.2_0"));

        assertTrue(contains("== v1.2.3", "1.002003"));
        assertFalse(contains("== v1.2.3", "v1.2.3_0"));
        assertFalse(contains("== v1.2.3", "v1.2.4"));

        assertFalse(contains("!= 1.5", "1.500"));
        assertTrue(contains("!= 1.5", "1.501"));
    }

    @Test
    public void testBareMinimum() {
        assertTrue(contains("v1.2.3", "v1.2.3"));
        assertTrue(contains("v1.2.3", "v1.2.4"));
        assertFalse(contains("v1.2.3", "v1.2.2"));
        assertTrue(contains("0", "v0.0.0"));
        assertTrue(contains("0", "1.5"));
    }

    @Test
    public void testConjunction() {
        assertTrue(contains(">= 1.2, < 2", "1.5"));
        assertTrue(contains(">= 1.2, < 2", "1.2"));
        assertFalse(contains(">= 1.2, < 2", "2"));
        assertFalse(contains(">= 1.2, < 2", "1.1"));
        assertFalse(contains(">=1.0,!=1.5,<2", "1.5"));
        assertTrue(contains(">=1.0,!=1.5,<2", "1.6"));
    }

    @Test
    public void testFreeRange() {
        assertSame(VersionRange.FREE_RANGE, VersionRange.parse(""));
        assertSame(VersionRange.FREE_RANGE, VersionRange.parse("   "));
        assertTrue(VersionRange.FREE_RANGE.containsVersion(Version.parse("0")));
        assertTrue(VersionRange.FREE_RANGE.containsVersion(Version.parse("v999.0.0")));
        assertEquals("", VersionRange.FREE_RANGE.toString());
        assertNull(VersionRange.FREE_RANGE.getMinimum());
    }

    @Test
    public void testIntersect() {
        VersionRange lower = VersionRange.parse(">= 1.0");
        VersionRange upper = VersionRange.parse("< 2.0");
        VersionRange both = lower.intersect(upper);

        assertTrue(both.containsVersion(Version.parse("1.5")));
        assertFalse(both.containsVersion(Version.parse("2.0")));
        assertFalse(both.containsVersion(Version.parse("0.9")));
        assertSame(lower, VersionRange.FREE_RANGE.intersect(lower));
        assertSame(lower, lower.intersect(VersionRange.FREE_RANGE));
    }

    @Test
    public void testSelect() {
        List<@NotNull Version> available = new ArrayList<>();
        for (String literal : new String[] {"v1.0.0", "v1.4.0", "v1.5.0", "v2.0.0", "v1.5.1_1"}) {
            available.add(Version.parse(literal));
        }

        Version selected = VersionRange.parse(">= v1.0.0, < v2.0.0, != v1.5.0").selectFrom(available);
        assertEquals(Version.parse("v1.5.1_1"), selected);
        assertEquals("v1.5.1_1", Objects.requireNonNull(selected).stringify());

        assertEquals(Version.parse("v2.0.0"), VersionRange.FREE_RANGE.selectFrom(available));
        assertNull(VersionRange.parse("> v3").selectFrom(available));
        assertNull(VersionRange.parse("> v3").selectFrom(null));
    }

    @Test
    public void testMinimum() {
        assertEquals(Version.parse("1.2"), VersionRange.parse(">= 1.0, >= 1.2, < 2").getMinimum());
        assertEquals(Version.parse("v1.5.0"), VersionRange.parse("== v1.5.0, >= 1.0").getMinimum());
        assertEquals(Version.parse("1.1"), VersionRange.parse("1.1").getMinimum());
        assertNull(VersionRange.parse("< 2").getMinimum());
        assertNull(VersionRange.parse("> 1.0").getMinimum());
    }

    @Test
    public void testToString() {
        assertEquals(">= 1.2, < v2.0.0, != 1.5", VersionRange.parse(">=1.2,<  v2.0.0 , !=1.5").toString());
        assertEquals(">= 1.2", VersionRange.parse("1.2").toString());
        assertEquals("== v1.2.3, > 0.5, <= 3", VersionRange.parse("==V1.2.3 ,>0.5, <=3").toString());

        for (String range : Arrays.asList(">= 1.2, < v2.0.0, != 1.5", "== v1.2.3, > 0.5, <= 3")) {
            assertEquals(range, VersionRange.parse(VersionRange.parse(range).toString()).toString());
        }
    }

    @Test
    public void testMalformed() {
        assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse("1.0,"));
        assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse(",1.0"));
        assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse("1.0,,2.0"));
        assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse(">="));
        assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse(">= 1.0a"));
        assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse("=> 1.0"));
        assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse("[1.0,2.0)"));
        assertEquals(4, assertThrows(MalformedVersionLiteralException.class, () -> VersionRange.parse("1.0, ")).getErrorIndex());
    }
}
