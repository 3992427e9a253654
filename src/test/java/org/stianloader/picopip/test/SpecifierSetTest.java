package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.version.PackageVersion;
import org.stianloader.picopip.version.SpecifierSet;

public class SpecifierSetTest {

    private static boolean contains(String specifiers, String version) {
        return SpecifierSet.parse(specifiers).containsVersion(PackageVersion.parse(version));
    }

    @Test
    public void testRanges() {
        assertTrue(SpecifierSetTest.contains(">=1.0,<2.0", "1.0"));
        assertTrue(SpecifierSetTest.contains(">=1.0,<2.0", "1.5"));
        assertFalse(SpecifierSetTest.contains(">=1.0,<2.0", "2.0"));
        assertFalse(SpecifierSetTest.contains(">=1.0,<2.0", "0.9"));
        assertTrue(SpecifierSetTest.contains(">1.0", "1.0.1"));
        assertFalse(SpecifierSetTest.contains(">1.0", "1.0"));
        assertTrue(SpecifierSetTest.contains("<=1.0", "1.0"));
        assertTrue(SpecifierSetTest.contains("!=1.5", "1.4"));
        assertFalse(SpecifierSetTest.contains("!=1.5", "1.5.0"));
    }

    @Test
    public void testWildcardsAndCompatibleRelease() {
        assertTrue(SpecifierSetTest.contains("==1.*", "1.9"));
        assertFalse(SpecifierSetTest.contains("==1.*", "2.0"));
        assertFalse(SpecifierSetTest.contains("!=1.*", "1.0"));
        assertTrue(SpecifierSetTest.contains("~=1.4", "1.9"));
        assertFalse(SpecifierSetTest.contains("~=1.4", "1.3"));
        assertFalse(SpecifierSetTest.contains("~=1.4", "2.0"));
        assertTrue(SpecifierSetTest.contains("~=1.4.2", "1.4.5"));
        assertFalse(SpecifierSetTest.contains("~=1.4.2", "1.5"));
    }

    @Test
    public void testAny() {
        assertSame(SpecifierSet.ANY, SpecifierSet.parse("*"));
        assertSame(SpecifierSet.ANY, SpecifierSet.parse(""));
        assertSame(SpecifierSet.ANY, SpecifierSet.parse("any"));
        assertTrue(SpecifierSet.ANY.containsVersion(PackageVersion.parse("0.0.1")));
        assertEquals("", SpecifierSet.ANY.toString());
    }

    @Test
    public void testPinned() {
        assertTrue(SpecifierSet.parse("==1.0").isPinned());
        assertEquals(PackageVersion.parse("1.0"), SpecifierSet.parse("==1.0").getPinnedVersion());
        assertTrue(SpecifierSet.parse("===1.0").isPinned());
        assertFalse(SpecifierSet.parse("==1.*").isPinned());
        assertFalse(SpecifierSet.parse(">=1.0").isPinned());
        assertFalse(SpecifierSet.parse("==1.0,!=1.1").isPinned());
        assertNull(SpecifierSet.parse(">=1.0").getPinnedVersion());
    }

    @Test
    public void testIntersect() {
        SpecifierSet intersection = SpecifierSet.parse(">=1.0").intersect(SpecifierSet.parse("<2.0"));
        assertEquals(">=1.0,<2.0", intersection.toString());
        assertTrue(intersection.containsVersion(PackageVersion.parse("1.2")));
        assertFalse(intersection.containsVersion(PackageVersion.parse("2.1")));
        assertSame(intersection, intersection.intersect(SpecifierSet.ANY));
    }

    @Test
    public void testSelectFrom() {
        List<PackageVersion> available = List.of(PackageVersion.parse("1.0"), PackageVersion.parse("1.5"), PackageVersion.parse("2.0"));
        assertEquals(PackageVersion.parse("1.5"), SpecifierSet.parse(">=1,<2").selectFrom(available));
        assertEquals(PackageVersion.parse("2.0"), SpecifierSet.ANY.selectFrom(available));
        assertNull(SpecifierSet.parse(">3").selectFrom(available));
    }

    @Test
    public void testSemanticEquality() {
        assertTrue(SpecifierSet.parse(">=1.0,>=1.2").semanticallyEquals(SpecifierSet.parse(">=1.2")));
        assertTrue(SpecifierSet.parse("<2,>=1").semanticallyEquals(SpecifierSet.parse(">=1,<2")));
        assertFalse(SpecifierSet.parse(">=1.0").semanticallyEquals(SpecifierSet.parse(">=1.2")));
    }

    @Test
    public void testMalformed() {
        assertEquals(RequirementParseException.Kind.MALFORMED_SPECIFIER, assertThrows(RequirementParseException.class, () -> SpecifierSet.parse("abc")).getKind());
        assertEquals(RequirementParseException.Kind.MALFORMED_SPECIFIER, assertThrows(RequirementParseException.class, () -> SpecifierSet.parse(">=1.*")).getKind());
        assertEquals(RequirementParseException.Kind.MALFORMED_SPECIFIER, assertThrows(RequirementParseException.class, () -> SpecifierSet.parse("~=1")).getKind());
    }
}
