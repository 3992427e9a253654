package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.version.PackageVersion;
import org.stianloader.picopip.version.SpecifierCache;
import org.stianloader.picopip.version.SpecifierUtil;

public class PackageVersionTest {
    @Test
    public void testTuplize() {
        assertArrayEquals(new int[] {1, 2, 3}, PackageVersion.tuplize("1.2.3"));
        assertArrayEquals(new int[] {3, 7}, PackageVersion.tuplize("3.7.*"));
        assertArrayEquals(new int[] {10}, PackageVersion.tuplize(" 10 "));
    }

    @Test
    public void testMalformed() {
        assertEquals(RequirementParseException.Kind.MALFORMED_VERSION, assertThrows(RequirementParseException.class, () -> PackageVersion.parse("1.x")).getKind());
        assertEquals(RequirementParseException.Kind.MALFORMED_VERSION, assertThrows(RequirementParseException.class, () -> PackageVersion.parse("1..2")).getKind());
        assertEquals(RequirementParseException.Kind.MALFORMED_VERSION, assertThrows(RequirementParseException.class, () -> PackageVersion.parse("*")).getKind());
        assertEquals(RequirementParseException.Kind.MALFORMED_VERSION, assertThrows(RequirementParseException.class, () -> PackageVersion.parse("")).getKind());
    }

    @Test
    public void testOrdering() {
        assertTrue(PackageVersion.parse("1.10").isNewerThan(PackageVersion.parse("1.9")));
        assertTrue(PackageVersion.parse("2").isNewerThan(PackageVersion.parse("1.99.99")));
        assertFalse(PackageVersion.parse("1.0").isNewerThan(PackageVersion.parse("1.0.0")));
        assertEquals(0, PackageVersion.parse("1.0").compareTo(PackageVersion.parse("1.0.0")));
    }

    @Test
    public void testEquality() {
        assertEquals(PackageVersion.parse("1.0"), PackageVersion.parse("1.0.0"));
        assertEquals(PackageVersion.parse("1.0").hashCode(), PackageVersion.parse("1.0.0").hashCode());
        assertEquals(PackageVersion.of(3, 7), PackageVersion.parse("3.7"));
        assertNotEquals(PackageVersion.parse("1.0"), PackageVersion.parse("1.0.*"));
        assertEquals("3.7.*", PackageVersion.parse("3.7.*").toString());
    }

    @Test
    public void testWildcardPrefix() {
        PackageVersion wildcard = PackageVersion.parse("3.7.*");
        assertTrue(wildcard.isWildcard());
        assertTrue(wildcard.isPrefixOf(PackageVersion.parse("3.7.4")));
        assertTrue(wildcard.isPrefixOf(PackageVersion.parse("3.7")));
        assertFalse(wildcard.isPrefixOf(PackageVersion.parse("3.8")));
    }

    @Test
    public void testCachedTuplize() {
        SpecifierCache cache = new SpecifierCache(2);
        assertArrayEquals(new int[] {1, 2}, SpecifierUtil.tuplize("1.2", cache));
        assertArrayEquals(new int[] {1, 2}, SpecifierUtil.tuplize("1.2", cache));
        assertEquals(1, cache.size());
        SpecifierUtil.tuplize("1.3", cache);
        SpecifierUtil.tuplize("1.4", cache);
        assertEquals(2, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
        assertArrayEquals(new int[] {4, 5}, SpecifierUtil.tuplize("4.5", null));
    }
}
