package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.stianloader.picopip.marker.Marker;
import org.stianloader.picopip.marker.MarkerAlgebra;
import org.stianloader.picopip.marker.MarkerEnvironment;
import org.stianloader.picopip.marker.MarkerVariable;
import org.stianloader.picopip.marker.StrippedMarker;
import org.stianloader.picopip.version.SpecifierSet;

public class MarkerAlgebraTest {

    @Test
    public void testCollect() {
        Marker marker = Marker.parse("(extra == 'socks' or extra == 'http2') and python_version >= '3.7' and os_name != 'nt'");
        assertEquals(Set.of("socks", "http2"), MarkerAlgebra.collect(marker, MarkerVariable.EXTRA));
        assertEquals(Set.of("3.7"), MarkerAlgebra.collect(marker, MarkerVariable.PYTHON_VERSION));
        assertTrue(MarkerAlgebra.collect(marker, MarkerVariable.SYS_PLATFORM).isEmpty());
        assertTrue(MarkerAlgebra.collect(null, MarkerVariable.EXTRA).isEmpty());
    }

    @Test
    public void testStripExtra() {
        StrippedMarker stripped = MarkerAlgebra.strip(Marker.parse("python_version >= '3.6' and extra == 'socks'"), MarkerVariable.EXTRA);
        assertTrue(stripped.modified());
        assertEquals("python_version >= '3.6'", String.valueOf(stripped.remainder()));

        stripped = MarkerAlgebra.strip(Marker.parse("extra == 'socks' and python_version >= '3.6'"), MarkerVariable.EXTRA);
        assertTrue(stripped.modified());
        assertEquals("python_version >= '3.6'", String.valueOf(stripped.remainder()));

        stripped = MarkerAlgebra.strip(Marker.parse("extra == 'socks'"), MarkerVariable.EXTRA);
        assertTrue(stripped.modified());
        assertNull(stripped.remainder());

        Marker untouched = Marker.parse("os_name == 'nt'");
        stripped = MarkerAlgebra.strip(untouched, MarkerVariable.EXTRA);
        assertFalse(stripped.modified());
        assertSame(untouched, stripped.remainder());

        stripped = MarkerAlgebra.strip(null, MarkerVariable.EXTRA);
        assertFalse(stripped.modified());
        assertNull(stripped.remainder());
    }

    @Test
    public void testStripNested() {
        StrippedMarker stripped = MarkerAlgebra.strip(Marker.parse("os_name == 'nt' and (extra == 'a' or extra == 'b')"), MarkerVariable.EXTRA);
        assertTrue(stripped.modified());
        assertEquals("os_name == 'nt'", String.valueOf(stripped.remainder()));
    }

    /**
     * Stripping the "and"-joined extra clause and joining it back with "and" yields an equivalent marker.
     */
    @Test
    public void testStripAndRecombine() {
        Marker original = Marker.parse("python_version >= '3.7' and os_name == 'posix' and extra == 'socks'");
        StrippedMarker stripped = MarkerAlgebra.strip(original, MarkerVariable.EXTRA);
        Marker remainder = stripped.remainder();
        assertNotNull(remainder);
        Marker recombined = remainder.and(Marker.parse("extra == 'socks'"));

        String[] pythons = {"3.6", "3.7", "3.10"};
        String[] osNames = {"posix", "nt"};
        List<List<String>> extraSets = List.of(List.of(), List.of("socks"), List.of("http2"));
        for (String python : pythons) {
            for (String osName : osNames) {
                for (List<String> extras : extraSets) {
                    MarkerEnvironment env = MarkerEnvironment.forPython(python).with(MarkerVariable.OS_NAME, osName).withExtras(extras);
                    assertEquals(original.evaluate(env), recombined.evaluate(env), env.toString());
                }
            }
        }
    }

    @Test
    public void testMerge() {
        Marker a = Marker.parse("python_version >= '3.6'");
        assertSame(a, MarkerAlgebra.merge(a, null));
        assertSame(a, MarkerAlgebra.merge(null, a));
        assertNull(MarkerAlgebra.merge(null, null));

        assertEquals("python_version >= '3.7'", String.valueOf(MarkerAlgebra.merge(a, Marker.parse("python_version >= '3.7'"))));
        assertEquals("python_version >= '3.6' and python_version < '4'", String.valueOf(MarkerAlgebra.merge(a, Marker.parse("python_version < '4'"))));
        assertEquals("python_version < '3' and os_name == 'nt'", String.valueOf(MarkerAlgebra.merge(Marker.parse("os_name == 'nt'"), Marker.parse("python_version < '3'"))));
    }

    @Test
    public void testMergeIsStable() {
        Marker a = Marker.parse("python_version >= '3.6' and os_name == 'nt'");
        Marker b = Marker.parse("python_version >= '3.7'");
        Marker once = MarkerAlgebra.merge(a, b);
        Marker twice = MarkerAlgebra.merge(once, b);
        assertEquals(once, twice);
        assertEquals("python_version >= '3.7' and os_name == 'nt'", String.valueOf(once));
    }

    @Test
    public void testMergeFoldsFullVersionClauses() {
        Marker first = MarkerAlgebra.merge(Marker.parse("python_version >= '3.6'"), Marker.parse("python_full_version >= '3.6.1'"));
        assertEquals("python_full_version >= '3.6.1'", String.valueOf(first));
        Marker second = MarkerAlgebra.merge(first, Marker.parse("python_version >= '3.7'"));
        assertEquals("python_version >= '3.7'", String.valueOf(second));
        assertEquals(second, MarkerAlgebra.merge(second, Marker.parse("python_full_version >= '3.6.1'")));

        Marker bounded = MarkerAlgebra.merge(Marker.parse("python_full_version < '3.9.2' and sys_platform == 'linux'"), Marker.parse("python_version < '3.9'"));
        assertEquals("python_version < '3.9' and sys_platform == 'linux'", String.valueOf(bounded));
    }

    @Test
    public void testToSpecifierSet() {
        assertEquals(">=3.6,<4", String.valueOf(MarkerAlgebra.toSpecifierSet(Marker.parse("python_version >= '3.6' and python_version < '4'"))));
        assertEquals(">=3.7", String.valueOf(MarkerAlgebra.toSpecifierSet(Marker.parse("python_version > '3.6'"))));
        assertEquals("in 3.6, 3.7", String.valueOf(MarkerAlgebra.toSpecifierSet(Marker.parse("python_version == '3.6' or python_version == '3.7'"))));
        assertSame(SpecifierSet.ANY, MarkerAlgebra.toSpecifierSet(Marker.parse("os_name == 'nt'")));
        // A union of two disjoint ranges is no specifier set
        assertNull(MarkerAlgebra.toSpecifierSet(Marker.parse("python_version < '3' or python_version >= '3.6'")));
    }

    @Test
    public void testNormalizePythonVersion() {
        Marker marker = Marker.parse("os_name == 'nt' and python_version >= '3.6' and python_version > '3.6'");
        assertEquals("python_version >= '3.7' and os_name == 'nt'", MarkerAlgebra.normalizePythonVersion(marker).toString());
        Marker disjunction = Marker.parse("python_version < '3' or os_name == 'nt'");
        assertSame(disjunction, MarkerAlgebra.normalizePythonVersion(disjunction));
    }
}
