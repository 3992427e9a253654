package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.marker.Marker;
import org.stianloader.picopip.marker.MarkerEnvironment;
import org.stianloader.picopip.marker.MarkerVariable;

public class MarkerTest {

    @Test
    public void testParseAndFormat() {
        assertEquals("python_version >= '3.7'", Marker.parse("python_version>=\"3.7\"").toString());
        assertEquals("os_name == 'nt' and (python_version < '3' or sys_platform == 'win32')",
                Marker.parse("os_name=='nt' and (python_version<'3' or sys_platform == \"win32\")").toString());
        assertEquals("'linux' in sys_platform", Marker.parse("'linux' in sys_platform").toString());
        assertEquals(Marker.parse("python_version >= '3.7'"), Marker.parse("python_version>='3.7'"));
    }

    @Test
    public void testMalformed() {
        String[] malformed = {"", "python_version", "python_version >= ", "foo == 'bar'", "'a' == 'b'", "(os_name == 'nt'", "os_name == 'nt' and", "os_name === 'nt' or"};
        for (String marker : malformed) {
            RequirementParseException e = assertThrows(RequirementParseException.class, () -> Marker.parse(marker), marker);
            assertEquals(RequirementParseException.Kind.MALFORMED_MARKER, e.getKind(), marker);
        }
    }

    @Test
    public void testEvaluateVersions() {
        MarkerEnvironment py38 = MarkerEnvironment.forPython("3.8");
        MarkerEnvironment py310 = MarkerEnvironment.forPython("3.10.2");
        Marker marker = Marker.parse("python_version >= '3.9'");
        assertFalse(marker.evaluate(py38));
        assertTrue(marker.evaluate(py310));
        // Versions are compared numerically, not lexicographically
        assertTrue(Marker.parse("python_version > '3.9'").evaluate(py310));
        assertTrue(Marker.parse("python_full_version == '3.8.0'").evaluate(py38));
        assertTrue(Marker.parse("python_version in '3.7, 3.8'").evaluate(py38));
        assertFalse(Marker.parse("python_version not in '3.7, 3.8'").evaluate(py38));
    }

    @Test
    public void testEvaluateStringsAndPrecedence() {
        MarkerEnvironment env = MarkerEnvironment.forPython("3.8")
                .with(MarkerVariable.OS_NAME, "posix")
                .with(MarkerVariable.SYS_PLATFORM, "linux");
        assertTrue(Marker.parse("os_name == 'posix'").evaluate(env));
        assertTrue(Marker.parse("'linux' in sys_platform").evaluate(env));
        assertTrue(Marker.parse("platform_machine == ''").evaluate(env));
        // "and" binds tighter than "or"
        assertTrue(Marker.parse("os_name == 'nt' and python_version < '3' or sys_platform == 'linux'").evaluate(env));
        assertFalse(Marker.parse("os_name == 'nt' and (python_version < '3' or sys_platform == 'linux')").evaluate(env));
    }

    @Test
    public void testEvaluateExtras() {
        Marker marker = Marker.parse("extra == 'Socks_Proxy'");
        assertTrue(marker.evaluate(MarkerEnvironment.EMPTY.withExtras(List.of("socks-proxy"))));
        assertFalse(marker.evaluate(MarkerEnvironment.EMPTY));
        assertTrue(Marker.parse("extra != 'socks'").evaluate(MarkerEnvironment.EMPTY));
        assertThrows(IllegalArgumentException.class, () -> MarkerEnvironment.EMPTY.with(MarkerVariable.EXTRA, "socks"));
    }

    @Test
    public void testForPython() {
        MarkerEnvironment env = MarkerEnvironment.forPython("3.9");
        assertEquals("3.9", env.get(MarkerVariable.PYTHON_VERSION));
        assertEquals("3.9.0", env.get(MarkerVariable.PYTHON_FULL_VERSION));
        env = MarkerEnvironment.forPython("3.11.4");
        assertEquals("3.11", env.get(MarkerVariable.PYTHON_VERSION));
        assertEquals("3.11.4", env.get(MarkerVariable.PYTHON_FULL_VERSION));
    }

    @Test
    public void testAndOr() {
        Marker a = Marker.parse("os_name == 'nt'");
        Marker b = Marker.parse("python_version < '3'");
        assertEquals("os_name == 'nt' and python_version < '3'", a.and(b).toString());
        assertEquals("os_name == 'nt' or python_version < '3'", a.or(b).toString());
        assertEquals(a, a.or(a));
        assertEquals("os_name == 'nt' or python_version < '3'", a.or(b).or(b).toString());
        assertEquals("(os_name == 'nt' and python_version < '3') or os_name == 'posix'", a.and(b).or(Marker.parse("os_name == 'posix'")).toString());
    }

    @Test
    public void testNormalizeMembership() {
        Marker marker = Marker.parse("python_version in '3.6, 3.7'").normalize();
        assertEquals("python_version == '3.6' or python_version == '3.7'", marker.toString());
        Marker notIn = Marker.parse("python_version not in '3.6, 3.7'").normalize();
        assertEquals("python_version != '3.6' and python_version != '3.7'", notIn.toString());
    }

    @Test
    public void testFromSpecifier() {
        assertNull(Marker.fromSpecifier("*"));
        assertNull(Marker.fromSpecifier(""));
        assertEquals("python_version >= '3.7'", String.valueOf(Marker.fromSpecifier(">3.6")));
        assertEquals("python_version >= '3.6' and python_version < '4'", String.valueOf(Marker.fromSpecifier(">=3.6,<4")));
        assertEquals("python_full_version >= '3.6.1'", String.valueOf(Marker.fromSpecifier(">=3.6.1")));
        assertEquals(RequirementParseException.Kind.MALFORMED_MARKER, assertThrows(RequirementParseException.class, () -> Marker.fromSpecifier(">=x")).getKind());
    }
}
