package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.line.LineParser;
import org.stianloader.picopip.line.RequirementLine;

public class LineParserTest {

    private static void assertFails(Kind kind, String line) {
        RequirementParseException e = assertThrows(RequirementParseException.class, () -> LineParser.parse(line), line);
        assertEquals(kind, e.getKind(), line);
    }

    @Test
    public void testNamed() {
        RequirementLine line = LineParser.parse("requests[security]>=2.20,<3; python_version>='3.7'");
        assertEquals("requests", line.name());
        assertEquals(List.of("security"), line.extras());
        assertEquals(">=2.20,<3", String.valueOf(line.specifiers()));
        assertEquals("python_version >= '3.7'", String.valueOf(line.markers()));
        assertNull(line.uri());
        assertNull(line.path());
        assertFalse(line.editable());

        line = LineParser.parse("Flask_SQLAlchemy");
        assertEquals("Flask_SQLAlchemy", line.name());
        assertNotNull(line.specifiers());
        assertTrue(line.specifiers().isAny());

        assertEquals(">=1.0", String.valueOf(LineParser.parse("pkg (>=1.0)").specifiers()));
        assertEquals("==1.0", String.valueOf(LineParser.parse("'pkg==1.0'").specifiers()));
        assertTrue(LineParser.parse("pkg *").specifiers().isAny());
    }

    @Test
    public void testHashes() {
        RequirementLine line = LineParser.parse("pkg==1.0 --hash=sha256:abc --hash=sha256:def");
        assertEquals(List.of("sha256:abc", "sha256:def"), line.hashes());
        assertEquals("==1.0", String.valueOf(line.specifiers()));

        line = LineParser.parse("pkg==1.0; os_name == 'nt' --hash=sha256:abc");
        assertEquals(List.of("sha256:abc"), line.hashes());
        assertEquals("os_name == 'nt'", String.valueOf(line.markers()));
    }

    @Test
    public void testPaths() {
        RequirementLine line = LineParser.parse("-e ./local/path[dev]");
        assertTrue(line.editable());
        assertEquals("./local/path", line.path());
        assertEquals(List.of("dev"), line.extras());

        assertEquals("dist/pkg-1.0-py3-none-any.whl", LineParser.parse("dist/pkg-1.0-py3-none-any.whl").path());
        assertEquals("pkg-1.0.tar.gz", LineParser.parse("pkg-1.0.tar.gz").path());
        assertEquals("C:\\projects\\pkg", LineParser.parse("--editable=C:\\projects\\pkg").path());
    }

    @Test
    public void testUrls() {
        RequirementLine line = LineParser.parse("https://example.com/pkg-1.0.tar.gz; python_version < '3'");
        assertNotNull(line.uri());
        assertEquals("https://example.com/pkg-1.0.tar.gz", line.uri().toString());
        assertEquals("python_version < '3'", String.valueOf(line.markers()));
        assertNull(line.vcs());

        line = LineParser.parse("-e git+https://github.com/org/repo.git@v1#egg=repo");
        assertTrue(line.editable());
        assertEquals(VcsType.GIT, line.vcs());
        assertEquals("repo", line.uri().getName());
        assertEquals("v1", line.uri().getRef());

        line = LineParser.parse("pkg[socks] @ https://example.com/pkg-1.0.zip");
        assertEquals(List.of("socks"), line.extras());
        assertEquals("pkg", line.uri().getName());

        line = LineParser.parse("https://example.com/pkg-1.0.zip[socks]");
        assertEquals(List.of("socks"), line.extras());
        assertEquals(List.of("socks"), line.uri().getExtras());
    }

    @Test
    public void testMalformed() {
        LineParserTest.assertFails(Kind.UNPARSABLE_REQUIREMENT, "");
        LineParserTest.assertFails(Kind.UNPARSABLE_REQUIREMENT, "   ");
        LineParserTest.assertFails(Kind.UNPARSABLE_REQUIREMENT, "; python_version > '3'");
        LineParserTest.assertFails(Kind.UNPARSABLE_REQUIREMENT, "pkg foo");
        LineParserTest.assertFails(Kind.UNPARSABLE_REQUIREMENT, "pkg==1.0 --hash=sha256:abc bogus");
        LineParserTest.assertFails(Kind.UNPARSABLE_REQUIREMENT, "-pkg");
        LineParserTest.assertFails(Kind.MALFORMED_SPECIFIER, "pkg>=abc");
        LineParserTest.assertFails(Kind.MALFORMED_MARKER, "pkg; python_version >> '3'");
        LineParserTest.assertFails(Kind.MALFORMED_MARKER, "pkg; os_name ==");
        LineParserTest.assertFails(Kind.MALFORMED_URI, "https://:80/pkg.zip");
    }

    @Test
    public void testSplitMarkers() {
        assertEquals("os_name == 'nt'", LineParser.splitMarkers("pkg; os_name == 'nt'"));
        assertEquals("os_name=='nt'", LineParser.splitMarkers("https://example.org/a;b.whl; os_name=='nt'"));
        assertNull(LineParser.splitMarkers("pkg>=1"));
        assertNull(LineParser.splitMarkers("pkg;"));
    }
}
