package plainconfig;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineRendererTest {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Test
    void keepsShortValuesOnOneLine() {
        var renderer = new LineRenderer(72, "|");

        assertEquals(List.of("port/i=42"), renderer.render("port", "i", "42", diagnostics::add));
        assertEquals(List.of("name=demo"), renderer.render("name", "", "demo", diagnostics::add));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void zeroWidthDisablesWrapping() {
        var payload = "x".repeat(500);

        var lines = new LineRenderer(0, "|").render("k", "", payload, diagnostics::add);

        assertEquals(List.of("k=" + payload), lines);
    }

    @Test
    void wrapsWithinWidth() {
        var payload = "a".repeat(40);

        var lines = new LineRenderer(20, "|").render("k", "", payload, diagnostics::add);

        assertEquals(List.of(
                "k/C|=" + "a".repeat(14) + "|",
                "a".repeat(19) + "|",
                "a".repeat(7)), lines);
    }

    @Test
    void prefersBreakingAfterSpace() {
        var lines = new LineRenderer(20, "|").render("k", "", "alpha beta gamma delta epsilon", diagnostics::add);

        assertEquals(List.of("k/C|=alpha beta |", "gamma delta epsilon"), lines);
    }

    @Test
    void keepsOtherOperationsAfterContinuation() {
        var lines = new LineRenderer(12, "|").render("n", "i", "1234567890123", diagnostics::add);

        assertTrue(lines.get(0).startsWith("n/C|i="));
        assertEquals("1234567890123", join(lines, "|", "n/C|i="));
    }

    @Test
    void skipsMarkersPresentInPayload() {
        var lines = new LineRenderer(10, "|;").render("k", "", "x|x|x|x|x|x", diagnostics::add);

        assertEquals(List.of("k/C;=x|x|;", "x|x|x|x"), lines);
    }

    @Test
    void neverUsesEqualsSignAsMarker() {
        var lines = new LineRenderer(10, "=|").render("k", "", "abcdefghijkl", diagnostics::add);

        assertTrue(lines.get(0).startsWith("k/C|="));
    }

    @Test
    void reportsUnsplittablePayload() {
        var payload = "a|b".repeat(30);

        var lines = new LineRenderer(20, "|").render("k", "", payload, diagnostics::add);

        assertEquals(List.of("k=" + payload), lines);
        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Severity.ERROR, diagnostics.get(0).getSeverity());
        assertEquals("k", diagnostics.get(0).getKey());
    }

    @Test
    void cutsOnCodePoints() {
        var payload = "😀".repeat(30);

        var lines = new LineRenderer(20, "|").render("k", "", payload, diagnostics::add);

        for (String line : lines) {
            assertTrue(line.codePointCount(0, line.length()) <= 20, line);
            assertTrue(line.codePoints().noneMatch(cp -> cp >= 0xD800 && cp <= 0xDFFF), line);
        }
        assertEquals(payload, join(lines, "|", "k/C|="));
    }

    @Test
    void overlongPrefixFallsBackToShortSegments() {
        var lines = new LineRenderer(5, "|").render("longkey", "", "abcdef", diagnostics::add);

        assertEquals(List.of("longkey/C|=ab|", "cdef"), lines);
    }

    private static String join(List<String> lines, String marker, String head) {
        var sb = new StringBuilder(lines.get(0).substring(head.length()));
        for (int i = 1; i < lines.size(); i++) {
            sb.setLength(sb.length() - marker.length());
            sb.append(lines.get(i));
        }
        return sb.toString();
    }
}
