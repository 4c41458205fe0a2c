package plainconfig;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns an encoded key line into physical lines, wrapping payloads wider than
 * {@code maxWidth} with a continuation marker.
 * <p>
 * A wrapped value gets {@code C<marker>} in front of its modifier, where the marker is the
 * first candidate character that does not occur in the payload. Every segment except the
 * last ends with the marker:
 * <pre>
 * motd/C|=Welcome to the build farm, please read the wiki before |
 * submitting jobs.
 * </pre>
 * Widths are counted in code points.
 */
public class LineRenderer {

    private static final String NICE_BREAKS = " ])},;-+\n\t";
    private static final String FORBIDDEN_MARKERS = "=\r\n";

    private final int maxWidth;
    private final String continuationChars;

    public LineRenderer(int maxWidth, String continuationChars) {
        this.maxWidth = Math.max(0, maxWidth);
        this.continuationChars = continuationChars == null ? "" : continuationChars;
    }

    /**
     * @return physical lines without terminators
     */
    public List<String> render(String key, String modifier, String payload, DiagnosticListener diagnostics) {
        String mod = modifier == null ? "" : modifier;
        int keyLength = codePoints(key);
        if (maxWidth == 0 || keyLength + codePoints(mod) + codePoints(payload) + 2 < maxWidth) {
            return Collections.singletonList(singleLine(key, mod, payload));
        }
        String marker = chooseMarker(payload);
        if (marker == null) {
            diagnostics.report(Diagnostic.error(0, key,
                    "Cannot split the value of '" + key + "': it contains every continuation character"));
            return Collections.singletonList(singleLine(key, mod, payload));
        }

        String wrappedModifier = "C" + marker + mod;
        int[] cps = payload.codePoints().toArray();
        List<String> lines = new ArrayList<>();
        String head = key + "/" + wrappedModifier + "=";
        int prefix = keyLength + codePoints(wrappedModifier) + 2;
        int start = 0;
        while (prefix + (cps.length - start) > maxWidth) {
            int budget = Math.min(Math.max(maxWidth - prefix - 1, 2), cps.length - start);
            int cut = niceCut(cps, start, budget);
            lines.add(head + new String(cps, start, cut) + marker);
            start += cut;
            head = "";
            prefix = 0;
        }
        lines.add(head + new String(cps, start, cps.length - start));
        return lines;
    }

    /**
     * First candidate that cannot be mistaken for payload content.
     */
    String chooseMarker(String payload) {
        int i = 0;
        while (i < continuationChars.length()) {
            int cp = continuationChars.codePointAt(i);
            i += Character.charCount(cp);
            String candidate = new String(Character.toChars(cp));
            if (!StringUtils.contains(FORBIDDEN_MARKERS, candidate) && !payload.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Segment length, moved back to just after a break character when one sits in the last
     * quarter of the budget.
     */
    private static int niceCut(int[] cps, int start, int budget) {
        int lowest = budget * 3 / 4;
        if (budget > lowest && lowest > 2) {
            for (int j = budget - 1; j >= lowest; j--) {
                if (NICE_BREAKS.indexOf(cps[start + j]) >= 0) {
                    return j + 1;
                }
            }
        }
        return budget;
    }

    static String singleLine(String key, String modifier, String payload) {
        if (modifier.isEmpty()) {
            return key + "=" + payload;
        }
        return key + "/" + modifier + "=" + payload;
    }

    private static int codePoints(String s) {
        return s.codePointCount(0, s.length());
    }
}
