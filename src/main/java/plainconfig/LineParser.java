package plainconfig;

import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single pass over a {@link LineSource}: every physical line ends up in exactly one
 * structure entry, and every key line that decodes ends up in the data map.
 * <p>
 * A line is
 * <ul>
 *   <li>a comment when it is blank or its first non-blank character is {@code #}</li>
 *   <li>a key line when it has {@code =}: {@code key[/modifier]=payload}</li>
 *   <li>invalid otherwise, or when its value cannot be decoded</li>
 * </ul>
 * Only structurally broken input (a continuation cut off by the end of input) fails the read.
 */
final class LineParser {

    private static final String TERMINATORS = "\r\n";

    private final ValueCodec codec;
    private final DiagnosticListener diagnostics;

    LineParser(ValueCodec codec, DiagnosticListener diagnostics) {
        this.codec = codec;
        this.diagnostics = diagnostics;
    }

    ConfigSnapshot parse(LineSource source) throws IOException {
        ParseContext ctx = new ParseContext(source);
        String rawLine;
        while ((rawLine = ctx.next()) != null) {
            processRawLine(ctx, rawLine);
        }
        return ctx.toResult();
    }

    private void processRawLine(ParseContext ctx, String rawLine) throws IOException {
        int lineNumber = ctx.lineNumber;
        String line = StringUtils.stripEnd(rawLine, TERMINATORS);
        if (isCommentLine(line)) {
            ctx.structure.add(StructureEntry.comment(rawLine));
            return;
        }

        int eq = line.indexOf('=');
        if (eq < 0) {
            diagnostics.report(Diagnostic.warning(lineNumber, null, "Ignoring line without '='"));
            ctx.structure.add(StructureEntry.invalid(rawLine));
            return;
        }

        String key = line.substring(0, eq);
        String modifier = "";
        int slash = key.indexOf('/');
        if (slash >= 0) {
            modifier = key.substring(slash + 1);
            key = key.substring(0, slash);
        }

        String operations = modifier;
        String payload = line.substring(eq + 1);
        String raw = rawLine;
        if (operations.startsWith("C")) {
            if (operations.length() < 2) {
                diagnostics.report(Diagnostic.warning(lineNumber, key,
                        "Continuation operator of '" + key + "' has no marker character"));
                ctx.structure.add(StructureEntry.invalid(rawLine));
                return;
            }
            int markerCp = operations.codePointAt(1);
            String marker = new String(Character.toChars(markerCp));
            operations = operations.substring(1 + marker.length());

            Continued continued = readContinuation(ctx, key, payload, rawLine, marker, lineNumber);
            payload = continued.value;
            raw = continued.raw;
        }

        if (key.isEmpty()) {
            diagnostics.report(Diagnostic.warning(lineNumber, null, "Ignoring line with an empty key"));
            ctx.structure.add(StructureEntry.invalid(raw));
            return;
        }

        try {
            Object value = codec.decode(operations, payload);
            ctx.data.put(key, value);
            ctx.structure.add(StructureEntry.key(key, "", raw));
        } catch (UnsafeOperationException ex) {
            diagnostics.report(Diagnostic.error(lineNumber, key,
                    "Refusing opaque value of '" + key + "' in safe mode"));
            ctx.structure.add(StructureEntry.invalid(raw));
        } catch (ValueDecodeException ex) {
            diagnostics.report(Diagnostic.error(lineNumber, key,
                    "Cannot decode '" + key + "': " + ex.getMessage()));
            ctx.structure.add(StructureEntry.invalid(raw));
        }
    }

    /**
     * Joins segments while the collected value ends with the marker, dropping one marker per join.
     */
    private static Continued readContinuation(ParseContext ctx, String key, String firstValue, String firstRaw,
                                              String marker, int startLine) throws IOException {
        StringBuilder value = new StringBuilder(firstValue);
        StringBuilder raw = new StringBuilder(firstRaw);
        while (endsWith(value, marker)) {
            String next = ctx.next();
            if (next == null) {
                throw new UnexpectedEndOfInputException(key, startLine);
            }
            raw.append(next);
            value.setLength(value.length() - marker.length());
            value.append(StringUtils.stripEnd(next, TERMINATORS));
        }
        return new Continued(value.toString(), raw.toString());
    }

    private static boolean endsWith(StringBuilder sb, String suffix) {
        int offset = sb.length() - suffix.length();
        return offset >= 0 && sb.indexOf(suffix, offset) == offset;
    }

    static boolean isCommentLine(String line) {
        if (StringUtils.isBlank(line)) {
            return true;
        }
        return StringUtils.stripStart(line, null).startsWith("#");
    }

    private static final class Continued {
        private final String value;
        private final String raw;

        Continued(String value, String raw) {
            this.value = value;
            this.raw = raw;
        }
    }

    private static final class ParseContext {
        private final LineSource source;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final List<StructureEntry> structure = new ArrayList<>();
        private int lineNumber;

        ParseContext(LineSource source) {
            this.source = source;
        }

        String next() throws IOException {
            String line = source.nextLine();
            if (line != null) {
                lineNumber++;
            }
            return line;
        }

        ConfigSnapshot toResult() {
            return new ConfigSnapshot(data, structure);
        }
    }
}
