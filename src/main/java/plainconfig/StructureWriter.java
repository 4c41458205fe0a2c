package plainconfig;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class StructureWriter {

    private final ValueCodec codec;
    private final LineRenderer renderer;
    private final boolean rewriteOld;
    private final String defaultLineSeparator;

    StructureWriter(ValueCodec codec, LineRenderer renderer, boolean rewriteOld, String defaultLineSeparator) {
        this.codec = codec;
        this.renderer = renderer;
        this.rewriteOld = rewriteOld;
        this.defaultLineSeparator = defaultLineSeparator == null ? "\n" : defaultLineSeparator;
    }

    List<String> dump(Map<String, ?> data, List<StructureEntry> structure, DiagnosticListener diagnostics) {
        List<StructureEntry> layout = structure == null ? Collections.emptyList() : structure;
        Map<String, EncodedValue> pending = encodeAll(data);
        DumpContext ctx = new DumpContext(detectLineSeparator(layout, defaultLineSeparator), diagnostics);

        for (StructureEntry entry : layout) {
            if (entry == null) {
                continue;
            }
            switch (entry.getKind()) {
                case KEY:
                    if (pending.containsKey(entry.getKey())) {
                        ctx.appendValue(entry.getKey(), pending.remove(entry.getKey()));
                    } else if (rewriteOld) {
                        ctx.appendRaw(entry.getRawLine());
                    }
                    break;
                case COMMENT:
                    ctx.appendRaw(entry.getRawLine());
                    break;
                default:
                    break;
            }
        }
        for (Map.Entry<String, EncodedValue> entry : pending.entrySet()) {
            ctx.appendValue(entry.getKey(), entry.getValue());
        }
        return ctx.chunks;
    }

    Map<String, EncodedValue> encodeAll(Map<String, ?> data) {
        Map<String, EncodedValue> encoded = new LinkedHashMap<>();
        if (data == null) {
            return encoded;
        }
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            Object key = entry.getKey();
            checkKey(key);
            encoded.put((String) key, codec.encode(entry.getValue()));
        }
        return encoded;
    }

    static void checkKey(Object key) {
        if (!(key instanceof String)) {
            throw new InvalidKeyException("Keys must be strings, got " + Literals.typeName(key));
        }
        String k = (String) key;
        if (k.isEmpty()) {
            throw new InvalidKeyException("Keys must not be empty");
        }
        for (int i = 0; i < k.length(); i++) {
            char c = k.charAt(i);
            if (c == '=' || c == '/' || c == '\r' || c == '\n') {
                throw new InvalidKeyException("Key " + Literals.repr(k) + " contains a forbidden character "
                        + Literals.repr(String.valueOf(c)));
            }
        }
        if (StringUtils.stripStart(k, null).startsWith("#")) {
            throw new InvalidKeyException("Key " + Literals.repr(k) + " would read back as a comment");
        }
    }

    static String detectLineSeparator(List<StructureEntry> structure, String fallback) {
        for (StructureEntry entry : structure) {
            String raw = entry == null ? null : entry.getRawLine();
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            int cr = raw.indexOf('\r');
            int lf = raw.indexOf('\n');
            if (cr < 0 && lf < 0) {
                continue;
            }
            if (cr >= 0 && (lf < 0 || cr < lf)) {
                return lf == cr + 1 ? "\r\n" : "\r";
            }
            return "\n";
        }
        return fallback;
    }

    private final class DumpContext {
        private final List<String> chunks = new ArrayList<>();
        private final String ls;
        private final DiagnosticListener diagnostics;
        private boolean openLine;

        DumpContext(String ls, DiagnosticListener diagnostics) {
            this.ls = ls;
            this.diagnostics = diagnostics;
        }

        void appendRaw(String raw) {
            if (raw == null || raw.isEmpty()) {
                return;
            }
            closeOpenLine();
            chunks.add(raw);
            char last = raw.charAt(raw.length() - 1);
            openLine = last != '\n' && last != '\r';
        }

        void appendValue(String key, EncodedValue value) {
            closeOpenLine();
            for (String line : renderer.render(key, value.getModifier(), value.getPayload(), diagnostics)) {
                chunks.add(line + ls);
            }
        }

        private void closeOpenLine() {
            if (openLine) {
                chunks.add(ls);
                openLine = false;
            }
        }
    }
}
