package plainconfig;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Literal syntax helpers: the safety predicate deciding which values may be written with
 * the {@code r} operation, and the writer producing their canonical text.
 * <p>
 * Spelling follows the literal syntax files already use ({@code True}, {@code None}, {@code 'text'},
 * {@code b'\x00'}, {@code (1,)}, {@code set()}) so existing files stay readable.
 * {@link LiteralParser} reads the same grammar back.
 */
public final class Literals {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Literals() {
    }

    /**
     * True when the value and everything it contains can be written as a literal and read
     * back by {@link LiteralParser} to an equal value.
     */
    public static boolean isSafe(Object value) {
        if (isScalar(value)) {
            return true;
        }
        if (value instanceof Tuple) {
            for (Object item : (Tuple) value) {
                if (!isSafe(item)) {
                    return false;
                }
            }
            return true;
        }
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (!isSafe(item)) {
                    return false;
                }
            }
            return true;
        }
        if (value instanceof Set) {
            for (Object item : (Set<?>) value) {
                if (!isHashable(item)) {
                    return false;
                }
            }
            return true;
        }
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!isHashable(entry.getKey()) || !isSafe(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Values allowed as set members and dict keys.
     */
    static boolean isHashable(Object value) {
        if (isScalar(value)) {
            return true;
        }
        if (value instanceof Tuple) {
            for (Object item : (Tuple) value) {
                if (!isHashable(item)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    static boolean isScalar(Object value) {
        return value == null
                || value instanceof CharSequence
                || value instanceof Bytes
                || value instanceof byte[]
                || value instanceof Boolean
                || isInteger(value)
                || value instanceof Double
                || value instanceof Float;
    }

    static boolean isInteger(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger) {
            return (BigInteger) value;
        }
        return BigInteger.valueOf(((Number) value).longValue());
    }

    /**
     * Integers come back as {@link Long} when they fit and as {@link BigInteger} otherwise.
     */
    static Object normalizeInteger(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }

    public static String repr(Object value) {
        StringBuilder sb = new StringBuilder();
        appendRepr(sb, value);
        return sb.toString();
    }

    private static void appendRepr(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("None");
        } else if (value instanceof Boolean) {
            sb.append((Boolean) value ? "True" : "False");
        } else if (value instanceof CharSequence) {
            appendString(sb, value.toString());
        } else if (value instanceof Bytes) {
            appendBytes(sb, ((Bytes) value).unsafeArray());
        } else if (value instanceof byte[]) {
            appendBytes(sb, (byte[]) value);
        } else if (isInteger(value)) {
            sb.append(toBigInteger(value));
        } else if (value instanceof Double || value instanceof Float) {
            sb.append(formatFloat(((Number) value).doubleValue()));
        } else if (value instanceof Tuple) {
            Tuple tuple = (Tuple) value;
            sb.append('(');
            appendItems(sb, tuple.iterator());
            if (tuple.size() == 1) {
                sb.append(',');
            }
            sb.append(')');
        } else if (value instanceof List) {
            sb.append('[');
            appendItems(sb, ((List<?>) value).iterator());
            sb.append(']');
        } else if (value instanceof Set) {
            Set<?> set = (Set<?>) value;
            if (set.isEmpty()) {
                sb.append("set()");
                return;
            }
            sb.append('{');
            appendItems(sb, set.iterator());
            sb.append('}');
        } else if (value instanceof Map) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                appendRepr(sb, entry.getKey());
                sb.append(": ");
                appendRepr(sb, entry.getValue());
            }
            sb.append('}');
        } else {
            throw new UnsafeValueException("Value of type " + typeName(value) + " has no literal form");
        }
    }

    private static void appendItems(StringBuilder sb, Iterator<?> items) {
        boolean first = true;
        while (items.hasNext()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            appendRepr(sb, items.next());
        }
    }

    private static void appendString(StringBuilder sb, String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        sb.append(quote);
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == quote || cp == '\\') {
                sb.append('\\').appendCodePoint(cp);
            } else if (cp == '\t') {
                sb.append("\\t");
            } else if (cp == '\n') {
                sb.append("\\n");
            } else if (cp == '\r') {
                sb.append("\\r");
            } else if (cp < 0x20 || cp == 0x7f) {
                appendHex(sb, 'x', cp, 2);
            } else if (cp < 0x7f || isPrintable(cp)) {
                sb.appendCodePoint(cp);
            } else if (cp <= 0xff) {
                appendHex(sb, 'x', cp, 2);
            } else if (cp <= 0xffff) {
                appendHex(sb, 'u', cp, 4);
            } else {
                appendHex(sb, 'U', cp, 8);
            }
        }
        sb.append(quote);
    }

    private static void appendBytes(StringBuilder sb, byte[] data) {
        boolean hasSingle = false;
        boolean hasDouble = false;
        for (byte b : data) {
            hasSingle |= b == '\'';
            hasDouble |= b == '"';
        }
        char quote = hasSingle && !hasDouble ? '"' : '\'';
        sb.append('b').append(quote);
        for (byte b : data) {
            int c = b & 0xff;
            if (c == quote || c == '\\') {
                sb.append('\\').append((char) c);
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c < 0x20 || c >= 0x7f) {
                appendHex(sb, 'x', c, 2);
            } else {
                sb.append((char) c);
            }
        }
        sb.append(quote);
    }

    private static void appendHex(StringBuilder sb, char kind, int cp, int width) {
        String hex = Integer.toHexString(cp);
        sb.append('\\').append(kind);
        for (int i = hex.length(); i < width; i++) {
            sb.append('0');
        }
        sb.append(hex);
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    /**
     * Shortest text that reads back to the same double: positional for decimal exponents
     * in [-4, 16), scientific ({@code 1e+16}, {@code 1.5e-05}) otherwise.
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return 1 / value < 0 ? "-0.0" : "0.0";
        }
        String sign = value < 0 ? "-" : "";
        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - decimal.scale() - 1;

        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            if (plain.indexOf('.') < 0) {
                plain = plain + ".0";
            }
            return sign + plain;
        }
        StringBuilder sb = new StringBuilder(sign);
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude).toString();
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
