package plainconfig;

import org.apache.commons.codec.binary.Base32;
import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Converts typed values to {@code (modifier, payload)} pairs and applies modifier chains
 * back to payload text.
 * <p>
 * Encoding picks the first matching rule:
 * <ul>
 *   <li>text without control characters: plain, no modifier</li>
 *   <li>text with control characters other than tab, CR and LF: {@code 64s}</li>
 *   <li>text whose only control characters are tab, CR or LF: {@code r}</li>
 *   <li>booleans and null: {@code r}</li>
 *   <li>integers: {@code i}; floats: {@code f}; bytes: {@code 32}</li>
 *   <li>tuples, lists, sets and dicts of literal values: {@code r}</li>
 *   <li>anything else: {@code 64p} when safe mode is off, otherwise {@link UnsafeValueException}</li>
 * </ul>
 * Decoding applies the modifier operations left to right, starting from the payload text.
 */
public class ValueCodec {

    public static final String MOD_PLAIN = "";
    public static final String MOD_LITERAL = "r";
    public static final String MOD_INTEGER = "i";
    public static final String MOD_FLOAT = "f";
    public static final String MOD_BYTES = "32";
    public static final String MOD_BINARY_TEXT = "64s";
    public static final String MOD_OPAQUE = "64p";

    private static final Pattern BASE32 = Pattern.compile(
            "(?:[A-Z2-7]{8})*(?:[A-Z2-7]{2}======|[A-Z2-7]{4}====|[A-Z2-7]{5}===|[A-Z2-7]{7}=)?");
    private static final String DIGITS = "\\d(?:_?\\d)*";
    private static final Pattern INTEGER = Pattern.compile("[+-]?" + DIGITS);
    private static final Pattern FLOAT = Pattern.compile(
            "[+-]?(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + "|" + DIGITS + ")(?:[eE][+-]?" + DIGITS + ")?");
    private static final Pattern FLOAT_SPECIAL = Pattern.compile("[+-]?(?i:inf|infinity|nan)");

    private final boolean safe;
    private final OpaqueSerializer opaqueSerializer;

    public ValueCodec() {
        this(true, null);
    }

    public ValueCodec(boolean safe, OpaqueSerializer opaqueSerializer) {
        this.safe = safe;
        this.opaqueSerializer = opaqueSerializer == null ? new YamlOpaqueSerializer() : opaqueSerializer;
    }

    public boolean isSafe() {
        return safe;
    }

    public EncodedValue encode(Object value) {
        if (value instanceof CharSequence) {
            return encodeText(value.toString());
        }
        if (value == null || value instanceof Boolean) {
            return new EncodedValue(MOD_LITERAL, Literals.repr(value));
        }
        if (Literals.isInteger(value)) {
            return new EncodedValue(MOD_INTEGER, Literals.toBigInteger(value).toString());
        }
        if (value instanceof Double || value instanceof Float) {
            return new EncodedValue(MOD_FLOAT, Literals.formatFloat(((Number) value).doubleValue()));
        }
        if (value instanceof Bytes) {
            return new EncodedValue(MOD_BYTES, new Base32().encodeToString(((Bytes) value).unsafeArray()));
        }
        if (value instanceof byte[]) {
            return new EncodedValue(MOD_BYTES, new Base32().encodeToString((byte[]) value));
        }
        if (Literals.isSafe(value)) {
            return new EncodedValue(MOD_LITERAL, Literals.repr(value));
        }
        if (!safe) {
            byte[] serialized = opaqueSerializer.serialize(value);
            return new EncodedValue(MOD_OPAQUE, Base64.getEncoder().encodeToString(serialized));
        }
        throw new UnsafeValueException("Cannot write a value of type " + Literals.typeName(value) + ", safe mode is on");
    }

    private static EncodedValue encodeText(String s) {
        boolean control = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (isControl(c)) {
                if (c != '\t' && c != '\r' && c != '\n') {
                    byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
                    return new EncodedValue(MOD_BINARY_TEXT, Base64.getEncoder().encodeToString(utf8));
                }
                control = true;
            }
        }
        if (control) {
            return new EncodedValue(MOD_LITERAL, Literals.repr(s));
        }
        return new EncodedValue(MOD_PLAIN, s);
    }

    static boolean isControl(char c) {
        return c <= 0x1f || (c >= 0x7f && c <= 0x9f);
    }

    /**
     * Applies the operations named by {@code modifier} to {@code payload}, left to right.
     * Continuation ({@code C}) is not an operation here: the parser consumes it before
     * calling this method.
     *
     * @throws ValueDecodeException when any operation fails
     */
    public Object decode(String modifier, String payload) {
        String m = modifier == null ? MOD_PLAIN : modifier;
        Object value = payload;
        int i = 0;
        while (i < m.length()) {
            if (m.startsWith("32", i)) {
                value = decodeBase32(value);
                i += 2;
                continue;
            }
            if (m.startsWith("64", i)) {
                value = decodeBase64(value);
                i += 2;
                continue;
            }
            char op = m.charAt(i);
            switch (op) {
                case 'p':
                    value = deserialize(value);
                    break;
                case 's':
                    value = toText(value);
                    break;
                case 'b':
                    value = toBytes(value);
                    break;
                case 'i':
                    value = toInteger(value);
                    break;
                case 'f':
                    value = toFloat(value);
                    break;
                case 'r':
                    value = LiteralParser.parse(asText("r", value));
                    break;
                default:
                    throw new UnknownModifierException(m.substring(i));
            }
            i++;
        }
        return value;
    }

    private Object deserialize(Object value) {
        if (safe) {
            throw new UnsafeOperationException();
        }
        byte[] data;
        if (value instanceof String) {
            data = ((String) value).getBytes(StandardCharsets.UTF_8);
        } else if (value instanceof Bytes) {
            data = ((Bytes) value).unsafeArray();
        } else {
            throw new TypeMismatchException("p", value);
        }
        return opaqueSerializer.deserialize(data);
    }

    private static Object toText(Object value) {
        if (value instanceof Bytes) {
            return utf8(((Bytes) value).unsafeArray());
        }
        if (value instanceof Long || value instanceof BigInteger) {
            return value.toString();
        }
        throw new TypeMismatchException("s", value);
    }

    private static Object toBytes(Object value) {
        if (value instanceof String) {
            return Bytes.wrap(((String) value).getBytes(StandardCharsets.UTF_8));
        }
        throw new TypeMismatchException("b", value);
    }

    private static Object toInteger(Object value) {
        if (value instanceof Long || value instanceof BigInteger) {
            return value;
        }
        String text = StringUtils.strip(asText("i", value));
        if (!INTEGER.matcher(text).matches()) {
            throw new FormatException("Not an integer: '" + StringUtils.abbreviate(text, 40) + "'");
        }
        return Literals.normalizeInteger(new BigInteger(StringUtils.remove(text, '_')));
    }

    private static Object toFloat(Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            return ((Number) value).doubleValue();
        }
        String text = StringUtils.strip(asText("f", value));
        if (FLOAT_SPECIAL.matcher(text).matches()) {
            boolean negative = text.startsWith("-");
            if (StringUtils.containsIgnoreCase(text, "nan")) {
                return Double.NaN;
            }
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (!FLOAT.matcher(text).matches()) {
            throw new FormatException("Not a float: '" + StringUtils.abbreviate(text, 40) + "'");
        }
        return Double.parseDouble(StringUtils.remove(text, '_'));
    }

    private static Object decodeBase32(Object value) {
        String text = asText("32", value);
        if (!BASE32.matcher(text).matches()) {
            throw new EncodingException("Invalid Base32 payload");
        }
        return Bytes.wrap(new Base32().decode(text));
    }

    private static Object decodeBase64(Object value) {
        String text = asText("64", value);
        try {
            return Bytes.wrap(Base64.getDecoder().decode(text));
        } catch (IllegalArgumentException ex) {
            throw new EncodingException("Invalid Base64 payload: " + ex.getMessage(), ex);
        }
    }

    /**
     * Text view of the current value for operations that parse text; bytes count as UTF-8.
     */
    private static String asText(String operation, Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Bytes) {
            return utf8(((Bytes) value).unsafeArray());
        }
        throw new TypeMismatchException(operation, value);
    }

    private static String utf8(byte[] data) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new EncodingException("Bytes are not valid UTF-8", ex);
        }
    }
}
