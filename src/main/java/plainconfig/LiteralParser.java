package plainconfig;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the restricted literal grammar written by {@link Literals#repr(Object)}: constants,
 * numbers, strings, bytes and nested tuple/list/set/dict. Nothing is ever evaluated; any
 * name, call or operator outside the grammar is a {@link FormatException}.
 */
final class LiteralParser {

    static final int MAX_DEPTH = 256;

    private static final String DIGITS = "\\d(?:_?\\d)*";
    private static final Pattern NUMBER = Pattern.compile(
            "(?<hex>0[xX](?:_?[0-9a-fA-F])+)"
                    + "|(?<oct>0[oO](?:_?[0-7])+)"
                    + "|(?<bin>0[bB](?:_?[01])+)"
                    + "|(?<float>(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")(?:[eE][+-]?" + DIGITS + ")?"
                    + "|" + DIGITS + "[eE][+-]?" + DIGITS + ")"
                    + "|(?<int>0(?:_?0)*|[1-9](?:_?\\d)*)");

    private final String text;
    private int pos;

    private LiteralParser(String text) {
        this.text = text;
    }

    static Object parse(String text) {
        if (text == null) {
            throw new FormatException("No literal text");
        }
        LiteralParser parser = new LiteralParser(text);
        parser.skipWhitespace();
        if (parser.atEnd()) {
            throw new FormatException("Empty literal");
        }
        Object value = parser.parseValue(0);
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("unexpected trailing text");
        }
        return value;
    }

    private Object parseValue(int depth) {
        if (depth > MAX_DEPTH) {
            throw error("literal nested deeper than " + MAX_DEPTH);
        }
        skipWhitespace();
        if (atEnd()) {
            throw error("value expected");
        }
        char c = peek();
        switch (c) {
            case '(':
                return parseParenthesized(depth);
            case '[':
                return parseList(depth);
            case '{':
                return parseBraced(depth);
            case '+':
            case '-':
                return parseSigned();
            case '\'':
            case '"':
                return parseStrings();
            default:
                break;
        }
        if (isDigit(c) || (c == '.' && pos + 1 < text.length() && isDigit(text.charAt(pos + 1)))) {
            return parseNumber(false);
        }
        if (isIdentifierStart(c)) {
            int start = pos;
            String name = readIdentifier();
            if (!atEnd() && isQuote(peek()) && isStringPrefix(name)) {
                pos = start;
                return parseStrings();
            }
            return resolveName(name, start);
        }
        throw error("unexpected character '" + c + "'");
    }

    private Object resolveName(String name, int start) {
        switch (name) {
            case "True":
                return Boolean.TRUE;
            case "False":
                return Boolean.FALSE;
            case "None":
                return null;
            case "inf":
                return Double.POSITIVE_INFINITY;
            case "nan":
                return Double.NaN;
            case "set":
                skipWhitespace();
                expect('(');
                skipWhitespace();
                expect(')');
                return new LinkedHashSet<>();
            default:
                pos = start;
                throw error("name '" + name + "' is not a literal");
        }
    }

    private Object parseSigned() {
        boolean negative = peek() == '-';
        pos++;
        skipWhitespace();
        if (atEnd()) {
            throw error("number expected after sign");
        }
        char c = peek();
        if (isDigit(c) || c == '.') {
            return parseNumber(negative);
        }
        if (isIdentifierStart(c)) {
            int start = pos;
            String name = readIdentifier();
            if ("inf".equals(name)) {
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            if ("nan".equals(name)) {
                return Double.NaN;
            }
            pos = start;
        }
        throw error("sign can only be applied to a number");
    }

    private Object parseNumber(boolean negative) {
        Matcher m = NUMBER.matcher(text);
        m.region(pos, text.length());
        if (!m.lookingAt()) {
            throw error("malformed number");
        }
        pos = m.end();
        if (!atEnd() && (isIdentifierPart(peek()) || peek() == '.')) {
            throw error("malformed number");
        }
        String token = m.group().replace("_", "");
        if (m.group("float") != null) {
            double d = Double.parseDouble(token);
            return negative ? -d : d;
        }
        BigInteger value;
        if (m.group("hex") != null) {
            value = new BigInteger(token.substring(2), 16);
        } else if (m.group("oct") != null) {
            value = new BigInteger(token.substring(2), 8);
        } else if (m.group("bin") != null) {
            value = new BigInteger(token.substring(2), 2);
        } else {
            value = new BigInteger(token);
        }
        return Literals.normalizeInteger(negative ? value.negate() : value);
    }

    private Object parseParenthesized(int depth) {
        expect('(');
        skipWhitespace();
        if (tryConsume(')')) {
            return Tuple.of();
        }
        Object first = parseValue(depth + 1);
        skipWhitespace();
        if (tryConsume(')')) {
            return first;
        }
        expect(',');
        List<Object> items = new ArrayList<>();
        items.add(first);
        parseItems(items, ')', depth);
        return Tuple.copyOf(items);
    }

    private Object parseList(int depth) {
        expect('[');
        List<Object> items = new ArrayList<>();
        skipWhitespace();
        if (tryConsume(']')) {
            return items;
        }
        items.add(parseValue(depth + 1));
        skipWhitespace();
        if (tryConsume(']')) {
            return items;
        }
        expect(',');
        parseItems(items, ']', depth);
        return items;
    }

    /**
     * Continues a comma separated sequence after its first separator, up to {@code close}.
     */
    private void parseItems(List<Object> items, char close, int depth) {
        while (true) {
            skipWhitespace();
            if (tryConsume(close)) {
                return;
            }
            items.add(parseValue(depth + 1));
            skipWhitespace();
            if (tryConsume(close)) {
                return;
            }
            expect(',');
        }
    }

    private Object parseBraced(int depth) {
        expect('{');
        skipWhitespace();
        if (tryConsume('}')) {
            return new LinkedHashMap<>();
        }
        int firstAt = pos;
        Object first = parseValue(depth + 1);
        skipWhitespace();
        if (tryConsume(':')) {
            return parseDict(first, firstAt, depth);
        }
        Set<Object> set = new LinkedHashSet<>();
        addHashable(set, first, firstAt);
        while (true) {
            skipWhitespace();
            if (tryConsume('}')) {
                return set;
            }
            expect(',');
            skipWhitespace();
            if (tryConsume('}')) {
                return set;
            }
            int at = pos;
            addHashable(set, parseValue(depth + 1), at);
        }
    }

    private Map<Object, Object> parseDict(Object firstKey, int firstAt, int depth) {
        Map<Object, Object> dict = new LinkedHashMap<>();
        requireHashable(firstKey, firstAt);
        dict.put(firstKey, parseValue(depth + 1));
        while (true) {
            skipWhitespace();
            if (tryConsume('}')) {
                return dict;
            }
            expect(',');
            skipWhitespace();
            if (tryConsume('}')) {
                return dict;
            }
            int at = pos;
            Object key = parseValue(depth + 1);
            requireHashable(key, at);
            skipWhitespace();
            expect(':');
            dict.put(key, parseValue(depth + 1));
        }
    }

    private void addHashable(Set<Object> set, Object item, int at) {
        requireHashable(item, at);
        set.add(item);
    }

    private void requireHashable(Object item, int at) {
        if (!Literals.isHashable(item)) {
            pos = at;
            throw error("unhashable " + Literals.typeName(item));
        }
    }

    /**
     * One string or bytes literal, plus any adjacent literals of the same kind.
     */
    private Object parseStrings() {
        Object result = parseOneString();
        while (true) {
            int save = pos;
            skipWhitespace();
            if (atEnd() || !startsString()) {
                pos = save;
                return result;
            }
            Object next = parseOneString();
            if (result instanceof String && next instanceof String) {
                result = result + (String) next;
            } else if (result instanceof Bytes && next instanceof Bytes) {
                result = Bytes.concat((Bytes) result, (Bytes) next);
            } else {
                throw error("cannot mix bytes and text literals");
            }
        }
    }

    private boolean startsString() {
        char c = peek();
        if (isQuote(c)) {
            return true;
        }
        if (!isIdentifierStart(c)) {
            return false;
        }
        int save = pos;
        String name = readIdentifier();
        boolean result = !atEnd() && isQuote(peek()) && isStringPrefix(name);
        pos = save;
        return result;
    }

    private Object parseOneString() {
        boolean raw = false;
        boolean bytes = false;
        while (!isQuote(peek())) {
            char p = Character.toLowerCase(peek());
            raw |= p == 'r';
            bytes |= p == 'b';
            pos++;
        }
        char quote = peek();
        boolean triple = text.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;

        StringBuilder chars = new StringBuilder();
        ByteArrayOutputStream octets = new ByteArrayOutputStream();
        while (true) {
            if (atEnd()) {
                throw error("unterminated string literal");
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (text.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            }
            if (!triple && (c == '\n' || c == '\r')) {
                throw error("line break inside string literal");
            }
            if (c == '\\') {
                if (pos + 1 >= text.length()) {
                    throw error("unterminated string literal");
                }
                if (raw) {
                    emit(chars, octets, bytes, '\\');
                    pos++;
                    emit(chars, octets, bytes, text.codePointAt(pos));
                    pos += Character.charCount(text.codePointAt(pos));
                } else {
                    pos++;
                    readEscape(chars, octets, bytes);
                }
                continue;
            }
            int cp = text.codePointAt(pos);
            emit(chars, octets, bytes, cp);
            pos += Character.charCount(cp);
        }
        if (bytes) {
            return Bytes.wrap(octets.toByteArray());
        }
        return chars.toString();
    }

    private void readEscape(StringBuilder chars, ByteArrayOutputStream octets, boolean bytes) {
        char e = peek();
        pos++;
        switch (e) {
            case '\n':
                return;
            case '\r':
                tryConsume('\n');
                return;
            case '\\':
            case '\'':
            case '"':
                emit(chars, octets, bytes, e);
                return;
            case 'a':
                emit(chars, octets, bytes, 7);
                return;
            case 'b':
                emit(chars, octets, bytes, '\b');
                return;
            case 'f':
                emit(chars, octets, bytes, '\f');
                return;
            case 'n':
                emit(chars, octets, bytes, '\n');
                return;
            case 'r':
                emit(chars, octets, bytes, '\r');
                return;
            case 't':
                emit(chars, octets, bytes, '\t');
                return;
            case 'v':
                emit(chars, octets, bytes, 11);
                return;
            case 'x':
                emitRaw(chars, octets, bytes, readHex(2));
                return;
            default:
                break;
        }
        if (e >= '0' && e <= '7') {
            int value = e - '0';
            for (int i = 0; i < 2 && !atEnd() && peek() >= '0' && peek() <= '7'; i++) {
                value = value * 8 + (peek() - '0');
                pos++;
            }
            if (bytes && value > 0xff) {
                throw error("octal escape out of range");
            }
            emitRaw(chars, octets, bytes, value);
            return;
        }
        if (!bytes && e == 'u') {
            emit(chars, octets, false, readHex(4));
            return;
        }
        if (!bytes && e == 'U') {
            int cp = readHex(8);
            if (cp < 0 || cp > Character.MAX_CODE_POINT) {
                throw error("escape outside the Unicode range");
            }
            emit(chars, octets, false, cp);
            return;
        }
        if (!bytes && e == 'N') {
            throw error("named unicode escapes are not supported");
        }
        emit(chars, octets, bytes, '\\');
        pos--;
        int cp = text.codePointAt(pos);
        emit(chars, octets, bytes, cp);
        pos += Character.charCount(cp);
    }

    private int readHex(int count) {
        if (pos + count > text.length()) {
            throw error("truncated escape");
        }
        int value = 0;
        for (int i = 0; i < count; i++) {
            int digit = Character.digit(text.charAt(pos + i), 16);
            if (digit < 0) {
                throw error("malformed escape");
            }
            value = value * 16 + digit;
        }
        pos += count;
        return value;
    }

    private void emit(StringBuilder chars, ByteArrayOutputStream octets, boolean bytes, int cp) {
        if (bytes) {
            if (cp > 0x7f) {
                throw error("bytes literal can only contain ASCII characters");
            }
            octets.write(cp);
        } else {
            chars.appendCodePoint(cp);
        }
    }

    /**
     * Escaped value: a byte for bytes literals, a code point for text.
     */
    private void emitRaw(StringBuilder chars, ByteArrayOutputStream octets, boolean bytes, int value) {
        if (bytes) {
            octets.write(value);
        } else {
            chars.appendCodePoint(value);
        }
    }

    private String readIdentifier() {
        int start = pos;
        while (!atEnd() && isIdentifierPart(peek())) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private void skipWhitespace() {
        while (!atEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f') {
                pos++;
            } else {
                return;
            }
        }
    }

    private void expect(char c) {
        if (!tryConsume(c)) {
            throw error("'" + c + "' expected");
        }
    }

    private boolean tryConsume(char c) {
        if (!atEnd() && peek() == c) {
            pos++;
            return true;
        }
        return false;
    }

    private char peek() {
        return text.charAt(pos);
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private FormatException error(String message) {
        return new FormatException("Invalid literal at offset " + pos + ": " + message);
    }

    private static boolean isStringPrefix(String name) {
        switch (name.toLowerCase()) {
            case "r":
            case "u":
            case "b":
            case "br":
            case "rb":
                return true;
            default:
                return false;
        }
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
