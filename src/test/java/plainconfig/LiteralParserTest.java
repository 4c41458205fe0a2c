package plainconfig;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiteralParserTest {

    @Test
    void parsesConstants() {
        assertEquals(true, LiteralParser.parse("True"));
        assertEquals(false, LiteralParser.parse(" False "));
        assertNull(LiteralParser.parse("None"));
    }

    @Test
    void parsesNumbers() {
        assertEquals(42L, LiteralParser.parse("42"));
        assertEquals(-42L, LiteralParser.parse("-42"));
        assertEquals(255L, LiteralParser.parse("0xff"));
        assertEquals(8L, LiteralParser.parse("0o10"));
        assertEquals(5L, LiteralParser.parse("0b101"));
        assertEquals(1000L, LiteralParser.parse("1_000"));
        assertEquals(new BigInteger("99999999999999999999"), LiteralParser.parse("99999999999999999999"));
        assertEquals(0.5, LiteralParser.parse(".5"));
        assertEquals(1.0, LiteralParser.parse("1."));
        assertEquals(1e16, LiteralParser.parse("1e+16"));
        assertEquals(Double.NEGATIVE_INFINITY, LiteralParser.parse("-inf"));
        assertTrue(Double.isNaN((Double) LiteralParser.parse("nan")));
    }

    @Test
    void parsesStrings() {
        assertEquals("it's", LiteralParser.parse("\"it's\""));
        assertEquals("a\tb\n", LiteralParser.parse("'a\\tb\\n'"));
        assertEquals("é€😀", LiteralParser.parse("'\\xe9\\u20ac\\U0001f600'"));
        assertEquals("raw\\n", LiteralParser.parse("r'raw\\n'"));
        assertEquals("ab", LiteralParser.parse("'a' \"b\""));
        assertEquals("multi\nline", LiteralParser.parse("'''multi\nline'''"));
        assertEquals("\\q", LiteralParser.parse("'\\q'"));
    }

    @Test
    void parsesBytes() {
        assertEquals(Bytes.of(0x00, 'a', 0xff), LiteralParser.parse("b'\\x00a\\xff'"));
        assertEquals(Bytes.of('\\', 'x'), LiteralParser.parse("rb'\\x'"));
    }

    @Test
    void parsesContainers() {
        Map<Object, Object> dict = new LinkedHashMap<>();
        dict.put("k", Arrays.asList(1L, 2L));
        dict.put(Tuple.of(1L, 2L), null);

        assertEquals(Arrays.asList(1L, "x", null), LiteralParser.parse("[1, 'x', None,]"));
        assertEquals(Tuple.of(), LiteralParser.parse("()"));
        assertEquals(Tuple.of(1L), LiteralParser.parse("(1,)"));
        assertEquals(1L, LiteralParser.parse("(1)"));
        assertEquals(new LinkedHashSet<>(List.of(1L, 2L)), LiteralParser.parse("{1, 2}"));
        assertEquals(new LinkedHashSet<>(), LiteralParser.parse("set()"));
        assertEquals(new LinkedHashMap<>(), LiteralParser.parse("{}"));
        assertEquals(dict, LiteralParser.parse("{'k': [1, 2], (1, 2): None}"));
    }

    @Test
    void rejectsNonLiterals() {
        assertThrows(FormatException.class, () -> LiteralParser.parse(""));
        assertThrows(FormatException.class, () -> LiteralParser.parse("__import__('os')"));
        assertThrows(FormatException.class, () -> LiteralParser.parse("1 + 2"));
        assertThrows(FormatException.class, () -> LiteralParser.parse("[1, 2"));
        assertThrows(FormatException.class, () -> LiteralParser.parse("'open"));
        assertThrows(FormatException.class, () -> LiteralParser.parse("{[1]: 2}"));
        assertThrows(FormatException.class, () -> LiteralParser.parse("--1"));
        assertThrows(FormatException.class, () -> LiteralParser.parse("'\\UFFFFFFFF'"));
        assertThrows(FormatException.class, () -> LiteralParser.parse("'\\U00110000'"));
    }

    @Test
    void limitsNesting() {
        var deep = "[".repeat(LiteralParser.MAX_DEPTH + 2) + "]".repeat(LiteralParser.MAX_DEPTH + 2);

        assertThrows(FormatException.class, () -> LiteralParser.parse(deep));
    }
}
