package plainconfig;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiteralsTest {

    @Test
    void formatsFloatsLikeRepr() {
        assertEquals("0.1", Literals.formatFloat(0.1));
        assertEquals("1.0", Literals.formatFloat(1.0));
        assertEquals("-2.5", Literals.formatFloat(-2.5));
        assertEquals("0.0001", Literals.formatFloat(1e-4));
        assertEquals("1e-05", Literals.formatFloat(1e-5));
        assertEquals("1.5e-05", Literals.formatFloat(1.5e-5));
        assertEquals("1000000000000000.0", Literals.formatFloat(1e15));
        assertEquals("1e+16", Literals.formatFloat(1e16));
        assertEquals("-0.0", Literals.formatFloat(-0.0));
        assertEquals("inf", Literals.formatFloat(Double.POSITIVE_INFINITY));
        assertEquals("nan", Literals.formatFloat(Double.NaN));
    }

    @Test
    void quotesStrings() {
        assertEquals("'plain'", Literals.repr("plain"));
        assertEquals("\"it's\"", Literals.repr("it's"));
        assertEquals("'both \\' and \"'", Literals.repr("both ' and \""));
        assertEquals("'back\\\\slash'", Literals.repr("back\\slash"));
        assertEquals("'\\x00\\x7f\\x85'", Literals.repr("\u0000\u007f\u0085"));
        assertEquals("'café \\u200b'", Literals.repr("café \u200b"));
    }

    @Test
    void writesContainers() {
        assertEquals("b'\\x00A'", Literals.repr(Bytes.of(0, 'A')));
        assertEquals("()", Literals.repr(Tuple.of()));
        assertEquals("(1,)", Literals.repr(Tuple.of(1)));
        assertEquals("(1, 2)", Literals.repr(Tuple.of(1, 2L)));
        assertEquals("[]", Literals.repr(Collections.emptyList()));
        assertEquals("{1, 2}", Literals.repr(new LinkedHashSet<>(List.of(1, 2))));
        assertEquals("{'a': None}", Literals.repr(Collections.singletonMap("a", null)));
        assertEquals("12345678901234567890", Literals.repr(new BigInteger("12345678901234567890")));
    }

    @Test
    void decidesSafety() {
        assertTrue(Literals.isSafe(Arrays.asList(1, "a", Tuple.of(Bytes.of(1)), Map.of("k", List.of()))));
        assertTrue(Literals.isSafe(Map.of(Tuple.of(1, 2), "pair")));
        assertFalse(Literals.isSafe(Map.of(List.of(1), "list key")));
        assertFalse(Literals.isSafe(Collections.singleton(Collections.emptySet())));
        assertFalse(Literals.isSafe(new Object()));
        assertFalse(Literals.isSafe(Tuple.of(new StringBuilder("ok"), new Object())));
    }

    @Test
    void refusesToWriteNonLiterals() {
        assertThrows(UnsafeValueException.class, () -> Literals.repr(new Object()));
    }

    @Test
    void reprReadsBack() {
        var value = Arrays.asList("x\ny", Tuple.of(1L, 0.25), Bytes.of(255), null, false);

        assertEquals(value, LiteralParser.parse(Literals.repr(value)));
    }
}
