package plainconfig;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlainConfigOptionsTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(PlainConfigOptions.PROP_MAX_WIDTH);
        System.clearProperty(PlainConfigOptions.PROP_SAFE);
    }

    @Test
    void hasDefaults() {
        var options = PlainConfigOptions.defaults();

        assertEquals(72, options.getMaxWidth());
        assertEquals(PlainConfigOptions.DEFAULT_CONTINUATION_CHARS, options.getContinuationChars());
        assertFalse(options.isRewriteOld());
        assertTrue(options.isSafe());
        assertEquals("\n", options.getLineSeparator());
        assertNull(options.getOpaqueSerializer());
    }

    @Test
    void readsProperties() {
        var props = new Properties();
        props.setProperty(PlainConfigOptions.PROP_MAX_WIDTH, "100");
        props.setProperty(PlainConfigOptions.PROP_CONTINUATION_CHARS, "|;");
        props.setProperty(PlainConfigOptions.PROP_REWRITE_OLD, "true");
        props.setProperty(PlainConfigOptions.PROP_SAFE, "false");
        props.setProperty(PlainConfigOptions.PROP_LINE_SEPARATOR, "crlf");

        var options = PlainConfigOptions.fromProperties(props);

        assertEquals(100, options.getMaxWidth());
        assertEquals("|;", options.getContinuationChars());
        assertTrue(options.isRewriteOld());
        assertFalse(options.isSafe());
        assertEquals("\r\n", options.getLineSeparator());
    }

    @Test
    void ignoresMalformedProperties() {
        var props = new Properties();
        props.setProperty(PlainConfigOptions.PROP_MAX_WIDTH, "wide");
        props.setProperty(PlainConfigOptions.PROP_LINE_SEPARATOR, "NEL");

        var options = PlainConfigOptions.fromProperties(props);

        assertEquals(PlainConfigOptions.DEFAULT_MAX_WIDTH, options.getMaxWidth());
        assertEquals("\n", options.getLineSeparator());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(PlainConfigOptions.PROP_MAX_WIDTH, "0");
        System.setProperty(PlainConfigOptions.PROP_SAFE, "false");

        var options = PlainConfigOptions.load();

        assertEquals(0, options.getMaxWidth());
        assertFalse(options.isSafe());
    }

    @Test
    void narrowWidthChangesWrapping() {
        var config = new PlainConfig(PlainConfigOptions.builder().maxWidth(12).continuationChars("|").build());

        assertEquals("k/C|=abcdef|\nghij\n", config.flatToString(Map.of("k", "abcdefghij"), null));
    }
}
