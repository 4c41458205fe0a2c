package plainconfig;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of the read and write paths.
 * <p>
 * {@link #load()} resolves every option from, highest first:
 * <ol>
 *   <li>system properties ({@code -Dplainconfig.maxWidth=100})</li>
 *   <li>{@code plain-config.properties} on the classpath</li>
 *   <li>built-in defaults</li>
 * </ol>
 * <pre>
 * # plain-config.properties
 * plainconfig.maxWidth=100
 * plainconfig.continuationChars=\\|;
 * plainconfig.rewriteOld=false
 * plainconfig.safe=true
 * plainconfig.lineSeparator=LF
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class PlainConfigOptions {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlainConfigOptions.class);

    public static final String PROPERTIES_FILE = "plain-config.properties";
    public static final String DEFAULT_CONTINUATION_CHARS = "\\|⤸;↓↘→⟶⇒⇨⇩▼▽◢◣⤵║│┃┆┇┊┋∣⎟⎢⎥";
    public static final int DEFAULT_MAX_WIDTH = 72;

    public static final String PROP_MAX_WIDTH = "plainconfig.maxWidth";
    public static final String PROP_CONTINUATION_CHARS = "plainconfig.continuationChars";
    public static final String PROP_REWRITE_OLD = "plainconfig.rewriteOld";
    public static final String PROP_SAFE = "plainconfig.safe";
    public static final String PROP_LINE_SEPARATOR = "plainconfig.lineSeparator";

    @Builder.Default
    int maxWidth = DEFAULT_MAX_WIDTH;

    @Builder.Default
    String continuationChars = DEFAULT_CONTINUATION_CHARS;

    @Builder.Default
    boolean rewriteOld = false;

    @Builder.Default
    boolean safe = true;

    @Builder.Default
    String lineSeparator = "\n";

    OpaqueSerializer opaqueSerializer;

    public static PlainConfigOptions defaults() {
        return builder().build();
    }

    public static PlainConfigOptions load() {
        Properties merged = new Properties();
        merged.putAll(loadPropertiesFile());
        for (String name : new String[]{PROP_MAX_WIDTH, PROP_CONTINUATION_CHARS, PROP_REWRITE_OLD,
                PROP_SAFE, PROP_LINE_SEPARATOR}) {
            String value = System.getProperty(name);
            if (value != null) {
                merged.setProperty(name, value);
            }
        }
        return fromProperties(merged);
    }

    public static PlainConfigOptions fromProperties(Properties properties) {
        PlainConfigOptionsBuilder builder = builder();
        if (properties == null) {
            return builder.build();
        }
        String maxWidth = properties.getProperty(PROP_MAX_WIDTH);
        if (StringUtils.isNotBlank(maxWidth)) {
            try {
                builder.maxWidth(Math.max(0, Integer.parseInt(maxWidth.trim())));
            } catch (NumberFormatException ex) {
                LOGGER.warn("Ignoring {}={}: not a number", PROP_MAX_WIDTH, maxWidth);
            }
        }
        String chars = properties.getProperty(PROP_CONTINUATION_CHARS);
        if (StringUtils.isNotEmpty(chars)) {
            builder.continuationChars(chars);
        }
        String rewriteOld = properties.getProperty(PROP_REWRITE_OLD);
        if (StringUtils.isNotBlank(rewriteOld)) {
            builder.rewriteOld(Boolean.parseBoolean(rewriteOld.trim()));
        }
        String safe = properties.getProperty(PROP_SAFE);
        if (StringUtils.isNotBlank(safe)) {
            builder.safe(Boolean.parseBoolean(safe.trim()));
        }
        String separator = properties.getProperty(PROP_LINE_SEPARATOR);
        if (StringUtils.isNotBlank(separator)) {
            String resolved = lineSeparatorFromToken(separator.trim());
            if (resolved == null) {
                LOGGER.warn("Ignoring {}={}: expected LF, CRLF or CR", PROP_LINE_SEPARATOR, separator);
            } else {
                builder.lineSeparator(resolved);
            }
        }
        return builder.build();
    }

    static String lineSeparatorFromToken(String token) {
        switch (token.toUpperCase()) {
            case "LF":
                return "\n";
            case "CRLF":
                return "\r\n";
            case "CR":
                return "\r";
            default:
                return null;
        }
    }

    private static Properties loadPropertiesFile() {
        Properties props = new Properties();
        try (InputStream is = PlainConfigOptions.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException ex) {
            LOGGER.warn("Cannot read {} from the classpath", PROPERTIES_FILE, ex);
        }
        return props;
    }
}
