package plainconfig;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the line format:
 * <pre>
 * # build settings
 * name=demo
 * port/i=42
 * ratio/f=0.75
 * enabled/r=True
 * tags/r=['a', 'b']
 * blob/32=AAA76===
 * </pre>
 * Instances hold no state between calls.
 */
public class PlainConfig implements PlainConfigService {

    private final PlainConfigOptions options;
    private final DiagnosticListener diagnostics;
    private final ValueCodec codec;

    public PlainConfig() {
        this(PlainConfigOptions.defaults());
    }

    public PlainConfig(PlainConfigOptions options) {
        this(options, null);
    }

    public PlainConfig(PlainConfigOptions options, DiagnosticListener diagnostics) {
        this.options = options == null ? PlainConfigOptions.defaults() : options;
        this.diagnostics = diagnostics == null ? new LoggingDiagnosticListener() : diagnostics;
        this.codec = new ValueCodec(this.options.isSafe(), this.options.getOpaqueSerializer());
    }

    public PlainConfigOptions getOptions() {
        return options;
    }

    @Override
    public ConfigSnapshot read(LineSource source) throws IOException {
        return new LineParser(codec, diagnostics).parse(source);
    }

    @Override
    public void write(Map<String, ?> data, List<StructureEntry> structure, LineSink sink) throws IOException {
        for (String chunk : newWriter().dump(data, structure, diagnostics)) {
            sink.write(chunk);
        }
    }

    @Override
    public void validate(Map<String, ?> data) {
        newWriter().encodeAll(data);
    }

    private StructureWriter newWriter() {
        LineRenderer renderer = new LineRenderer(options.getMaxWidth(), options.getContinuationChars());
        return new StructureWriter(codec, renderer, options.isRewriteOld(), options.getLineSeparator());
    }
}
