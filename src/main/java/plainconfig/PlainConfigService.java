package plainconfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

public interface PlainConfigService {

    ConfigSnapshot read(LineSource source) throws IOException;

    void write(Map<String, ?> data, List<StructureEntry> structure, LineSink sink) throws IOException;

    void validate(Map<String, ?> data);

    default ConfigSnapshot flatToMap(String data) {
        try {
            return read(LineSource.fromString(data));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    default String flatToString(Map<String, ?> data, List<StructureEntry> structure) {
        StringBuilder out = new StringBuilder();
        try {
            write(data, structure, LineSink.of(out));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return out.toString();
    }
}
