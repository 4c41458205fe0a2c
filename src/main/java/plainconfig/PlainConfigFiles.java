package plainconfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PlainConfigFiles {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlainConfigFiles.class);
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final PlainConfigOptions options;
    private final DiagnosticListener diagnostics;

    public PlainConfigFiles() {
        this(PlainConfigOptions.defaults());
    }

    public PlainConfigFiles(PlainConfigOptions options) {
        this(options, null);
    }

    public PlainConfigFiles(PlainConfigOptions options, DiagnosticListener diagnostics) {
        this.options = options == null ? PlainConfigOptions.defaults() : options;
        this.diagnostics = diagnostics;
    }

    public ConfigSnapshot read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return service(path).read(LineSource.fromReader(reader));
        }
    }

    public void write(Path path, Map<String, ?> data) throws IOException {
        write(path, data, null);
    }

    public void write(Path path, Map<String, ?> data, List<StructureEntry> structure) throws IOException {
        String text = service(path).flatToString(data, structure);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            restrictPermissions(path);
            writer.write(text);
        }
    }

    private PlainConfigService service(Path path) {
        DiagnosticListener listener = diagnostics == null
                ? new LoggingDiagnosticListener(path.toString())
                : diagnostics;
        return new PlainConfig(options, listener);
    }

    private static void restrictPermissions(Path path) {
        try {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        } catch (UnsupportedOperationException ex) {
            LOGGER.debug("{} does not support POSIX permissions", path);
        } catch (IOException ex) {
            LOGGER.warn("Cannot restrict permissions of {}", path, ex);
        }
    }
}
