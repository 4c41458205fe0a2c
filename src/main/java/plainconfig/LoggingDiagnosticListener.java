package plainconfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDiagnosticListener implements DiagnosticListener {

    private static final Logger LOGGER = LoggerFactory.getLogger("plainconfig");

    private final String source;

    public LoggingDiagnosticListener() {
        this(null);
    }

    public LoggingDiagnosticListener(String source) {
        this.source = source == null ? "<input>" : source;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        if (diagnostic.getSeverity() == Diagnostic.Severity.ERROR) {
            LOGGER.error("In {} line {}: {}", source, diagnostic.getLineNumber(), diagnostic.getMessage());
        } else {
            LOGGER.warn("In {} line {}: {}", source, diagnostic.getLineNumber(), diagnostic.getMessage());
        }
    }
}
