package plainconfig;

import lombok.Value;

@Value
public class Diagnostic {

    public enum Severity {
        WARNING,
        ERROR
    }

    Severity severity;
    int lineNumber;
    String key;
    String message;

    static Diagnostic warning(int lineNumber, String key, String message) {
        return new Diagnostic(Severity.WARNING, lineNumber, key, message);
    }

    static Diagnostic error(int lineNumber, String key, String message) {
        return new Diagnostic(Severity.ERROR, lineNumber, key, message);
    }
}
