package plainconfig;

@FunctionalInterface
public interface DiagnosticListener {

    void report(Diagnostic diagnostic);
}
