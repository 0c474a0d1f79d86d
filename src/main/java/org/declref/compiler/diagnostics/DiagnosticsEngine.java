package org.declref.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects errors and warnings produced while checking a batch of references.
 * Reporting never aborts the batch; callers inspect {@link #hasErrors()} at the end.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportError(String message, String sourceName, int line) {
        report(Diagnostic.Severity.ERROR, message, sourceName, line);
    }

    public void reportWarning(String message, String sourceName, int line) {
        report(Diagnostic.Severity.WARNING, message, sourceName, line);
    }

    public void report(Diagnostic.Severity severity, String message, String sourceName, int line) {
        diagnostics.add(new Diagnostic(severity, message, sourceName, line));
    }

    public boolean hasErrors() {
        return count(Diagnostic.Severity.ERROR) > 0;
    }

    public long count(Diagnostic.Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Formats all diagnostics, one per line.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            sb.append(diagnostic).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
