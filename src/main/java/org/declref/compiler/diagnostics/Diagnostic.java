package org.declref.compiler.diagnostics;

/**
 * A single message reported while checking references.
 *
 * @param severity   The severity.
 * @param message    The human-readable message.
 * @param sourceName The file the message refers to.
 * @param line       The one-based line number, or 0 if unknown.
 */
public record Diagnostic(Severity severity, String message, String sourceName, int line) {

    public enum Severity {
        ERROR,
        WARNING
    }

    @Override
    public String toString() {
        String location = line > 0 ? sourceName + ":" + line : sourceName;
        return "[" + severity + "] " + location + ": " + message;
    }
}
