package org.declref.compiler.check;

/**
 * A reference as it appears in some input, with its location.
 *
 * @param text       The reference text.
 * @param sourceName The file or document that contains the reference.
 * @param line       The one-based line number, or 0 if unknown.
 */
public record ReferenceSite(String text, String sourceName, int line) {
}
