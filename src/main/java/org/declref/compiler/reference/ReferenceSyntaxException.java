package org.declref.compiler.reference;

/**
 * Thrown when reference text cannot be parsed.
 */
public class ReferenceSyntaxException extends RuntimeException {

    private final String text;
    private final int column;

    public ReferenceSyntaxException(String message, String text, int column) {
        super(message + " at column " + (column + 1) + " in '" + text + "'");
        this.text = text;
        this.column = column;
    }

    /**
     * @return The text that failed to parse.
     */
    public String getText() {
        return text;
    }

    /**
     * @return The zero-based offset of the offending character.
     */
    public int getColumn() {
        return column;
    }
}
