package org.declref.compiler.reference;

/**
 * Disambiguation tag attached to a member reference.
 *
 * @param family The selector family.
 * @param text   The raw selector text without the leading colon.
 */
public record Selector(SelectorFamily family, String text) {

    public static Selector system(String text) {
        return new Selector(SelectorFamily.SYSTEM, text);
    }

    @Override
    public String toString() {
        return ":" + text;
    }
}
