package org.declref.compiler.model;

import java.util.Optional;

/**
 * The syntactic kind of a declaration. Each kind carries the system selector tag
 * that picks it out of a set of merged or overloaded declarations.
 */
public enum DeclarationKind {
    CLASS("class"),
    INTERFACE("interface"),
    ENUM("enum"),
    FUNCTION("function"),
    VARIABLE("variable"),
    TYPE_ALIAS("type"),
    NAMESPACE("namespace");

    private final String selectorTag;

    DeclarationKind(String selectorTag) {
        this.selectorTag = selectorTag;
    }

    /**
     * @return The lower-case selector tag, e.g. {@code class} or {@code type}.
     */
    public String selectorTag() {
        return selectorTag;
    }

    /**
     * Maps a selector tag to its declaration kind. Matching is case-sensitive.
     *
     * @param tag The raw selector text.
     * @return The matching kind, or empty if the tag is not recognized.
     */
    public static Optional<DeclarationKind> fromSelectorTag(String tag) {
        for (DeclarationKind kind : values()) {
            if (kind.selectorTag.equals(tag)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
