package org.declref.compiler.reference;

/**
 * The syntactic family of a member selector.
 */
public enum SelectorFamily {
    /** Lower-case keyword naming a declaration kind, e.g. {@code :class}. */
    SYSTEM,
    /** Numeric overload index, e.g. {@code :2}. */
    INDEX,
    /** Upper-case label declared on the target, e.g. {@code :WITH_OPTIONS}. */
    LABEL
}
