package org.declref.compiler.semantics;

/**
 * Tag distinguishing the two {@link Entity} variants.
 */
public enum EntityKind {
    /** Declared in the exporting module; expands to declaration nodes. */
    LOCAL,
    /** Re-exported from elsewhere; never expanded during resolution. */
    IMPORTED
}
