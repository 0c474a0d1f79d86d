package org.declref.compiler.resolver;

/**
 * Describes why a reference could not be resolved. This is a value, not an exception:
 * callers usually route it to a diagnostics sink and move on to the next reference.
 *
 * @param kind   The failure category.
 * @param reason Human-readable explanation naming the offending package, member or selector.
 */
public record ResolverFailure(FailureKind kind, String reason) {

    @Override
    public String toString() {
        return kind + ": " + reason;
    }
}
