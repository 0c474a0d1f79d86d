package org.declref.compiler.reference;

/**
 * One step of a dotted declaration path.
 *
 * <p>A well-formed member carries either a plain {@code identifier} or a {@code symbolKey}
 * (an ECMAScript symbol such as {@code Symbol.iterator}). Both may be absent when the
 * producer could not recover a name; the resolver reports that case.</p>
 *
 * @param identifier The plain member name, or {@code null}.
 * @param symbolKey  The symbol-keyed member name, or {@code null}.
 * @param selector   The disambiguation selector, or {@code null}.
 */
public record MemberReference(String identifier, String symbolKey, Selector selector) {

    public static MemberReference named(String identifier) {
        return new MemberReference(identifier, null, null);
    }

    public static MemberReference named(String identifier, Selector selector) {
        return new MemberReference(identifier, null, selector);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (symbolKey != null) {
            sb.append('[').append(symbolKey).append(']');
        } else if (identifier != null) {
            sb.append(identifier);
        }
        if (selector != null) {
            sb.append(selector);
        }
        return sb.toString();
    }
}
