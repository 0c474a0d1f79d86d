package org.declref.compiler.model;

/**
 * Stable handle of a declaration node inside a {@link DeclarationGraph}.
 *
 * @param index The position of the node in the graph's arena.
 */
public record DeclarationId(int index) {

    @Override
    public String toString() {
        return "#" + index;
    }
}
