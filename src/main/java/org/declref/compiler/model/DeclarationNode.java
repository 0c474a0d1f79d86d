package org.declref.compiler.model;

import org.declref.compiler.semantics.SymbolId;

import java.util.List;

/**
 * One syntactic declaration. Nodes are immutable and link to their parent and children
 * through {@link DeclarationId} handles rather than object references; use the owning
 * {@link DeclarationGraph} to follow those links.
 *
 * @param id       The handle of this node.
 * @param name     The declared identifier.
 * @param kind     The syntactic kind, fixed at creation.
 * @param entity   The export whose declaration tree contains this node.
 * @param parent   The enclosing declaration, or {@code null} for an export's root declaration.
 * @param children The nested declarations in declaration order.
 */
public record DeclarationNode(
        DeclarationId id,
        String name,
        DeclarationKind kind,
        SymbolId entity,
        DeclarationId parent,
        List<DeclarationId> children
) {

    public DeclarationNode {
        children = List.copyOf(children);
    }

    /**
     * @return True if this node is the root declaration of an export.
     */
    public boolean isRoot() {
        return parent == null;
    }
}
