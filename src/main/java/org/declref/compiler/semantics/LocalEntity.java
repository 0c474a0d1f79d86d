package org.declref.compiler.semantics;

import org.declref.compiler.model.DeclarationId;

import java.util.List;

/**
 * An exported name declared in its own module. Overloaded functions and merged
 * declarations (e.g. an interface and a class sharing a name) contribute one
 * declaration each, in source order.
 *
 * @param id           The export identity.
 * @param declarations Handles of the root declarations; never empty.
 */
public record LocalEntity(SymbolId id, List<DeclarationId> declarations) implements Entity {

    public LocalEntity {
        if (declarations == null || declarations.isEmpty()) {
            throw new IllegalArgumentException("Local entity '" + id + "' must own at least one declaration");
        }
        declarations = List.copyOf(declarations);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.LOCAL;
    }
}
