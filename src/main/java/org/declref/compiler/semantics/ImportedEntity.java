package org.declref.compiler.semantics;

/**
 * An exported name that re-exports a declaration from another module or package.
 *
 * @param id     The export identity.
 * @param target Opaque description of the re-export source, e.g. {@code other-pkg#Legacy}.
 */
public record ImportedEntity(SymbolId id, String target) implements Entity {

    @Override
    public EntityKind kind() {
        return EntityKind.IMPORTED;
    }
}
