package org.declref.compiler.semantics;

/**
 * The resolvable unit bound to an exported name.
 * Callers dispatch on {@link #kind()} and narrow to the matching variant.
 */
public sealed interface Entity permits LocalEntity, ImportedEntity {

    /**
     * @return The module and export name this entity is bound to.
     */
    SymbolId id();

    EntityKind kind();

    /**
     * @return The export name.
     */
    default String localName() {
        return id().name();
    }
}
