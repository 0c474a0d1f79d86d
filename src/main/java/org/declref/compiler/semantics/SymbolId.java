package org.declref.compiler.semantics;

/**
 * Uniquely identifies an exported name across all modules of the analyzed package.
 *
 * @param module The module exporting the name.
 * @param name   The export name, case preserved.
 */
public record SymbolId(ModuleId module, String name) {

    @Override
    public String toString() {
        return module.path() + "::" + name;
    }
}
