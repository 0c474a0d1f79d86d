package org.declref.compiler.semantics;

/**
 * Identifies a module of the analyzed package by its entry path, e.g. {@code src/index}.
 * Used as a map key in the symbol table.
 *
 * @param path The normalized module path that uniquely identifies a module.
 */
public record ModuleId(String path) {

    @Override
    public String toString() {
        return path;
    }
}
