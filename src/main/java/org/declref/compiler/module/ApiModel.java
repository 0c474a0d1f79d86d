package org.declref.compiler.module;

import org.declref.compiler.model.DeclarationGraph;
import org.declref.compiler.resolver.ReferenceResolver;
import org.declref.compiler.semantics.SymbolTable;
import org.declref.compiler.semantics.WorkingPackage;

/**
 * The exported surface of an analyzed package.
 *
 * @param workingPackage The package identity and entry module.
 * @param symbolTable    The per-module export index.
 * @param graph          The declaration arena.
 */
public record ApiModel(WorkingPackage workingPackage, SymbolTable symbolTable, DeclarationGraph graph) {

    /**
     * Creates a resolver over this model.
     */
    public ReferenceResolver newResolver() {
        return new ReferenceResolver(symbolTable, graph, workingPackage);
    }
}
