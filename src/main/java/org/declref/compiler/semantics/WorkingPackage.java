package org.declref.compiler.semantics;

/**
 * The package under analysis.
 *
 * @param name        The package name as it appears in qualified references, e.g. {@code widgets}.
 * @param entryModule The module whose exports form the package's public surface.
 */
public record WorkingPackage(String name, ModuleId entryModule) {
}
