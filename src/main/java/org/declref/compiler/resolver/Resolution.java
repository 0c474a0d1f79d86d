package org.declref.compiler.resolver;

import org.declref.compiler.model.DeclarationNode;

import java.util.Optional;

/**
 * Outcome of resolving a declaration reference: either the single declaration it
 * denotes or the first failure encountered.
 */
public sealed interface Resolution permits Resolution.Resolved, Resolution.Failed {

    record Resolved(DeclarationNode declaration) implements Resolution {
    }

    record Failed(ResolverFailure failure) implements Resolution {
    }

    static Resolution resolved(DeclarationNode declaration) {
        return new Resolved(declaration);
    }

    static Resolution failed(FailureKind kind, String reason) {
        return new Failed(new ResolverFailure(kind, reason));
    }

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    default Optional<DeclarationNode> findDeclaration() {
        return this instanceof Resolved resolved ? Optional.of(resolved.declaration()) : Optional.empty();
    }

    default Optional<ResolverFailure> findFailure() {
        return this instanceof Failed failed ? Optional.of(failed.failure()) : Optional.empty();
    }
}
