package org.declref.compiler.check;

import org.declref.compiler.resolver.Resolution;
import org.declref.compiler.resolver.ResolverFailure;

import java.util.List;
import java.util.Optional;

/**
 * Result of checking a batch of references, in input order.
 *
 * @param outcomes One entry per checked site.
 */
public record CheckReport(List<Outcome> outcomes) {

    public CheckReport {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Outcome of one site. {@code resolution} is {@code null} when the text could not be parsed,
     * in which case {@code syntaxError} holds the parser message.
     */
    public record Outcome(ReferenceSite site, Resolution resolution, String syntaxError) {

        public boolean isResolved() {
            return resolution != null && resolution.isResolved();
        }

        public Optional<ResolverFailure> failure() {
            return resolution == null ? Optional.empty() : resolution.findFailure();
        }
    }

    public long resolvedCount() {
        return outcomes.stream().filter(Outcome::isResolved).count();
    }

    public long failedCount() {
        return outcomes.size() - resolvedCount();
    }
}
