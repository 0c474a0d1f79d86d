package org.declref.compiler.check;

import com.typesafe.config.Config;
import org.declref.compiler.diagnostics.Diagnostic;
import org.declref.compiler.diagnostics.DiagnosticsEngine;
import org.declref.compiler.reference.DeclarationReference;
import org.declref.compiler.reference.ReferenceParser;
import org.declref.compiler.reference.ReferenceSyntaxException;
import org.declref.compiler.resolver.ReferenceResolver;
import org.declref.compiler.resolver.Resolution;
import org.declref.compiler.resolver.ResolverFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a batch of references and routes every failure to a {@link DiagnosticsEngine}.
 * A failing reference never stops the batch.
 */
public class ReferenceChecker {

    private static final Logger log = LoggerFactory.getLogger(ReferenceChecker.class);

    static final String SEVERITY_PATH = "declref.check.unresolved-severity";

    private final ReferenceResolver resolver;
    private final DiagnosticsEngine diagnostics;
    private final Diagnostic.Severity unresolvedSeverity;

    public ReferenceChecker(ReferenceResolver resolver, DiagnosticsEngine diagnostics,
                            Diagnostic.Severity unresolvedSeverity) {
        this.resolver = resolver;
        this.diagnostics = diagnostics;
        this.unresolvedSeverity = unresolvedSeverity;
    }

    /**
     * Creates a checker whose severity for unresolved references comes from
     * {@code declref.check.unresolved-severity}.
     */
    public static ReferenceChecker fromConfig(ReferenceResolver resolver, DiagnosticsEngine diagnostics,
                                              Config config) {
        Diagnostic.Severity severity = config.hasPath(SEVERITY_PATH)
                ? config.getEnum(Diagnostic.Severity.class, SEVERITY_PATH)
                : Diagnostic.Severity.ERROR;
        return new ReferenceChecker(resolver, diagnostics, severity);
    }

    public CheckReport check(List<ReferenceSite> sites) {
        List<CheckReport.Outcome> outcomes = new ArrayList<>(sites.size());
        for (ReferenceSite site : sites) {
            outcomes.add(checkOne(site));
        }
        CheckReport report = new CheckReport(outcomes);
        log.info("Checked {} references: {} resolved, {} failed",
                outcomes.size(), report.resolvedCount(), report.failedCount());
        return report;
    }

    private CheckReport.Outcome checkOne(ReferenceSite site) {
        DeclarationReference reference;
        try {
            reference = ReferenceParser.parse(site.text());
        } catch (ReferenceSyntaxException e) {
            log.debug("Skipping malformed reference at {}:{}: {}", site.sourceName(), site.line(), e.getMessage());
            diagnostics.reportError("Malformed declaration reference: " + e.getMessage(), site.sourceName(), site.line());
            return new CheckReport.Outcome(site, null, e.getMessage());
        }

        Resolution resolution = resolver.resolve(reference);
        if (resolution instanceof Resolution.Failed failed) {
            ResolverFailure failure = failed.failure();
            log.debug("Unresolved reference '{}' at {}:{} ({})", site.text(), site.sourceName(), site.line(),
                    failure.kind());
            diagnostics.report(unresolvedSeverity,
                    "Unable to resolve reference \"" + site.text() + "\": " + failure.reason(),
                    site.sourceName(), site.line());
        }
        return new CheckReport.Outcome(site, resolution, null);
    }

    /**
     * Reads one reference per line. Blank lines and lines starting with {@code //} are skipped.
     *
     * @throws IOException if the file cannot be read.
     */
    public static List<ReferenceSite> readSites(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<ReferenceSite> sites = new ArrayList<>();
        String sourceName = file.getFileName().toString();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("//")) {
                continue;
            }
            sites.add(new ReferenceSite(line, sourceName, i + 1));
        }
        return sites;
    }
}
