package org.declref.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.declref.cli.CommandLineInterface;
import org.declref.compiler.check.CheckReport;
import org.declref.compiler.check.ReferenceChecker;
import org.declref.compiler.check.ReferenceSite;
import org.declref.compiler.diagnostics.Diagnostic;
import org.declref.compiler.diagnostics.DiagnosticsEngine;
import org.declref.compiler.module.ApiModel;
import org.declref.compiler.module.ApiModelLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command checking every reference listed in a file and reporting diagnostics.
 * <p>
 * Exit code 1 if any error diagnostic was reported; unresolved references count as
 * errors unless {@code declref.check.unresolved-severity} is {@code WARNING}.
 */
@Command(
    name = "check",
    mixinStandardHelpOptions = true,
    description = "Check a file of declaration references against an API model"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Option(
        names = {"-m", "--model"},
        required = true,
        description = "HOCON file describing the package's exports"
    )
    private File modelFile;

    @Option(
        names = {"-r", "--refs"},
        required = true,
        description = "File with one reference per line (// starts a comment line)"
    )
    private File refsFile;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            ApiModel model = ApiModelLoader.load(modelFile);
            List<ReferenceSite> sites = ReferenceChecker.readSites(refsFile.toPath());

            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            ReferenceChecker checker = ReferenceChecker.fromConfig(model.newResolver(), diagnostics, config);
            CheckReport report = checker.check(sites);

            out.print(diagnostics.summary());
            out.printf("=== Summary ===%n");
            out.printf("References: %d resolved, %d failed%n", report.resolvedCount(), report.failedCount());
            out.printf("Diagnostics: %d errors, %d warnings%n",
                    diagnostics.count(Diagnostic.Severity.ERROR), diagnostics.count(Diagnostic.Severity.WARNING));
            out.flush();
            return diagnostics.hasErrors() ? 1 : 0;

        } catch (IOException e) {
            log.error("Cannot read references file {}: {}", refsFile, e.getMessage());
            err.println("Error: cannot read " + refsFile + ": " + e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            log.error("Check failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }
}
