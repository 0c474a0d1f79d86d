package org.declref.cli.commands;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.declref.cli.CommandLineInterface;
import org.declref.compiler.model.DeclarationGraph;
import org.declref.compiler.model.DeclarationNode;
import org.declref.compiler.module.ApiModel;
import org.declref.compiler.module.ApiModelException;
import org.declref.compiler.module.ApiModelLoader;
import org.declref.compiler.reference.ReferenceParser;
import org.declref.compiler.reference.ReferenceSyntaxException;
import org.declref.compiler.resolver.ReferenceResolver;
import org.declref.compiler.resolver.Resolution;
import org.declref.compiler.resolver.ResolverFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command resolving one or more references against an API model.
 * <p>
 * Exit code 0 if every reference resolves, 1 if any fails, 2 if the model cannot be loaded.
 */
@Command(
    name = "resolve",
    mixinStandardHelpOptions = true,
    description = "Resolve declaration references against an API model"
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    static final int EXIT_UNRESOLVED = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Option(
        names = {"-m", "--model"},
        required = true,
        description = "HOCON file describing the package's exports"
    )
    private File modelFile;

    @Option(
        names = {"--json"},
        description = "Print results as a JSON array"
    )
    private boolean json;

    @Parameters(
        arity = "1..*",
        paramLabel = "REFERENCE",
        description = "References such as Button.onClick or widgets#Shape:class"
    )
    private List<String> references;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ApiModel model;
        try {
            // Applies logging settings before anything logs.
            parent.getConfig();
            model = ApiModelLoader.load(modelFile);
        } catch (ApiModelException | IllegalArgumentException | com.typesafe.config.ConfigException e) {
            log.error("Resolve failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        ReferenceResolver resolver = model.newResolver();
        List<Map<String, Object>> results = new ArrayList<>();
        boolean allResolved = true;

        for (String text : references) {
            Map<String, Object> result = resolveOne(resolver, model.graph(), text);
            allResolved &= Boolean.TRUE.equals(result.get("resolved"));
            results.add(result);
            if (!json) {
                out.println(formatLine(result));
            }
        }

        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(results));
        }
        out.flush();
        return allResolved ? 0 : EXIT_UNRESOLVED;
    }

    private Map<String, Object> resolveOne(ReferenceResolver resolver, DeclarationGraph graph, String text) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("reference", text);
        Resolution resolution;
        try {
            resolution = resolver.resolve(ReferenceParser.parse(text));
        } catch (ReferenceSyntaxException e) {
            result.put("resolved", false);
            result.put("failure", "SYNTAX_ERROR");
            result.put("reason", e.getMessage());
            return result;
        }

        if (resolution instanceof Resolution.Resolved resolved) {
            DeclarationNode node = resolved.declaration();
            result.put("resolved", true);
            result.put("kind", node.kind().name());
            result.put("path", graph.qualifiedName(node));
            result.put("module", node.entity().module().path());
        } else {
            ResolverFailure failure = resolution.findFailure().orElseThrow();
            result.put("resolved", false);
            result.put("failure", failure.kind().name());
            result.put("reason", failure.reason());
        }
        return result;
    }

    private static String formatLine(Map<String, Object> result) {
        if (Boolean.TRUE.equals(result.get("resolved"))) {
            return String.format("%s -> %s %s", result.get("reference"), result.get("kind"), result.get("path"));
        }
        return String.format("%s !! %s: %s", result.get("reference"), result.get("failure"), result.get("reason"));
    }
}
