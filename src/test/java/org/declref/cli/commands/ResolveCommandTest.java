package org.declref.cli.commands;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.declref.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the resolve command.
 */
@Tag("unit")
public class ResolveCommandTest {

    private String modelPath;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cmdLine;

    @BeforeEach
    void setUp() throws Exception {
        modelPath = new File(getClass().getResource("/models/widgets.conf").toURI()).getAbsolutePath();
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void testCommandIsRegistered() {
        assertThat(cmdLine.getSubcommands()).containsKeys("resolve", "check");
    }

    @Test
    void testHelpOutput() {
        cmdLine.execute("resolve", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("resolve").contains("--model").contains("--json");
    }

    @Test
    void testResolvesAllReferences() {
        int exitCode = cmdLine.execute("resolve", "-m", modelPath, "Button.onClick", "Shape:class");

        assertThat(exitCode)
            .describedAs("stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString())
            .contains("Button.onClick -> FUNCTION Button.onClick")
            .contains("Shape:class -> CLASS Shape");
    }

    @Test
    void testFailureReturnsNonZeroAndNamesKind() {
        int exitCode = cmdLine.execute("resolve", "-m", modelPath, "Button.onClick", "Shape", "Legacy");

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_UNRESOLVED);
        assertThat(out.toString())
            .contains("Button.onClick -> FUNCTION")
            .contains("Shape !! AMBIGUOUS_REFERENCE")
            .contains("Legacy !! UNSUPPORTED_REEXPORT");
    }

    @Test
    void testSyntaxErrorIsReportedPerReference() {
        int exitCode = cmdLine.execute("resolve", "-m", modelPath, "Button..label", "Widget.render");

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_UNRESOLVED);
        assertThat(out.toString())
            .contains("Button..label !! SYNTAX_ERROR")
            .contains("Widget.render -> FUNCTION Widget.render");
    }

    @Test
    void testJsonOutput() {
        int exitCode = cmdLine.execute("resolve", "-m", modelPath, "--json", "Layout.Grid.cells", "Shape:enum");

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_UNRESOLVED);
        JsonArray results = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(results.size()).isEqualTo(2);

        JsonObject cells = results.get(0).getAsJsonObject();
        assertThat(cells.get("resolved").getAsBoolean()).isTrue();
        assertThat(cells.get("kind").getAsString()).isEqualTo("VARIABLE");
        assertThat(cells.get("path").getAsString()).isEqualTo("Layout.Grid.cells");
        assertThat(cells.get("module").getAsString()).isEqualTo("index");

        JsonObject shape = results.get(1).getAsJsonObject();
        assertThat(shape.get("resolved").getAsBoolean()).isFalse();
        assertThat(shape.get("failure").getAsString()).isEqualTo("NO_DECLARATION_FOR_SELECTOR");
        assertThat(shape.get("reason").getAsString()).contains("\"enum\"");
    }

    @Test
    void testMissingModelFile() {
        int exitCode = cmdLine.execute("resolve", "-m", "/nonexistent/model.conf", "Button");

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_BAD_INPUT);
        assertThat(err.toString()).contains("not found");
    }

    @Test
    void testMissingRequiredOptions() {
        int exitCode = cmdLine.execute("resolve", "Button");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--model");
    }
}
