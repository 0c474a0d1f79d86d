package org.declref.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void countsBySeverityAndFormatsLocations() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.reportWarning("deprecated", "api.md", 0);
        assertThat(diagnostics.hasErrors()).isFalse();

        diagnostics.reportError("broken link", "api.md", 7);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.count(Diagnostic.Severity.WARNING)).isEqualTo(1);
        assertThat(diagnostics.count(Diagnostic.Severity.ERROR)).isEqualTo(1);
        assertThat(diagnostics.summary())
                .contains("[WARNING] api.md: deprecated")
                .contains("[ERROR] api.md:7: broken link");
    }
}
