package org.declref.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.LoggingEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    private final LogLevelHighlightConverter converter = new LogLevelHighlightConverter();

    private String render(Level level) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(level);
        return converter.transform(event, "LEVEL");
    }

    @Test
    void colorsByLevel() {
        assertThat(render(Level.ERROR)).isEqualTo(LogLevelHighlightConverter.ANSI_RED + "LEVEL"
                + LogLevelHighlightConverter.ANSI_RESET);
        assertThat(render(Level.WARN)).startsWith(LogLevelHighlightConverter.ANSI_YELLOW);
        assertThat(render(Level.INFO)).startsWith(LogLevelHighlightConverter.ANSI_BLUE);
        assertThat(render(Level.DEBUG)).startsWith(LogLevelHighlightConverter.ANSI_GREY);
        assertThat(render(Level.TRACE)).isEqualTo("LEVEL");
    }
}
