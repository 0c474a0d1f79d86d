package org.declref.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level column of console output:
 * errors red, warnings yellow, info blue, debug grey. Trace stays uncolored.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_GREY = "\u001B[90m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        Level level = event.getLevel();
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            case Level.INFO_INT -> ANSI_BLUE + in + ANSI_RESET;
            case Level.DEBUG_INT -> ANSI_GREY + in + ANSI_RESET;
            default -> in;
        };
    }
}
