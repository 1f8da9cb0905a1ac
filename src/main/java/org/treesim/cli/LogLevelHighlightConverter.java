package org.treesim.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level column of the {@code STDOUT} appender.
 * ERROR is red, WARN yellow, DEBUG and TRACE are dimmed, INFO stays plain.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        Level level = event.getLevel();
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_DIM + in + ANSI_RESET;
            default -> in;
        };
    }
}
