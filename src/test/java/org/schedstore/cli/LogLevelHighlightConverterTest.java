package org.schedstore.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.LoggingEvent;

@Tag("unit")
class LogLevelHighlightConverterTest {

    private final LogLevelHighlightConverter converter = new LogLevelHighlightConverter();

    private String render(Level level) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(level);
        return converter.transform(event, level.toString());
    }

    @Test
    void colorsErrorWarnAndInfo() {
        assertThat(render(Level.ERROR)).isEqualTo("\u001B[31mERROR\u001B[0m");
        assertThat(render(Level.WARN)).isEqualTo("\u001B[33mWARN\u001B[0m");
        assertThat(render(Level.INFO)).isEqualTo("\u001B[34mINFO\u001B[0m");
    }

    @Test
    void leavesDebugAndTraceUncolored() {
        assertThat(render(Level.DEBUG)).isEqualTo("DEBUG");
        assertThat(render(Level.TRACE)).isEqualTo("TRACE");
    }
}
