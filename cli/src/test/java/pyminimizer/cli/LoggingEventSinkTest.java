package pyminimizer.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;
import pyminimizer.lang.Minimizer;
import pyminimizer.lang.MinimizerEvent;
import pyminimizer.lang.MinimizerOptions;

public class LoggingEventSinkTest {

    @Test
    void counts() {
        var sink = new LoggingEventSink(Path.of("a.py"));
        new Minimizer(MinimizerOptions.defaults(), sink).minimize("'''doc'''\n# c\nx = 1  # d\n\n\ny = 2\n");

        assertEquals(1, sink.count(MinimizerEvent.Type.DOCSTRING_REMOVED));
        assertEquals(1, sink.count(MinimizerEvent.Type.COMMENT_REMOVED));
        assertEquals(1, sink.count(MinimizerEvent.Type.INLINE_COMMENT_REMOVED));
        assertEquals(2, sink.count(MinimizerEvent.Type.BLANK_LINE_REMOVED));
        assertEquals(0, sink.count(MinimizerEvent.Type.TOKEN_AFTER_END_IGNORED));
        sink.logSummary();
    }

    @Test
    void verbosity() {
        assertEquals(Level.WARN, LoggingConfigurator.levelFor(0));
        assertEquals(Level.INFO, LoggingConfigurator.levelFor(1));
        assertEquals(Level.DEBUG, LoggingConfigurator.levelFor(2));
        assertEquals(Level.DEBUG, LoggingConfigurator.levelFor(5));
    }
}
