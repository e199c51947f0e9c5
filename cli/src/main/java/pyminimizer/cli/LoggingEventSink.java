package pyminimizer.cli;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import pyminimizer.lang.MinimizerEvent;
import pyminimizer.lang.MinimizerEventSink;

/**
 * Logs the engine's decisions for one file and tallies them for a summary. One instance per
 * file; not thread-safe.
 */
@RequiredArgsConstructor
final class LoggingEventSink implements MinimizerEventSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingEventSink.class);

    private final @NonNull Path path;
    private final Map<MinimizerEvent.Type, Integer> counts = new EnumMap<>(MinimizerEvent.Type.class);

    @Override
    public void accept(MinimizerEvent event) {
        counts.merge(event.type(), 1, Integer::sum);
        if (event.type() == MinimizerEvent.Type.TOKEN_AFTER_END_IGNORED) {
            LOGGER.warn("{}:{}: ignoring token after end of input: {}", path, event.line(), event.detail());
        } else {
            LOGGER.debug("{}:{}: {} {}", path, event.line(), event.type(), event.detail());
        }
    }

    int count(MinimizerEvent.Type type) {
        return counts.getOrDefault(type, 0);
    }

    void logSummary() {
        LOGGER.info("{}: removed {} blank lines", path,
            count(MinimizerEvent.Type.BLANK_LINE_REMOVED) + count(MinimizerEvent.Type.BLANK_LINE_COLLAPSED));
        LOGGER.info("{}: removed {} comments and {} inline comments", path,
            count(MinimizerEvent.Type.COMMENT_REMOVED), count(MinimizerEvent.Type.INLINE_COMMENT_REMOVED));
        LOGGER.info("{}: removed {} docstrings", path, count(MinimizerEvent.Type.DOCSTRING_REMOVED));
        if (count(MinimizerEvent.Type.DOCSTRING_RETAINED) > 0) {
            LOGGER.info("{}: kept {} docstrings that are the only statement of their body", path,
                count(MinimizerEvent.Type.DOCSTRING_RETAINED));
        }
    }
}
