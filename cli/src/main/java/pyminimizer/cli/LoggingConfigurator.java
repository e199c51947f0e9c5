package pyminimizer.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Maps the command line verbosity onto the logback level of the {@code pyminimizer} loggers.
 */
public final class LoggingConfigurator {

    static final String LOGGER_NAME = "pyminimizer";

    private LoggingConfigurator() {
    }

    public static void configure(int verbosity) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger logger = context.getLogger(LOGGER_NAME);
        logger.setLevel(levelFor(verbosity));
    }

    static Level levelFor(int verbosity) {
        if (verbosity <= 0) {
            return Level.WARN;
        }
        return verbosity == 1 ? Level.INFO : Level.DEBUG;
    }
}
