package de.bsommerfeld.updatecreator.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raises the log level of this application's loggers for {@code --debug} and {@code --trace}.
 */
final class LogLevels {

    static final String APPLICATION_LOGGER = "de.bsommerfeld.updatecreator";

    private LogLevels() {
    }

    static void apply(boolean debug, boolean trace) {
        if (!debug && !trace) return;
        Logger logger = LoggerFactory.getLogger(APPLICATION_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
        } else {
            logger.warn("Logging backend {} does not support changing levels", logger.getClass().getName());
        }
    }
}
