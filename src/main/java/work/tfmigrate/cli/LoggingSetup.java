package work.tfmigrate.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.api.LogLevel;

/**
 * Applies {@code --log-level} to the Logback root logger.
 */
final class LoggingSetup {
    private LoggingSetup() {}

    static void apply(LogLevel level) {
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            root.setLevel(Level.toLevel(level.name(), Level.INFO));
        }
    }
}
