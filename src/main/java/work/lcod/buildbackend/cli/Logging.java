package work.lcod.buildbackend.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.api.LogLevel;

/**
 * Adjusts the Logback root level configured by {@code logback.xml}.
 */
final class Logging {
    private Logging() {}

    static void configure(LogLevel level) {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger logback) {
            logback.setLevel(Level.toLevel(level.name(), Level.INFO));
        }
    }
}
