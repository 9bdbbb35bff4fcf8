package io.github.simbo1905.styler;

import org.junit.jupiter.api.BeforeAll;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Base class for styler tests that configures logging.
///
/// Extend this class to configure JUL logging from the
/// `java.util.logging.ConsoleHandler.level` system property.
abstract class StylerLoggingConfig {

    @BeforeAll
    static void configureLogging() {
        final var levelStr = System.getProperty("java.util.logging.ConsoleHandler.level", "INFO");
        final var level = Level.parse(levelStr);

        final var rootLogger = Logger.getLogger("");
        rootLogger.setLevel(level);

        for (final var handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }

        Logger.getLogger("io.github.simbo1905.styler").setLevel(level);
    }
}
