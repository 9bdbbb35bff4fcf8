package io.github.simbo1905.styler.rules;

import org.junit.jupiter.api.BeforeAll;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Base class for rule tests that configures logging.
///
/// Reads the level from the `java.util.logging.ConsoleHandler.level` system property.
abstract class RulesLoggingConfig {

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

        Logger.getLogger("io.github.simbo1905.styler.rules").setLevel(level);
    }
}
