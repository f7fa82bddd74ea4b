package org.cognita.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.cognita.junit.extensions.logging.ExpectLog;
import org.cognita.junit.extensions.logging.LogLevel;
import org.cognita.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String SAMPLE = "org.cognita.sample";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void resetLevels() {
        context.getLogger(SAMPLE).setLevel(null);
        context.getLogger("org.cognita.other").setLevel(null);
    }

    @Test
    void appliesPerLoggerLevels() {
        int configured = LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging.levels { "org.cognita.sample" = "DEBUG" }
                """));

        assertThat(configured).isEqualTo(1);
        assertThat(context.getLogger(SAMPLE).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.cognita.other'")
    void skipsUnknownLevels() {
        int configured = LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging.levels { "org.cognita.sample" = "ERROR", "org.cognita.other" = "LOUD" }
                """));

        assertThat(configured).isEqualTo(1);
        assertThat(context.getLogger("org.cognita.other").getLevel()).isNull();
        assertThat(context.getLogger(SAMPLE).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void missingBlockChangesNothing() {
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Level before = root.getLevel();

        assertThat(LoggingConfigurator.configure(ConfigFactory.empty())).isZero();
        assertThat(root.getLevel()).isEqualTo(before);
    }
}
