package org.kernform.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void configure_withPlainFormat_shouldSetPlainFormat() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("STDOUT_PLAIN", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals(Level.INFO, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withDetailedFormat_shouldSetDetailedFormat() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "DETAILED"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_DETAILED", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT_DETAILED", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withSpecificLevels_shouldApplyThem() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels {
                "org.kernform.validator.ContractValidator" = "DEBUG"
                "org.kernform.validator.binding" = "LOUD"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.WARN, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context().getLogger("org.kernform.validator.ContractValidator").getLevel());
        assertNull(context().getLogger("org.kernform.validator.binding").getLevel(), "unknown levels are ignored");
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"ERROR\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"TRACE\" }"));

        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"TRACE\" }"));

        assertEquals(Level.TRACE, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
