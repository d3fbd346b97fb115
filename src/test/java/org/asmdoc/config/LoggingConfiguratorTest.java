package org.asmdoc.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.asmdoc.junit.extensions.logging.ExpectLog;
import org.asmdoc.junit.extensions.logging.LogLevel;
import org.asmdoc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class. The root logger's level and appenders are
 * restored after every test.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String SAMPLE_LOGGER = "org.asmdoc.sample";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private ch.qos.logback.classic.Logger rootLogger;
    private Level originalRootLevel;
    private final List<Appender<ILoggingEvent>> originalAppenders = new ArrayList<>();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        originalRootLevel = rootLogger.getLevel();
        Iterator<Appender<ILoggingEvent>> appenders = rootLogger.iteratorForAppenders();
        appenders.forEachRemaining(originalAppenders::add);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        rootLogger.setLevel(originalRootLevel);
        rootLogger.detachAppender(LoggingConfigurator.PLAIN_APPENDER);
        originalAppenders.forEach(appender -> {
            if (rootLogger.getAppender(appender.getName()) == null) {
                rootLogger.addAppender(appender);
            }
        });
        context.getLogger(SAMPLE_LOGGER).setLevel(null);
    }

    @Test
    void configure_withPlainFormat_shouldAttachPlainConsoleAppender() {
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
        assertEquals("STDOUT_PLAIN", context.getProperty("asmdoc.logging.format"));
        final Appender<ILoggingEvent> plainAppender = rootLogger.getAppender("STDOUT_PLAIN");
        assertNotNull(plainAppender, "STDOUT_PLAIN appender should be attached to the root logger");
        assertTrue(plainAppender instanceof ConsoleAppender, "STDOUT_PLAIN appender should be a ConsoleAppender");
        assertNull(rootLogger.getAppender("STDOUT"), "The detailed appender should be detached");
    }

    @Test
    void configure_withDetailedFormat_shouldPublishDetailedAppender() {
        // Given
        final Config config = ConfigFactory.parseString("logging.format = DETAILED");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("STDOUT", context.getProperty("asmdoc.logging.format"));
        assertNotNull(rootLogger.getAppender("STDOUT"));
        assertNull(rootLogger.getAppender("STDOUT_PLAIN"));
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.asmdoc.sample" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, rootLogger.getLevel());
        assertEquals(Level.DEBUG, context.getLogger(SAMPLE_LOGGER).getLevel());
    }

    @Test
    void configure_shouldOnlyApplyOnceUntilReset() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = WARN"));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = DEBUG"));

        // Then
        assertEquals(Level.WARN, rootLogger.getLevel());

        // And after a reset the new configuration is applied
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = DEBUG"));
        assertEquals(Level.DEBUG, rootLogger.getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level 'LOUD' for logger 'org.asmdoc.sample'")
    void configure_shouldIgnoreUnknownLevels() {
        // Given
        final Config config = ConfigFactory.parseString("logging.levels { \"org.asmdoc.sample\" = LOUD }");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger(SAMPLE_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_shouldLeaveLoggingUntouched() {
        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertEquals(originalRootLevel, rootLogger.getLevel());
    }
}
