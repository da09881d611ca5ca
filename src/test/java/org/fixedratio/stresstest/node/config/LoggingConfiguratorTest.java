package org.fixedratio.stresstest.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.fixedratio.stresstest.logging.sample";

    private LoggerContext context;
    private Level previousRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        previousRootLevel = context.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME).setLevel(previousRootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    @Test
    void levelsAndFormatAreApplied() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging { format = PLAIN, default-level = ERROR, levels { \"" + TEST_LOGGER + "\" = DEBUG } }"));

        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
        assertEquals(Level.ERROR, context.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals("STDOUT_PLAIN", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void onlyFirstCallHasEffect() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { levels { \"" + TEST_LOGGER + "\" = DEBUG } }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { levels { \"" + TEST_LOGGER + "\" = ERROR } }"));

        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void missingSectionChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertNull(context.getLogger(TEST_LOGGER).getLevel());
        assertNull(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }
}
