package com.taskagent.core;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests run with the module's logback-test.xml: debug output for the agent,
 * warnings only for libraries.
 */
class LoggingConfigurationTest {

    @Test
    void agentLoggers_shouldLogAtDebug() {
        assertTrue(LoggerFactory.getLogger("com.taskagent.core.debug").isDebugEnabled());
    }

    @Test
    void libraryLoggers_shouldOnlyLogWarnings() {
        Logger library = LoggerFactory.getLogger("com.fasterxml.jackson");
        assertFalse(library.isInfoEnabled());
        assertTrue(library.isWarnEnabled());
    }
}
