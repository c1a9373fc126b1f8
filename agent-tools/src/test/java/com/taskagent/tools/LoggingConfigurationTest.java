package com.taskagent.tools;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests run with the module's logback-test.xml.
 */
class LoggingConfigurationTest {

    @Test
    void toolLoggers_shouldLogAtDebug() {
        assertThat(LoggerFactory.getLogger(RunCommandTool.class).isDebugEnabled()).isTrue();
    }

    @Test
    void libraryLoggers_shouldOnlyLogWarnings() {
        Logger library = LoggerFactory.getLogger("com.fasterxml.jackson");
        assertThat(library.isInfoEnabled()).isFalse();
        assertThat(library.isWarnEnabled()).isTrue();
    }
}
