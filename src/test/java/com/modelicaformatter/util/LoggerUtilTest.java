package com.modelicaformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LoggerUtil Tests")
class LoggerUtilTest {

    @AfterEach
    void tearDown() {
        LoggerUtil.setConsoleLevel(Level.WARNING);
        Logger.getLogger(LoggerUtil.BASE_LOGGER).setLevel(Level.INFO);
    }

    @Test
    @DisplayName("Should initialize logging on first use and name loggers after their class")
    void shouldCreateClassLoggers() {
        Logger logger = LoggerUtil.getLogger(LoggerUtilTest.class);

        assertThat(LoggerUtil.isInitialized()).isTrue();
        assertThat(logger.getName()).isEqualTo("com.modelicaformatter.util.LoggerUtilTest");
    }

    @Test
    @DisplayName("Should make fine messages of formatter loggers visible in verbose mode")
    void shouldSwitchToVerbose() {
        Logger logger = LoggerUtil.getLogger(LoggerUtilTest.class);

        LoggerUtil.setConsoleLevel(Level.FINE);

        assertThat(logger.isLoggable(Level.FINE)).isTrue();
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                assertThat(handler.getLevel()).isEqualTo(Level.FINE);
            }
        }
    }
}
