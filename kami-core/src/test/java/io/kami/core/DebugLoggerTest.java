// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("io.kami.debug");

    @AfterEach
    void reset() {
        KamiDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        DebugLogger.log("should not appear");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        KamiDebug.setEnabled(true);
        DebugLogger.log("payload %s", "{\"message\":\"hi\",\"signature\":\"0xabc\"}");

        assertEquals(1, appender.list.size());
        final String line = appender.list.get(0).getFormattedMessage();
        assertTrue(line.contains("\"signature\":\"***[REDACTED]***\""), line);
        assertFalse(line.contains("0xabc"), line);
    }
}
