// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized request-tracing logger.
 *
 * <p>Messages go to the {@code io.kami.debug} SLF4J logger, and only while
 * {@link KamiDebug} is enabled. Every message is sanitized first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.kami.debug");

    private DebugLogger() {
    }

    public static void log(final String message, final Object... args) {
        if (!KamiDebug.isEnabled()) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
