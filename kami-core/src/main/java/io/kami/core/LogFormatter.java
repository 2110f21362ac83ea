// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core;

import java.util.Locale;

/**
 * Formats one-line request traces for {@link DebugLogger}.
 *
 * <p>
 * All traces use a bracketed tag and a status symbol:
 * <pre>
 * [REQUEST] GET chain/latest-block
 * [REQUEST] POST chain/serve-axon body={"netuid":1,...}
 * ✓ [RESPONSE] GET chain/latest-block status=200 duration=4.20ms
 * ✗ [REQUEST-ERROR] POST chain/set-weights error=Connection refused duration=0.80ms
 * ○ [RETRY] attempt=2/10 wait=1.50s error=Kami API error: still indexing
 * </pre>
 *
 * <p>All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    /**
     * Format: [REQUEST] GET chain/latest-block body={...}
     */
    public static String formatRequest(final String method, final String path, final String body) {
        if (body == null || body.isEmpty()) {
            return String.format(Locale.ROOT, "[REQUEST] %s %s", method, path);
        }
        return String.format(Locale.ROOT, "[REQUEST] %s %s body=%s", method, path, body);
    }

    /**
     * Format: ✓ [RESPONSE] GET chain/latest-block status=200 duration=4.20ms
     */
    public static String formatResponse(
            final String method, final String path, final int status, final long durationMicros) {
        return String.format(Locale.ROOT,
                "✓ [RESPONSE] %s %s status=%d %s", method, path, status, duration(durationMicros));
    }

    /**
     * Format: ✗ [REQUEST-ERROR] POST chain/set-weights error=Connection refused duration=0.80ms
     */
    public static String formatRequestError(
            final String method, final String path, final String error, final long durationMicros) {
        return String.format(Locale.ROOT,
                "✗ [REQUEST-ERROR] %s %s error=%s %s", method, path, error, duration(durationMicros));
    }

    /**
     * Format: ○ [RETRY] attempt=2/10 wait=1.50s error=...
     */
    public static String formatRetry(
            final int attempt, final int maxAttempts, final long waitMillis, final String error) {
        return String.format(Locale.ROOT,
                "○ [RETRY] attempt=%d/%d wait=%.2fs error=%s",
                attempt, maxAttempts, waitMillis / 1000.0, error);
    }

    private static String duration(final long micros) {
        final double ms = micros / 1000.0;
        if (ms < 1000) {
            return String.format(Locale.ROOT, "duration=%.2fms", ms);
        }
        return String.format(Locale.ROOT, "duration=%.2fs", ms / 1000.0);
    }
}
