// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts signatures and weight commits</li>
 * <li>Truncates excessively long logs (a metagraph body can be megabytes)</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches "signature":"..." and "commit":"..." JSON values. */
    private static final Pattern SECRET_PATTERN =
            Pattern.compile("\"(signature|commit)\"\\s*:\\s*\"[^\"]+\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"signature\"") || sanitized.contains("\"commit\"")) {
            sanitized = SECRET_PATTERN.matcher(sanitized).replaceAll("\"$1\":\"***[REDACTED]***\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
