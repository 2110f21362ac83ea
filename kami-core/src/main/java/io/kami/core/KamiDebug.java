// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core;

/**
 * Global toggle for verbose request tracing.
 *
 * <p>The flag is volatile so a toggle from one thread is seen by requests
 * already running on others.
 */
public final class KamiDebug {

    private static volatile boolean requestLogging = false;

    private KamiDebug() {
    }

    public static boolean isEnabled() {
        return requestLogging;
    }

    public static void setEnabled(final boolean enabled) {
        requestLogging = enabled;
    }
}
