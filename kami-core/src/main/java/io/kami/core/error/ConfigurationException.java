// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.error;

/**
 * Thrown when required configuration is missing or invalid, such as an
 * unresolved host or a subnet whose tempo or reveal period is zero while
 * commit-reveal is enabled.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends KamiException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
