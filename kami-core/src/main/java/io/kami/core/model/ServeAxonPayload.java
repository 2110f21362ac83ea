// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

/**
 * Payload announcing an axon so other participants can reach it.
 *
 * @param netuid       subnet the axon serves
 * @param version      axon version (default 1)
 * @param ip           IPv4 or IPv6 address as an integer
 * @param port         port
 * @param ipType       4 for IPv4, 6 for IPv6 (default 4)
 * @param protocol     should match {@code ipType} (default 4)
 * @param placeholder1 reserved (default 0)
 * @param placeholder2 reserved (default 0)
 */
public record ServeAxonPayload(
        int netuid,
        int version,
        long ip,
        int port,
        int ipType,
        int protocol,
        int placeholder1,
        int placeholder2) {

    /**
     * Creates an IPv4 payload with default version, protocol and placeholders.
     *
     * @param netuid subnet the axon serves
     * @param ip     IPv4 address as an integer
     * @param port   port
     * @return the payload
     */
    public static ServeAxonPayload ipv4(final int netuid, final long ip, final int port) {
        return new ServeAxonPayload(netuid, 1, ip, port, 4, 4, 0, 0);
    }
}
