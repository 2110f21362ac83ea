// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Network endpoint of a subnet participant.
 *
 * <p>
 * The chain service reports axons without their owning keys; {@code hotkey}
 * and {@code coldkey} default to the empty string and are filled in from the
 * metagraph by {@link #withOwner(String, String)}.
 *
 * @param block        block at which the axon was last served
 * @param version      axon version
 * @param ip           address, as reported by the service
 * @param port         port
 * @param ipType       4 for IPv4, 6 for IPv6
 * @param protocol     transport protocol
 * @param placeholder1 reserved
 * @param placeholder2 reserved
 * @param hotkey       owning hotkey, or {@code ""} until denormalized
 * @param coldkey      owning coldkey, or {@code ""} until denormalized
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AxonInfo(
        long block,
        int version,
        String ip,
        int port,
        int ipType,
        int protocol,
        int placeholder1,
        int placeholder2,
        String hotkey,
        String coldkey) {

    public AxonInfo {
        hotkey = hotkey == null ? "" : hotkey;
        coldkey = coldkey == null ? "" : coldkey;
    }

    /**
     * Returns a copy of this axon attributed to the given keys.
     *
     * @param ownerHotkey  hotkey of the uid that serves this axon
     * @param ownerColdkey coldkey of the uid that serves this axon
     * @return the attributed axon
     */
    public AxonInfo withOwner(final String ownerHotkey, final String ownerColdkey) {
        return new AxonInfo(block, version, ip, port, ipType, protocol, placeholder1, placeholder2,
                ownerHotkey, ownerColdkey);
    }
}
