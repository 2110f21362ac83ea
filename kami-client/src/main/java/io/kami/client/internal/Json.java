// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared JSON support for the client.
 *
 * <p>
 * {@link ObjectMapper} is expensive to create and thread-safe after
 * configuration, so a single instance is shared by the executor and the
 * domain operations.
 */
public final class Json {

    /**
     * Shared mapper. Unknown response fields are ignored so the chain service
     * can add fields without breaking older clients; a {@code null} for a
     * numeric or boolean field is rejected rather than read as zero or false.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private Json() {
        // Utility class - prevent instantiation
    }
}
