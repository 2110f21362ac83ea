// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import io.kami.core.error.ValidationException;

class SetWeightsPayloadTest {

    @Test
    void rejectsMismatchedLengths() {
        assertThrows(ValidationException.class,
                () -> new SetWeightsPayload(1, List.of(0, 1), List.of(65535), 0L));
    }

    @Test
    void serializesVersionKeyInSnakeCase() {
        final JsonNode json = new ObjectMapper().valueToTree(
                new SetWeightsPayload(3, List.of(0, 1), List.of(100, 200), 7L));

        assertEquals(3, json.get("netuid").intValue());
        assertEquals(7L, json.get("version_key").longValue());
        assertTrue(json.has("dests"));
        assertTrue(json.has("weights"));
    }

    @Test
    void ipv4AxonPayloadUsesDefaults() {
        final ServeAxonPayload payload = ServeAxonPayload.ipv4(1, 167772161L, 8091);

        assertEquals(1, payload.version());
        assertEquals(4, payload.ipType());
        assertEquals(4, payload.protocol());
        assertEquals(0, payload.placeholder1());
    }
}
