// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.List;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class SubnetMetagraphTest {

    private static final List<String> PER_UID_FIELDS = List.of(
            "hotkeys", "coldkeys", "identities", "axons", "active", "validatorPermit", "pruningScore",
            "lastUpdate", "emission", "dividends", "incentives", "consensus", "trust", "rank",
            "blockAtRegistration", "alphaStake", "taoStake", "totalStake");

    private final ObjectMapper mapper = new ObjectMapper();

    private ObjectNode fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/subnet-metagraph.json")) {
            return (ObjectNode) mapper.readTree(in);
        }
    }

    @Test
    void attributesAxonsToTheirUids() throws Exception {
        final SubnetMetagraph graph = mapper.treeToValue(fixture(), SubnetMetagraph.class);

        assertEquals(2, graph.numUids());
        for (int uid = 0; uid < graph.numUids(); uid++) {
            assertEquals(graph.hotkeys().get(uid), graph.axons().get(uid).hotkey());
            assertEquals(graph.coldkeys().get(uid), graph.axons().get(uid).coldkey());
        }
        assertEquals("5HotA", graph.axons().get(0).hotkey());
        assertEquals("5ColdB", graph.axons().get(1).coldkey());
    }

    @Test
    void readsScalarsQuantitiesAndDividendPairs() throws Exception {
        final SubnetMetagraph graph = mapper.treeToValue(fixture(), SubnetMetagraph.class);

        assertEquals(BigInteger.valueOf(26), graph.difficulty());
        assertEquals(BigInteger.valueOf(100), graph.weightsRateLimit());
        assertEquals(new BigInteger("ffffffffffffffff", 16), graph.maxDifficulty());
        assertEquals(BigInteger.valueOf(123456789), graph.movingPrice().bits());
        assertNull(graph.identity());
        assertNull(graph.identities().get(0));
        assertEquals("bee", graph.identities().get(1).name());
        assertEquals(new HotkeyDividend("5HotA", 0.25), graph.taoDividendsPerHotkey().get(0));
        assertEquals(2, graph.alphaDividendsPerHotkey().size());
    }

    @Test
    void everyPerUidListMustMatchNumUids() throws Exception {
        for (final String field : PER_UID_FIELDS) {
            final ObjectNode broken = fixture();
            ((ArrayNode) broken.get(field)).remove(1);

            final JsonMappingException e = assertThrows(JsonMappingException.class,
                    () -> mapper.treeToValue(broken, SubnetMetagraph.class), field);
            assertTrue(e.getMessage().contains(field), e.getMessage());
        }
    }

    @Test
    void missingUidCountIsRejected() throws Exception {
        final ObjectNode node = fixture();
        node.remove("numUids");

        final JsonMappingException e = assertThrows(JsonMappingException.class,
                () -> mapper.treeToValue(node, SubnetMetagraph.class));
        assertTrue(e.getMessage().contains("numUids"), e.getMessage());
    }

    @Test
    void missingOrNullPerUidListsAreRejected() throws Exception {
        for (final String field : PER_UID_FIELDS) {
            final ObjectNode absent = fixture();
            absent.remove(field);
            assertThrows(JsonMappingException.class, () -> mapper.treeToValue(absent, SubnetMetagraph.class), field);

            final ObjectNode nulled = fixture();
            nulled.putNull(field);
            assertThrows(JsonMappingException.class, () -> mapper.treeToValue(nulled, SubnetMetagraph.class), field);
        }
    }

    @Test
    void bodyWithoutParticipantsIsNotAnEmptySubnet() {
        assertThrows(JsonMappingException.class,
                () -> mapper.readValue("{\"netuid\":1,\"name\":\"apex\"}", SubnetMetagraph.class));
    }

    @Test
    void dividendListsAreNotLengthChecked() throws Exception {
        final ObjectNode node = fixture();
        ((ArrayNode) node.get("alphaDividendsPerHotkey")).removeAll();

        final SubnetMetagraph graph = mapper.treeToValue(node, SubnetMetagraph.class);

        assertTrue(graph.alphaDividendsPerHotkey().isEmpty());
    }

    @Test
    void emptySubnetIsValid() throws Exception {
        final ObjectNode node = fixture();
        node.put("numUids", 0);
        for (final String field : PER_UID_FIELDS) {
            ((ArrayNode) node.get(field)).removeAll();
        }

        final SubnetMetagraph graph = mapper.treeToValue(node, SubnetMetagraph.class);

        assertTrue(graph.axons().isEmpty());
        assertTrue(graph.hotkeys().isEmpty());
    }

    @Test
    void listsAreImmutable() throws Exception {
        final SubnetMetagraph graph = mapper.treeToValue(fixture(), SubnetMetagraph.class);

        assertThrows(UnsupportedOperationException.class, () -> graph.hotkeys().add("5Intruder"));
        assertThrows(UnsupportedOperationException.class, () -> graph.identities().remove(0));
    }
}
