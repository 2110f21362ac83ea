// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import io.kami.core.error.ApiException;

class ResponseErrorClassifierTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ResponseEnvelope envelope(final String json, final Integer httpStatus) throws Exception {
        return ResponseEnvelope.fromJson(mapper.readTree(json), httpStatus);
    }

    @Test
    void embeddedErrorInSuccessfulResponseRaises() throws Exception {
        final ApiException e = assertThrows(ApiException.class,
                () -> ResponseErrorClassifier.classify(envelope("{\"data\":{},\"error\":\"rate limited\"}", 200)));

        assertEquals("rate limited", e.errorMessage());
        assertNull(e.errorType());
    }

    @Test
    void structuredErrorKeepsItsType() throws Exception {
        final ApiException e = assertThrows(ApiException.class, () -> ResponseErrorClassifier.classify(
                envelope("{\"error\":{\"message\":\"no subnet\",\"type\":\"SubnetNotExists\"}}", 200)));

        assertEquals("SubnetNotExists", e.errorType());
        assertEquals("Kami API error (type: SubnetNotExists): no subnet", e.getMessage());
    }

    @Test
    void badStatusInBodyRaises() throws Exception {
        final ApiException e = assertThrows(ApiException.class, () -> ResponseErrorClassifier.classify(
                envelope("{\"statusCode\":404,\"message\":\"Not Found\"}", 200)));

        assertEquals("HTTP error: 404: Not Found", e.errorMessage());
    }

    @Test
    void httpStatusIsUsedWhenBodyHasNone() throws Exception {
        final ApiException e = assertThrows(ApiException.class,
                () -> ResponseErrorClassifier.classify(envelope("{\"data\":null}", 503)));

        assertEquals("HTTP error: 503", e.errorMessage());
    }

    @Test
    void successfulEnvelopePassesThrough() throws Exception {
        final ResponseEnvelope ok = envelope("{\"data\":{\"blockNumber\":12},\"error\":null,\"statusCode\":200}", 200);

        assertSame(ok, ResponseErrorClassifier.classify(ok));
        assertEquals(12, ok.data().get("blockNumber").intValue());
    }

    @Test
    void falsyErrorsAreIgnored() throws Exception {
        final ResponseEnvelope ok = envelope("{\"data\":[],\"error\":false}", 201);

        assertSame(ok, ResponseErrorClassifier.classify(ok));
    }
}
