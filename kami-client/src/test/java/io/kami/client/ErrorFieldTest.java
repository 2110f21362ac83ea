// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ErrorFieldTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ErrorField parse(final String json) throws Exception {
        final JsonNode node = mapper.readTree(json);
        return ErrorField.parse(node);
    }

    @Test
    void falsyValuesMeanNoError() throws Exception {
        for (final String json : new String[] {"null", "false", "\"\"", "0", "{}", "[]"}) {
            final ErrorField field = parse(json);
            assertSame(ErrorField.NONE, field, json);
            assertFalse(field.isPresent(), json);
        }
        assertSame(ErrorField.NONE, ErrorField.parse(null));
    }

    @Test
    void stringIsTheMessage() throws Exception {
        assertEquals(new ErrorField.Message("rate limited"), parse("\"rate limited\""));
    }

    @Test
    void objectWithTypeIsTyped() throws Exception {
        assertEquals(new ErrorField.Typed("Subnet does not exist", "SubnetNotExists"),
                parse("{\"message\":\"Subnet does not exist\",\"type\":\"SubnetNotExists\"}"));
    }

    @Test
    void objectFallsBackToNameAndToItsText() throws Exception {
        assertEquals(new ErrorField.Typed("boom", "RuntimeError"), parse("{\"message\":\"boom\",\"name\":\"RuntimeError\"}"));
        assertEquals(new ErrorField.Message("{\"code\":7}"), parse("{\"code\":7}"));
    }

    @Test
    void otherTruthyValuesUseTheirJsonText() throws Exception {
        assertEquals(new ErrorField.Message("true"), parse("true"));
        assertEquals(new ErrorField.Message("500"), parse("500"));
    }
}
