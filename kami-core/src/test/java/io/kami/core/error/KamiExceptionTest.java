// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.ConnectException;

import org.junit.jupiter.api.Test;

class KamiExceptionTest {

    @Test
    void apiExceptionWithoutType() {
        final ApiException e = new ApiException("rate limited");

        assertEquals("Kami API error: rate limited", e.getMessage());
        assertEquals("rate limited", e.errorMessage());
        assertNull(e.errorType());
    }

    @Test
    void apiExceptionWithType() {
        final ApiException e = new ApiException("bad netuid", "SubnetNotExists");

        assertEquals("Kami API error (type: SubnetNotExists): bad netuid", e.getMessage());
        assertEquals("SubnetNotExists", e.errorType());
    }

    @Test
    void transportExceptionNamesUrlAndCause() {
        final ConnectException cause = new ConnectException("Connection refused");
        final TransportException e = new TransportException("http://localhost:3000/chain/latest-block", cause);

        assertEquals("http://localhost:3000/chain/latest-block", e.url());
        assertEquals("Error connecting to Kami API at http://localhost:3000/chain/latest-block: Connection refused",
                e.getMessage());
        assertSame(cause, e.getCause());
    }

    @Test
    void transportExceptionFallsBackToCauseType() {
        final TransportException e = new TransportException("http://h:1/x", new ConnectException());

        assertTrue(e.getMessage().endsWith(": ConnectException"), e.getMessage());
    }

    @Test
    void allFailuresShareTheRoot() {
        assertInstanceOf(KamiException.class, new ProtocolException("bad body"));
        assertInstanceOf(KamiException.class, new ConfigurationException("bad host"));
        assertInstanceOf(KamiException.class, ValidationException.signatureNotHex("abc"));
        assertInstanceOf(RuntimeException.class, ValidationException.emptyCommit(1));
    }

    @Test
    void signatureValidationMessageShowsValue() {
        assertTrue(ValidationException.signatureNotHex("not-hex").getMessage().contains("not-hex"));
    }
}
