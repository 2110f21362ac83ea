// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    @Test
    void formatsRequestWithAndWithoutBody() {
        assertEquals("[REQUEST] GET chain/latest-block", LogFormatter.formatRequest("GET", "chain/latest-block", null));
        assertEquals("[REQUEST] POST chain/serve-axon body={}", LogFormatter.formatRequest("POST", "chain/serve-axon", "{}"));
    }

    @Test
    void formatsDurations() {
        assertEquals("✓ [RESPONSE] GET chain/latest-block status=200 duration=4.20ms",
                LogFormatter.formatResponse("GET", "chain/latest-block", 200, 4_200));
        assertEquals("✗ [REQUEST-ERROR] POST chain/set-weights error=refused duration=1.50s",
                LogFormatter.formatRequestError("POST", "chain/set-weights", "refused", 1_500_000));
    }

    @Test
    void formatsRetry() {
        assertEquals("○ [RETRY] attempt=2/10 wait=1.50s error=boom", LogFormatter.formatRetry(2, 10, 1500, "boom"));
    }
}
