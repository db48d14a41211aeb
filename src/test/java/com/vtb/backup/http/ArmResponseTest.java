package com.vtb.backup.http;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArmResponseTest {

    @Test
    void headerLookupIgnoresCase() {
        ArmResponse response = new ArmResponse(200, JsonNodeFactory.instance.objectNode(),
            Map.of("X-Ms-Continuation", "token-1", "Empty", " "));

        assertEquals("token-1", response.header("x-ms-continuation"));
        assertEquals("token-1", response.header("X-MS-CONTINUATION"));
        assertNull(response.header("empty"));
        assertNull(response.header("missing"));
    }

    @Test
    void nullBodyBecomesMissingNode() {
        assertTrue(new ArmResponse(200, null, null).getBody().isMissingNode());
    }
}
