// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.error;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class BubblegumErrorTest {

    @Test
    void rpcPayloadErrorReadsCodeAndMessage() throws Exception {
        JsonNode error = new ObjectMapper().readTree("""
                {"code": -32002, "message": "Transaction simulation failed: Blockhash not found", "data": {}}
                """);
        BubblegumError.RpcPayloadError payload = BubblegumError.RpcPayloadError.from(error);
        assertEquals(-32002, payload.code());
        assertEquals("Transaction simulation failed: Blockhash not found", payload.errorMessage());
        assertTrue(payload.isRpcError());
        assertEquals("RpcPayloadError", payload.kind());
    }

    @Test
    void rpcPayloadErrorWithoutMessageUsesRawPayload() throws Exception {
        JsonNode error = new ObjectMapper().readTree("{\"code\": 7}");
        assertEquals("{\"code\":7}", BubblegumError.RpcPayloadError.from(error).errorMessage());
    }

    @Test
    void submitFailedGuidanceMentionsStaleProof() {
        BubblegumError error = new BubblegumError.SubmitFailed(new BubblegumError.HttpError(503, "busy"));
        assertTrue(error.guidance().contains("stale"));
        assertTrue(error.message().contains("HTTP error 503: busy"));
        assertFalse(error.isRpcError());
    }

    @Test
    void lifecycleErrorsAreNotRpcErrors() {
        assertFalse(new BubblegumError.NotInitialized().isRpcError());
        assertTrue(new BubblegumError.NetworkError(new java.io.IOException("refused")).isRpcError());
    }
}
