// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    @Test
    void shortensLongValues() {
        assertEquals("4mKS...MgZX", LogFormatter.shorten("4mKSoDDqApmF1DqXvVTSL7sGe1pCP2q6KomxEsYQMgZX"));
        assertEquals("asset1", LogFormatter.shorten("asset1"));
        assertNull(LogFormatter.shorten(null));
    }

    @Test
    void formatsTransferStep() {
        String line = LogFormatter.formatTransferStep("4mKSoDDqApmF1DqXvVTSL7sGe1pCP2q6KomxEsYQMgZX", "FETCHING_PROOF");
        assertTrue(line.contains("[TRANSFER]"));
        assertTrue(line.contains("asset=4mKS...MgZX"));
        assertTrue(line.contains("state=FETCHING_PROOF"));
    }

    @Test
    void formatsRpcLines() {
        assertTrue(LogFormatter.formatRpc("getAssetBatch", 1500).contains("method=getAssetBatch"));
        String error = LogFormatter.formatRpcError("sendTransaction", 500, "HTTP 500", 2_500_000);
        assertTrue(error.contains("[RPC-ERROR]"));
        assertTrue(error.contains("duration=2.50s"));
    }

    @Test
    void formatsTreeOutcome() {
        assertTrue(LogFormatter.formatTree("9WzDXyMrFftHVK4jBUEcqABUVVjLPCT9keST9ycxL22F", null).contains("tree=9WzD...L22F"));
        assertTrue(LogFormatter.formatTree(null, "ExpiredBlockhash").contains("kind=ExpiredBlockhash"));
    }
}
