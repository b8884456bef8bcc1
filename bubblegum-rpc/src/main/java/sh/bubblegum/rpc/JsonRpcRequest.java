// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * JSON-RPC 2.0 request envelope.
 * <p>
 * {@code id} is a number for {@code sendTransaction} and a string for the DAS methods,
 * matching what DAS providers expect; {@code params} is positional (a list) or named (a map).
 */
@JsonPropertyOrder({"jsonrpc", "id", "method", "params"})
public record JsonRpcRequest(String jsonrpc, Object id, String method, Object params) {

    static final String VERSION = "2.0";
    static final int SUBMIT_ID = 1;
    static final String DAS_ID = "test";

    /**
     * {@code {"jsonrpc":"2.0","id":1,"method":"sendTransaction","params":[base64Tx,{"encoding":"base64"}]}}
     */
    public static JsonRpcRequest sendTransaction(final String base64Transaction) {
        return new JsonRpcRequest(VERSION, SUBMIT_ID, "sendTransaction",
                List.of(base64Transaction, Map.of("encoding", "base64")));
    }

    /**
     * {@code {"jsonrpc":"2.0","id":"test","method":<method>,"params":{"ids":[...]}}}
     */
    public static JsonRpcRequest dasBatch(final String method, final List<String> ids) {
        return new JsonRpcRequest(VERSION, DAS_ID, method, Map.of("ids", List.copyOf(ids)));
    }
}
