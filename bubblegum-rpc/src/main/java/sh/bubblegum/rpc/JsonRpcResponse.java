// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * A decoded JSON-RPC 2.0 response: a {@code result}, an {@code error}, or (for a
 * misbehaving server) neither.
 *
 * @param result the result node if present and not JSON {@code null}
 * @param error  the error object if present and not JSON {@code null}
 * @param raw    the whole decoded body
 */
public record JsonRpcResponse(@Nullable JsonNode result, @Nullable JsonNode error, JsonNode raw) {

    public JsonRpcResponse {
        Objects.requireNonNull(raw, "raw");
    }

    public static JsonRpcResponse from(final JsonNode body) {
        Objects.requireNonNull(body, "body");
        return new JsonRpcResponse(present(body, "result"), present(body, "error"), body);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasResult() {
        return result != null;
    }

    private static @Nullable JsonNode present(final JsonNode body, final String field) {
        final JsonNode node = body.get(field);
        return node == null || node.isNull() ? null : node;
    }
}
