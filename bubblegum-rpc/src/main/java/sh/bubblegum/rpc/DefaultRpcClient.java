// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import static sh.bubblegum.rpc.internal.RpcUtils.MAPPER;
import static sh.bubblegum.rpc.internal.RpcUtils.elapsedMicros;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;

import sh.bubblegum.core.ConnectionContext;
import sh.bubblegum.core.DebugLogger;
import sh.bubblegum.core.LogFormatter;
import sh.bubblegum.core.Outcome;
import sh.bubblegum.core.error.BubblegumError;
import sh.bubblegum.core.types.TransactionEnvelope;
import sh.bubblegum.core.types.TransactionSignature;

/**
 * {@link RpcClient} that reads the endpoint from a {@link ConnectionContext} and sends
 * requests through an {@link RpcTransport}.
 *
 * <p>
 * <strong>Response classification:</strong>
 * <ul>
 * <li>transport failure → {@code NetworkError}</li>
 * <li>status other than 200 → {@code HttpError} with status and body</li>
 * <li>200 with a body that is not JSON → {@code MalformedResponse}</li>
 * <li>{@code sendTransaction}: 200 with {@code error} → {@code RpcPayloadError};
 * with a string {@code result} → the signature; anything else → {@code MalformedResponse}</li>
 * <li>DAS methods: 200 with JSON → the decoded body as-is</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Safety:</strong> thread-safe if the transport is.
 */
public final class DefaultRpcClient implements RpcClient {

    static final String SEND_TRANSACTION = "sendTransaction";
    static final String GET_ASSET_BATCH = "getAssetBatch";
    static final String GET_ASSET_PROOF_BATCH = "getAssetProofBatch";

    private static final ObjectReader RESPONSE_READER =
            MAPPER.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final ConnectionContext context;
    private final RpcTransport transport;

    public DefaultRpcClient(final ConnectionContext context, final RpcTransport transport) {
        this.context = Objects.requireNonNull(context, "context");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public Outcome<TransactionSignature> submit(final TransactionEnvelope transaction) {
        Objects.requireNonNull(transaction, "transaction");
        DebugLogger.logTx(LogFormatter.formatTxSend(transaction.size()));
        final long start = System.nanoTime();
        return call(JsonRpcRequest.sendTransaction(transaction.toBase64()))
                .flatMap(this::toSignature)
                .map(signature -> {
                    DebugLogger.logTx(LogFormatter.formatTxSignature(signature.value(), elapsedMicros(start)));
                    return signature;
                });
    }

    @Override
    public Outcome<JsonNode> getAssetBatch(final List<String> ids) {
        return call(JsonRpcRequest.dasBatch(GET_ASSET_BATCH, Objects.requireNonNull(ids, "ids")))
                .map(JsonRpcResponse::raw);
    }

    @Override
    public Outcome<JsonNode> getAssetProofBatch(final List<String> ids) {
        return call(JsonRpcRequest.dasBatch(GET_ASSET_PROOF_BATCH, Objects.requireNonNull(ids, "ids")))
                .map(JsonRpcResponse::raw);
    }

    private Outcome<JsonRpcResponse> call(final JsonRpcRequest request) {
        final Outcome<URI> endpoint = context.endpoint();
        if (endpoint instanceof Outcome.Err<URI> err) {
            return err.<JsonRpcResponse>cast().withContext("method", request.method());
        }

        final String payload;
        try {
            payload = MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return fail(request.method(), new BubblegumError.MalformedResponse(
                    "unable to serialize request for " + request.method(), e), "serialize", 0L);
        }

        final long start = System.nanoTime();
        final HttpReply reply;
        try {
            reply = transport.post(endpoint.orElseThrow(), payload);
        } catch (IOException e) {
            return fail(request.method(), new BubblegumError.NetworkError(e), "network", elapsedMicros(start));
        }
        final long durationMicros = elapsedMicros(start);

        if (reply.statusCode() != 200) {
            return fail(request.method(), new BubblegumError.HttpError(reply.statusCode(), reply.body()),
                    reply.statusCode(), durationMicros);
        }

        final JsonNode body;
        try {
            body = RESPONSE_READER.readTree(reply.body());
        } catch (JsonProcessingException e) {
            return fail(request.method(), new BubblegumError.MalformedResponse(
                    "response body for " + request.method() + " is not valid JSON", e), "parse", durationMicros);
        }
        if (body == null || body.isMissingNode() || !body.isObject()) {
            return fail(request.method(), new BubblegumError.MalformedResponse(
                    "response body for " + request.method() + " is not a JSON object", null), "parse", durationMicros);
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(request.method(), durationMicros));
        return Outcome.ok(JsonRpcResponse.from(body));
    }

    private Outcome<TransactionSignature> toSignature(final JsonRpcResponse response) {
        if (response.hasError()) {
            final BubblegumError.RpcPayloadError error = BubblegumError.RpcPayloadError.from(response.error());
            DebugLogger.logRpc(LogFormatter.formatRpcError(SEND_TRANSACTION, error.code(), error.errorMessage(), 0L));
            return Outcome.<TransactionSignature>err(error).withContext("method", SEND_TRANSACTION);
        }
        final JsonNode result = response.result();
        if (result == null || !result.isTextual() || result.asText().isBlank()) {
            return Outcome.<TransactionSignature>err(new BubblegumError.MalformedResponse(
                    "sendTransaction response has neither a signature result nor an error: " + response.raw(), null))
                    .withContext("method", SEND_TRANSACTION);
        }
        return Outcome.ok(new TransactionSignature(result.asText()));
    }

    private static <T> Outcome<T> fail(
            final String method, final BubblegumError error, final Object code, final long durationMicros) {
        DebugLogger.logRpc(LogFormatter.formatRpcError(method, code, error.kind(), durationMicros));
        return Outcome.<T>err(error).withContext("method", method);
    }
}
