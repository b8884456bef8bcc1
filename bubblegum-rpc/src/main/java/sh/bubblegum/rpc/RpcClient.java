// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import sh.bubblegum.core.Outcome;
import sh.bubblegum.core.types.TransactionEnvelope;
import sh.bubblegum.core.types.TransactionSignature;

/**
 * JSON-RPC operations the Bubblegum workflows need: transaction submission and the
 * batched DAS queries for assets and proofs.
 *
 * <p>
 * Every call is a single blocking HTTP POST to the endpoint held by the connection
 * context. Nothing is retried. Failures come back as {@link Outcome.Err} values carrying
 * one of the RPC-layer errors: {@code NetworkError}, {@code HttpError},
 * {@code RpcPayloadError} or {@code MalformedResponse}; {@code NotInitialized} when no
 * connection exists yet.
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe.
 *
 * @see DefaultRpcClient
 */
public interface RpcClient {

    /**
     * Submits a signed transaction with {@code sendTransaction}, base64-encoded.
     *
     * @param transaction the signed transaction
     * @return the transaction signature from the {@code result} field
     */
    Outcome<TransactionSignature> submit(TransactionEnvelope transaction);

    /**
     * Calls the DAS {@code getAssetBatch} method.
     *
     * @param ids asset ids
     * @return the decoded response body, unmodified (it may itself carry an {@code error})
     */
    Outcome<JsonNode> getAssetBatch(List<String> ids);

    /**
     * Calls the DAS {@code getAssetProofBatch} method.
     *
     * @param ids asset ids
     * @return the decoded response body, unmodified; proofs are keyed by asset id under {@code result}
     */
    Outcome<JsonNode> getAssetProofBatch(List<String> ids);
}
