// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.bubblegum.core.ConnectionContext;
import sh.bubblegum.core.DebugLogger;
import sh.bubblegum.core.LogFormatter;
import sh.bubblegum.core.Outcome;
import sh.bubblegum.core.crypto.Credential;
import sh.bubblegum.core.error.BubblegumError;
import sh.bubblegum.core.error.TransactionBuildException;
import sh.bubblegum.core.model.AssetProof;
import sh.bubblegum.core.model.AssetRecord;
import sh.bubblegum.core.model.TransferInstruction;
import sh.bubblegum.core.types.Address;
import sh.bubblegum.core.types.TransactionEnvelope;
import sh.bubblegum.core.types.TransactionSignature;

/**
 * Transfers compressed NFTs to a new owner.
 *
 * <p>
 * Each call walks {@link TransferState} from {@code IDLE} to {@code DONE} or {@code FAILED}:
 * <ol>
 * <li>validate arguments, without any network call</li>
 * <li>fetch the asset with {@code getAssetBatch}</li>
 * <li>check that the connected credential owns it; stop before the proof fetch if not</li>
 * <li>fetch proof path and root together with {@code getAssetProofBatch}</li>
 * <li>build the transfer from the compression fields, proof and root</li>
 * <li>submit</li>
 * </ol>
 *
 * <p>
 * Asset and proof are never cached. A proof can go stale between fetch and submit when the
 * tree changes; that shows up as {@code SubmitFailed} and the caller retries the whole call,
 * which fetches everything again.
 *
 * <p>
 * Every failure carries {@code assetId}, {@code toAddress} and the failing {@code step} in
 * its context.
 */
public final class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private static final Pattern BASE58 = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]+$");

    private final ConnectionContext context;
    private final TransactionBuilder builder;
    private final RpcClient rpc;
    private final TransferListener listener;

    public TransferService(final ConnectionContext context, final TransactionBuilder builder, final RpcClient rpc) {
        this(context, builder, rpc, TransferListener.NONE);
    }

    public TransferService(
            final ConnectionContext context,
            final TransactionBuilder builder,
            final RpcClient rpc,
            final TransferListener listener) {
        this.context = Objects.requireNonNull(context, "context");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.rpc = Objects.requireNonNull(rpc, "rpc");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Transfers one compressed asset from the connected wallet to {@code toAddress}.
     *
     * @param assetId   the asset id
     * @param toAddress the new owner, base58
     * @return the transfer signature, or one of {@code InvalidArgument}, {@code NotInitialized},
     *         {@code AssetNotFound}, {@code NotOwner}, {@code ProofUnavailable},
     *         {@code NotCompressed}, {@code BuildFailed}, {@code SubmitFailed}, or an RPC error
     *         from one of the fetches
     */
    public Outcome<TransactionSignature> transfer(final String assetId, final String toAddress) {
        return new Attempt(assetId, toAddress).run();
    }

    /** State of one call. Never shared between calls. */
    private final class Attempt {
        private final String assetId;
        private final String toAddress;
        private TransferState state = TransferState.IDLE;

        Attempt(final String assetId, final String toAddress) {
            this.assetId = assetId;
            this.toAddress = toAddress;
        }

        Outcome<TransactionSignature> run() {
            moveTo(TransferState.VALIDATING);
            if (assetId == null || assetId.isBlank()) {
                return fail(new BubblegumError.InvalidArgument("assetId", "must not be empty"));
            }
            if (toAddress == null || toAddress.isBlank()) {
                return fail(new BubblegumError.InvalidArgument("toAddress", "must not be empty"));
            }
            if (!BASE58.matcher(toAddress).matches()) {
                return fail(new BubblegumError.InvalidArgument("toAddress", "contains non-base58 characters"));
            }
            if (!Address.isValid(toAddress)) {
                return fail(new BubblegumError.InvalidArgument("toAddress", "must decode to 32 bytes"));
            }
            final Address destination = new Address(toAddress);

            final Outcome<Credential> credentialOutcome = context.credential();
            if (credentialOutcome instanceof Outcome.Err<Credential> err) {
                return fail(err.cast());
            }
            final Credential credential = credentialOutcome.orElseThrow();

            moveTo(TransferState.FETCHING_ASSET);
            final Outcome<JsonNode> assetBody = rpc.getAssetBatch(List.of(assetId));
            if (assetBody instanceof Outcome.Err<JsonNode> err) {
                return fail(err.cast());
            }
            final Outcome<AssetRecord> assetOutcome = parseAsset(assetBody.orElseThrow());
            if (assetOutcome instanceof Outcome.Err<AssetRecord> err) {
                return fail(err.cast());
            }
            final AssetRecord asset = assetOutcome.orElseThrow();

            moveTo(TransferState.VERIFYING_OWNERSHIP);
            final Address expectedOwner = credential.address();
            if (!expectedOwner.value().equals(asset.owner())) {
                return fail(new BubblegumError.NotOwner(assetId, expectedOwner, asset.owner()));
            }

            moveTo(TransferState.FETCHING_PROOF);
            final Outcome<JsonNode> proofBody = rpc.getAssetProofBatch(List.of(assetId));
            if (proofBody instanceof Outcome.Err<JsonNode> err) {
                return fail(err.cast());
            }
            final Outcome<AssetProof> proofOutcome = parseProof(proofBody.orElseThrow());
            if (proofOutcome instanceof Outcome.Err<AssetProof> err) {
                return fail(err.cast());
            }
            if (asset.compression() == null) {
                return fail(new BubblegumError.NotCompressed(assetId,
                        Objects.requireNonNullElse(asset.compressionIssue(), "missing compression block")));
            }
            final TransferInstruction instruction =
                    TransferInstruction.of(destination, asset, asset.compression(), proofOutcome.orElseThrow());

            moveTo(TransferState.BUILDING);
            final TransactionEnvelope envelope;
            try {
                envelope = builder.buildTransfer(credential, instruction);
            } catch (TransactionBuildException | RuntimeException e) {
                log.debug("Transfer build failed for asset {}", assetId, e);
                return fail(Outcome.err(new BubblegumError.BuildFailed("transfer", e)));
            }

            moveTo(TransferState.SUBMITTING);
            final Outcome<TransactionSignature> submitted = rpc.submit(envelope);
            if (submitted instanceof Outcome.Err<TransactionSignature> err) {
                final Outcome<TransactionSignature> wrapped =
                        new Outcome.Err<>(new BubblegumError.SubmitFailed(err.error()), err.context());
                return fail(wrapped);
            }

            moveTo(TransferState.DONE);
            log.debug("Transferred asset {} to {} in {}", assetId, toAddress, submitted.orElseThrow());
            return submitted;
        }

        private Outcome<AssetRecord> parseAsset(final JsonNode body) {
            final JsonNode error = body.get("error");
            if (error != null && !error.isNull()) {
                return Outcome.err(BubblegumError.RpcPayloadError.from(error));
            }
            final JsonNode result = body.get("result");
            if (result == null || !result.isArray() || result.isEmpty()) {
                return Outcome.err(new BubblegumError.AssetNotFound(assetId));
            }
            final JsonNode first = result.get(0);
            if (first == null || !first.isObject()) {
                return Outcome.err(new BubblegumError.AssetNotFound(assetId));
            }
            return Outcome.ok(AssetRecord.fromJson(assetId, first));
        }

        private Outcome<AssetProof> parseProof(final JsonNode body) {
            final JsonNode error = body.get("error");
            if (error != null && !error.isNull()) {
                return Outcome.err(BubblegumError.RpcPayloadError.from(error));
            }
            final JsonNode result = body.get("result");
            final Optional<AssetProof> proof =
                    AssetProof.fromJson(result == null ? null : result.get(assetId));
            return proof.<Outcome<AssetProof>>map(Outcome::ok)
                    .orElseGet(() -> Outcome.err(new BubblegumError.ProofUnavailable(assetId)));
        }

        private Outcome<TransactionSignature> fail(final BubblegumError error) {
            return fail(Outcome.err(error));
        }

        private Outcome<TransactionSignature> fail(final Outcome<TransactionSignature> failure) {
            final TransferState step = state;
            final BubblegumError error = failure.errorOrNull();
            moveTo(TransferState.FAILED);
            DebugLogger.logTx(LogFormatter.formatTransferFailure(assetId, error.kind(), error.message()));
            if (error instanceof BubblegumError.SubmitFailed) {
                log.warn("Transfer of asset {} failed at submission: {}", assetId, error.message());
            } else {
                log.debug("Transfer of asset {} failed at {}: {}", assetId, step, error.message());
            }
            return failure
                    .withContext("assetId", assetId)
                    .withContext("toAddress", toAddress)
                    .withContext("step", step);
        }

        private void moveTo(final TransferState next) {
            final TransferState previous = state;
            state = next;
            DebugLogger.logTx(LogFormatter.formatTransferStep(String.valueOf(assetId), next.name()));
            listener.onTransition(assetId, previous, next);
        }
    }
}
