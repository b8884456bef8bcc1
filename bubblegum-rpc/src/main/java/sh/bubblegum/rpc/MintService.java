// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.bubblegum.core.ConnectionContext;
import sh.bubblegum.core.DebugLogger;
import sh.bubblegum.core.LogFormatter;
import sh.bubblegum.core.Outcome;
import sh.bubblegum.core.crypto.Credential;
import sh.bubblegum.core.error.BubblegumError;
import sh.bubblegum.core.error.TransactionBuildException;
import sh.bubblegum.core.model.MintRequest;
import sh.bubblegum.core.types.TransactionEnvelope;
import sh.bubblegum.core.types.TransactionSignature;

/**
 * Mints compressed NFTs into an existing tree.
 *
 * <p>
 * Sequence: read the credential, build the mint transaction, submit it. Parameters are
 * not validated here; the builder rejects what it cannot encode. Failures carry the
 * mint parameters in their context.
 */
public final class MintService {

    private static final Logger log = LoggerFactory.getLogger(MintService.class);

    private final ConnectionContext context;
    private final TransactionBuilder builder;
    private final RpcClient rpc;

    public MintService(final ConnectionContext context, final TransactionBuilder builder, final RpcClient rpc) {
        this.context = Objects.requireNonNull(context, "context");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.rpc = Objects.requireNonNull(rpc, "rpc");
    }

    /**
     * Mints one compressed NFT.
     *
     * @param treeAddress    tree to mint into
     * @param name           NFT name
     * @param symbol         collection symbol
     * @param uri            metadata URI
     * @param creatorAddress creator wallet
     * @param royaltyShare   creator royalty share
     * @return the mint transaction's signature, or {@code NotInitialized}, {@code BuildFailed},
     *         {@code SubmitFailed}
     */
    public Outcome<TransactionSignature> mint(
            final String treeAddress,
            final String name,
            final String symbol,
            final String uri,
            final String creatorAddress,
            final int royaltyShare) {
        return mint(new MintRequest(treeAddress, name, symbol, uri, creatorAddress, royaltyShare));
    }

    public Outcome<TransactionSignature> mint(final MintRequest request) {
        Objects.requireNonNull(request, "request");
        final Outcome<Credential> credential = context.credential();
        if (credential instanceof Outcome.Err<Credential> err) {
            return withParameters(err.cast(), request);
        }

        DebugLogger.logTx(LogFormatter.formatMint(request.treeAddress(), request.name(), request.symbol()));

        final TransactionEnvelope envelope;
        try {
            envelope = builder.buildMint(credential.orElseThrow(), request);
        } catch (TransactionBuildException | RuntimeException e) {
            log.debug("Mint build failed for tree {}", request.treeAddress(), e);
            return withParameters(Outcome.err(new BubblegumError.BuildFailed("mint", e)), request);
        }

        final Outcome<TransactionSignature> submitted = rpc.submit(envelope);
        if (submitted instanceof Outcome.Err<TransactionSignature> err) {
            log.warn("Mint into tree {} failed: {}", request.treeAddress(), err.error().message());
            return withParameters(Outcome.err(new BubblegumError.SubmitFailed(err.error())), request);
        }
        return submitted;
    }

    private static Outcome<TransactionSignature> withParameters(
            final Outcome<TransactionSignature> outcome, final MintRequest request) {
        Outcome<TransactionSignature> result = outcome.withContext("operation", "mint");
        for (Map.Entry<String, String> param : request.describe().entrySet()) {
            result = result.withContext(param.getKey(), param.getValue());
        }
        return result;
    }
}
