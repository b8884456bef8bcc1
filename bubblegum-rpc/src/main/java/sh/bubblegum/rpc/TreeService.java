// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

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
import sh.bubblegum.core.model.TreeCreation;
import sh.bubblegum.core.types.Address;
import sh.bubblegum.core.types.TransactionSignature;

/**
 * Creates Merkle trees that compressed NFTs are minted into.
 *
 * <p>
 * Sequence: read the credential, build the create-tree transaction, submit it. The tree
 * address returned on success is the one the builder assigned, not anything from the
 * submit response. A failed submission is classified with a
 * {@link SubmitFailureClassifier}; {@code ExpiredBlockhash} means the caller should run
 * {@link #createTree()} again, which builds a fresh transaction.
 */
public final class TreeService {

    private static final Logger log = LoggerFactory.getLogger(TreeService.class);

    private final ConnectionContext context;
    private final TransactionBuilder builder;
    private final RpcClient rpc;
    private final SubmitFailureClassifier classifier;

    public TreeService(final ConnectionContext context, final TransactionBuilder builder, final RpcClient rpc) {
        this(context, builder, rpc, SubmitFailureClassifier.defaults());
    }

    public TreeService(
            final ConnectionContext context,
            final TransactionBuilder builder,
            final RpcClient rpc,
            final SubmitFailureClassifier classifier) {
        this.context = Objects.requireNonNull(context, "context");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.rpc = Objects.requireNonNull(rpc, "rpc");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Creates a new Merkle tree.
     *
     * @return the new tree's address, or {@code NotInitialized}, {@code BuildFailed},
     *         {@code InsufficientFunds}, {@code ExpiredBlockhash}, {@code UnknownSubmitFailure}
     */
    public Outcome<Address> createTree() {
        final Outcome<Credential> credential = context.credential();
        if (credential instanceof Outcome.Err<Credential> err) {
            return err.<Address>cast().withContext("operation", "createTree");
        }

        final TreeCreation creation;
        try {
            creation = builder.buildCreateTree(credential.orElseThrow());
        } catch (TransactionBuildException | RuntimeException e) {
            log.debug("Create-tree build failed", e);
            return failure(new BubblegumError.BuildFailed("createTree", e), null);
        }

        final Outcome<TransactionSignature> submitted = rpc.submit(creation.envelope());
        if (submitted instanceof Outcome.Err<TransactionSignature> err) {
            final BubblegumError classified = classifier.classify(err.error());
            log.warn("Tree creation for {} failed: {}", creation.treeAddress(), classified.message());
            Outcome<Address> failed = failure(classified, creation.treeAddress());
            for (var entry : err.context().entrySet()) {
                failed = failed.withContext(entry.getKey(), entry.getValue());
            }
            return failed;
        }

        DebugLogger.logTx(LogFormatter.formatTree(creation.treeAddress().value(), null));
        log.debug("Created tree {} in transaction {}", creation.treeAddress(), submitted.orElseThrow());
        return Outcome.ok(creation.treeAddress());
    }

    private static Outcome<Address> failure(final BubblegumError error, final Address treeAddress) {
        DebugLogger.logTx(LogFormatter.formatTree(null, error.kind()));
        final Outcome<Address> outcome = Outcome.<Address>err(error).withContext("operation", "createTree");
        return treeAddress == null ? outcome : outcome.withContext("treeAddress", treeAddress);
    }
}
