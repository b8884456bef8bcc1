// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import sh.bubblegum.core.crypto.Credential;
import sh.bubblegum.core.error.TransactionBuildException;
import sh.bubblegum.core.model.MintRequest;
import sh.bubblegum.core.model.TransferInstruction;
import sh.bubblegum.core.model.TreeCreation;
import sh.bubblegum.core.types.TransactionEnvelope;

/**
 * Encodes and signs Bubblegum program instructions into ready-to-submit transactions.
 *
 * <p>
 * This library does not implement instruction encoding; an implementation is supplied by
 * the application (a native binding, a remote signer, or a test double). Implementations
 * fetch their own recent blockhash, so every call produces a fresh transaction.
 *
 * <p>
 * Any failure (invalid credential, malformed address, internal fault) should be reported
 * with {@link TransactionBuildException}. The services also treat a
 * {@link RuntimeException} thrown from here as a build failure.
 */
public interface TransactionBuilder {

    /**
     * Builds the transaction that creates a new Merkle tree and its tree config.
     *
     * @param credential the payer and tree creator
     * @return the signed transaction and the address of the tree it creates
     * @throws TransactionBuildException if the transaction cannot be built
     */
    TreeCreation buildCreateTree(Credential credential) throws TransactionBuildException;

    /**
     * Builds a {@code mint_v1} transaction.
     *
     * @param credential the payer, leaf owner and tree delegate
     * @param request    metadata and target tree
     * @return the signed transaction
     * @throws TransactionBuildException if the transaction cannot be built
     */
    TransactionEnvelope buildMint(Credential credential, MintRequest request) throws TransactionBuildException;

    /**
     * Builds a {@code transfer} transaction for a compressed asset.
     *
     * @param credential  the current owner
     * @param instruction leaf data and proof fetched for this transfer
     * @return the signed transaction
     * @throws TransactionBuildException if the transaction cannot be built
     */
    TransactionEnvelope buildTransfer(Credential credential, TransferInstruction instruction)
            throws TransactionBuildException;
}
