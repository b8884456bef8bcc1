// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.model;

import java.util.List;
import java.util.Objects;

import sh.bubblegum.core.types.Address;

/**
 * Everything a transaction builder needs to encode a compressed NFT transfer.
 * <p>
 * {@code root} and {@code proofPath} come from the same proof query and are passed
 * through unmodified.
 *
 * @param toAddress   new owner
 * @param assetId     the asset being transferred
 * @param leafId      leaf index (nonce) of the asset
 * @param dataHash    leaf data hash
 * @param creatorHash leaf creator hash
 * @param root        Merkle root the proof was computed against
 * @param proofPath   sibling hashes, leaf to root
 * @param treeAddress the tree holding the leaf
 */
public record TransferInstruction(
        Address toAddress,
        String assetId,
        long leafId,
        String dataHash,
        String creatorHash,
        String root,
        List<String> proofPath,
        Address treeAddress) {

    public TransferInstruction {
        Objects.requireNonNull(toAddress, "toAddress");
        Objects.requireNonNull(assetId, "assetId");
        Objects.requireNonNull(dataHash, "dataHash");
        Objects.requireNonNull(creatorHash, "creatorHash");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(proofPath, "proofPath");
        Objects.requireNonNull(treeAddress, "treeAddress");
        proofPath = List.copyOf(proofPath);
    }

    public static TransferInstruction of(
            final Address toAddress,
            final AssetRecord asset,
            final Compression compression,
            final AssetProof proof) {
        return new TransferInstruction(
                toAddress,
                asset.id(),
                compression.leafId(),
                compression.dataHash(),
                compression.creatorHash(),
                proof.root(),
                proof.proofPath(),
                compression.tree());
    }
}
