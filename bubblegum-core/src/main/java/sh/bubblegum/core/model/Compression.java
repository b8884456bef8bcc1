// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.model;

import java.util.Objects;

import sh.bubblegum.core.types.Address;

/**
 * The {@code compression} block of a DAS asset: where the asset's leaf lives and the
 * hashes the leaf was built from.
 *
 * @param creatorHash base58 hash of the creators array
 * @param dataHash    base58 hash of the metadata
 * @param leafId      leaf index (nonce) in the tree
 * @param tree        the Merkle tree holding the leaf
 */
public record Compression(String creatorHash, String dataHash, long leafId, Address tree) {

    public Compression {
        Objects.requireNonNull(creatorHash, "creatorHash");
        Objects.requireNonNull(dataHash, "dataHash");
        Objects.requireNonNull(tree, "tree");
        if (leafId < 0) {
            throw new IllegalArgumentException("leafId cannot be negative: " + leafId);
        }
    }
}
