// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Merkle proof for one asset: the sibling hashes from leaf to root and the root they
 * hash to, both taken from the same {@code getAssetProofBatch} entry.
 * <p>
 * The proof is a snapshot. Any change to the tree after it was fetched makes it stale.
 *
 * @param proofPath base58 sibling hashes, leaf to root
 * @param root      base58 root hash
 */
public record AssetProof(List<String> proofPath, String root) {

    public AssetProof {
        Objects.requireNonNull(proofPath, "proofPath");
        Objects.requireNonNull(root, "root");
        proofPath = List.copyOf(proofPath);
    }

    /**
     * Parses {@code result[assetId]} of a proof batch response.
     *
     * @param entry the keyed proof object, may be missing
     * @return the proof, or empty when {@code proof} or {@code root} is absent or malformed
     */
    public static Optional<AssetProof> fromJson(final JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        final JsonNode proof = entry.get("proof");
        final JsonNode root = entry.get("root");
        if (proof == null || !proof.isArray() || root == null || !root.isTextual() || root.asText().isEmpty()) {
            return Optional.empty();
        }
        final List<String> path = new ArrayList<>(proof.size());
        for (JsonNode hash : proof) {
            if (!hash.isTextual()) {
                return Optional.empty();
            }
            path.add(hash.asText());
        }
        return Optional.of(new AssetProof(path, root.asText()));
    }
}
