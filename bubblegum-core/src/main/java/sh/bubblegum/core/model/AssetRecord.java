// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.model;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.bubblegum.core.types.Address;

/**
 * One asset from a {@code getAssetBatch} response.
 * <p>
 * Only the fields a transfer needs are kept. Records are never cached: every transfer
 * attempt fetches a fresh one.
 *
 * @param id          the asset id
 * @param owner       {@code ownership.owner} as returned by the node, {@code null} when absent
 * @param compression the parsed {@code compression} block, {@code null} when the asset is not
 *                    compressed or the block is incomplete
 * @param compressionIssue why {@code compression} is {@code null}, {@code null} otherwise
 */
public record AssetRecord(
        String id,
        @Nullable String owner,
        @Nullable Compression compression,
        @Nullable String compressionIssue) {

    public AssetRecord {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Parses a single element of the {@code result} array.
     *
     * @param fallbackId asset id to use when the element has no {@code id}
     * @param node       the asset JSON object
     * @return the record
     */
    public static AssetRecord fromJson(final String fallbackId, final JsonNode node) {
        Objects.requireNonNull(node, "node");
        final String id = text(node, "id") != null ? text(node, "id") : fallbackId;
        final String owner = text(node.path("ownership"), "owner");

        final JsonNode c = node.get("compression");
        if (c == null || !c.isObject()) {
            return new AssetRecord(id, owner, null, "missing compression block");
        }
        final String creatorHash = text(c, "creator_hash");
        final String dataHash = text(c, "data_hash");
        final String tree = text(c, "tree");
        final JsonNode leafId = c.get("leaf_id");
        if (creatorHash == null || dataHash == null || tree == null || leafId == null) {
            return new AssetRecord(id, owner, null, "incomplete compression block " + c);
        }
        if (!leafId.isIntegralNumber() || !leafId.canConvertToLong() || leafId.asLong() < 0) {
            return new AssetRecord(id, owner, null, "invalid leaf_id " + leafId);
        }
        if (!Address.isValid(tree)) {
            return new AssetRecord(id, owner, null, "invalid tree address " + tree);
        }
        return new AssetRecord(id, owner,
                new Compression(creatorHash, dataHash, leafId.asLong(), new Address(tree)), null);
    }

    public boolean isCompressed() {
        return compression != null;
    }

    private static @Nullable String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        final String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
