// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of a compressed NFT mint.
 * <p>
 * Values are passed to the transaction builder as given; the builder decides what is
 * valid.
 *
 * @param treeAddress    the Merkle tree to mint into
 * @param name           NFT name
 * @param symbol         collection symbol
 * @param uri            metadata JSON URI
 * @param creatorAddress creator wallet address
 * @param royaltyShare   creator's royalty share
 */
public record MintRequest(
        String treeAddress,
        String name,
        String symbol,
        String uri,
        String creatorAddress,
        int royaltyShare) {

    public MintRequest {
        Objects.requireNonNull(treeAddress, "treeAddress");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(creatorAddress, "creatorAddress");
    }

    /**
     * The parameters as an ordered map, attached to failures for diagnostics.
     *
     * @return parameter name to value
     */
    public Map<String, String> describe() {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("treeAddress", treeAddress);
        params.put("name", name);
        params.put("symbol", symbol);
        params.put("uri", uri);
        params.put("creatorAddress", creatorAddress);
        params.put("royaltyShare", String.valueOf(royaltyShare));
        return params;
    }
}
