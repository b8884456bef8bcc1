// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.model;

import java.util.Objects;

import sh.bubblegum.core.types.Address;
import sh.bubblegum.core.types.TransactionEnvelope;

/**
 * Output of building a create-tree transaction: the signed transaction and the address
 * of the Merkle tree account it will create.
 *
 * @param envelope    the signed transaction
 * @param treeAddress the new tree's address
 */
public record TreeCreation(TransactionEnvelope envelope, Address treeAddress) {

    public TreeCreation {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(treeAddress, "treeAddress");
    }
}
