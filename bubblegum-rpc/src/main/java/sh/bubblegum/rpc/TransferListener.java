// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

/**
 * Observes state transitions of transfers run by a {@link TransferService}.
 *
 * <p>
 * Called synchronously on the transferring thread. Implementations must not throw.
 */
@FunctionalInterface
public interface TransferListener {

    /** Listener that ignores every transition. */
    TransferListener NONE = (assetId, from, to) -> { };

    void onTransition(String assetId, TransferState from, TransferState to);
}
