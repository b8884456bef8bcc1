// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

/**
 * Steps of a single {@link TransferService#transfer(String, String)} call.
 *
 * <p>
 * A call starts in {@link #IDLE} and ends in {@link #DONE} or {@link #FAILED}. There is no
 * way back to {@code IDLE}: a failed transfer is retried by calling {@code transfer} again.
 */
public enum TransferState {
    IDLE,
    VALIDATING,
    FETCHING_ASSET,
    VERIFYING_OWNERSHIP,
    FETCHING_PROOF,
    BUILDING,
    SUBMITTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
