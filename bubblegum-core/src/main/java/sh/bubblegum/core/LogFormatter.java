// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core;

import static sh.bubblegum.core.AnsiColors.*;

/**
 * Log formatter for Bubblegum debug output.
 *
 * <p>
 * All logs use a bracketed {@code [OPERATION]} tag, shorten long base58 values to
 * {@code 3Kn6...xfEP} and print durations as {@code 1.50ms} or {@code 2.10s}.
 * Status symbols (✓ ✗) mark success and failure.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * DebugLogger.logRpc(LogFormatter.formatRpc("getAssetBatch", durationMicros));
 * // Output: [RPC] method=getAssetBatch duration=1.06ms
 *
 * DebugLogger.logTx(LogFormatter.formatTransferStep(assetId, "FETCHING_PROOF"));
 * // Output: [TRANSFER] asset=4mKS...MgZX state=FETCHING_PROOF
 * }</pre>
 *
 * <p>
 * All methods are thread-safe and free of side effects.
 *
 * @see AnsiColors
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at each end of a shortened value. */
    private static final int SHORTEN_KEEP = 4;

    /** Values up to this length are printed in full. */
    private static final int SHORTEN_THRESHOLD = 12;

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=getAssetBatch duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s %s",
                INDIGO, RESET,
                method,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=sendTransaction code=-32002 message=error duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: [TX-SEND] bytes=412
     */
    public static String formatTxSend(int sizeBytes) {
        return String.format(
                "%s[TX-SEND]%s bytes=%d",
                LAVENDER, RESET,
                sizeBytes);
    }

    /**
     * Format: ✓ [TX-SIGNATURE] signature=5VER...xQ2n duration=3.20ms
     */
    public static String formatTxSignature(String signature, long durationMicros) {
        return String.format(
                "%s✓%s %s[TX-SIGNATURE]%s signature=%s %s",
                TEAL, RESET,
                LAVENDER, RESET,
                shorten(signature),
                duration(durationMicros));
    }

    /**
     * Format: ✓ [TREE] tree=9WzD...L22F
     * or: ✗ [TREE] kind=ExpiredBlockhash
     */
    public static String formatTree(String treeAddress, String failureKind) {
        if (failureKind == null) {
            return String.format("%s✓%s %s[TREE]%s tree=%s", TEAL, RESET, AMBER, RESET, shorten(treeAddress));
        }
        return String.format("%s✗%s %s[TREE]%s kind=%s", CORAL, RESET, AMBER, RESET, failureKind);
    }

    /**
     * Format: [MINT] tree=9WzD...L22F name=My NFT symbol=MNFT
     */
    public static String formatMint(String treeAddress, String name, String symbol) {
        return String.format(
                "%s[MINT]%s tree=%s name=%s symbol=%s",
                AMBER, RESET,
                shorten(treeAddress), name, symbol);
    }

    /**
     * Format: [TRANSFER] asset=4mKS...MgZX state=FETCHING_PROOF
     */
    public static String formatTransferStep(String assetId, String state) {
        return String.format(
                "%s[TRANSFER]%s asset=%s state=%s",
                LAVENDER, RESET,
                shorten(assetId), state);
    }

    /**
     * Format: ✗ [TRANSFER] asset=4mKS...MgZX kind=NotOwner message=...
     */
    public static String formatTransferFailure(String assetId, String kind, String message) {
        return String.format(
                "%s✗%s %s[TRANSFER]%s asset=%s kind=%s message=%s%s%s",
                CORAL, RESET,
                LAVENDER, RESET,
                shorten(assetId), kind,
                CORAL, message, RESET);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    /**
     * Shortens an address, asset id or signature to {@code 3Kn6...xfEP}.
     *
     * @param value the full value
     * @return the shortened value, or the original if null or already short enough
     */
    static String shorten(String value) {
        if (value == null || value.length() <= SHORTEN_THRESHOLD) {
            return value;
        }
        return value.substring(0, SHORTEN_KEEP)
                + "..."
                + value.substring(value.length() - SHORTEN_KEEP);
    }
}
