// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.error;

/**
 * Thrown by transaction builder implementations when a transaction cannot be encoded
 * or signed (invalid secret key, malformed address, blockhash lookup failure, ...).
 *
 * @since 0.1.0
 */
public class TransactionBuildException extends Exception {

    public TransactionBuildException(final String message) {
        super(message);
    }

    public TransactionBuildException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
