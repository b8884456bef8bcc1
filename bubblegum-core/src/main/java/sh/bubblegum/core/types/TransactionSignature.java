// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.types;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transaction signature returned by {@code sendTransaction}, used as the transaction id.
 * <p>
 * The value is kept exactly as the node returned it.
 *
 * @since 0.1.0
 */
public record TransactionSignature(@JsonValue String value) {

    public TransactionSignature {
        Objects.requireNonNull(value, "signature");
        if (value.isBlank()) {
            throw new IllegalArgumentException("signature cannot be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
