// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.types;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Serialized, signed transaction produced by a transaction builder.
 * <p>
 * The bytes are opaque to this library: they are only base64-encoded for
 * {@code sendTransaction}. The array is copied on the way in and out.
 *
 * @since 0.1.0
 */
public final class TransactionEnvelope {

    private final byte[] bytes;

    private TransactionEnvelope(final byte[] bytes) {
        this.bytes = bytes;
    }

    public static TransactionEnvelope of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "transaction bytes");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("transaction bytes cannot be empty");
        }
        return new TransactionEnvelope(bytes.clone());
    }

    /**
     * Wraps a transaction already encoded as base64.
     *
     * @param base64 standard base64 text
     * @return the envelope
     * @throws IllegalArgumentException if the text is not valid base64
     */
    public static TransactionEnvelope fromBase64(final String base64) {
        Objects.requireNonNull(base64, "base64 transaction");
        return of(Base64.getDecoder().decode(base64));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TransactionEnvelope other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "TransactionEnvelope{size=" + bytes.length + "}";
    }
}
