// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.types;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.bubblegum.primitives.Base58;

/**
 * Base58-encoded 32-byte account address (wallet, Merkle tree or program).
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Only characters of the base58 alphabet (no {@code 0}, {@code O}, {@code I}, {@code l})</li>
 * <li>Must decode to exactly 32 bytes</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    public static final int BYTE_LENGTH = 32;

    public Address {
        Objects.requireNonNull(value, "address");
        if (!Base58.isBase58(value)) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        if (Base58.decode(value).length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must decode to " + BYTE_LENGTH + " bytes: " + value);
        }
    }

    /**
     * Checks whether a string is a well-formed address without throwing.
     *
     * @param value candidate address text
     * @return {@code true} if {@code new Address(value)} would succeed
     */
    public static boolean isValid(final String value) {
        return value != null && Base58.isBase58(value) && Base58.decode(value).length == BYTE_LENGTH;
    }

    public byte[] toBytes() {
        return Base58.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Base58.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
