// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.primitives;

import java.util.Arrays;

/**
 * Utility methods for Bitcoin-alphabet base58 encoding/decoding, the text form of
 * Solana addresses, hashes, signatures and secret keys.
 *
 * <p>The alphabet is {@code 123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz}:
 * digits and letters without {@code 0}, {@code O}, {@code I} and {@code l}. Each leading
 * zero byte is encoded as a leading {@code '1'} and vice versa.
 *
 * @since 0.1.0
 */
public final class Base58 {
    private static final char[] ALPHABET =
            "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final char ENCODED_ZERO = ALPHABET[0];
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    private Base58() {
        // Utility class
    }

    /**
     * Encode bytes as a base58 string.
     *
     * @param input the bytes to encode
     * @return the base58 text, empty for an empty input
     * @throws IllegalArgumentException if {@code input} is {@code null}
     */
    public static String encode(final byte[] input) {
        if (input == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        if (input.length == 0) {
            return "";
        }

        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            ++zeros;
        }

        // work on a copy, divmod mutates the number in place
        final byte[] number = Arrays.copyOf(input, input.length);
        final char[] encoded = new char[number.length * 2];
        int outputStart = encoded.length;
        for (int inputStart = zeros; inputStart < number.length; ) {
            encoded[--outputStart] = ALPHABET[divmod(number, inputStart, 256, 58)];
            if (number[inputStart] == 0) {
                ++inputStart;
            }
        }
        while (outputStart < encoded.length && encoded[outputStart] == ENCODED_ZERO) {
            ++outputStart;
        }
        while (--zeros >= 0) {
            encoded[--outputStart] = ENCODED_ZERO;
        }
        return new String(encoded, outputStart, encoded.length - outputStart);
    }

    /**
     * Decode a base58 string into bytes.
     *
     * @param input the base58 text
     * @return the decoded bytes, empty for an empty input
     * @throws IllegalArgumentException if the input is null or contains a character
     *                                  outside the base58 alphabet
     */
    public static byte[] decode(final String input) {
        if (input == null) {
            throw new IllegalArgumentException("base58 string cannot be null");
        }
        if (input.isEmpty()) {
            return new byte[0];
        }

        final byte[] input58 = new byte[input.length()];
        for (int i = 0; i < input.length(); ++i) {
            input58[i] = (byte) toDigit(input.charAt(i), input);
        }

        int zeros = 0;
        while (zeros < input58.length && input58[zeros] == 0) {
            ++zeros;
        }

        final byte[] decoded = new byte[input.length()];
        int outputStart = decoded.length;
        for (int inputStart = zeros; inputStart < input58.length; ) {
            decoded[--outputStart] = divmod(input58, inputStart, 58, 256);
            if (input58[inputStart] == 0) {
                ++inputStart;
            }
        }
        while (outputStart < decoded.length && decoded[outputStart] == 0) {
            ++outputStart;
        }
        return Arrays.copyOfRange(decoded, outputStart - zeros, decoded.length);
    }

    /**
     * Checks whether every character of the input belongs to the base58 alphabet.
     *
     * @param input the text to check
     * @return {@code true} for a non-empty string made only of base58 characters
     */
    public static boolean isBase58(final CharSequence input) {
        if (input == null || input.length() == 0) {
            return false;
        }
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (c >= 128 || INDEXES[c] < 0) {
                return false;
            }
        }
        return true;
    }

    private static int toDigit(final char c, final String source) {
        final int digit = c < 128 ? INDEXES[c] : -1;
        if (digit < 0) {
            throw new IllegalArgumentException("Invalid base58 character '" + c + "' in: " + source);
        }
        return digit;
    }

    /**
     * Divides the big-endian number held in {@code number[firstDigit..]} (digits in
     * {@code base}) by {@code divisor} in place and returns the remainder.
     */
    private static byte divmod(final byte[] number, final int firstDigit, final int base, final int divisor) {
        int remainder = 0;
        for (int i = firstDigit; i < number.length; i++) {
            final int digit = (int) number[i] & 0xFF;
            final int temp = remainder * base + digit;
            number[i] = (byte) (temp / divisor);
            remainder = temp % divisor;
        }
        return (byte) remainder;
    }
}
