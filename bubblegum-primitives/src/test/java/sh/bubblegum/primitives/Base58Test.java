// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.primitives;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class Base58Test {

    @Test
    @DisplayName("Encoding empty input and known vectors")
    void testEncodeKnownVectors() {
        assertEquals("", Base58.encode(new byte[] {}));
        assertEquals("2NEpo7TZRRrLZSi2U", Base58.encode("Hello World!".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("USm3fpXnKG5EUBx2ndxBDMPVciP5hGey2Jh4NDv6gmeo1LkMeiKrLJUUBk6Z",
                Base58.encode("The quick brown fox jumps over the lazy dog.".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void testLeadingZerosBecomeOnes() {
        assertEquals("1", Base58.encode(new byte[] {0}));
        assertEquals("111", Base58.encode(new byte[] {0, 0, 0}));
        assertEquals("11233QC4", Base58.encode(new byte[] {0, 0, 0x28, 0x7f, (byte) 0xb4, (byte) 0xcd}));
    }

    @Test
    void testDecodeKnownVectors() {
        assertArrayEquals(new byte[] {}, Base58.decode(""));
        assertArrayEquals("Hello World!".getBytes(StandardCharsets.US_ASCII), Base58.decode("2NEpo7TZRRrLZSi2U"));
        assertArrayEquals(new byte[] {0, 0, 0x28, 0x7f, (byte) 0xb4, (byte) 0xcd}, Base58.decode("11233QC4"));
    }

    @Test
    void testSystemProgramIdDecodesToZeroKey() {
        byte[] decoded = Base58.decode("11111111111111111111111111111111");
        assertEquals(32, decoded.length);
        assertArrayEquals(new byte[32], decoded);
        assertEquals("11111111111111111111111111111111", Base58.encode(new byte[32]));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc0def", "O1", "I1", "l1", "with space", "ü"})
    void testDecodeRejectsCharactersOutsideAlphabet(String input) {
        assertThrows(IllegalArgumentException.class, () -> Base58.decode(input));
        assertFalse(Base58.isBase58(input));
    }

    @Test
    void testIsBase58() {
        assertTrue(Base58.isBase58("3Kn6a9nJLW5324a5M3qW3xTpvnwGf7nKzBmpJVLYxfEP"));
        assertFalse(Base58.isBase58(""));
        assertFalse(Base58.isBase58(null));
    }

    @Test
    void testNullInputs() {
        assertThrows(IllegalArgumentException.class, () -> Base58.encode(null));
        assertThrows(IllegalArgumentException.class, () -> Base58.decode(null));
    }
}
