// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    @DisplayName("Encoding empty and single bytes")
    void encodesBasicValues() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
        assertEquals("deadbeef", Hex.encodeNoPrefix(new byte[] {(byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef}));
    }

    @Test
    void encodesSubRange() {
        byte[] word = new byte[32];
        word[12] = 0x11;
        word[31] = 0x22;
        assertEquals("0x1100000000000000000000000000000000000022", Hex.encode(word, 12, 32));
    }

    @Test
    void decodesMixedCaseWithAndWithoutPrefix() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
        assertArrayEquals(new byte[] {}, Hex.decode("0x"));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeNoPrefix(null));
    }

    @Test
    void hasPrefixChecksBothCases() {
        assertTrue(Hex.hasPrefix("0x1"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("1"));
        assertFalse(Hex.hasPrefix(""));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void isZeroInspectsOnlyTheRange() {
        byte[] word = new byte[32];
        word[20] = 1;
        assertTrue(Hex.isZero(word, 0, 12));
        assertFalse(Hex.isZero(word, 12, 32));
        assertTrue(Hex.isZero(word, 5, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> Hex.isZero(word, 0, 33));
    }

    @Test
    void leftPadsToWord() {
        byte[] padded = Hex.leftPad(new byte[] {1, 2});
        assertEquals(32, padded.length);
        assertEquals(1, padded[30]);
        assertEquals(2, padded[31]);
        assertTrue(Hex.isZero(padded, 0, 30));
        assertThrows(IllegalArgumentException.class, () -> Hex.leftPad(new byte[33]));
    }
}
