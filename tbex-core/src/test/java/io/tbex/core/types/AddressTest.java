// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tbex.primitives.Hex;
import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void normalizesToLowercase() {
        final Address checksummed = new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48");
        assertEquals("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", checksummed.value());
        assertEquals(checksummed, new Address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Address("a0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
    }

    @Test
    void wordRoundTrip() {
        final Address address = new Address("0xd8da6bf26964af9d7eed9e03e53415d37aa96045");
        final byte[] word = address.toWord();
        assertEquals(32, word.length);
        assertTrue(Hex.isZero(word, 0, 12));
        assertEquals(address, Address.fromWord(word, 0));
    }

    @Test
    void fromWordIgnoresUpperBytes() {
        final byte[] word = Hex.decode("0xffffffffffffffffffffffff" + "d8da6bf26964af9d7eed9e03e53415d37aa96045");
        assertEquals(new Address("0xd8da6bf26964af9d7eed9e03e53415d37aa96045"), Address.fromWord(word, 0));
    }

    @Test
    void fromWordRequiresFullWord() {
        assertThrows(IllegalArgumentException.class, () -> Address.fromWord(new byte[31], 0));
        assertThrows(IllegalArgumentException.class, () -> Address.fromWord(new byte[40], 10));
    }

    @Test
    void zero() {
        assertTrue(Address.ZERO.isZero());
        assertTrue(Address.fromBytes(new byte[20]).isZero());
    }
}
