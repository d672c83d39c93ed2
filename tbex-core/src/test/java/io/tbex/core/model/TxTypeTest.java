// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class TxTypeTest {

    @Test
    void knownEnvelopes() {
        assertSame(TxType.LEGACY, TxType.fromTypeByte(0));
        assertSame(TxType.ACCESS_LIST, TxType.fromTypeByte(1));
        assertSame(TxType.EIP1559, TxType.fromTypeByte(2));
        assertSame(TxType.BLOB, TxType.fromTypeByte(3));
        assertEquals("EIP-1559 (Type 2)", TxType.EIP1559.label());
        assertEquals("Blob (Type 3)", TxType.BLOB.label());
    }

    @Test
    void unknownKeepsRawByte() {
        final TxType type = TxType.fromTypeByte(0x7e);
        assertEquals(TxType.Kind.UNKNOWN, type.kind());
        assertEquals(0x7e, type.rawType());
        assertEquals("Unknown", type.label());
    }
}
