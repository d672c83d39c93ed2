// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.abi.AbiCodec;
import io.tbex.core.types.Address;
import io.tbex.core.types.HexData;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * ABI-encoded return values for stubbed {@code eth_call}s.
 */
public final class AbiResponses {

    private AbiResponses() {
    }

    public static HexData uint(final long value) {
        return uint(BigInteger.valueOf(value));
    }

    public static HexData uint(final BigInteger value) {
        return HexData.fromBytes(AbiCodec.word(value));
    }

    public static HexData address(final Address address) {
        return HexData.fromBytes(AbiCodec.word(address));
    }

    public static HexData string(final String value) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(AbiCodec.word(BigInteger.valueOf(32)));
        out.writeBytes(stringTail(value));
        return HexData.fromBytes(out.toByteArray());
    }

    public static HexData stringArray(final List<String> values) {
        final List<byte[]> tails = new ArrayList<>();
        for (String value : values) {
            tails.add(stringTail(value));
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(AbiCodec.word(BigInteger.valueOf(32)));
        out.writeBytes(AbiCodec.word(BigInteger.valueOf(values.size())));
        long offset = 32L * values.size();
        for (byte[] tail : tails) {
            out.writeBytes(AbiCodec.word(BigInteger.valueOf(offset)));
            offset += tail.length;
        }
        for (byte[] tail : tails) {
            out.writeBytes(tail);
        }
        return HexData.fromBytes(out.toByteArray());
    }

    private static byte[] stringTail(final String value) {
        final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        final int padded = ((utf8.length + 31) / 32) * 32;
        final byte[] tail = new byte[32 + padded];
        System.arraycopy(AbiCodec.word(BigInteger.valueOf(utf8.length)), 0, tail, 0, 32);
        System.arraycopy(utf8, 0, tail, 32, utf8.length);
        return tail;
    }
}
