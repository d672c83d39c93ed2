// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.abi;

import io.tbex.core.crypto.Keccak256;
import io.tbex.core.error.AbiDecodingException;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.primitives.Hex;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Word-level ABI codec for the handful of call shapes the engine issues.
 *
 * <p>
 * The engine never decodes against a full interface description. Calls it makes are
 * zero-argument getters, single {@code address} or {@code bytes32} arguments, and one
 * {@code address[]} argument; responses it reads are a single word, a
 * {@code string} or a {@code string[]}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HexData call = AbiCodec.encodeCall("balanceOf(address)", AbiCodec.word(holder));
 * BigInteger balance = AbiCodec.decodeUint(transport.call(token, call).toBytes());
 * }</pre>
 */
public final class AbiCodec {

    private static final int WORD = Hex.WORD;

    /** {@code 2^256 - 1}. */
    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private AbiCodec() {
    }

    /**
     * Builds calldata: the 4-byte selector of {@code signature} followed by the given
     * 32-byte head words.
     *
     * @param signature canonical function signature, e.g. {@code "owner()"}
     * @param words     already-encoded 32-byte words
     * @return the calldata
     */
    public static HexData encodeCall(final String signature, final byte[]... words) {
        return encodeCall(Keccak256.selector(signature), words);
    }

    public static HexData encodeCall(final byte[] selector, final byte[]... words) {
        Objects.requireNonNull(selector, "selector");
        if (selector.length != 4) {
            throw new IllegalArgumentException("Selector must be 4 bytes, got " + selector.length);
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream(4 + words.length * WORD);
        out.writeBytes(selector);
        for (byte[] word : words) {
            if (word.length != WORD) {
                throw new IllegalArgumentException("ABI head word must be 32 bytes, got " + word.length);
            }
            out.writeBytes(word);
        }
        return HexData.fromBytes(out.toByteArray());
    }

    /**
     * Encodes a call with a single dynamic {@code address[]} argument.
     */
    public static HexData encodeAddressArrayCall(final String signature, final List<Address> addresses) {
        final byte[][] words = new byte[2 + addresses.size()][];
        words[0] = word(BigInteger.valueOf(WORD));
        words[1] = word(BigInteger.valueOf(addresses.size()));
        for (int i = 0; i < addresses.size(); i++) {
            words[2 + i] = addresses.get(i).toWord();
        }
        return encodeCall(signature, words);
    }

    public static byte[] word(final Address address) {
        return address.toWord();
    }

    public static byte[] word(final Hash hash) {
        return hash.toBytes();
    }

    public static byte[] word(final BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Negative values are not supported: " + value);
        }
        final byte[] raw = value.toByteArray();
        // toByteArray may carry a leading sign byte
        final int start = (raw.length > WORD && raw[0] == 0) ? 1 : 0;
        return Hex.leftPad(Arrays.copyOfRange(raw, start, raw.length));
    }

    /**
     * Reads the first word as an unsigned integer.
     *
     * @throws AbiDecodingException if fewer than 32 bytes are present
     */
    public static BigInteger decodeUint(final byte[] data) {
        requireLength(data, WORD, "uint256");
        return uintAt(data, 0);
    }

    /**
     * Reads the first word, or returns zero when the data is shorter than a word.
     */
    public static BigInteger uintOrZero(final byte[] data, final int offset) {
        if (data.length < offset + WORD) {
            return BigInteger.ZERO;
        }
        return uintAt(data, offset);
    }

    public static BigInteger uintAt(final byte[] data, final int offset) {
        return new BigInteger(1, Arrays.copyOfRange(data, offset, offset + WORD));
    }

    /**
     * Reads the first word as an address (its low 20 bytes).
     *
     * @throws AbiDecodingException if fewer than 32 bytes are present
     */
    public static Address decodeAddress(final byte[] data) {
        requireLength(data, WORD, "address");
        return Address.fromWord(data, 0);
    }

    /**
     * Decodes a return value that is a single dynamic {@code string}.
     *
     * @throws AbiDecodingException if offsets or lengths point outside the data
     */
    public static String decodeString(final byte[] data) {
        requireLength(data, 2 * WORD, "string");
        final int offset = intAt(data, 0, "string offset");
        return stringAt(data, offset);
    }

    /**
     * Decodes a return value that is a single dynamic {@code string[]}.
     *
     * @throws AbiDecodingException if offsets or lengths point outside the data
     */
    public static List<String> decodeStringArray(final byte[] data) {
        requireLength(data, 2 * WORD, "string[]");
        final int arrayOffset = intAt(data, 0, "array offset");
        final int length = intAt(data, arrayOffset, "array length");
        final int headStart = arrayOffset + WORD;
        requireLength(data, headStart + (long) length * WORD, "string[] heads");
        final List<String> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            final int relative = intAt(data, headStart + i * WORD, "element offset");
            values.add(stringAt(data, headStart + relative));
        }
        return values;
    }

    private static String stringAt(final byte[] data, final int offset) {
        final int length = intAt(data, offset, "string length");
        final int start = offset + WORD;
        requireLength(data, (long) start + length, "string data");
        return new String(data, start, length, StandardCharsets.UTF_8);
    }

    private static int intAt(final byte[] data, final int offset, final String what) {
        if (offset < 0 || data.length < offset + WORD) {
            throw new AbiDecodingException(what + " out of bounds at " + offset + " (length " + data.length + ")");
        }
        final BigInteger value = uintAt(data, offset);
        if (value.bitLength() > 31) {
            throw new AbiDecodingException(what + " too large: " + value);
        }
        return value.intValue();
    }

    private static void requireLength(final byte[] data, final long required, final String what) {
        if (data.length < required) {
            throw new AbiDecodingException(
                    "Response too short for " + what + ": expected at least " + required + " bytes, got " + data.length);
        }
    }
}
