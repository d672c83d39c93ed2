// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import io.tbex.primitives.Hex;

/**
 * Hex-encoded 32-byte value: block and transaction hashes, log topics, namehash nodes
 * and storage words.
 * <p>
 * The value is stored in lowercase.
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = Pattern.compile("^0[xX][0-9a-fA-F]{64}$");

    /** All-zero hash; also the namehash of the empty name. */
    public static final Hash ZERO = new Hash("0x" + "0".repeat(64));

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = "0x" + value.substring(2).toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash(Hex.encode(bytes));
    }
}
