// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import io.tbex.primitives.Hex;

/**
 * Arbitrary-length byte payload such as call input, contract code, log data and
 * {@code eth_call} results.
 * <p>
 * Instances are immutable: the backing array is copied on the way in and out.
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0[xX]([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] bytes;

    public HexData(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.bytes = Hex.decode(value);
    }

    private HexData(final byte[] bytes) {
        this.bytes = bytes;
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    public String value() {
        return Hex.encode(bytes);
    }

    public int byteLength() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HexData other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "HexData[value=" + value() + ']';
    }
}
