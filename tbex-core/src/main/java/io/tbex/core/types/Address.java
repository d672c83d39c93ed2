// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import io.tbex.primitives.Hex;

/**
 * Hex-encoded 20-byte Ethereum address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two addresses that differ only in checksum
 * casing are equal.
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = Pattern.compile("^0[xX][0-9a-fA-F]{40}$");

    /** The zero address, used by registries and accessors to mean "unset". */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = "0x" + value.substring(2).toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    /**
     * Returns this address left-padded to a 32-byte ABI word.
     *
     * @return a new 32-byte array
     */
    public byte[] toWord() {
        return Hex.leftPad(toBytes());
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    /**
     * Reads the low 20 bytes of the 32-byte word starting at {@code offset}.
     * <p>
     * The upper 12 bytes are ignored, matching how indexed address topics and
     * ABI-encoded address return values are laid out.
     *
     * @param data   the source bytes
     * @param offset start of the word
     * @return the address in the word
     * @throws IllegalArgumentException if fewer than 32 bytes are available at {@code offset}
     */
    public static Address fromWord(final byte[] data, final int offset) {
        if (data == null || offset < 0 || data.length - offset < Hex.WORD) {
            throw new IllegalArgumentException("Need a full 32-byte word at offset " + offset);
        }
        return new Address(Hex.encode(data, offset + Hex.WORD - BYTE_LENGTH, offset + Hex.WORD));
    }
}
