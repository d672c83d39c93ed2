// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.primitives;

/**
 * Hex codec for node payloads and 32-byte ABI words.
 *
 * <p>Decoding accepts an optional {@code 0x}/{@code 0X} prefix and mixed case.
 * Encoding always produces lowercase output.
 */
public final class Hex {

    /** Width of one ABI word (and of every log topic) in bytes. */
    public static final int WORD = 32;

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string into bytes.
     *
     * @param hexString the string to decode, with or without {@code 0x}
     * @return the decoded bytes, empty for {@code "0x"} or {@code ""}
     * @throws IllegalArgumentException if the input is null, of odd length, or not hex
     */
    public static byte[] decode(final String hexString) {
        final String digits = cleanPrefix(hexString);
        if ((digits.length() & 1) == 1) {
            throw new IllegalArgumentException("Hex string must have an even length: " + hexString);
        }
        final byte[] out = new byte[digits.length() / 2];
        for (int i = 0; i < out.length; i++) {
            final int high = nibble(digits.charAt(2 * i), hexString);
            final int low = nibble(digits.charAt(2 * i + 1), hexString);
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    /**
     * Encodes bytes as a {@code 0x}-prefixed lowercase hex string.
     *
     * @param bytes the bytes to encode
     * @return the hex string
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes a sub-range of bytes as a {@code 0x}-prefixed lowercase hex string.
     *
     * @param bytes the source bytes
     * @param from  first index, inclusive
     * @param to    last index, exclusive
     * @return the hex string
     */
    public static String encode(final byte[] bytes, final int from, final int to) {
        checkRange(bytes, from, to);
        final StringBuilder sb = new StringBuilder(2 + (to - from) * 2).append("0x");
        for (int i = from; i < to; i++) {
            appendByte(sb, bytes[i]);
        }
        return sb.toString();
    }

    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            appendByte(sb, b);
        }
        return sb.toString();
    }

    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    /**
     * Returns whether every byte in {@code [from, to)} is zero.
     *
     * <p>Used to tell left-padded addresses apart from full-width integers inside
     * 32-byte words.
     *
     * @param bytes the source bytes
     * @param from  first index, inclusive
     * @param to    last index, exclusive
     * @return true if the range is all zero (an empty range counts as zero)
     */
    public static boolean isZero(final byte[] bytes, final int from, final int to) {
        checkRange(bytes, from, to);
        for (int i = from; i < to; i++) {
            if (bytes[i] != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Left-pads a value to a full 32-byte word.
     *
     * @param bytes the value, at most 32 bytes
     * @return a new 32-byte array
     * @throws IllegalArgumentException if the value is longer than one word
     */
    public static byte[] leftPad(final byte[] bytes) {
        if (bytes.length > WORD) {
            throw new IllegalArgumentException("Value exceeds one word: " + bytes.length + " bytes");
        }
        final byte[] word = new byte[WORD];
        System.arraycopy(bytes, 0, word, WORD - bytes.length, bytes.length);
        return word;
    }

    private static void appendByte(final StringBuilder sb, final byte b) {
        sb.append(DIGITS[(b >>> 4) & 0x0F]).append(DIGITS[b & 0x0F]);
    }

    private static int nibble(final char c, final String input) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        throw new IllegalArgumentException("Invalid hex character in: " + input);
    }

    private static void checkRange(final byte[] bytes, final int from, final int to) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        if (from < 0 || to > bytes.length || from > to) {
            throw new IndexOutOfBoundsException(
                    "Range [" + from + ", " + to + ") out of bounds for length " + bytes.length);
        }
    }
}
