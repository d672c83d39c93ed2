// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Hex quantity codec, JSON error data extraction and the shared {@link ObjectMapper}.
 *
 * <p><strong>Internal Use Only.</strong>
 */
public final class RpcUtils {

    /** Shared, thread-safe mapper for all JSON-RPC (de)serialization. */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
    }

    /**
     * Flattens nested error data ({@code {data: {data: "0x..."}}}) to its first string
     * leaf.
     *
     * @return the extracted string, or {@code null} if {@code dataValue} is null
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String) {
            return (String) dataValue;
        }
        if (dataValue instanceof Map<?, ?>) {
            return extractFromIterable(((Map<?, ?>) dataValue).values(), dataValue);
        }
        if (dataValue instanceof Iterable<?>) {
            return extractFromIterable((Iterable<?>) dataValue, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    public static @Nullable String stringValue(final @Nullable Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Decodes a hex quantity; {@code null} stays {@code null}, {@code ""} and
     * {@code "0x"} are zero.
     */
    public static @Nullable Long decodeHexLong(final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        final String normalized = strip(value.toString());
        if (normalized.isEmpty()) {
            return 0L;
        }
        return Long.parseUnsignedLong(normalized, 16);
    }

    public static long decodeHexLong(final @Nullable Object value, final long defaultValue) {
        final Long decoded = decodeHexLong(value);
        return decoded != null ? decoded : defaultValue;
    }

    public static BigInteger decodeHexBigInteger(final @Nullable String hex) {
        if (hex == null) {
            return BigInteger.ZERO;
        }
        final String normalized = strip(hex);
        if (normalized.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(normalized, 16);
    }

    public static String toQuantityHex(final BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static String toQuantityHex(final long value) {
        return "0x" + Long.toHexString(value);
    }

    private static String strip(final String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
