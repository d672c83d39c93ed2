// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.util;

import io.tbex.core.types.Wei;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fixed-point display helpers for token and ether amounts.
 *
 * <p>All formatting is exact on the integer value; nothing goes through floating point
 * except {@link #formatGwei(Wei)}, whose output is rounded for display anyway.
 */
public final class Units {

    private static final BigInteger GWEI = BigInteger.TEN.pow(9);

    private Units() {
    }

    /**
     * Formats an unsigned integer scaled by {@code 10^decimals}. The fractional part is
     * zero-padded to {@code decimals} digits and trailing zeros are trimmed; zero prints
     * as {@code "0"}.
     *
     * <pre>{@code
     * formatUnits(1_500_000_000_000_000_000, 18)  // "1.5"
     * formatUnits(1_000_000, 6)                  // "1"
     * }</pre>
     */
    public static String formatUnits(final BigInteger value, final int decimals) {
        if (value.signum() == 0) {
            return "0";
        }
        if (decimals <= 0) {
            return value.toString();
        }
        final BigInteger[] parts = value.divideAndRemainder(BigInteger.TEN.pow(decimals));
        final String whole = parts[0].toString();
        if (parts[1].signum() == 0) {
            return whole;
        }
        final String fraction = padLeft(parts[1].toString(), decimals);
        return whole + "." + stripTrailingZeros(fraction);
    }

    /**
     * Formats a token amount with at most four fractional digits (truncated, not rounded).
     */
    public static String formatTokenAmount(final BigInteger value, final int decimals) {
        if (decimals <= 0) {
            return value.toString();
        }
        final BigInteger[] parts = value.divideAndRemainder(BigInteger.TEN.pow(decimals));
        final String whole = parts[0].toString();
        if (parts[1].signum() == 0) {
            return whole;
        }
        final String fraction = padLeft(parts[1].toString(), decimals);
        final String shown = stripTrailingZeros(fraction.substring(0, Math.min(4, fraction.length())));
        return shown.isEmpty() ? whole : whole + "." + shown;
    }

    /**
     * Ether with six fractional digits, e.g. {@code "1.500000 ETH"}.
     */
    public static String formatEther(final Wei wei) {
        return wei.toEther().setScale(6, RoundingMode.DOWN).toPlainString() + " ETH";
    }

    /**
     * Gwei with two fractional digits at or above one gwei, four below.
     */
    public static String formatGwei(final Wei wei) {
        final BigDecimal gwei = new BigDecimal(wei.value()).divide(new BigDecimal(GWEI));
        final int scale = gwei.compareTo(BigDecimal.ONE) >= 0 ? 2 : 4;
        return gwei.setScale(scale, RoundingMode.HALF_UP).toPlainString() + " gwei";
    }

    private static String padLeft(final String digits, final int width) {
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    private static String stripTrailingZeros(final String digits) {
        int end = digits.length();
        while (end > 0 && digits.charAt(end - 1) == '0') {
            end--;
        }
        return digits.substring(0, end);
    }
}
