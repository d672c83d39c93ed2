// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A Transfer-shaped event lifted out of a receipt.
 *
 * <p>{@code symbol} and {@code decimals} are {@code null} unless resolved separately.
 */
public record TokenTransfer(
        Address token,
        Address from,
        Address to,
        BigInteger amount,
        @Nullable String symbol,
        @Nullable Integer decimals) {

    public TokenTransfer {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(amount, "amount");
    }
}
