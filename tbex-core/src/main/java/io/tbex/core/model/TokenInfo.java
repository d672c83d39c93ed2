// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Token metadata read from a contract. Present only when both {@code symbol()} and
 * {@code decimals()} answered.
 */
public record TokenInfo(
        @Nullable String name,
        String symbol,
        int decimals,
        @Nullable BigInteger totalSupply) {

    public TokenInfo {
        Objects.requireNonNull(symbol, "symbol");
    }
}
