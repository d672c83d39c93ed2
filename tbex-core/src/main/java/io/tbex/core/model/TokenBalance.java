// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.util.Units;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Balance of one well-known token held by an address.
 */
public record TokenBalance(
        Address token,
        String symbol,
        String name,
        int decimals,
        BigInteger balance) {

    public TokenBalance {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(balance, "balance");
    }

    /** Balance with at most four fractional digits. */
    public String formatted() {
        return Units.formatTokenAmount(balance, decimals);
    }
}
