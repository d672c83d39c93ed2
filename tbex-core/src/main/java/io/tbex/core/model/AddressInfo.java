// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.types.Wei;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Account detail record.
 *
 * <p>
 * Balance, nonce and contract-ness always come from the node. Every other field is
 * an enrichment and is independently {@code null} (or empty) when its probe failed or
 * did not apply.
 */
public record AddressInfo(
        Address address,
        Wei balance,
        long nonce,
        boolean isContract,
        @Nullable Integer codeSize,
        @Nullable Address proxyImplementation,
        @Nullable TokenInfo tokenInfo,
        @Nullable String name,
        @Nullable Address owner,
        List<TokenBalance> tokenBalances) {

    public AddressInfo {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(balance, "balance");
        tokenBalances = List.copyOf(tokenBalances);
    }
}
