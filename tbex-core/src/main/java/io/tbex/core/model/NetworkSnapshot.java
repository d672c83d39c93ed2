// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Wei;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Point-in-time view of the network.
 *
 * @param latestBlock            head block number
 * @param gasPrice               node's suggested gas price
 * @param clientVersion          node client string, {@code "Unknown"} if unavailable
 * @param baseFeeTrend           base fee over the recent window, {@code null} if fee history failed
 * @param priorityFeePercentiles 25th, 50th and 75th percentile tips of the latest block
 */
public record NetworkSnapshot(
        long latestBlock,
        Wei gasPrice,
        String clientVersion,
        @Nullable List<Wei> baseFeeTrend,
        @Nullable List<Wei> priorityFeePercentiles) {

    public NetworkSnapshot {
        Objects.requireNonNull(gasPrice, "gasPrice");
        Objects.requireNonNull(clientVersion, "clientVersion");
        baseFeeTrend = baseFeeTrend == null ? null : List.copyOf(baseFeeTrend);
        priorityFeePercentiles = priorityFeePercentiles == null ? null : List.copyOf(priorityFeePercentiles);
    }
}
