// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Wei;
import java.util.List;

/**
 * Result of {@code eth_feeHistory}.
 *
 * @param oldestBlock   first block of the window
 * @param baseFeePerGas base fee per block; one entry longer than the window (next block)
 * @param gasUsedRatio  gas used / gas limit per block
 * @param reward        per block, the priority fee at each requested percentile
 */
public record FeeHistory(
        long oldestBlock,
        List<Wei> baseFeePerGas,
        List<Double> gasUsedRatio,
        List<List<Wei>> reward) {

    public FeeHistory {
        baseFeePerGas = baseFeePerGas == null ? List.of() : List.copyOf(baseFeePerGas);
        gasUsedRatio = gasUsedRatio == null ? List.of() : List.copyOf(gasUsedRatio);
        reward = reward == null ? List.of() : reward.stream().map(List::copyOf).toList();
    }
}
