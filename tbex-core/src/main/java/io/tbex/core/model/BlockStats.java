// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Wei;
import java.util.Objects;

/**
 * Totals derived from a block's transactions and receipts.
 *
 * @param totalValue sum of transferred ether
 * @param totalFees  sum of {@code gasUsed × effectiveGasPrice} over receipts
 * @param burntFees  {@code baseFee × block gasUsed}, zero before London
 * @param blobCount  number of blobs carried by the block
 */
public record BlockStats(Wei totalValue, Wei totalFees, Wei burntFees, int blobCount) {

    public static final BlockStats EMPTY = new BlockStats(Wei.ZERO, Wei.ZERO, Wei.ZERO, 0);

    public BlockStats {
        Objects.requireNonNull(totalValue, "totalValue");
        Objects.requireNonNull(totalFees, "totalFees");
        Objects.requireNonNull(burntFees, "burntFees");
    }
}
