// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Display record for a block.
 *
 * <p>
 * The derived totals ({@code totalValue}, {@code totalFees}, {@code burntFees},
 * {@code blobCount}) are zero when the block was fetched on its own and are filled in
 * by {@link #withStats(BlockStats)} once the block's transactions have been fetched.
 *
 * @param builderTag       block builder identified from extra data or miner address
 * @param extraDataDecoded extra data as text when it is printable ASCII
 */
public record BlockInfo(
        long number,
        Hash hash,
        Hash parentHash,
        long timestamp,
        long gasUsed,
        long gasLimit,
        @Nullable Wei baseFeePerGas,
        Address miner,
        @Nullable String minerName,
        @Nullable String builderTag,
        Hash stateRoot,
        Hash receiptsRoot,
        Hash transactionsRoot,
        HexData extraData,
        @Nullable String extraDataDecoded,
        @Nullable Long size,
        int uncleCount,
        @Nullable Integer withdrawalCount,
        @Nullable Long blobGasUsed,
        @Nullable Long excessBlobGas,
        int transactionCount,
        Wei totalValue,
        Wei totalFees,
        Wei burntFees,
        int blobCount) {

    public BlockInfo {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(miner, "miner");
        Objects.requireNonNull(extraData, "extraData");
        Objects.requireNonNull(totalValue, "totalValue");
        Objects.requireNonNull(totalFees, "totalFees");
        Objects.requireNonNull(burntFees, "burntFees");
    }

    /** Gas used as a percentage of the gas limit. */
    public double gasUsedPercent() {
        return gasLimit == 0 ? 0.0 : (gasUsed * 100.0) / gasLimit;
    }

    public BlockInfo withStats(final BlockStats stats) {
        return new BlockInfo(number, hash, parentHash, timestamp, gasUsed, gasLimit, baseFeePerGas, miner,
                minerName, builderTag, stateRoot, receiptsRoot, transactionsRoot, extraData, extraDataDecoded, size,
                uncleCount, withdrawalCount, blobGasUsed, excessBlobGas, transactionCount,
                stats.totalValue(), stats.totalFees(), stats.burntFees(), stats.blobCount());
    }

    public BlockInfo withMinerName(final @Nullable String name) {
        return new BlockInfo(number, hash, parentHash, timestamp, gasUsed, gasLimit, baseFeePerGas, miner,
                name, builderTag, stateRoot, receiptsRoot, transactionsRoot, extraData, extraDataDecoded, size,
                uncleCount, withdrawalCount, blobGasUsed, excessBlobGas, transactionCount,
                totalValue, totalFees, burntFees, blobCount);
    }
}
