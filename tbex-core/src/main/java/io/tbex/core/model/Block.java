// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A block as returned by {@code eth_getBlockByNumber}.
 *
 * <p>
 * When the block is fetched without bodies only {@code transactionHashes} is
 * populated; with bodies, {@code transactions} holds the full objects and
 * {@code transactionHashes} mirrors their hashes.
 *
 * <p>
 * {@code baseFeePerGas} is {@code null} before London, {@code withdrawalCount}
 * before Shanghai, and the blob gas fields before Cancun.
 */
public record Block(
        long number,
        Hash hash,
        Hash parentHash,
        long timestamp,
        long gasUsed,
        long gasLimit,
        @Nullable Wei baseFeePerGas,
        Address miner,
        Hash stateRoot,
        Hash receiptsRoot,
        Hash transactionsRoot,
        HexData extraData,
        @Nullable Long size,
        int uncleCount,
        @Nullable Integer withdrawalCount,
        @Nullable Long blobGasUsed,
        @Nullable Long excessBlobGas,
        List<Hash> transactionHashes,
        List<Transaction> transactions) {

    public Block {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(miner, "miner cannot be null");
        Objects.requireNonNull(extraData, "extraData cannot be null");
        transactionHashes = transactionHashes == null ? List.of() : List.copyOf(transactionHashes);
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public int transactionCount() {
        return Math.max(transactionHashes.size(), transactions.size());
    }
}
