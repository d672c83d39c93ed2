// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.Wei;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Receipt for an executed transaction.
 *
 * @param transactionHash   the executed transaction
 * @param blockNumber       the including block
 * @param status            {@code true} if execution succeeded, {@code false} if reverted
 * @param gasUsed           gas consumed by this transaction
 * @param effectiveGasPrice price actually paid per gas, if reported
 * @param contractAddress   deployed contract for creation transactions
 * @param logs              emitted events
 * @param blobGasUsed       blob gas consumed (blob transactions only)
 * @param blobGasPrice      blob gas price paid (blob transactions only)
 */
public record TransactionReceipt(
        Hash transactionHash,
        long blockNumber,
        boolean status,
        long gasUsed,
        @Nullable Wei effectiveGasPrice,
        @Nullable Address contractAddress,
        List<LogEntry> logs,
        @Nullable Long blobGasUsed,
        @Nullable Wei blobGasPrice) {

    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        logs = List.copyOf(logs);
    }

    /**
     * {@code gasUsed × effectiveGasPrice}; zero when the node did not report a price.
     */
    public Wei fee() {
        if (effectiveGasPrice == null) {
            return Wei.ZERO;
        }
        return effectiveGasPrice.times(gasUsed);
    }
}
