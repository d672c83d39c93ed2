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
 * Full detail record for one transaction.
 *
 * <p>
 * Receipt-dependent fields ({@code gasUsed}, {@code status}, {@code actualFee},
 * {@code contractCreated}, {@code logsCount}, {@code blobGasUsed},
 * {@code blobGasPrice}) are {@code null} while the transaction is pending or when the
 * receipt could not be retrieved; {@link #isPending()} reports that case.
 * {@code contractCreated} is additionally {@code null} for plain calls.
 */
public record TxInfo(
        Hash hash,
        @Nullable Long blockNumber,
        @Nullable Long txIndex,
        Address from,
        @Nullable Address to,
        Wei value,
        long nonce,
        long gasLimit,
        @Nullable Long gasUsed,
        @Nullable Wei gasPrice,
        @Nullable Wei maxFeePerGas,
        @Nullable Wei maxPriorityFeePerGas,
        @Nullable Wei maxFeePerBlobGas,
        @Nullable Long blobGasUsed,
        @Nullable Wei blobGasPrice,
        List<Hash> blobHashes,
        TxType txType,
        @Nullable Boolean status,
        @Nullable Address contractCreated,
        @Nullable Integer logsCount,
        int accessListSize,
        HexData input,
        @Nullable String methodSelector,
        @Nullable String decodedMethod,
        List<DecodedLog> decodedLogs,
        List<TokenTransfer> tokenTransfers,
        @Nullable Wei actualFee,
        @Nullable String fromName,
        @Nullable String toName) {

    public TxInfo {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(txType, "txType");
        Objects.requireNonNull(input, "input");
        blobHashes = List.copyOf(blobHashes);
        decodedLogs = List.copyOf(decodedLogs);
        tokenTransfers = List.copyOf(tokenTransfers);
    }

    public boolean isPending() {
        return status == null;
    }

    public boolean isContractCreation() {
        return to == null;
    }
}
