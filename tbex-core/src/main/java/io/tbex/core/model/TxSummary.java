// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.Wei;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One row of a block's transaction list.
 *
 * @param methodSelector {@code 0x}-prefixed first four input bytes, for calls only
 * @param decodedMethod  method name without its argument list, if the selector is known
 * @param feePaid        from the receipt; {@code null} when receipts were unavailable
 */
public record TxSummary(
        Hash hash,
        Address from,
        @Nullable Address to,
        Wei value,
        long gasLimit,
        TxType txType,
        boolean contractCreation,
        @Nullable String fromName,
        @Nullable String toName,
        int inputSize,
        @Nullable String methodSelector,
        @Nullable String decodedMethod,
        int blobCount,
        @Nullable Wei feePaid) {

    public TxSummary {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(txType, "txType");
    }
}
