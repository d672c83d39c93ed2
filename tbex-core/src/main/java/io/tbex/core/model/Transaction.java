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
 * A transaction object as returned by the node.
 *
 * <p>
 * Fee fields depend on the envelope: legacy and access-list transactions carry
 * {@code gasPrice}; EIP-1559 and blob transactions carry the max fee fields (most
 * nodes also report the effective {@code gasPrice} once mined). Blob transactions
 * additionally carry {@code maxFeePerBlobGas} and versioned blob hashes.
 *
 * @param hash                 the transaction hash
 * @param blockNumber          the including block, or {@code null} while pending
 * @param transactionIndex     position in the block, or {@code null} while pending
 * @param from                 the sender
 * @param to                   the recipient, or {@code null} for contract creation
 * @param value                ether transferred
 * @param gas                  gas limit
 * @param gasPrice             legacy or effective gas price
 * @param maxFeePerGas         EIP-1559 fee cap
 * @param maxPriorityFeePerGas EIP-1559 tip cap
 * @param maxFeePerBlobGas     EIP-4844 blob fee cap
 * @param nonce                sender nonce
 * @param input                calldata
 * @param type                 raw envelope type byte (0 when absent)
 * @param accessListSize       number of access list entries
 * @param blobVersionedHashes  blob hashes (empty unless type 3)
 */
public record Transaction(
        Hash hash,
        @Nullable Long blockNumber,
        @Nullable Long transactionIndex,
        Address from,
        @Nullable Address to,
        Wei value,
        long gas,
        @Nullable Wei gasPrice,
        @Nullable Wei maxFeePerGas,
        @Nullable Wei maxPriorityFeePerGas,
        @Nullable Wei maxFeePerBlobGas,
        long nonce,
        HexData input,
        int type,
        int accessListSize,
        List<Hash> blobVersionedHashes) {

    public Transaction {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        blobVersionedHashes = blobVersionedHashes == null ? List.of() : List.copyOf(blobVersionedHashes);
    }
}
