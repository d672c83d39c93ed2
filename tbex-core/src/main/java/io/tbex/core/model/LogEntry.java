// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An event log as returned inside a transaction receipt.
 *
 * @param address         the emitting contract
 * @param topics          indexed topics; topic 0 is usually the event signature hash
 * @param data            non-indexed data (may be empty)
 * @param logIndex        position within the block, if reported
 * @param transactionHash the originating transaction, if reported
 */
public record LogEntry(
        Address address,
        List<Hash> topics,
        HexData data,
        @Nullable Long logIndex,
        @Nullable Hash transactionHash) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        topics = List.copyOf(topics);
    }

    public LogEntry(final Address address, final List<Hash> topics, final HexData data) {
        this(address, topics, data, null, null);
    }
}
