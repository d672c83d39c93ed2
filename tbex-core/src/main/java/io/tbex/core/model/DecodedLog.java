// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An event log with a best-effort interpretation attached.
 *
 * @param address   emitting contract
 * @param eventName canonical signature of a recognized event, {@code null} otherwise
 * @param params    decoded arguments in event argument order
 * @param topics    raw topics
 * @param data      raw data
 */
public record DecodedLog(
        Address address,
        @Nullable String eventName,
        List<DecodedParam> params,
        List<Hash> topics,
        HexData data) {

    public DecodedLog {
        Objects.requireNonNull(address, "address");
        params = List.copyOf(params);
        topics = List.copyOf(topics);
        Objects.requireNonNull(data, "data");
    }

    /** Event name without its argument list, e.g. {@code "Transfer"}. */
    public @Nullable String shortEventName() {
        if (eventName == null) {
            return null;
        }
        final int paren = eventName.indexOf('(');
        return paren < 0 ? eventName : eventName.substring(0, paren);
    }
}
