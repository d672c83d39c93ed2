// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.ens;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import io.tbex.core.crypto.Keccak256;
import io.tbex.core.types.Hash;

/**
 * ENS namehash: the 256-bit node identifier of a dotted name.
 *
 * <p>The node is computed by walking the labels right to left (TLD first), starting
 * from the zero node and repeatedly hashing {@code keccak(node ‖ keccak(label))}:
 *
 * <pre>{@code
 * Namehash.of("")            // 0x0000...0000
 * Namehash.of("eth")         // 0x93cdeb70...a93fc4ae
 * Namehash.of("vitalik.eth") // 0xee6c4522...53475835
 * }</pre>
 *
 * <p>Names are hashed as given; normalization (lowercasing, UTS-46) is the caller's job.
 */
public final class Namehash {

    private Namehash() {
    }

    public static Hash of(final String name) {
        Objects.requireNonNull(name, "name");
        byte[] node = new byte[32];
        if (name.isEmpty()) {
            return Hash.fromBytes(node);
        }
        final String[] labels = name.split("\\.", -1);
        for (int i = labels.length - 1; i >= 0; i--) {
            final byte[] labelHash = Keccak256.hash(labels[i].getBytes(StandardCharsets.UTF_8));
            node = Keccak256.hash(node, labelHash);
        }
        return Hash.fromBytes(node);
    }
}
