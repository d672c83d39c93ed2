// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.decode;

import io.tbex.core.crypto.Keccak256;
import io.tbex.core.types.Hash;
import org.jspecify.annotations.Nullable;

/**
 * Events recognized by topic 0.
 */
public enum EventSignature {
    TRANSFER("Transfer(address,address,uint256)"),
    APPROVAL("Approval(address,address,uint256)"),
    UNISWAP_V2_SWAP("Swap(address,uint256,uint256,uint256,uint256,address)"),
    UNISWAP_V3_SWAP("Swap(address,address,int256,int256,uint160,uint128,int24)"),
    WETH_DEPOSIT("Deposit(address,uint256)"),
    WETH_WITHDRAWAL("Withdrawal(address,uint256)");

    private final String signature;
    private final Hash topic;

    EventSignature(final String signature) {
        this.signature = signature;
        this.topic = Hash.fromBytes(Keccak256.hashUtf8(signature));
    }

    public String signature() {
        return signature;
    }

    /** {@code keccak256(signature)}. */
    public Hash topic() {
        return topic;
    }

    public static @Nullable EventSignature fromTopic(final Hash topic0) {
        for (EventSignature event : values()) {
            if (event.topic.equals(topic0)) {
                return event;
            }
        }
        return null;
    }
}
