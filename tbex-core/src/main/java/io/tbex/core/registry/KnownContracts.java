// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.registry;

import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;

/**
 * Mainnet contract addresses and storage slots the engine relies on.
 */
public final class KnownContracts {

    /** ENS ReverseRecords aggregator exposing {@code getNames(address[])}. */
    public static final Address ENS_REVERSE_RECORDS = new Address("0x3671aE578E63FdF66ad4F3E12CC0c0d71Ac7510C");

    /** ENS registry exposing {@code resolver(bytes32)}. */
    public static final Address ENS_REGISTRY = new Address("0x00000000000C2E074eC69A0dFb2997BA6C7d2e1e");

    /** EIP-1967 implementation slot: {@code keccak256("eip1967.proxy.implementation") - 1}. */
    public static final Hash EIP1967_IMPLEMENTATION_SLOT =
            new Hash("0x360894a13ba1a3210667c828492db98dca3e2076cc3735a920a3ca505d382bbc");

    private KnownContracts() {
    }
}
