// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.inspect;

import io.tbex.core.abi.AbiCodec;
import io.tbex.core.error.AbiDecodingException;
import io.tbex.core.model.TokenInfo;
import io.tbex.core.registry.KnownContracts;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.FailureReport;
import io.tbex.rpc.RetryExecutor;
import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort probes of a contract: EIP-1967 proxy slot, ERC-20 metadata and
 * {@code owner()}.
 *
 * <p>
 * No probe ever fails its future. A failed call or an undecodable answer completes
 * with {@code null} and is logged at DEBUG.
 */
public final class ContractInspector {

    private static final Logger log = LoggerFactory.getLogger(ContractInspector.class);

    private static final HexData NAME = AbiCodec.encodeCall("name()");
    private static final HexData SYMBOL = AbiCodec.encodeCall("symbol()");
    private static final HexData DECIMALS = AbiCodec.encodeCall("decimals()");
    private static final HexData TOTAL_SUPPLY = AbiCodec.encodeCall("totalSupply()");
    private static final HexData OWNER = AbiCodec.encodeCall("owner()");

    private final ChainTransport transport;
    private final RetryExecutor retry;

    public ContractInspector(final ChainTransport transport, final RetryExecutor retry) {
        this.transport = transport;
        this.retry = retry;
    }

    /**
     * Reads the EIP-1967 implementation slot.
     *
     * @return the implementation address, or {@code null} for a zero slot or a failed read
     */
    public CompletableFuture<@Nullable Address> proxyImplementation(final Address contract) {
        return probe(contract, "proxy slot",
                retry.execute("eth_getStorageAt",
                        () -> transport.getStorageAt(contract, KnownContracts.EIP1967_IMPLEMENTATION_SLOT)),
                ContractInspector::slotAddress);
    }

    /**
     * Probes {@code name()}, {@code symbol()}, {@code decimals()} and {@code totalSupply()}
     * independently.
     *
     * @return token metadata when both symbol and decimals decoded, otherwise {@code null}
     */
    public CompletableFuture<@Nullable TokenInfo> tokenInfo(final Address contract) {
        final CompletableFuture<@Nullable String> name = callProbe(contract, "name()", NAME, AbiCodec::decodeString);
        final CompletableFuture<@Nullable String> symbol = callProbe(contract, "symbol()", SYMBOL, AbiCodec::decodeString);
        final CompletableFuture<@Nullable Integer> decimals = callProbe(contract, "decimals()", DECIMALS, ContractInspector::decodeUint8);
        final CompletableFuture<@Nullable BigInteger> supply = callProbe(contract, "totalSupply()", TOTAL_SUPPLY, AbiCodec::decodeUint);

        return CompletableFuture.allOf(name, symbol, decimals, supply).thenApply(ignored -> {
            final String tokenSymbol = symbol.join();
            final Integer tokenDecimals = decimals.join();
            if (tokenSymbol == null || tokenDecimals == null) {
                return null;
            }
            return new TokenInfo(name.join(), tokenSymbol, tokenDecimals, supply.join());
        });
    }

    /**
     * @return the {@code owner()} address, or {@code null} when zero or unavailable
     */
    public CompletableFuture<@Nullable Address> owner(final Address contract) {
        return callProbe(contract, "owner()", OWNER, data -> {
            final Address owner = AbiCodec.decodeAddress(data);
            return owner.isZero() ? null : owner;
        });
    }

    private <T> CompletableFuture<@Nullable T> callProbe(
            final Address contract, final String probe, final HexData calldata, final Function<byte[], @Nullable T> decoder) {
        return probe(contract, probe,
                retry.execute("eth_call " + probe, () -> transport.call(contract, calldata)),
                response -> decoder.apply(response.toBytes()));
    }

    private static <R, T> CompletableFuture<@Nullable T> probe(
            final Address contract,
            final String probe,
            final CompletableFuture<R> call,
            final Function<R, @Nullable T> decoder) {
        return call.thenApply(decoder).exceptionally(error -> {
            log.debug("{} probe failed for {}: {}", probe, contract, FailureReport.chain(error));
            return null;
        });
    }

    private static @Nullable Address slotAddress(final Hash slot) {
        final Address implementation = Address.fromWord(slot.toBytes(), 0);
        return implementation.isZero() ? null : implementation;
    }

    private static Integer decodeUint8(final byte[] data) {
        if (data.length < 32) {
            throw new AbiDecodingException("uint8 return too short: " + data.length + " bytes");
        }
        return data[31] & 0xff;
    }
}
