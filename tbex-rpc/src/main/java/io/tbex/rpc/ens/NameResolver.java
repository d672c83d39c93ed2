// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.ens;

import io.tbex.core.abi.AbiCodec;
import io.tbex.core.ens.Namehash;
import io.tbex.core.error.NameResolutionException;
import io.tbex.core.registry.KnownContracts;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.FailureReport;
import io.tbex.rpc.RetryExecutor;
import io.tbex.rpc.internal.Futures;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ENS lookups in both directions.
 *
 * <p>
 * Reverse lookups use the ReverseRecords aggregator, which answers a whole batch of
 * addresses with one {@code getNames(address[])} call; addresses without a primary
 * name come back as empty strings and are left out of the result. Reverse lookups are
 * enrichment: any failure yields an empty map.
 *
 * <p>
 * Forward lookups walk the registry: {@code resolver(namehash)} on the ENS registry,
 * then {@code addr(namehash)} on the returned resolver. A zero address at either step,
 * or a failed call, completes the future with a {@link NameResolutionException}.
 */
public final class NameResolver {

    private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

    private static final String GET_NAMES = "getNames(address[])";
    private static final String RESOLVER = "resolver(bytes32)";
    private static final String ADDR = "addr(bytes32)";

    private final ChainTransport transport;
    private final RetryExecutor retry;

    public NameResolver(final ChainTransport transport, final RetryExecutor retry) {
        this.transport = transport;
        this.retry = retry;
    }

    /**
     * Reverse-resolves a batch of addresses in one call.
     *
     * @return address to primary name, only for addresses that have one; never fails
     */
    public CompletableFuture<Map<Address, String>> lookupNames(final List<Address> addresses) {
        if (addresses.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        final HexData call = AbiCodec.encodeAddressArrayCall(GET_NAMES, addresses);
        return retry.execute("ENS getNames", () -> transport.call(KnownContracts.ENS_REVERSE_RECORDS, call))
                .thenApply(response -> pairNames(addresses, AbiCodec.decodeStringArray(response.toBytes())))
                .exceptionally(error -> {
                    log.debug("Reverse name lookup for {} addresses failed: {}",
                            addresses.size(), FailureReport.chain(error));
                    return Map.of();
                });
    }

    /**
     * Reverse-resolves one address.
     *
     * @return a future completing with the name, or with {@code null} if there is none
     */
    public CompletableFuture<String> lookupName(final Address address) {
        return lookupNames(List.of(address)).thenApply(names -> names.get(address));
    }

    /**
     * Forward-resolves {@code name} to an address.
     *
     * @return a future failing with {@link NameResolutionException} if the name has no
     *         resolver, does not resolve, or a lookup call fails
     */
    public CompletableFuture<Address> resolve(final String name) {
        final Hash node = Namehash.of(name);
        final HexData resolverCall = AbiCodec.encodeCall(RESOLVER, AbiCodec.word(node));
        return retry.execute("ENS resolver", () -> transport.call(KnownContracts.ENS_REGISTRY, resolverCall))
                .handle((response, error) -> {
                    if (error != null) {
                        throw failure("Failed to query ENS registry for " + name, name,
                                NameResolutionException.Step.REGISTRY_LOOKUP, error);
                    }
                    final Address resolver = decodeAddress(response, name, NameResolutionException.Step.REGISTRY_LOOKUP);
                    if (resolver.isZero()) {
                        throw new CompletionException(new NameResolutionException(
                                "No resolver found for ENS name: " + name, name,
                                NameResolutionException.Step.REGISTRY_LOOKUP, null));
                    }
                    return resolver;
                })
                .thenCompose(resolver -> {
                    final HexData addrCall = AbiCodec.encodeCall(ADDR, AbiCodec.word(node));
                    return retry.execute("ENS addr", () -> transport.call(resolver, addrCall));
                })
                .handle((response, error) -> {
                    if (error != null) {
                        final Throwable cause = Futures.unwrap(error);
                        if (cause instanceof NameResolutionException) {
                            throw new CompletionException(cause);
                        }
                        throw failure("Failed to query ENS resolver for " + name, name,
                                NameResolutionException.Step.RESOLVER_LOOKUP, cause);
                    }
                    final Address resolved = decodeAddress(response, name, NameResolutionException.Step.RESOLVER_LOOKUP);
                    if (resolved.isZero()) {
                        throw new CompletionException(new NameResolutionException(
                                "ENS name " + name + " does not resolve to an address", name,
                                NameResolutionException.Step.RESOLVER_LOOKUP, null));
                    }
                    return resolved;
                });
    }

    private static Address decodeAddress(final HexData response, final String name, final NameResolutionException.Step step) {
        try {
            return AbiCodec.decodeAddress(response.toBytes());
        } catch (RuntimeException e) {
            throw failure("Failed to decode " + (step == NameResolutionException.Step.REGISTRY_LOOKUP
                    ? "resolver address" : "resolved address") + " for " + name, name, step, e);
        }
    }

    private static CompletionException failure(
            final String message, final String name, final NameResolutionException.Step step, final Throwable cause) {
        return new CompletionException(new NameResolutionException(message, name, step, Futures.unwrap(cause)));
    }

    private static Map<Address, String> pairNames(final List<Address> addresses, final List<String> names) {
        final Map<Address, String> result = new LinkedHashMap<>();
        final int count = Math.min(addresses.size(), names.size());
        for (int i = 0; i < count; i++) {
            final String name = names.get(i);
            if (!name.isEmpty()) {
                result.put(addresses.get(i), name);
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
