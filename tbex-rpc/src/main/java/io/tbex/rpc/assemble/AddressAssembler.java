// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import io.tbex.core.model.AddressInfo;
import io.tbex.core.model.TokenBalance;
import io.tbex.core.model.TokenInfo;
import io.tbex.core.types.Address;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.RetryExecutor;
import io.tbex.rpc.ens.NameResolver;
import io.tbex.rpc.inspect.ContractInspector;
import io.tbex.rpc.inspect.TokenBalanceScanner;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;

/**
 * Builds the account view of one address.
 *
 * <p>
 * Balance, nonce and code are read one after another and any failure among them fails
 * the whole view. Contracts are then probed for a proxy implementation, token metadata,
 * an owner and popular token balances; every address gets a reverse-name lookup. These
 * enrichments never fail the view: each one that does not answer is left empty.
 */
public final class AddressAssembler {

    private final ChainTransport transport;
    private final RetryExecutor retry;
    private final NameResolver names;
    private final ContractInspector inspector;
    private final TokenBalanceScanner scanner;

    public AddressAssembler(
            final ChainTransport transport,
            final RetryExecutor retry,
            final NameResolver names,
            final ContractInspector inspector,
            final TokenBalanceScanner scanner) {
        this.transport = transport;
        this.retry = retry;
        this.names = names;
        this.inspector = inspector;
        this.scanner = scanner;
    }

    public CompletableFuture<AddressInfo> fetchAddress(final Address address) {
        final CompletableFuture<AddressInfo> info = retry
                .execute("eth_getBalance", () -> transport.getBalance(address))
                .thenCompose(balance -> retry.execute("eth_getTransactionCount", () -> transport.getTransactionCount(address))
                        .thenCompose(nonce -> retry.execute("eth_getCode", () -> transport.getCode(address))
                                .thenCompose(code -> enrich(address, balance, nonce, code))));
        return FetchFailures.wrap(info, "fetch address", address.value());
    }

    private CompletableFuture<AddressInfo> enrich(
            final Address address, final Wei balance, final long nonce, final HexData code) {
        final boolean contract = !code.isEmpty();
        final CompletableFuture<@Nullable String> name = names.lookupName(address);
        if (!contract) {
            return name.thenApply(resolved ->
                    new AddressInfo(address, balance, nonce, false, null, null, null, resolved, null, List.of()));
        }
        final CompletableFuture<@Nullable Address> proxy = inspector.proxyImplementation(address);
        final CompletableFuture<@Nullable TokenInfo> token = inspector.tokenInfo(address);
        final CompletableFuture<@Nullable Address> owner = inspector.owner(address);
        final CompletableFuture<List<TokenBalance>> balances = scanner.scan(address);
        return CompletableFuture.allOf(name, proxy, token, owner, balances).thenApply(ignored -> new AddressInfo(
                address,
                balance,
                nonce,
                true,
                code.byteLength(),
                proxy.join(),
                token.join(),
                name.join(),
                owner.join(),
                balances.join()));
    }
}
