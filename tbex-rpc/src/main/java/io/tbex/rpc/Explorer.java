// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.model.AddressInfo;
import io.tbex.core.model.BlockInfo;
import io.tbex.core.model.NetworkSnapshot;
import io.tbex.core.model.TxInfo;
import io.tbex.core.model.TxSummary;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.rpc.assemble.AddressAssembler;
import io.tbex.rpc.assemble.BlockAssembler;
import io.tbex.rpc.assemble.NetworkAssembler;
import io.tbex.rpc.assemble.TransactionAssembler;
import io.tbex.rpc.ens.NameResolver;
import io.tbex.rpc.inspect.ContractInspector;
import io.tbex.rpc.inspect.TokenBalanceScanner;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading and decoding chain data from one JSON-RPC node.
 *
 * <p>
 * Every operation returns a {@link CompletableFuture} and never blocks the caller.
 * Node reads run on an I/O executor and are retried on transient failures; lookups
 * that only enrich a view (names, token metadata, balances of popular tokens) degrade
 * to empty fields instead of failing it.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (Explorer explorer = Explorer.connect("https://eth.example.com")) {
 *     BlockInfo block = explorer.block(19_000_000).join();
 *     AddressInfo vitalik = explorer.resolveAndFetchAddress("vitalik.eth").join();
 * }
 * }</pre>
 *
 * <h2>Failures</h2>
 * <p>
 * Futures of the primary reads fail with a {@link io.tbex.core.error.FetchException}
 * naming the operation and target; its cause is a
 * {@link io.tbex.core.error.NotFoundException} when the node answered {@code null}, or
 * a {@link io.tbex.rpc.exception.RetryFailedException} listing every attempt.
 * {@link #describe(Throwable)} renders such a failure for display.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are thread-safe. There is no cache and no request deduplication: every
 * call reads the node afresh and runs to completion even if nobody waits for it.
 */
public final class Explorer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Explorer.class);

    /**
     * A block header view merged with the totals of its transactions.
     */
    public record BlockWithTransactions(BlockInfo block, List<TxSummary> transactions) {
        public BlockWithTransactions {
            Objects.requireNonNull(block, "block");
            transactions = List.copyOf(transactions);
        }
    }

    private final ChainTransport transport;
    private final @Nullable ExecutorService ownedExecutor;
    private final NameResolver names;
    private final BlockAssembler blocks;
    private final TransactionAssembler transactions;
    private final AddressAssembler addresses;
    private final NetworkAssembler network;

    /**
     * Wires an explorer over an existing transport. The caller keeps ownership of
     * {@code ioExecutor}.
     */
    public Explorer(
            final ChainTransport transport,
            final RetryExecutor retry,
            final Executor ioExecutor,
            final Duration tokenScanTimeout) {
        this(transport, retry, ioExecutor, tokenScanTimeout, null);
    }

    private Explorer(
            final ChainTransport transport,
            final RetryExecutor retry,
            final Executor ioExecutor,
            final Duration tokenScanTimeout,
            final @Nullable ExecutorService ownedExecutor) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.ownedExecutor = ownedExecutor;
        this.names = new NameResolver(transport, retry);
        this.blocks = new BlockAssembler(transport, retry, names);
        this.transactions = new TransactionAssembler(transport, retry, names);
        this.addresses = new AddressAssembler(transport, retry, names,
                new ContractInspector(transport, retry),
                new TokenBalanceScanner(transport, ioExecutor, tokenScanTimeout));
        this.network = new NetworkAssembler(transport, retry);
    }

    /** Connects to {@code url} with default timeouts and retry settings. */
    public static Explorer connect(final String url) {
        return create(ExplorerConfig.builder(url).build());
    }

    /**
     * Connects over HTTP as described by {@code config}. The explorer owns its I/O
     * threads and releases them on {@link #close()}.
     */
    public static Explorer create(final ExplorerConfig config) {
        final ExecutorService io = TbexExecutors.newIoExecutor();
        final ChainTransport transport = new JsonRpcTransport(HttpTbexProvider.create(config.rpcConfig()));
        final RetryExecutor retry = new RetryExecutor(config.retry(), io);
        log.debug("Explorer connected to {}", transport.endpoint());
        return new Explorer(transport, retry, io, config.tokenScanTimeout(), io);
    }

    /** Block header view; the transaction totals are zero. */
    public CompletableFuture<BlockInfo> block(final long number) {
        return blocks.fetchBlock(number);
    }

    /** Transaction summaries of a block with its fee and value totals. */
    public CompletableFuture<BlockAssembler.BlockTransactions> blockTransactions(final long number) {
        return blocks.fetchBlockTransactions(number);
    }

    /**
     * Fetches the block, then its transactions, and merges the totals into the block view.
     */
    public CompletableFuture<BlockWithTransactions> blockWithTransactions(final long number) {
        return blocks.fetchBlock(number).thenCompose(block -> blocks.fetchBlockTransactions(number)
                .thenApply(txs -> new BlockWithTransactions(block.withStats(txs.stats()), txs.transactions())));
    }

    public CompletableFuture<List<Hash>> blockTransactionHashes(final long number) {
        return blocks.blockTransactionHashes(number);
    }

    public CompletableFuture<TxInfo> transaction(final Hash hash) {
        return transactions.fetchTransaction(hash);
    }

    public CompletableFuture<AddressInfo> address(final Address address) {
        return addresses.fetchAddress(address);
    }

    /** Forward-resolves an ENS name such as {@code "vitalik.eth"}. */
    public CompletableFuture<Address> resolveName(final String name) {
        return names.resolve(name);
    }

    /** Reverse-resolves an address; completes with {@code null} when it has no primary name. */
    public CompletableFuture<String> lookupName(final Address address) {
        return names.lookupName(address);
    }

    public CompletableFuture<AddressInfo> resolveAndFetchAddress(final String name) {
        return names.resolve(name).thenCompose(addresses::fetchAddress);
    }

    public CompletableFuture<NetworkSnapshot> network() {
        return network.fetchSnapshot();
    }

    public String endpoint() {
        return transport.endpoint();
    }

    /**
     * Renders {@code failure} with its full cause chain and the endpoint, credentials
     * removed.
     */
    public String describe(final Throwable failure) {
        return FailureReport.describe(failure, transport.endpoint());
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }
}
