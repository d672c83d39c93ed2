// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import io.tbex.core.decode.BuilderTags;
import io.tbex.core.decode.SelectorDecoder;
import io.tbex.core.model.Block;
import io.tbex.core.model.BlockInfo;
import io.tbex.core.model.BlockStats;
import io.tbex.core.model.Transaction;
import io.tbex.core.model.TransactionReceipt;
import io.tbex.core.model.TxSummary;
import io.tbex.core.model.TxType;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.Wei;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.FailureReport;
import io.tbex.rpc.RetryExecutor;
import io.tbex.rpc.ens.NameResolver;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds block views.
 *
 * <p>
 * {@link #fetchBlock(long)} returns the header view with zero totals.
 * {@link #fetchBlockTransactions(long)} fetches the full block plus its receipts and
 * computes the per-block totals. Receipts are optional: when
 * {@code eth_getBlockReceipts} fails, fees are zero and no summary carries a fee.
 */
public final class BlockAssembler {

    private static final Logger log = LoggerFactory.getLogger(BlockAssembler.class);

    /**
     * Transactions of one block with the totals derived from them.
     */
    public record BlockTransactions(List<TxSummary> transactions, BlockStats stats) {
        public BlockTransactions {
            transactions = List.copyOf(transactions);
            Objects.requireNonNull(stats, "stats");
        }
    }

    private final ChainTransport transport;
    private final RetryExecutor retry;
    private final NameResolver names;

    public BlockAssembler(final ChainTransport transport, final RetryExecutor retry, final NameResolver names) {
        this.transport = transport;
        this.retry = retry;
        this.names = names;
    }

    public CompletableFuture<BlockInfo> fetchBlock(final long number) {
        final CompletableFuture<BlockInfo> info = retry
                .execute("eth_getBlockByNumber", () -> transport.getBlockByNumber(number, false))
                .thenApply(block -> toInfo(FetchFailures.requireFound(block, "Block", Long.toString(number))))
                .thenCompose(block -> names.lookupName(block.miner()).thenApply(block::withMinerName));
        return FetchFailures.wrap(info, "fetch block", "#" + number);
    }

    public CompletableFuture<BlockTransactions> fetchBlockTransactions(final long number) {
        final CompletableFuture<BlockTransactions> result = retry
                .execute("eth_getBlockByNumber", () -> transport.getBlockByNumber(number, true))
                .thenApply(block -> FetchFailures.requireFound(block, "Block", Long.toString(number)))
                .thenCompose(block -> names.lookupNames(participants(block.transactions()))
                        .thenCombine(receipts(number), (resolved, receipts) -> summarize(block, resolved, receipts)));
        return FetchFailures.wrap(result, "fetch transactions for block", "#" + number);
    }

    public CompletableFuture<List<Hash>> blockTransactionHashes(final long number) {
        final CompletableFuture<List<Hash>> hashes = retry
                .execute("eth_getBlockByNumber", () -> transport.getBlockByNumber(number, false))
                .thenApply(block -> FetchFailures.requireFound(block, "Block", Long.toString(number)).transactionHashes());
        return FetchFailures.wrap(hashes, "fetch transaction hashes for block", "#" + number);
    }

    static BlockInfo toInfo(final Block block) {
        return new BlockInfo(
                block.number(),
                block.hash(),
                block.parentHash(),
                block.timestamp(),
                block.gasUsed(),
                block.gasLimit(),
                block.baseFeePerGas(),
                block.miner(),
                null,
                BuilderTags.detect(block.extraData(), block.miner()),
                block.stateRoot(),
                block.receiptsRoot(),
                block.transactionsRoot(),
                block.extraData(),
                BuilderTags.decodeExtraData(block.extraData()),
                block.size(),
                block.uncleCount(),
                block.withdrawalCount(),
                block.blobGasUsed(),
                block.excessBlobGas(),
                block.transactionCount(),
                Wei.ZERO,
                Wei.ZERO,
                Wei.ZERO,
                0);
    }

    private CompletableFuture<Map<Hash, TransactionReceipt>> receipts(final long number) {
        return retry.execute("eth_getBlockReceipts", () -> transport.getBlockReceipts(number))
                .handle((receipts, error) -> {
                    if (error != null) {
                        log.debug("Receipts for block #{} unavailable, fees omitted: {}", number, FailureReport.chain(error));
                        return Map.of();
                    }
                    if (receipts == null) {
                        return Map.of();
                    }
                    final Map<Hash, TransactionReceipt> byHash = new HashMap<>();
                    for (TransactionReceipt receipt : receipts) {
                        byHash.put(receipt.transactionHash(), receipt);
                    }
                    return byHash;
                });
    }

    private static List<Address> participants(final List<Transaction> transactions) {
        final Set<Address> addresses = new LinkedHashSet<>();
        for (Transaction tx : transactions) {
            addresses.add(tx.from());
            if (tx.to() != null) {
                addresses.add(tx.to());
            }
        }
        return new ArrayList<>(addresses);
    }

    static BlockTransactions summarize(
            final Block block, final Map<Address, String> resolved, final Map<Hash, TransactionReceipt> receipts) {
        Wei totalValue = Wei.ZERO;
        Wei totalFees = Wei.ZERO;
        int blobCount = 0;
        final List<TxSummary> summaries = new ArrayList<>(block.transactions().size());
        for (Transaction tx : block.transactions()) {
            totalValue = totalValue.plus(tx.value());
            blobCount += tx.blobVersionedHashes().size();
            final TransactionReceipt receipt = receipts.get(tx.hash());
            final Wei fee = receipt == null ? null : receipt.fee();
            if (fee != null) {
                totalFees = totalFees.plus(fee);
            }
            summaries.add(summary(tx, resolved, fee));
        }
        final Wei burnt = block.baseFeePerGas() == null ? Wei.ZERO : block.baseFeePerGas().times(block.gasUsed());
        return new BlockTransactions(summaries, new BlockStats(totalValue, totalFees, burnt, blobCount));
    }

    private static TxSummary summary(final Transaction tx, final Map<Address, String> resolved, final @Nullable Wei fee) {
        final byte[] input = tx.input().toBytes();
        final String signature = tx.to() == null ? null : SelectorDecoder.decode(input);
        return new TxSummary(
                tx.hash(),
                tx.from(),
                tx.to(),
                tx.value(),
                tx.gas(),
                TxType.fromTypeByte(tx.type()),
                tx.to() == null,
                resolved.get(tx.from()),
                tx.to() == null ? null : resolved.get(tx.to()),
                input.length,
                tx.to() == null ? null : SelectorDecoder.selectorHex(input),
                signature == null ? null : SelectorDecoder.shortName(signature),
                tx.blobVersionedHashes().size(),
                fee);
    }
}
