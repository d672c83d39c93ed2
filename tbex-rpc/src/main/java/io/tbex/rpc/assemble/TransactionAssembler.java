// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import io.tbex.core.decode.EventDecoder;
import io.tbex.core.decode.SelectorDecoder;
import io.tbex.core.model.Transaction;
import io.tbex.core.model.TransactionReceipt;
import io.tbex.core.model.TxInfo;
import io.tbex.core.model.TxType;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.Wei;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.FailureReport;
import io.tbex.rpc.RetryExecutor;
import io.tbex.rpc.ens.NameResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the detail view of one transaction.
 *
 * <p>
 * The transaction itself is required. Its receipt is not: a {@code null} receipt or a
 * failed receipt call yields a pending view without gas used, status, fee or logs.
 */
public final class TransactionAssembler {

    private static final Logger log = LoggerFactory.getLogger(TransactionAssembler.class);

    private final ChainTransport transport;
    private final RetryExecutor retry;
    private final NameResolver names;

    public TransactionAssembler(final ChainTransport transport, final RetryExecutor retry, final NameResolver names) {
        this.transport = transport;
        this.retry = retry;
        this.names = names;
    }

    public CompletableFuture<TxInfo> fetchTransaction(final Hash hash) {
        final CompletableFuture<TxInfo> info = retry
                .execute("eth_getTransactionByHash", () -> transport.getTransactionByHash(hash))
                .thenApply(tx -> FetchFailures.requireFound(tx, "Transaction", hash.value()))
                .thenCompose(tx -> receipt(hash)
                        .thenCombine(names.lookupNames(parties(tx)), (receipt, resolved) -> assemble(tx, receipt, resolved)));
        return FetchFailures.wrap(info, "fetch transaction", hash.value());
    }

    private CompletableFuture<@Nullable TransactionReceipt> receipt(final Hash hash) {
        return retry.execute("eth_getTransactionReceipt", () -> transport.getTransactionReceipt(hash))
                .exceptionally(error -> {
                    log.debug("Receipt for {} unavailable, treating as pending: {}", hash, FailureReport.chain(error));
                    return null;
                });
    }

    private static List<Address> parties(final Transaction tx) {
        final List<Address> parties = new ArrayList<>(2);
        parties.add(tx.from());
        if (tx.to() != null && !tx.to().equals(tx.from())) {
            parties.add(tx.to());
        }
        return parties;
    }

    static TxInfo assemble(
            final Transaction tx, final @Nullable TransactionReceipt receipt, final Map<Address, String> resolved) {
        final byte[] input = tx.input().toBytes();
        final EventDecoder.Result events = receipt == null
                ? new EventDecoder.Result(List.of(), List.of())
                : EventDecoder.decodeAll(receipt.logs());
        final Wei gasPrice = tx.gasPrice() != null || receipt == null ? tx.gasPrice() : receipt.effectiveGasPrice();
        return new TxInfo(
                tx.hash(),
                tx.blockNumber(),
                tx.transactionIndex(),
                tx.from(),
                tx.to(),
                tx.value(),
                tx.nonce(),
                tx.gas(),
                receipt == null ? null : receipt.gasUsed(),
                gasPrice,
                tx.maxFeePerGas(),
                tx.maxPriorityFeePerGas(),
                tx.maxFeePerBlobGas(),
                receipt == null ? null : receipt.blobGasUsed(),
                receipt == null ? null : receipt.blobGasPrice(),
                tx.blobVersionedHashes(),
                TxType.fromTypeByte(tx.type()),
                receipt == null ? null : receipt.status(),
                receipt == null ? null : receipt.contractAddress(),
                receipt == null ? null : receipt.logs().size(),
                tx.accessListSize(),
                tx.input(),
                tx.to() == null ? null : SelectorDecoder.selectorHex(input),
                SelectorDecoder.decode(input),
                events.logs(),
                events.tokenTransfers(),
                receipt == null || receipt.effectiveGasPrice() == null ? null : receipt.fee(),
                resolved.get(tx.from()),
                tx.to() == null ? null : resolved.get(tx.to()));
    }
}
