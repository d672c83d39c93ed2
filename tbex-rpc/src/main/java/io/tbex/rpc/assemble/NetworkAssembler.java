// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import io.tbex.core.LogSanitizer;
import io.tbex.core.model.FeeHistory;
import io.tbex.core.model.NetworkSnapshot;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.FailureReport;
import io.tbex.rpc.RetryExecutor;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the network overview: head block, gas price, client version and recent fees.
 *
 * <p>
 * Head block and gas price are required. The client version falls back to
 * {@value #UNKNOWN_CLIENT}; fee history is optional.
 */
public final class NetworkAssembler {

    private static final Logger log = LoggerFactory.getLogger(NetworkAssembler.class);

    static final String UNKNOWN_CLIENT = "Unknown";
    static final int FEE_HISTORY_BLOCKS = 5;
    static final List<Double> REWARD_PERCENTILES = List.of(25.0, 50.0, 75.0);

    private final ChainTransport transport;
    private final RetryExecutor retry;

    public NetworkAssembler(final ChainTransport transport, final RetryExecutor retry) {
        this.transport = transport;
        this.retry = retry;
    }

    public CompletableFuture<NetworkSnapshot> fetchSnapshot() {
        final CompletableFuture<NetworkSnapshot> snapshot = retry
                .execute("eth_blockNumber", transport::blockNumber)
                .thenCompose(head -> retry.execute("eth_gasPrice", transport::gasPrice)
                        .thenCompose(gasPrice -> clientVersion()
                                .thenCombine(feeHistory(), (client, fees) -> new NetworkSnapshot(
                                        head,
                                        gasPrice,
                                        client,
                                        fees == null ? null : fees.baseFeePerGas(),
                                        fees == null || fees.reward().isEmpty()
                                                ? null
                                                : fees.reward().get(fees.reward().size() - 1)))));
        return FetchFailures.wrap(snapshot, "fetch network info from",
                LogSanitizer.sanitize(transport.endpoint()));
    }

    private CompletableFuture<String> clientVersion() {
        return retry.execute("web3_clientVersion", transport::clientVersion)
                .exceptionally(error -> {
                    log.debug("Client version unavailable: {}", FailureReport.chain(error));
                    return UNKNOWN_CLIENT;
                });
    }

    private CompletableFuture<@Nullable FeeHistory> feeHistory() {
        return retry.execute("eth_feeHistory",
                        () -> transport.feeHistory(FEE_HISTORY_BLOCKS, "latest", REWARD_PERCENTILES))
                .exceptionally(error -> {
                    log.debug("Fee history unavailable: {}", FailureReport.chain(error));
                    return null;
                });
    }
}
