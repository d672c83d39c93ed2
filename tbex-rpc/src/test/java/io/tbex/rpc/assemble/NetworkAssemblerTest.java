// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.tbex.core.error.FetchException;
import io.tbex.core.error.RpcException;
import io.tbex.core.model.FeeHistory;
import io.tbex.core.model.NetworkSnapshot;
import io.tbex.core.types.Wei;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.FakeChainTransport;
import io.tbex.rpc.InlineRetry;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class NetworkAssemblerTest {

    private final FakeChainTransport transport = new FakeChainTransport().head(19_500_000L).gasPrice(Wei.gwei(25));
    private final NetworkAssembler assembler = new NetworkAssembler(transport, InlineRetry.create());

    @Test
    void snapshotIncludesFeeTrendAndLatestPercentiles() {
        transport.clientVersion("Nethermind/v1.25.4")
                .feeHistory(new FeeHistory(19_499_996L,
                        List.of(Wei.gwei(10), Wei.gwei(11), Wei.gwei(12), Wei.gwei(13), Wei.gwei(14), Wei.gwei(15)),
                        List.of(0.4, 0.5, 0.6, 0.5, 0.5),
                        List.of(
                                List.of(Wei.gwei(1), Wei.gwei(2), Wei.gwei(3)),
                                List.of(Wei.gwei(4), Wei.gwei(5), Wei.gwei(6)))));

        final NetworkSnapshot snapshot = assembler.fetchSnapshot().join();

        assertEquals(19_500_000L, snapshot.latestBlock());
        assertEquals(Wei.gwei(25), snapshot.gasPrice());
        assertEquals("Nethermind/v1.25.4", snapshot.clientVersion());
        assertEquals(6, snapshot.baseFeeTrend().size());
        assertEquals(List.of(Wei.gwei(4), Wei.gwei(5), Wei.gwei(6)), snapshot.priorityFeePercentiles());
    }

    @Test
    void optionalPartsDegrade() {
        transport.failing("web3_clientVersion", new RpcException(-32601, "method not found", null, null));

        final NetworkSnapshot snapshot = assembler.fetchSnapshot().join();

        assertEquals("Unknown", snapshot.clientVersion());
        assertNull(snapshot.baseFeeTrend());
        assertNull(snapshot.priorityFeePercentiles());
    }

    @Test
    void feeHistoryWithoutRewardsHasNoPercentiles() {
        transport.feeHistory(new FeeHistory(1L, List.of(Wei.gwei(1)), List.of(), List.of()));

        final NetworkSnapshot snapshot = assembler.fetchSnapshot().join();

        assertEquals(List.of(Wei.gwei(1)), snapshot.baseFeeTrend());
        assertNull(snapshot.priorityFeePercentiles());
    }

    @Test
    void gasPriceFailureFailsSnapshot() {
        transport.failing("eth_gasPrice", new RpcException(-32000, "internal error", null, null));

        final CompletionException thrown = assertThrows(CompletionException.class, () -> assembler.fetchSnapshot().join());

        final FetchException fetch = assertInstanceOf(FetchException.class, thrown.getCause());
        assertEquals("Failed to fetch network info from http://fake-node.local", fetch.getMessage());
    }

    @Test
    void failureTargetHidesEndpointKey() {
        final ChainTransport keyed = mock(ChainTransport.class);
        when(keyed.endpoint()).thenReturn("https://eth-mainnet.g.alchemy.com/v2/abcdefghijklmnopqrstuvwxyz123456");
        when(keyed.blockNumber()).thenThrow(new RpcException(-32601, "method not found", null, null));

        final CompletionException thrown = assertThrows(CompletionException.class,
                () -> new NetworkAssembler(keyed, InlineRetry.create()).fetchSnapshot().join());

        final FetchException fetch = assertInstanceOf(FetchException.class, thrown.getCause());
        assertEquals("Failed to fetch network info from https://eth-mainnet.g.alchemy.com/v2/***", fetch.getMessage());
    }
}
