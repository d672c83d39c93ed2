// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import static io.tbex.rpc.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import io.tbex.core.model.AddressInfo;
import io.tbex.core.registry.KnownContracts;
import io.tbex.core.types.Address;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class ExplorerTest {

    private static final Address MINER = address(0x3e);
    private static final Address ALICE = address(0xa1);
    private static final Address BOB = address(0xb2);
    private static final Address RESOLVER = address(0x4e5);

    private final FakeChainTransport transport = new FakeChainTransport();
    private final Explorer explorer = new Explorer(transport, InlineRetry.create(), Runnable::run, Duration.ofSeconds(5));

    @Test
    void blockWithTransactionsMergesTotals() {
        transport.block(block(500, Wei.gwei(2), 42_000L, MINER, text("titanbuilder.xyz"), List.of(
                        transfer(hash(1), ALICE, BOB, Wei.of(10)),
                        transfer(hash(2), BOB, ALICE, Wei.of(20)))))
                .blockReceipts(500, List.of(
                        receipt(hash(1), 21_000L, Wei.gwei(3), List.of()),
                        receipt(hash(2), 21_000L, Wei.gwei(3), List.of())));

        final Explorer.BlockWithTransactions result = explorer.blockWithTransactions(500).join();

        assertEquals("Titan", result.block().builderTag());
        assertEquals(2, result.block().transactionCount());
        assertEquals(Wei.of(30), result.block().totalValue());
        assertEquals(Wei.gwei(3).times(42_000L), result.block().totalFees());
        assertEquals(Wei.gwei(2).times(42_000L), result.block().burntFees());
        assertEquals(2, result.transactions().size());
    }

    @Test
    void resolvesNameThenFetchesAddress() {
        transport.onCall(KnownContracts.ENS_REGISTRY, "resolver(bytes32)", AbiResponses.address(RESOLVER))
                .onCall(RESOLVER, "addr(bytes32)", AbiResponses.address(ALICE))
                .onCall(KnownContracts.ENS_REVERSE_RECORDS, "getNames(address[])",
                        AbiResponses.stringArray(List.of("alice.eth")))
                .account(ALICE, Wei.of(99), 3, HexData.EMPTY);

        final AddressInfo info = explorer.resolveAndFetchAddress("alice.eth").join();

        assertEquals(ALICE, info.address());
        assertEquals("alice.eth", info.name());
        assertEquals(Wei.of(99), info.balance());
    }

    @Test
    void describeRendersChainAndEndpoint() {
        final CompletionException thrown = assertThrows(CompletionException.class, () -> explorer.block(7).join());

        assertEquals("Failed to fetch block #7: Block 7 not found (RPC returned null)\n\nRPC: http://fake-node.local",
                explorer.describe(thrown));
    }

    @Test
    void closeLeavesBorrowedExecutorAlone() {
        transport.block(block(600, null, 0L, MINER, HexData.EMPTY, List.of(transfer(hash(3), ALICE, BOB, Wei.ZERO))));
        explorer.close();

        assertEquals(List.of(hash(3)), explorer.blockTransactionHashes(600).join());
    }
}
