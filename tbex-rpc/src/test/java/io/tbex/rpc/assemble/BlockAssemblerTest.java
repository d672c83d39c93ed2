// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import static io.tbex.rpc.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import io.tbex.core.error.FetchException;
import io.tbex.core.error.NotFoundException;
import io.tbex.core.error.RpcException;
import io.tbex.core.model.BlockInfo;
import io.tbex.core.model.Transaction;
import io.tbex.core.model.TxSummary;
import io.tbex.core.registry.KnownContracts;
import io.tbex.core.types.Address;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import io.tbex.rpc.AbiResponses;
import io.tbex.rpc.FakeChainTransport;
import io.tbex.rpc.InlineRetry;
import io.tbex.rpc.RetryExecutor;
import io.tbex.rpc.ens.NameResolver;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class BlockAssemblerTest {

    private static final Address FLASHBOTS = new Address("0x95222290dd7278aa3ddd389cc1e1d165cc4bafe5");
    private static final Address ALICE = address(0xa11ce);
    private static final Address BOB = address(0xb0b);

    private final FakeChainTransport transport = new FakeChainTransport();
    private final RetryExecutor retry = InlineRetry.create();
    private final BlockAssembler assembler = new BlockAssembler(transport, retry, new NameResolver(transport, retry));

    @Test
    void fetchBlockDerivesBuilderTagAndMinerName() {
        transport.block(block(100, Wei.gwei(10), 15_000_000L, FLASHBOTS, text("beaverbuild.org"), List.of()))
                .onCall(KnownContracts.ENS_REVERSE_RECORDS, "getNames(address[])",
                        AbiResponses.stringArray(List.of("builder.eth")));

        final BlockInfo info = assembler.fetchBlock(100).join();

        assertEquals(100L, info.number());
        assertEquals("Beaver", info.builderTag());
        assertEquals("beaverbuild.org", info.extraDataDecoded());
        assertEquals("builder.eth", info.minerName());
        assertEquals(50.0, info.gasUsedPercent(), 1e-9);
        assertEquals(Wei.ZERO, info.totalFees());
        assertEquals(0, info.blobCount());
    }

    @Test
    void fetchBlockFallsBackToKnownMinerAddress() {
        final HexData binary = new HexData("0xd883010d0e846765746888676f312e32312e36856c696e7578");
        transport.block(block(101, Wei.gwei(10), 1L, FLASHBOTS, binary, List.of()));

        final BlockInfo info = assembler.fetchBlock(101).join();

        assertEquals("Flashbots", info.builderTag());
        assertNull(info.extraDataDecoded());
        assertNull(info.minerName());
    }

    @Test
    void missingBlockIsNotFoundWithoutRetry() {
        final CompletionException thrown = assertThrows(CompletionException.class,
                () -> assembler.fetchBlock(15_030).join());

        final FetchException fetch = assertInstanceOf(FetchException.class, thrown.getCause());
        assertEquals("Failed to fetch block #15030", fetch.getMessage());
        final NotFoundException notFound = assertInstanceOf(NotFoundException.class, fetch.getCause());
        assertEquals("Block 15030 not found (RPC returned null)", notFound.getMessage());
        assertEquals(1, transport.count("eth_getBlockByNumber"));
    }

    @Test
    void transactionsCarryStatsFeesAndNames() {
        final Transaction payment = transfer(hash(1), ALICE, BOB, Wei.of(1_000));
        final Transaction call = tx(hash(2), BOB, ALICE, Wei.of(500),
                new HexData("0xa9059cbb" + "00".repeat(64)), 2, List.of());
        final Transaction blob = tx(hash(3), ALICE, BOB, Wei.ZERO, HexData.EMPTY, 3,
                List.of(hash(0xb1), hash(0xb2)));
        final Transaction deploy = transfer(hash(4), BOB, null, Wei.ZERO);
        transport.block(block(200, Wei.gwei(10), 1_000_000L, FLASHBOTS, HexData.EMPTY,
                        List.of(payment, call, blob, deploy)))
                .blockReceipts(200, List.of(
                        receipt(hash(1), 21_000L, Wei.gwei(12), List.of()),
                        receipt(hash(2), 50_000L, Wei.gwei(11), List.of()),
                        receipt(hash(3), 21_000L, Wei.gwei(13), List.of())))
                .onCall(KnownContracts.ENS_REVERSE_RECORDS, "getNames(address[])",
                        AbiResponses.stringArray(List.of("alice.eth", "")));

        final BlockAssembler.BlockTransactions result = assembler.fetchBlockTransactions(200).join();

        final Wei fee1 = Wei.gwei(12).times(21_000L);
        final Wei fee2 = Wei.gwei(11).times(50_000L);
        final Wei fee3 = Wei.gwei(13).times(21_000L);
        assertEquals(Wei.of(1_500), result.stats().totalValue());
        assertEquals(fee1.plus(fee2).plus(fee3), result.stats().totalFees());
        assertEquals(Wei.gwei(10).times(1_000_000L), result.stats().burntFees());
        assertEquals(2, result.stats().blobCount());

        final List<TxSummary> txs = result.transactions();
        assertEquals(4, txs.size());
        assertEquals("alice.eth", txs.get(0).fromName());
        assertNull(txs.get(0).toName());
        assertEquals(fee1, txs.get(0).feePaid());
        assertNull(txs.get(0).methodSelector());
        assertEquals("0xa9059cbb", txs.get(1).methodSelector());
        assertEquals("transfer", txs.get(1).decodedMethod());
        assertEquals(68, txs.get(1).inputSize());
        assertEquals(2, txs.get(2).blobCount());
        assertTrue(txs.get(3).contractCreation());
        assertNull(txs.get(3).feePaid());
    }

    @Test
    void creationInitCodeIsNotNamedAsMethod() {
        final Transaction deploy = tx(hash(5), ALICE, null, Wei.ZERO,
                new HexData("0xa9059cbb" + "60806040"), 2, List.of());
        transport.block(block(201, Wei.gwei(10), 21_000L, FLASHBOTS, HexData.EMPTY, List.of(deploy)));

        final TxSummary summary = assembler.fetchBlockTransactions(201).join().transactions().get(0);

        assertTrue(summary.contractCreation());
        assertNull(summary.methodSelector());
        assertNull(summary.decodedMethod());
        assertEquals(8, summary.inputSize());
    }

    @Test
    void receiptFailureLeavesFeesEmpty() {
        transport.block(block(300, null, 21_000L, ALICE, HexData.EMPTY,
                        List.of(transfer(hash(1), ALICE, BOB, Wei.of(7)))))
                .failing("eth_getBlockReceipts", new RpcException(-32601, "the method eth_getBlockReceipts does not exist", null, null));

        final BlockAssembler.BlockTransactions result = assembler.fetchBlockTransactions(300).join();

        assertEquals(Wei.of(7), result.stats().totalValue());
        assertEquals(Wei.ZERO, result.stats().totalFees());
        assertEquals(Wei.ZERO, result.stats().burntFees());
        assertNull(result.transactions().get(0).feePaid());
    }

    @Test
    void transactionHashesFollowBlockOrder() {
        transport.block(block(400, Wei.gwei(1), 42_000L, ALICE, HexData.EMPTY,
                List.of(transfer(hash(9), ALICE, BOB, Wei.ZERO), transfer(hash(8), BOB, ALICE, Wei.ZERO))));

        assertEquals(List.of(hash(9), hash(8)), assembler.blockTransactionHashes(400).join());
    }
}
