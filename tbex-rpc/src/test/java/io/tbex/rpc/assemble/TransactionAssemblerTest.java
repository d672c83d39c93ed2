// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import static io.tbex.rpc.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import io.tbex.core.decode.EventSignature;
import io.tbex.core.error.FetchException;
import io.tbex.core.error.NotFoundException;
import io.tbex.core.error.RpcException;
import io.tbex.core.model.DecodedLog;
import io.tbex.core.model.LogEntry;
import io.tbex.core.model.TokenTransfer;
import io.tbex.core.model.TransactionReceipt;
import io.tbex.core.model.TxInfo;
import io.tbex.core.model.TxType;
import io.tbex.core.registry.KnownContracts;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import io.tbex.rpc.AbiResponses;
import io.tbex.rpc.FakeChainTransport;
import io.tbex.rpc.InlineRetry;
import io.tbex.rpc.RetryExecutor;
import io.tbex.rpc.ens.NameResolver;
import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class TransactionAssemblerTest {

    private static final Address ROUTER = new Address("0x7a250d5630B4cF539739dF2C5dAcb4c659F2488D");
    private static final Address USDC = new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48");
    private static final Address WETH = new Address("0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2");
    private static final Address TRADER = address(0x7ade);
    private static final Address PAIR = address(0x9a17);

    private final FakeChainTransport transport = new FakeChainTransport();
    private final RetryExecutor retry = InlineRetry.create();
    private final TransactionAssembler assembler =
            new TransactionAssembler(transport, retry, new NameResolver(transport, retry));

    @Test
    void minedSwapDecodesBothTransfers() {
        final Hash hash = hash(0x5a9);
        final HexData input = new HexData("0x38ed1739" + "00".repeat(160));
        transport.transaction(tx(hash, TRADER, ROUTER, Wei.ZERO, input, 2, List.of()))
                .receipt(receipt(hash, 120_000L, Wei.gwei(15), List.of(
                        transferLog(USDC, TRADER, PAIR, BigInteger.valueOf(2_000_000_000L)),
                        transferLog(WETH, PAIR, TRADER, new BigInteger("1000000000000000000")))))
                .onCall(KnownContracts.ENS_REVERSE_RECORDS, "getNames(address[])",
                        AbiResponses.stringArray(List.of("trader.eth", "")));

        final TxInfo info = assembler.fetchTransaction(hash).join();

        assertFalse(info.isPending());
        assertEquals(Boolean.TRUE, info.status());
        assertEquals(TxType.EIP1559, info.txType());
        assertEquals("swapExactTokensForTokens", info.decodedMethod());
        assertEquals("0x38ed1739", info.methodSelector());
        assertEquals(Wei.gwei(15).times(120_000L), info.actualFee());
        assertEquals(Wei.gwei(15), info.gasPrice());
        assertEquals(120_000L, info.gasUsed());
        assertEquals(2, info.logsCount());
        assertEquals("trader.eth", info.fromName());
        assertNull(info.toName());

        assertEquals(2, info.decodedLogs().size());
        for (DecodedLog log : info.decodedLogs()) {
            assertEquals("Transfer", log.shortEventName());
            assertEquals(3, log.params().size());
        }
        assertEquals("1", info.decodedLogs().get(1).params().get(2).value());
        assertEquals(List.of(
                new TokenTransfer(USDC, TRADER, PAIR, BigInteger.valueOf(2_000_000_000L), null, null),
                new TokenTransfer(WETH, PAIR, TRADER, new BigInteger("1000000000000000000"), null, null)),
                info.tokenTransfers());
    }

    @Test
    void missingReceiptMeansPending() {
        final Hash hash = hash(0x9e);
        transport.transaction(transfer(hash, TRADER, PAIR, Wei.of(5)));

        final TxInfo info = assembler.fetchTransaction(hash).join();

        assertTrue(info.isPending());
        assertNull(info.gasUsed());
        assertNull(info.actualFee());
        assertNull(info.logsCount());
        assertTrue(info.decodedLogs().isEmpty());
        assertTrue(info.tokenTransfers().isEmpty());
        assertNull(info.methodSelector());
    }

    @Test
    void failingReceiptCallMeansPending() {
        final Hash hash = hash(0x9f);
        transport.transaction(transfer(hash, TRADER, PAIR, Wei.of(5)))
                .failing("eth_getTransactionReceipt", new RpcException(-32000, "invalid receipt", null, null));

        assertTrue(assembler.fetchTransaction(hash).join().isPending());
    }

    @Test
    void contractCreationHasNoSelector() {
        final Hash hash = hash(0xc0de);
        final Address created = address(0xc4ea7e);
        transport.transaction(tx(hash, TRADER, null, Wei.ZERO, new HexData("0x60806040"), 0, List.of()))
                .receipt(new TransactionReceipt(
                        hash, 1L, true, 500_000L, Wei.gwei(30), created, List.of(), null, null));

        final TxInfo info = assembler.fetchTransaction(hash).join();

        assertTrue(info.isContractCreation());
        assertEquals(created, info.contractCreated());
        assertEquals(TxType.LEGACY, info.txType());
        assertNull(info.methodSelector());
        assertEquals(Wei.gwei(30), info.gasPrice());
    }

    @Test
    void unknownTransactionIsNotFound() {
        final Hash hash = hash(0xdead);

        final CompletionException thrown = assertThrows(CompletionException.class,
                () -> assembler.fetchTransaction(hash).join());

        final FetchException fetch = assertInstanceOf(FetchException.class, thrown.getCause());
        assertEquals("Failed to fetch transaction " + hash.value(), fetch.getMessage());
        assertInstanceOf(NotFoundException.class, fetch.getCause());
        assertEquals(0, transport.count("eth_getTransactionReceipt"));
    }

    private static LogEntry transferLog(final Address token, final Address from, final Address to, final BigInteger amount) {
        return new LogEntry(token,
                List.of(EventSignature.TRANSFER.topic(), topic(from), topic(to)),
                AbiResponses.uint(amount));
    }

    private static Hash topic(final Address address) {
        return Hash.fromBytes(address.toWord());
    }
}
