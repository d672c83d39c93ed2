// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.crypto.Keccak256;
import io.tbex.core.error.RpcException;
import io.tbex.core.model.Block;
import io.tbex.core.model.FeeHistory;
import io.tbex.core.model.Transaction;
import io.tbex.core.model.TransactionReceipt;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import io.tbex.primitives.Hex;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * In-memory node for assembler tests.
 *
 * <p>
 * Unknown blocks, transactions and receipts answer {@code null}; unknown accounts have
 * zero balance, zero nonce and no code. {@code eth_call} is routed by target and
 * function signature; an unrouted call reverts. {@link #failing(String, RuntimeException)}
 * makes every call of one JSON-RPC method throw.
 */
public final class FakeChainTransport implements ChainTransport {

    private final Map<Long, Block> blocks = new HashMap<>();
    private final Map<Long, List<TransactionReceipt>> blockReceipts = new HashMap<>();
    private final Map<Hash, Transaction> transactions = new HashMap<>();
    private final Map<Hash, TransactionReceipt> receipts = new HashMap<>();
    private final Map<Address, Wei> balances = new HashMap<>();
    private final Map<Address, Long> nonces = new HashMap<>();
    private final Map<Address, HexData> code = new HashMap<>();
    private final Map<Address, Hash> implementationSlots = new HashMap<>();
    private final Map<String, Function<HexData, HexData>> calls = new HashMap<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();
    private final List<String> requests = Collections.synchronizedList(new ArrayList<>());

    private long head;
    private Wei gasPrice = Wei.gwei(20);
    private String clientVersion = "Geth/v1.14.0";
    private @Nullable FeeHistory feeHistory;

    public FakeChainTransport block(final Block block) {
        blocks.put(block.number(), block);
        return this;
    }

    public FakeChainTransport blockReceipts(final long number, final List<TransactionReceipt> list) {
        blockReceipts.put(number, list);
        return this;
    }

    public FakeChainTransport transaction(final Transaction tx) {
        transactions.put(tx.hash(), tx);
        return this;
    }

    public FakeChainTransport receipt(final TransactionReceipt receipt) {
        receipts.put(receipt.transactionHash(), receipt);
        return this;
    }

    public FakeChainTransport account(final Address address, final Wei balance, final long nonce, final HexData bytecode) {
        balances.put(address, balance);
        nonces.put(address, nonce);
        code.put(address, bytecode);
        return this;
    }

    public FakeChainTransport implementationSlot(final Address address, final Hash value) {
        implementationSlots.put(address, value);
        return this;
    }

    /** Routes {@code eth_call} to {@code to} whose calldata starts with the selector of {@code signature}. */
    public FakeChainTransport onCall(final Address to, final String signature, final Function<HexData, HexData> handler) {
        calls.put(key(to, Hex.encode(Keccak256.selector(signature))), handler);
        return this;
    }

    public FakeChainTransport onCall(final Address to, final String signature, final HexData response) {
        return onCall(to, signature, data -> response);
    }

    public FakeChainTransport failing(final String method, final RuntimeException failure) {
        failures.put(method, failure);
        return this;
    }

    public FakeChainTransport head(final long number) {
        this.head = number;
        return this;
    }

    public FakeChainTransport gasPrice(final Wei price) {
        this.gasPrice = price;
        return this;
    }

    public FakeChainTransport clientVersion(final String version) {
        this.clientVersion = version;
        return this;
    }

    public FakeChainTransport feeHistory(final FeeHistory history) {
        this.feeHistory = history;
        return this;
    }

    /** JSON-RPC methods in the order they were called. */
    public List<String> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public long count(final String method) {
        return requests().stream().filter(method::equals).count();
    }

    @Override
    public @Nullable Block getBlockByNumber(final long number, final boolean fullBodies) {
        record("eth_getBlockByNumber");
        return blocks.get(number);
    }

    @Override
    public @Nullable List<TransactionReceipt> getBlockReceipts(final long number) {
        record("eth_getBlockReceipts");
        return blockReceipts.get(number);
    }

    @Override
    public @Nullable Transaction getTransactionByHash(final Hash hash) {
        record("eth_getTransactionByHash");
        return transactions.get(hash);
    }

    @Override
    public @Nullable TransactionReceipt getTransactionReceipt(final Hash hash) {
        record("eth_getTransactionReceipt");
        return receipts.get(hash);
    }

    @Override
    public Wei getBalance(final Address address) {
        record("eth_getBalance");
        return balances.getOrDefault(address, Wei.ZERO);
    }

    @Override
    public long getTransactionCount(final Address address) {
        record("eth_getTransactionCount");
        return nonces.getOrDefault(address, 0L);
    }

    @Override
    public HexData getCode(final Address address) {
        record("eth_getCode");
        return code.getOrDefault(address, HexData.EMPTY);
    }

    @Override
    public Hash getStorageAt(final Address address, final Hash slot) {
        record("eth_getStorageAt");
        return implementationSlots.getOrDefault(address, Hash.ZERO);
    }

    @Override
    public HexData call(final Address to, final HexData data) {
        record("eth_call");
        final String selector = Hex.encode(data.toBytes(), 0, Math.min(4, data.byteLength()));
        final Function<HexData, HexData> handler = calls.get(key(to, selector));
        if (handler == null) {
            throw new RpcException(3, "execution reverted", null, null);
        }
        return handler.apply(data);
    }

    @Override
    public Wei gasPrice() {
        record("eth_gasPrice");
        return gasPrice;
    }

    @Override
    public FeeHistory feeHistory(final int blockCount, final String newestBlock, final List<Double> rewardPercentiles) {
        record("eth_feeHistory");
        if (feeHistory == null) {
            throw new RpcException(-32601, "the method eth_feeHistory does not exist/is not available", null, null);
        }
        return feeHistory;
    }

    @Override
    public long blockNumber() {
        record("eth_blockNumber");
        return head;
    }

    @Override
    public String clientVersion() {
        record("web3_clientVersion");
        return clientVersion;
    }

    @Override
    public String endpoint() {
        return "http://fake-node.local";
    }

    private void record(final String method) {
        requests.add(method);
        final RuntimeException failure = failures.get(method);
        if (failure != null) {
            throw failure;
        }
    }

    private static String key(final Address to, final String selector) {
        return to.value() + "/" + selector.toLowerCase(Locale.ROOT);
    }
}
