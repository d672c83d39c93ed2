// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.model.Block;
import io.tbex.core.model.FeeHistory;
import io.tbex.core.model.Transaction;
import io.tbex.core.model.TransactionReceipt;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import io.tbex.primitives.Hex;
import io.tbex.rpc.internal.NodeParsers;
import io.tbex.rpc.internal.RpcInvoker;
import io.tbex.rpc.internal.RpcUtils;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@link ChainTransport} backed by a {@link TbexProvider}.
 *
 * <pre>{@code
 * ChainTransport transport = new JsonRpcTransport(HttpTbexProvider.builder(url).build());
 * Block head = transport.getBlockByNumber(transport.blockNumber(), false);
 * }</pre>
 */
public final class JsonRpcTransport implements ChainTransport {

    private static final String LATEST = "latest";

    private final TbexProvider provider;
    private final RpcInvoker rpc;

    public JsonRpcTransport(final TbexProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.rpc = new RpcInvoker(provider);
    }

    @Override
    public @Nullable Block getBlockByNumber(final long number, final boolean fullBodies) {
        return rpc.callNullable(
                "eth_getBlockByNumber",
                List.of(RpcUtils.toQuantityHex(number), fullBodies),
                NodeParsers::parseBlock);
    }

    @Override
    public @Nullable List<TransactionReceipt> getBlockReceipts(final long number) {
        return rpc.callNullable(
                "eth_getBlockReceipts",
                List.of(RpcUtils.toQuantityHex(number)),
                NodeParsers::parseReceipts);
    }

    @Override
    public @Nullable Transaction getTransactionByHash(final Hash hash) {
        return rpc.callNullable("eth_getTransactionByHash", List.of(hash.value()), NodeParsers::parseTransaction);
    }

    @Override
    public @Nullable TransactionReceipt getTransactionReceipt(final Hash hash) {
        return rpc.callNullable("eth_getTransactionReceipt", List.of(hash.value()), NodeParsers::parseReceipt);
    }

    @Override
    public Wei getBalance(final Address address) {
        return rpc.call("eth_getBalance", List.of(address.value(), LATEST),
                result -> new Wei(RpcUtils.decodeHexBigInteger(result.toString())));
    }

    @Override
    public long getTransactionCount(final Address address) {
        return rpc.call("eth_getTransactionCount", List.of(address.value(), LATEST),
                result -> RpcUtils.decodeHexLong(result, 0L));
    }

    @Override
    public HexData getCode(final Address address) {
        return rpc.callWithDefault("eth_getCode", List.of(address.value(), LATEST),
                result -> new HexData(result.toString()), HexData.EMPTY);
    }

    @Override
    public Hash getStorageAt(final Address address, final Hash slot) {
        return rpc.callWithDefault("eth_getStorageAt", List.of(address.value(), slot.value(), LATEST),
                result -> Hash.fromBytes(Hex.leftPad(Hex.decode(result.toString()))), Hash.ZERO);
    }

    @Override
    public HexData call(final Address to, final HexData data) {
        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("to", to.value());
        request.put("data", data.value());
        return rpc.callWithDefault("eth_call", List.of(request, LATEST),
                result -> new HexData(result.toString()), HexData.EMPTY);
    }

    @Override
    public Wei gasPrice() {
        return rpc.call("eth_gasPrice", List.of(),
                result -> new Wei(RpcUtils.decodeHexBigInteger(result.toString())));
    }

    @Override
    public FeeHistory feeHistory(final int blockCount, final String newestBlock, final List<Double> rewardPercentiles) {
        return rpc.call("eth_feeHistory",
                List.of(RpcUtils.toQuantityHex(blockCount), newestBlock, rewardPercentiles),
                NodeParsers::parseFeeHistory);
    }

    @Override
    public long blockNumber() {
        return rpc.call("eth_blockNumber", List.of(), result -> RpcUtils.decodeHexLong(result, 0L));
    }

    @Override
    public String clientVersion() {
        return rpc.call("web3_clientVersion", List.of(), Object::toString);
    }

    @Override
    public String endpoint() {
        return provider.endpoint();
    }
}
