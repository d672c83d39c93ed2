// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.internal;

import static io.tbex.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.type.TypeReference;
import io.tbex.core.error.RpcException;
import io.tbex.core.model.Block;
import io.tbex.core.model.FeeHistory;
import io.tbex.core.model.LogEntry;
import io.tbex.core.model.Transaction;
import io.tbex.core.model.TransactionReceipt;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Converts raw JSON-RPC result objects into model records.
 *
 * <p>Missing required fields raise {@link RpcException}; optional fork-dependent
 * fields become {@code null}.
 *
 * <p><strong>Internal Use Only.</strong>
 */
public final class NodeParsers {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private NodeParsers() {
    }

    public static Block parseBlock(final Object result) {
        final Map<String, Object> map = asMap(result);
        final List<Hash> hashes = new ArrayList<>();
        final List<Transaction> transactions = new ArrayList<>();
        for (Object entry : asList(map.get("transactions"))) {
            if (entry instanceof String) {
                hashes.add(new Hash((String) entry));
            } else {
                final Transaction tx = parseTransaction(entry);
                transactions.add(tx);
                hashes.add(tx.hash());
            }
        }
        final Object withdrawals = map.get("withdrawals");
        final String size = RpcUtils.stringValue(map.get("size"));
        final String extraData = RpcUtils.stringValue(map.get("extraData"));
        return new Block(
                required(RpcUtils.decodeHexLong(map.get("number")), "eth_getBlockByNumber", "number"),
                new Hash(requiredString(map, "hash", "eth_getBlockByNumber")),
                new Hash(requiredString(map, "parentHash", "eth_getBlockByNumber")),
                RpcUtils.decodeHexLong(map.get("timestamp"), 0L),
                RpcUtils.decodeHexLong(map.get("gasUsed"), 0L),
                RpcUtils.decodeHexLong(map.get("gasLimit"), 0L),
                optionalWei(map.get("baseFeePerGas")),
                new Address(requiredString(map, "miner", "eth_getBlockByNumber")),
                optionalHash(map.get("stateRoot")),
                optionalHash(map.get("receiptsRoot")),
                optionalHash(map.get("transactionsRoot")),
                extraData != null ? new HexData(extraData) : HexData.EMPTY,
                size != null ? RpcUtils.decodeHexLong(size) : null,
                asList(map.get("uncles")).size(),
                withdrawals != null ? asList(withdrawals).size() : null,
                RpcUtils.decodeHexLong(map.get("blobGasUsed")),
                RpcUtils.decodeHexLong(map.get("excessBlobGas")),
                hashes,
                transactions);
    }

    public static Transaction parseTransaction(final Object result) {
        final Map<String, Object> map = asMap(result);
        final String method = "eth_getTransactionByHash";
        final String to = RpcUtils.stringValue(map.get("to"));
        final String input = RpcUtils.stringValue(map.get("input"));
        final List<Hash> blobHashes = new ArrayList<>();
        for (Object blobHash : asList(map.get("blobVersionedHashes"))) {
            blobHashes.add(new Hash(blobHash.toString()));
        }
        return new Transaction(
                new Hash(requiredString(map, "hash", method)),
                RpcUtils.decodeHexLong(map.get("blockNumber")),
                RpcUtils.decodeHexLong(map.get("transactionIndex")),
                new Address(requiredString(map, "from", method)),
                to != null ? new Address(to) : null,
                new Wei(RpcUtils.decodeHexBigInteger(RpcUtils.stringValue(map.get("value")))),
                RpcUtils.decodeHexLong(map.get("gas"), 0L),
                optionalWei(map.get("gasPrice")),
                optionalWei(map.get("maxFeePerGas")),
                optionalWei(map.get("maxPriorityFeePerGas")),
                optionalWei(map.get("maxFeePerBlobGas")),
                RpcUtils.decodeHexLong(map.get("nonce"), 0L),
                input != null ? new HexData(input) : HexData.EMPTY,
                (int) RpcUtils.decodeHexLong(map.get("type"), 0L),
                asList(map.get("accessList")).size(),
                blobHashes);
    }

    public static TransactionReceipt parseReceipt(final Object result) {
        final Map<String, Object> map = asMap(result);
        final String method = "eth_getTransactionReceipt";
        final String contractAddress = RpcUtils.stringValue(map.get("contractAddress"));
        final String statusHex = RpcUtils.stringValue(map.get("status"));
        final boolean status = statusHex != null && RpcUtils.decodeHexBigInteger(statusHex).signum() != 0;
        final List<LogEntry> logs = new ArrayList<>();
        for (Object log : asList(map.get("logs"))) {
            logs.add(parseLog(log));
        }
        return new TransactionReceipt(
                new Hash(requiredString(map, "transactionHash", method)),
                RpcUtils.decodeHexLong(map.get("blockNumber"), 0L),
                status,
                RpcUtils.decodeHexLong(map.get("gasUsed"), 0L),
                optionalWei(map.get("effectiveGasPrice")),
                contractAddress != null ? new Address(contractAddress) : null,
                logs,
                RpcUtils.decodeHexLong(map.get("blobGasUsed")),
                optionalWei(map.get("blobGasPrice")));
    }

    public static List<TransactionReceipt> parseReceipts(final Object result) {
        final List<TransactionReceipt> receipts = new ArrayList<>();
        for (Object receipt : asList(result)) {
            receipts.add(parseReceipt(receipt));
        }
        return receipts;
    }

    public static LogEntry parseLog(final Object result) {
        final Map<String, Object> map = asMap(result);
        final String data = RpcUtils.stringValue(map.get("data"));
        final String txHash = RpcUtils.stringValue(map.get("transactionHash"));
        final List<Hash> topics = new ArrayList<>();
        for (Object topic : asList(map.get("topics"))) {
            topics.add(new Hash(topic.toString()));
        }
        return new LogEntry(
                new Address(requiredString(map, "address", "log")),
                topics,
                data != null ? new HexData(data) : HexData.EMPTY,
                RpcUtils.decodeHexLong(map.get("logIndex")),
                txHash != null ? new Hash(txHash) : null);
    }

    public static FeeHistory parseFeeHistory(final Object result) {
        final Map<String, Object> map = asMap(result);
        final List<Wei> baseFees = new ArrayList<>();
        for (Object fee : asList(map.get("baseFeePerGas"))) {
            baseFees.add(new Wei(RpcUtils.decodeHexBigInteger(fee.toString())));
        }
        final List<Double> ratios = new ArrayList<>();
        for (Object ratio : asList(map.get("gasUsedRatio"))) {
            ratios.add(((Number) ratio).doubleValue());
        }
        final List<List<Wei>> rewards = new ArrayList<>();
        for (Object row : asList(map.get("reward"))) {
            final List<Wei> parsed = new ArrayList<>();
            for (Object reward : asList(row)) {
                parsed.add(new Wei(RpcUtils.decodeHexBigInteger(reward.toString())));
            }
            rewards.add(parsed);
        }
        return new FeeHistory(RpcUtils.decodeHexLong(map.get("oldestBlock"), 0L), baseFees, ratios, rewards);
    }

    private static Map<String, Object> asMap(final Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    private static List<Object> asList(final @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        return MAPPER.convertValue(value, LIST_TYPE);
    }

    private static @Nullable Wei optionalWei(final @Nullable Object value) {
        return value != null ? new Wei(RpcUtils.decodeHexBigInteger(value.toString())) : null;
    }

    private static Hash optionalHash(final @Nullable Object value) {
        return value != null ? new Hash(value.toString()) : Hash.ZERO;
    }

    private static String requiredString(final Map<String, Object> map, final String field, final String method) {
        return required(RpcUtils.stringValue(map.get(field)), method, field);
    }

    private static <T> T required(final @Nullable T value, final String method, final String field) {
        if (value == null) {
            throw new RpcException(-32000, method + " response missing '" + field + "' field", null, null);
        }
        return value;
    }
}
