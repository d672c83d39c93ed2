// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.decode;

import io.tbex.core.abi.AbiCodec;
import io.tbex.core.model.DecodedLog;
import io.tbex.core.model.DecodedParam;
import io.tbex.core.model.LogEntry;
import io.tbex.core.model.TokenTransfer;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.util.Units;
import io.tbex.primitives.Hex;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Best-effort interpretation of receipt logs without an ABI registry.
 *
 * <p>
 * Logs whose topic 0 matches a known {@link EventSignature} and that carry enough
 * topics are decoded with fixed rules. Everything else, including the recognized
 * Uniswap V3 swap, goes through the generic rule: every topic after the first is an
 * address when its upper 12 bytes are zero and an unsigned integer otherwise, and up
 * to four leading data words are shown as 18-decimal amounts.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EventDecoder.Result result = EventDecoder.decodeAll(receipt.logs());
 * result.logs().forEach(log -> System.out.println(log.shortEventName()));
 * }</pre>
 */
public final class EventDecoder {

    private static final int DISPLAY_DECIMALS = 18;
    private static final int MAX_GENERIC_DATA_WORDS = 4;
    private static final int WORD = Hex.WORD;

    /**
     * Decoded logs and the Transfer-shaped subset lifted out as token movements.
     */
    public record Result(List<DecodedLog> logs, List<TokenTransfer> tokenTransfers) {
        public Result {
            logs = List.copyOf(logs);
            tokenTransfers = List.copyOf(tokenTransfers);
        }
    }

    private EventDecoder() {
    }

    public static Result decodeAll(final List<LogEntry> logs) {
        final List<DecodedLog> decoded = new ArrayList<>(logs.size());
        final List<TokenTransfer> transfers = new ArrayList<>();
        for (LogEntry log : logs) {
            decoded.add(decode(log));
            final TokenTransfer transfer = toTokenTransfer(log);
            if (transfer != null) {
                transfers.add(transfer);
            }
        }
        return new Result(decoded, transfers);
    }

    public static DecodedLog decode(final LogEntry log) {
        final List<Hash> topics = log.topics();
        final EventSignature event = topics.isEmpty() ? null : EventSignature.fromTopic(topics.get(0));
        final String eventName = event == null ? null : event.signature();
        final List<DecodedParam> params = topics.isEmpty() ? List.of() : decodeParams(event, log);
        return new DecodedLog(log.address(), eventName, params, topics, log.data());
    }

    /**
     * Lifts a Transfer log with at least three topics into a {@link TokenTransfer};
     * returns {@code null} for anything else.
     */
    public static @Nullable TokenTransfer toTokenTransfer(final LogEntry log) {
        final List<Hash> topics = log.topics();
        if (topics.size() < 3 || !EventSignature.TRANSFER.topic().equals(topics.get(0))) {
            return null;
        }
        return new TokenTransfer(
                log.address(),
                topicAddress(topics.get(1)),
                topicAddress(topics.get(2)),
                AbiCodec.uintOrZero(log.data().toBytes(), 0),
                null,
                null);
    }

    private static List<DecodedParam> decodeParams(final @Nullable EventSignature event, final LogEntry log) {
        final List<Hash> topics = log.topics();
        final byte[] data = log.data().toBytes();
        final List<DecodedParam> params = new ArrayList<>();
        if (event == EventSignature.TRANSFER && topics.size() >= 3) {
            params.add(DecodedParam.address("from", topicAddress(topics.get(1))));
            params.add(DecodedParam.address("to", topicAddress(topics.get(2))));
            params.add(DecodedParam.value("value", amount(AbiCodec.uintOrZero(data, 0))));
        } else if (event == EventSignature.APPROVAL && topics.size() >= 3) {
            final BigInteger value = AbiCodec.uintOrZero(data, 0);
            params.add(DecodedParam.address("owner", topicAddress(topics.get(1))));
            params.add(DecodedParam.address("spender", topicAddress(topics.get(2))));
            params.add(DecodedParam.value("value",
                    AbiCodec.UINT256_MAX.equals(value) ? "unlimited" : amount(value)));
        } else if (event == EventSignature.UNISWAP_V2_SWAP && topics.size() >= 2) {
            params.add(DecodedParam.address("sender", topicAddress(topics.get(1))));
            if (data.length >= 4 * WORD) {
                params.add(DecodedParam.value("amount0In", amount(AbiCodec.uintAt(data, 0))));
                params.add(DecodedParam.value("amount1In", amount(AbiCodec.uintAt(data, WORD))));
                params.add(DecodedParam.value("amount0Out", amount(AbiCodec.uintAt(data, 2 * WORD))));
                params.add(DecodedParam.value("amount1Out", amount(AbiCodec.uintAt(data, 3 * WORD))));
            }
            if (data.length >= 5 * WORD) {
                params.add(DecodedParam.address("to", Address.fromWord(data, 4 * WORD)));
            }
        } else if (event == EventSignature.WETH_DEPOSIT && topics.size() >= 2) {
            params.add(DecodedParam.address("dst", topicAddress(topics.get(1))));
            params.add(DecodedParam.value("wad", amount(AbiCodec.uintOrZero(data, 0))));
        } else if (event == EventSignature.WETH_WITHDRAWAL && topics.size() >= 2) {
            params.add(DecodedParam.address("src", topicAddress(topics.get(1))));
            params.add(DecodedParam.value("wad", amount(AbiCodec.uintOrZero(data, 0))));
        } else {
            decodeGeneric(topics, data, params);
        }
        return params;
    }

    private static void decodeGeneric(final List<Hash> topics, final byte[] data, final List<DecodedParam> params) {
        for (int i = 1; i < topics.size(); i++) {
            final byte[] word = topics.get(i).toBytes();
            if (Hex.isZero(word, 0, WORD - 20)) {
                params.add(DecodedParam.address("topic" + i, Address.fromWord(word, 0)));
            } else {
                params.add(DecodedParam.value("topic" + i, new BigInteger(1, word).toString()));
            }
        }
        final int words = Math.min(data.length / WORD, MAX_GENERIC_DATA_WORDS);
        for (int i = 0; i < words; i++) {
            params.add(DecodedParam.value("data" + i, amount(AbiCodec.uintAt(data, i * WORD))));
        }
    }

    private static Address topicAddress(final Hash topic) {
        return Address.fromWord(topic.toBytes(), 0);
    }

    private static String amount(final BigInteger value) {
        return Units.formatUnits(value, DISPLAY_DECIMALS);
    }
}
