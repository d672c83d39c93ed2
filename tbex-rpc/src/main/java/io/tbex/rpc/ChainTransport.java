// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.error.RpcException;
import io.tbex.core.model.Block;
import io.tbex.core.model.FeeHistory;
import io.tbex.core.model.Transaction;
import io.tbex.core.model.TransactionReceipt;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.core.types.Wei;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Read-only view of an Ethereum node.
 *
 * <p>
 * Each method is a single blocking request with no retry. Methods returning
 * {@code @Nullable} report "not found" as {@code null}; every other failure is thrown
 * as an {@link RpcException}. Implementations must be safe for concurrent use.
 */
public interface ChainTransport {

    /**
     * @param number       block number
     * @param fullBodies   {@code true} to include full transaction objects
     * @return the block, or {@code null} if the node does not know it
     */
    @Nullable Block getBlockByNumber(long number, boolean fullBodies);

    /**
     * @return all receipts of the block, or {@code null} if the node does not know it
     */
    @Nullable List<TransactionReceipt> getBlockReceipts(long number);

    @Nullable Transaction getTransactionByHash(Hash hash);

    /**
     * @return the receipt, or {@code null} while the transaction is pending
     */
    @Nullable TransactionReceipt getTransactionReceipt(Hash hash);

    Wei getBalance(Address address);

    long getTransactionCount(Address address);

    /** Deployed bytecode; empty for externally owned accounts. */
    HexData getCode(Address address);

    /** 32-byte storage word at {@code slot}. */
    Hash getStorageAt(Address address, Hash slot);

    /** {@code eth_call} against the latest block. */
    HexData call(Address to, HexData data);

    Wei gasPrice();

    FeeHistory feeHistory(int blockCount, String newestBlock, List<Double> rewardPercentiles);

    long blockNumber();

    String clientVersion();

    /** Endpoint description for error reports. */
    String endpoint();
}
