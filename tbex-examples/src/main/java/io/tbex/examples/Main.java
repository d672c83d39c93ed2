// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.examples;

import io.tbex.core.TbexDebug;
import io.tbex.core.model.AddressInfo;
import io.tbex.core.model.BlockInfo;
import io.tbex.core.model.NetworkSnapshot;
import io.tbex.core.model.TokenBalance;
import io.tbex.core.model.TxInfo;
import io.tbex.core.model.TxSummary;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.Wei;
import io.tbex.core.util.Units;
import io.tbex.rpc.Explorer;
import io.tbex.rpc.ExplorerConfig;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line walkthrough of the explorer API.
 *
 * <pre>
 * TBEX_RPC_URL=https://... java io.tbex.examples.Main network
 * TBEX_RPC_URL=https://... java io.tbex.examples.Main block 19000000
 * TBEX_RPC_URL=https://... java io.tbex.examples.Main tx 0x...
 * TBEX_RPC_URL=https://... java io.tbex.examples.Main address vitalik.eth
 * </pre>
 *
 * Set {@code -Dtbex.examples.debug=true} to log RPC traffic.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final int MAX_LISTED_TRANSACTIONS = 10;

    private Main() {}

    public static void main(final String[] args) {
        if (args.length == 0) {
            System.err.println("usage: Main network | block <n> | tx <hash> | address <address|name>");
            System.exit(2);
        }
        if (Boolean.getBoolean("tbex.examples.debug")) {
            TbexDebug.setEnabled(true);
        }

        final ExplorerConfig config = ExplorerConfig.fromEnvironment();
        try (Explorer explorer = Explorer.create(config)) {
            log.info("Connected to {}", explorer.endpoint());
            try {
                run(explorer, args);
            } catch (CompletionException e) {
                System.err.println(explorer.describe(e));
                System.exit(1);
            }
        }
    }

    private static void run(final Explorer explorer, final String[] args) {
        switch (args[0]) {
            case "network" -> printNetwork(explorer.network().join());
            case "block" -> {
                final Explorer.BlockWithTransactions result =
                        explorer.blockWithTransactions(Long.parseLong(argument(args))).join();
                printBlock(result.block(), result.transactions());
            }
            case "tx" -> printTransaction(explorer.transaction(new Hash(argument(args))).join());
            case "address" -> {
                final String target = argument(args);
                final AddressInfo info = target.startsWith("0x")
                        ? explorer.address(new Address(target)).join()
                        : explorer.resolveAndFetchAddress(target).join();
                printAddress(info);
            }
            default -> {
                System.err.println("Unknown command: " + args[0]);
                System.exit(2);
            }
        }
    }

    private static String argument(final String[] args) {
        if (args.length < 2) {
            System.err.println("Missing argument for " + args[0]);
            System.exit(2);
        }
        return args[1];
    }

    private static void printNetwork(final NetworkSnapshot snapshot) {
        System.out.println("Latest block:  " + snapshot.latestBlock());
        System.out.println("Gas price:     " + Units.formatGwei(snapshot.gasPrice()) + " gwei");
        System.out.println("Client:        " + snapshot.clientVersion());
        if (snapshot.baseFeeTrend() != null) {
            System.out.println("Base fee trend:");
            for (Wei fee : snapshot.baseFeeTrend()) {
                System.out.println("  " + Units.formatGwei(fee) + " gwei");
            }
        }
        if (snapshot.priorityFeePercentiles() != null) {
            final List<Wei> tips = snapshot.priorityFeePercentiles();
            System.out.println("Priority fees (25/50/75): "
                    + String.join(" / ", tips.stream().map(Units::formatGwei).toList()) + " gwei");
        }
    }

    private static void printBlock(final BlockInfo block, final List<TxSummary> transactions) {
        System.out.println("Block #" + block.number() + " " + block.hash().value());
        System.out.println("Miner:         " + block.miner().value()
                + (block.minerName() != null ? " (" + block.minerName() + ")" : ""));
        if (block.builderTag() != null) {
            System.out.println("Builder:       " + block.builderTag());
        }
        System.out.printf("Gas used:      %d / %d (%.1f%%)%n",
                block.gasUsed(), block.gasLimit(), block.gasUsedPercent());
        if (block.baseFeePerGas() != null) {
            System.out.println("Base fee:      " + Units.formatGwei(block.baseFeePerGas()) + " gwei");
        }
        System.out.println("Transactions:  " + block.transactionCount());
        System.out.println("Total value:   " + Units.formatEther(block.totalValue()) + " ETH");
        System.out.println("Total fees:    " + Units.formatEther(block.totalFees()) + " ETH");
        System.out.println("Burnt fees:    " + Units.formatEther(block.burntFees()) + " ETH");
        System.out.println("Blobs:         " + block.blobCount());

        transactions.stream().limit(MAX_LISTED_TRANSACTIONS).forEach(tx -> System.out.println("  "
                + tx.hash().value() + " " + tx.txType()
                + " " + label(tx.from(), tx.fromName())
                + " -> " + (tx.to() == null ? "[create]" : label(tx.to(), tx.toName()))
                + " " + Units.formatEther(tx.value()) + " ETH"
                + (tx.decodedMethod() != null ? " " + tx.decodedMethod() : "")));
        if (transactions.size() > MAX_LISTED_TRANSACTIONS) {
            System.out.println("  ... " + (transactions.size() - MAX_LISTED_TRANSACTIONS) + " more");
        }
    }

    private static void printTransaction(final TxInfo tx) {
        System.out.println("Transaction " + tx.hash().value() + (tx.isPending() ? " (pending)" : ""));
        System.out.println("Type:          " + tx.txType());
        System.out.println("From:          " + label(tx.from(), tx.fromName()));
        System.out.println("To:            " + (tx.to() == null ? "[create]" : label(tx.to(), tx.toName())));
        System.out.println("Value:         " + Units.formatEther(tx.value()) + " ETH");
        if (tx.decodedMethod() != null) {
            System.out.println("Method:        " + tx.decodedMethod());
        }
        if (tx.status() != null) {
            System.out.println("Status:        " + (tx.status() ? "success" : "reverted"));
        }
        if (tx.actualFee() != null) {
            System.out.println("Fee:           " + Units.formatEther(tx.actualFee()) + " ETH");
        }
        if (tx.contractCreated() != null) {
            System.out.println("Created:       " + tx.contractCreated().value());
        }
        tx.tokenTransfers().forEach(transfer -> System.out.println("  transfer " + transfer));
        tx.decodedLogs().forEach(decoded -> System.out.println("  log " + decoded.eventName()));
    }

    private static void printAddress(final AddressInfo info) {
        System.out.println("Address " + label(info.address(), info.name()));
        System.out.println("Balance:       " + Units.formatEther(info.balance()) + " ETH");
        System.out.println("Nonce:         " + info.nonce());
        if (!info.isContract()) {
            return;
        }
        System.out.println("Code size:     " + info.codeSize() + " bytes");
        if (info.proxyImplementation() != null) {
            System.out.println("Proxy for:     " + info.proxyImplementation().value());
        }
        if (info.tokenInfo() != null) {
            System.out.println("Token:         " + info.tokenInfo().symbol()
                    + " (" + info.tokenInfo().decimals() + " decimals)");
        }
        if (info.owner() != null) {
            System.out.println("Owner:         " + info.owner().value());
        }
        for (TokenBalance balance : info.tokenBalances()) {
            System.out.println("  " + balance.formatted() + " " + balance.symbol());
        }
    }

    private static String label(final Address address, final String name) {
        return name == null ? address.value() : name + " (" + address.value() + ")";
    }
}
