// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.inspect;

import io.tbex.core.abi.AbiCodec;
import io.tbex.core.model.TokenBalance;
import io.tbex.core.registry.PopularTokens;
import io.tbex.core.types.Address;
import io.tbex.core.types.HexData;
import io.tbex.rpc.ChainTransport;
import io.tbex.rpc.FailureReport;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code balanceOf(holder)} on every token of {@link PopularTokens#ALL}.
 *
 * <p>
 * Tokens are queried one after another in table order, without retries. A failed or
 * short answer skips the token; balances below {@link PopularTokens.Token#dustThreshold()}
 * are dropped. The whole scan is bounded by a timeout, after which the result is an
 * empty list. The scan itself is not cancelled and finishes in the background.
 */
public final class TokenBalanceScanner {

    private static final Logger log = LoggerFactory.getLogger(TokenBalanceScanner.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private static final String BALANCE_OF = "balanceOf(address)";

    private final ChainTransport transport;
    private final Executor ioExecutor;
    private final Duration timeout;
    private final List<PopularTokens.Token> tokens;

    public TokenBalanceScanner(final ChainTransport transport, final Executor ioExecutor, final Duration timeout) {
        this(transport, ioExecutor, timeout, PopularTokens.ALL);
    }

    TokenBalanceScanner(
            final ChainTransport transport,
            final Executor ioExecutor,
            final Duration timeout,
            final List<PopularTokens.Token> tokens) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.tokens = List.copyOf(tokens);
    }

    /**
     * @return non-dust balances in table order; empty on timeout
     */
    public CompletableFuture<List<TokenBalance>> scan(final Address holder) {
        final HexData calldata = AbiCodec.encodeCall(BALANCE_OF, AbiCodec.word(holder));
        return CompletableFuture.supplyAsync(() -> scanAll(holder, calldata), ioExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    log.debug("Token balance scan for {} abandoned after {} ms: {}",
                            holder, timeout.toMillis(), FailureReport.chain(error));
                    return List.of();
                });
    }

    private List<TokenBalance> scanAll(final Address holder, final HexData calldata) {
        final List<TokenBalance> balances = new ArrayList<>();
        for (PopularTokens.Token token : tokens) {
            final BigInteger balance = balanceOf(token, holder, calldata);
            if (balance != null && balance.compareTo(token.dustThreshold()) >= 0) {
                balances.add(new TokenBalance(token.address(), token.symbol(), token.name(), token.decimals(), balance));
            }
        }
        return List.copyOf(balances);
    }

    private @Nullable BigInteger balanceOf(final PopularTokens.Token token, final Address holder, final HexData calldata) {
        try {
            final byte[] response = transport.call(token.address(), calldata).toBytes();
            if (response.length < 32) {
                log.debug("balanceOf({}) on {} returned {} bytes, skipping", holder, token.symbol(), response.length);
                return null;
            }
            return AbiCodec.uintAt(response, 0);
        } catch (RuntimeException e) {
            log.debug("balanceOf({}) on {} failed: {}", holder, token.symbol(), FailureReport.chain(e));
            return null;
        }
    }
}
