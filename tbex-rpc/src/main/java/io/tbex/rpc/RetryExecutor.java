// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.DebugLogger;
import io.tbex.rpc.exception.RetryFailedException;
import io.tbex.rpc.internal.Futures;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs idempotent node reads with exponential backoff.
 *
 * <p>
 * Each attempt runs on the I/O executor. A failure is retried when its rendered
 * message chain (lowercased) mentions rate limiting, a timeout, a connection problem,
 * temporary unavailability or a 502/503/504 status; anything else fails at once.
 * Between attempts the executor does not park a thread: the next attempt is
 * scheduled on a delayed executor ({@link CompletableFuture#delayedExecutor}).
 *
 * <p>
 * Every call completes exactly once, with the read's value or a
 * {@link RetryFailedException} listing all attempts.
 *
 * <pre>{@code
 * RetryExecutor retry = new RetryExecutor(RetryConfig.defaults(), TbexExecutors.newIoExecutor());
 * CompletableFuture<Long> head = retry.execute("eth_blockNumber", transport::blockNumber);
 * }</pre>
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private static final List<String> RETRYABLE_MARKERS = List.of(
            "rate", "limit", "429", "too many",
            "timeout", "timed out", "connection",
            "temporarily", "unavailable",
            "502", "503", "504");

    /**
     * Produces the executor that runs the next attempt after {@code delay}.
     */
    @FunctionalInterface
    public interface DelayScheduler {
        Executor after(Duration delay, Executor executor);

        static DelayScheduler standard() {
            return (delay, executor) -> CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
        }
    }

    private final RetryConfig config;
    private final Executor ioExecutor;
    private final DelayScheduler scheduler;

    public RetryExecutor(final RetryConfig config, final Executor ioExecutor) {
        this(config, ioExecutor, DelayScheduler.standard());
    }

    public RetryExecutor(final RetryConfig config, final Executor ioExecutor, final DelayScheduler scheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public RetryConfig config() {
        return config;
    }

    /**
     * @param operation name used in failure messages, usually the JSON-RPC method
     * @param read      the blocking read; must be idempotent
     * @return a future completed with the read's value or a {@link RetryFailedException}
     */
    public <T> CompletableFuture<T> execute(final String operation, final Supplier<T> read) {
        final CompletableFuture<T> result = new CompletableFuture<>();
        final Attempts attempts = new Attempts(operation, System.currentTimeMillis());
        attempt(read, 0, attempts, result, ioExecutor);
        return result;
    }

    private <T> void attempt(
            final Supplier<T> read,
            final int retryIndex,
            final Attempts attempts,
            final CompletableFuture<T> result,
            final Executor executor) {
        CompletableFuture.supplyAsync(read, executor).whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            final Throwable failure = Futures.unwrap(error);
            final String rendered = FailureReport.chain(failure);
            attempts.record(rendered, failure);
            final boolean retryable = isRetryable(failure);
            if (retryable && retryIndex < config.maxRetries()) {
                final Duration delay = config.delayFor(retryIndex);
                log.debug("{} attempt {} failed, retrying in {} ms: {}",
                        attempts.operation, retryIndex + 1, delay.toMillis(), rendered);
                DebugLogger.logRetry("[RETRY] %s attempt=%d delay=%dms error=%s",
                        attempts.operation, retryIndex + 1, delay.toMillis(), rendered);
                attempt(read, retryIndex + 1, attempts, result, scheduler.after(delay, ioExecutor));
            } else {
                if (retryable) {
                    log.warn("{} failed after {} attempts: {}", attempts.operation, retryIndex + 1, rendered);
                }
                result.completeExceptionally(attempts.toException(retryable, rendered, failure));
            }
        });
    }

    /**
     * Classifies a rendered failure message.
     */
    public static boolean isRetryable(final String renderedMessage) {
        final String lower = renderedMessage.toLowerCase(Locale.ROOT);
        for (String marker : RETRYABLE_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isRetryable(final Throwable failure) {
        return isRetryable(FailureReport.bareChain(failure));
    }

    private static final class Attempts {
        private final String operation;
        private final long startedAt;
        private final List<String> messages = new ArrayList<>();
        private final List<Throwable> failures = new ArrayList<>();

        private Attempts(final String operation, final long startedAt) {
            this.operation = operation;
            this.startedAt = startedAt;
        }

        // attempts of one call never overlap, but each runs on a different thread
        private synchronized void record(final String rendered, final Throwable failure) {
            messages.add("Attempt " + (messages.size() + 1) + ": " + rendered);
            failures.add(failure);
        }

        private synchronized RetryFailedException toException(
                final boolean exhausted, final String lastMessage, final Throwable last) {
            final RetryFailedException exception = new RetryFailedException(
                    operation, messages, lastMessage, exhausted, System.currentTimeMillis() - startedAt, last);
            for (int i = 0; i < failures.size() - 1; i++) {
                exception.addSuppressed(failures.get(i));
            }
            return exception;
        }
    }
}
