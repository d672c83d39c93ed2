// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.exception;

import java.util.List;

/**
 * Terminal failure of a retried read.
 *
 * <p>
 * The message carries the last failure and, when more than one attempt was made,
 * every attempt's rendered message in order:
 * <pre>
 * eth_getBlockByNumber failed: HTTP 429 for eth_getBlockByNumber
 *
 * All attempts:
 * Attempt 1: HTTP 429 for eth_getBlockByNumber
 * Attempt 2: HTTP 429 for eth_getBlockByNumber
 * </pre>
 * The cause is the final failure; earlier failures are attached as suppressed
 * exceptions in attempt order.
 */
public final class RetryFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final List<String> attempts;
    private final boolean exhausted;
    private final long totalRetryDurationMs;

    public RetryFailedException(
            final String operation,
            final List<String> attempts,
            final String lastMessage,
            final boolean exhausted,
            final long totalRetryDurationMs,
            final Throwable cause) {
        super(render(operation, attempts, lastMessage), cause);
        this.operation = operation;
        this.attempts = List.copyOf(attempts);
        this.exhausted = exhausted;
        this.totalRetryDurationMs = totalRetryDurationMs;
    }

    public String operation() {
        return operation;
    }

    /** {@code "Attempt N: message"} for every attempt, in order. */
    public List<String> attempts() {
        return attempts;
    }

    public int attemptCount() {
        return attempts.size();
    }

    /** {@code true} when the last failure was retryable but no retries were left. */
    public boolean exhausted() {
        return exhausted;
    }

    /** Time from the first attempt to the final failure, including delays. */
    public long totalRetryDurationMs() {
        return totalRetryDurationMs;
    }

    private static String render(final String operation, final List<String> attempts, final String lastMessage) {
        final StringBuilder message = new StringBuilder(operation).append(" failed: ").append(lastMessage);
        if (attempts.size() > 1) {
            message.append("\n\nAll attempts:\n").append(String.join("\n", attempts));
        }
        return message.toString();
    }
}
