// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy for node reads.
 *
 * <p>A read is attempted at most {@code maxRetries + 1} times. Before retry {@code n}
 * (counting from zero) the executor waits {@code baseDelay × 2^n}, so the defaults
 * wait 500 ms, 1 s, 2 s, 4 s and 8 s.
 *
 * @param maxRetries retries after the first attempt (must be &gt;= 0)
 * @param baseDelay  delay before the first retry (must be positive)
 */
public record RetryConfig(int maxRetries, Duration baseDelay) {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);

    public RetryConfig {
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive, got: " + baseDelay);
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
    }

    /**
     * @param retryIndex zero-based index of the retry about to happen
     * @return {@code baseDelay × 2^retryIndex}
     */
    public Duration delayFor(final int retryIndex) {
        return baseDelay.multipliedBy(1L << Math.min(retryIndex, 30));
    }
}
