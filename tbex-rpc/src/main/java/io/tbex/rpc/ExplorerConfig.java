// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.rpc.inspect.TokenBalanceScanner;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for an {@link Explorer}.
 *
 * <pre>{@code
 * ExplorerConfig config = ExplorerConfig.builder("https://eth.example.com")
 *     .retry(new RetryConfig(3, Duration.ofMillis(250)))
 *     .tokenScanTimeout(Duration.ofSeconds(2))
 *     .build();
 * }</pre>
 *
 * @param url              JSON-RPC endpoint
 * @param connectTimeout   HTTP connect timeout
 * @param readTimeout      HTTP request timeout
 * @param headers          extra HTTP headers, e.g. an authorization header
 * @param retry            backoff settings for node reads
 * @param tokenScanTimeout bound on the popular-token balance scan
 */
public record ExplorerConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers,
        RetryConfig retry,
        Duration tokenScanTimeout) {

    public static final String ENV_RPC_URL = "TBEX_RPC_URL";
    public static final String ENV_MAX_RETRIES = "TBEX_MAX_RETRIES";
    public static final String ENV_BASE_DELAY_MS = "TBEX_BASE_DELAY_MS";

    public ExplorerConfig {
        Objects.requireNonNull(url, "url");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        connectTimeout = connectTimeout == null ? RpcConfig.DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? RpcConfig.DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        retry = retry == null ? RetryConfig.defaults() : retry;
        tokenScanTimeout = tokenScanTimeout == null ? TokenBalanceScanner.DEFAULT_TIMEOUT : tokenScanTimeout;
        if (tokenScanTimeout.isNegative() || tokenScanTimeout.isZero()) {
            throw new IllegalArgumentException("tokenScanTimeout must be positive, got " + tokenScanTimeout);
        }
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    /** Reads the endpoint and retry settings from the process environment. */
    public static ExplorerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads {@value #ENV_RPC_URL} (required), {@value #ENV_MAX_RETRIES} and
     * {@value #ENV_BASE_DELAY_MS} from {@code env}.
     *
     * @throws IllegalStateException if the URL is missing or a number does not parse
     */
    public static ExplorerConfig fromEnvironment(final Map<String, String> env) {
        final String url = env.get(ENV_RPC_URL);
        if (url == null || url.isBlank()) {
            throw new IllegalStateException(ENV_RPC_URL + " is not set");
        }
        final int maxRetries = intSetting(env, ENV_MAX_RETRIES, RetryConfig.DEFAULT_MAX_RETRIES);
        final long baseDelayMs = intSetting(env, ENV_BASE_DELAY_MS, (int) RetryConfig.DEFAULT_BASE_DELAY.toMillis());
        return builder(url.trim())
                .retry(new RetryConfig(maxRetries, Duration.ofMillis(baseDelayMs)))
                .build();
    }

    RpcConfig rpcConfig() {
        return new RpcConfig(url, connectTimeout, readTimeout, headers);
    }

    private static int intSetting(final Map<String, String> env, final String key, final int fallback) {
        final String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private RetryConfig retry = RetryConfig.defaults();
        private Duration tokenScanTimeout = TokenBalanceScanner.DEFAULT_TIMEOUT;

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public Builder retry(final RetryConfig retry) {
            this.retry = retry;
            return this;
        }

        public Builder tokenScanTimeout(final Duration tokenScanTimeout) {
            this.tokenScanTimeout = tokenScanTimeout;
            return this;
        }

        public ExplorerConfig build() {
            return new ExplorerConfig(url, connectTimeout, readTimeout, headers, retry, tokenScanTimeout);
        }
    }
}
