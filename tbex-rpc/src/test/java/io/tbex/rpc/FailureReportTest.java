// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import static org.junit.jupiter.api.Assertions.*;

import io.tbex.core.error.FetchException;
import io.tbex.core.error.NotFoundException;
import io.tbex.core.error.RpcException;
import io.tbex.rpc.exception.RetryFailedException;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class FailureReportTest {

    @Test
    void joinsCauseChain() {
        final Throwable failure = new FetchException("fetch block", "#12",
                new NotFoundException("Block", "12"));

        assertEquals("Failed to fetch block #12: Block 12 not found (RPC returned null)",
                FailureReport.chain(failure));
    }

    @Test
    void unwrapsCompletionException() {
        final Throwable failure = new CompletionException(new RpcException(-32000, "boom", null, null));

        assertEquals("boom", FailureReport.chain(failure));
    }

    @Test
    void stopsAtRetryFailure() {
        final RpcException last = new RpcException(-32000, "HTTP 503 for eth_call", null, null);
        final RetryFailedException retry = new RetryFailedException(
                "eth_call", List.of("Attempt 1: HTTP 503 for eth_call"), "HTTP 503 for eth_call", true, 0L, last);
        final Throwable failure = new FetchException("fetch address", "0xabc", retry);

        assertEquals("Failed to fetch address 0xabc: eth_call failed: HTTP 503 for eth_call",
                FailureReport.chain(failure));
    }

    @Test
    void describeAppendsSanitizedEndpoint() {
        final Throwable failure = new RpcException(-32000, "boom", null, null);

        final String report = FailureReport.describe(failure,
                "https://eth-mainnet.g.alchemy.com/v2/abcdefghijklmnop1234");

        assertEquals("boom\n\nRPC: https://eth-mainnet.g.alchemy.com/v2/***", report);
    }

    @Test
    void describeRemovesCredentialsFromWholeChain() {
        final String endpoint = "https://eth-mainnet.g.alchemy.com/v2/abcdefghijklmnopqrstuvwxyz123456";
        final Throwable failure = new FetchException("fetch network info from", endpoint,
                new RpcException(-32601, "method not found", null, null));

        final String report = FailureReport.describe(failure, endpoint);

        assertFalse(report.contains("abcdefghijklmnopqrstuvwxyz123456"), report);
        assertEquals("Failed to fetch network info from https://eth-mainnet.g.alchemy.com/v2/***: method not found"
                + "\n\nRPC: https://eth-mainnet.g.alchemy.com/v2/***", report);
    }

    @Test
    void bareChainDropsRequestIds() {
        final Throwable failure = new FetchException("fetch address", "0xabc",
                new RpcException(3, "execution reverted", null, 503L));

        assertEquals("Failed to fetch address 0xabc: [requestId=503] execution reverted",
                FailureReport.chain(failure));
        assertEquals("Failed to fetch address 0xabc: execution reverted", FailureReport.bareChain(failure));
    }

    @Test
    void messagelessFailureUsesClassName() {
        assertEquals("IllegalStateException", FailureReport.chain(new IllegalStateException()));
    }
}
