// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.error;

/**
 * Base runtime exception for engine failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * TbexException
 * ├── {@link RpcException} - JSON-RPC transport and node errors
 * ├── {@link NotFoundException} - node returned null for a block or transaction
 * ├── {@link AbiDecodingException} - a probe's response has the wrong shape
 * ├── {@link FetchException} - a primary fetch failed, with operation and target
 * └── {@link NameResolutionException} - a forward ENS step failed
 * </pre>
 *
 * <p>
 * Enrichment failures (names, proxy slot, token probes, owner, balances) never
 * surface as exceptions to callers of the assemblers; they show up as absent fields.
 */
public sealed class TbexException extends RuntimeException
        permits RpcException,
        NotFoundException,
        AbiDecodingException,
        FetchException,
        NameResolutionException {

    public TbexException(final String message) {
        super(message);
    }

    public TbexException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
