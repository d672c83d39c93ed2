// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.error;

/**
 * A primary fetch (block, transaction, address, network snapshot) failed.
 *
 * <p>The message names the operation and its target, e.g.
 * {@code "Failed to fetch block #19000000"}; the cause holds the underlying failure.
 */
public final class FetchException extends TbexException {

    private final String operation;
    private final String target;

    public FetchException(final String operation, final String target, final Throwable cause) {
        super("Failed to " + operation + " " + target, cause);
        this.operation = operation;
        this.target = target;
    }

    public String operation() {
        return operation;
    }

    public String target() {
        return target;
    }
}
