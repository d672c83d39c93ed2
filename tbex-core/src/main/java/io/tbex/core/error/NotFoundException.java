// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.error;

/**
 * The node answered, but with {@code null}: the requested block or transaction does
 * not exist (yet). Never retried.
 */
public final class NotFoundException extends TbexException {

    private final String kind;
    private final String identifier;

    public NotFoundException(final String kind, final String identifier) {
        super(kind + " " + identifier + " not found (RPC returned null)");
        this.kind = kind;
        this.identifier = identifier;
    }

    /** What was looked up, e.g. {@code "Block"} or {@code "Transaction"}. */
    public String kind() {
        return kind;
    }

    public String identifier() {
        return identifier;
    }
}
