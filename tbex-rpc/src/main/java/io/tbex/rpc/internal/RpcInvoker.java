// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.internal;

import io.tbex.core.error.RpcException;
import io.tbex.rpc.TbexProvider;
import java.util.List;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Sends a request and applies one of three null-result policies:
 * <ul>
 *   <li>{@link #call} - a {@code null} result is an error</li>
 *   <li>{@link #callNullable} - a {@code null} result means "not found"</li>
 *   <li>{@link #callWithDefault} - a {@code null} result is replaced</li>
 * </ul>
 * Decoders receive the raw JSON value (string, map or list).
 *
 * <p><strong>Internal Use Only.</strong>
 */
public final class RpcInvoker {

    private final TbexProvider provider;

    public RpcInvoker(final TbexProvider provider) {
        this.provider = provider;
    }

    /**
     * @throws RpcException if the result is {@code null}
     */
    public <T> T call(final String method, final List<?> params, final Function<Object, T> decoder) {
        final Object result = provider.send(method, params).result();
        if (result == null) {
            throw RpcException.fromNullResult(method);
        }
        return decoder.apply(result);
    }

    public <T> @Nullable T callNullable(final String method, final List<?> params, final Function<Object, T> decoder) {
        final Object result = provider.send(method, params).result();
        if (result == null) {
            return null;
        }
        return decoder.apply(result);
    }

    public <T> T callWithDefault(
            final String method, final List<?> params, final Function<Object, T> decoder, final T defaultValue) {
        final Object result = provider.send(method, params).result();
        if (result == null) {
            return defaultValue;
        }
        return decoder.apply(result);
    }
}
