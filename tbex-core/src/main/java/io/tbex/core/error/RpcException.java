// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a JSON-RPC request to an Ethereum node fails.
 *
 * <p>
 * Covers transport failures (connection refused, HTTP status errors, unparsable
 * bodies) as well as error objects returned by the node. Whether the failure is
 * worth retrying is decided from the rendered message, so HTTP status codes are
 * kept in the message text.
 *
 * <p>
 * <strong>Codes used locally:</strong>
 * <ul>
 * <li><strong>-32000</strong>: network error (I/O failure, interrupted)</li>
 * <li><strong>-32001</strong>: non-2xx HTTP status</li>
 * <li><strong>-32700</strong>: request or response could not be (de)serialized</li>
 * </ul>
 * Any other code is the node's own.
 */
public final class RpcException extends TbexException {

    private final int code;
    private final String rawMessage;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.rawMessage = message;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, requestId, null);
    }

    public int code() {
        return code;
    }

    /**
     * The message as reported by the node or transport, without the request id prefix
     * that {@link #getMessage()} carries.
     */
    public String rawMessage() {
        return rawMessage;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    /**
     * Creates the exception raised when a method that must return a value returned
     * JSON {@code null}.
     *
     * @param method the JSON-RPC method
     * @return the exception
     */
    public static RpcException fromNullResult(final String method) {
        return new RpcException(-32000, method + " returned null result", null, null);
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code + ", message=" + getMessage() + ", data=" + data
                + ", requestId=" + requestId + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
