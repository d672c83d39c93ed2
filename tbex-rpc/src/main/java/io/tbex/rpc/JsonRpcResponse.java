// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import static io.tbex.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response: either a result (possibly JSON {@code null}) or an error.
 *
 * @param jsonrpc the JSON-RPC version (always "2.0")
 * @param result  the result if successful
 * @param error   the error if failed
 * @param id      the id of the request this answers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        String id) {

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    /**
     * Returns the result as a map, for object results such as blocks and receipts.
     *
     * @throws IllegalArgumentException if the result is not an object
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }

    /**
     * Returns the result as a list, for array results such as block receipts.
     *
     * @throws IllegalArgumentException if the result is not an array
     */
    @SuppressWarnings("unchecked")
    public @Nullable List<Object> resultAsList() {
        if (result == null) {
            return null;
        }
        if (result instanceof List<?>) {
            return (List<Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<List<Object>>() {});
    }
}
