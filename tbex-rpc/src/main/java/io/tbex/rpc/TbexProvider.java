// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.error.RpcException;
import java.util.List;

/**
 * Low-level JSON-RPC sender.
 *
 * <p>
 * Implementations perform exactly one request per call and do not retry; retrying is
 * the job of {@link RetryExecutor}. A response carrying a JSON-RPC error object is
 * reported as an {@link RpcException}, so a returned response always has a result
 * (which may be JSON {@code null}).
 */
public interface TbexProvider {

    /**
     * @param method JSON-RPC method name, e.g. {@code "eth_getBalance"}
     * @param params positional parameters
     * @return the response
     * @throws RpcException on transport failure, non-2xx status, unparsable body or
     *                      an error returned by the node
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    /**
     * Endpoint description for error reports. May contain credentials; sanitize before
     * logging.
     */
    String endpoint();
}
