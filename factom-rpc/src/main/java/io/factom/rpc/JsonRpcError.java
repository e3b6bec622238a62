// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.factom.core.error.RpcException;
import io.factom.rpc.internal.RpcUtils;
import org.jspecify.annotations.Nullable;

/**
 * The {@code error} member of a JSON-RPC response.
 *
 * <p>A code of {@code 0} means "no error". Factom daemons never send it, but
 * a defaulted error object decodes that way and is treated as success.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, @Nullable Object data) {

    public boolean isError() {
        return code != 0;
    }

    public RpcException toException() {
        return new RpcException(code, message, RpcUtils.extractErrorData(data));
    }
}
