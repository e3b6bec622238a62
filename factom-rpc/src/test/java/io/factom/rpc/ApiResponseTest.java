// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.factom.core.error.RpcException;
import org.junit.jupiter.api.Test;

class ApiResponseTest {

    @Test
    void successExposesResult() {
        final ApiResponse<String> response = ApiResponse.ofResult("2.0", 0L, "ok");

        assertTrue(response.success());
        assertFalse(response.isError());
        assertEquals("ok", response.result());
        assertEquals("ok", response.orElseThrow());
        assertNull(response.error());
    }

    @Test
    void failureThrowsOnResult() {
        final JsonRpcError error = new JsonRpcError(-32008, "Object not found", null);
        final ApiResponse<String> response = ApiResponse.ofError("2.0", 0L, error);

        assertTrue(response.isError());
        assertSame(error, response.error());
        assertThrows(IllegalStateException.class, response::result);
    }

    @Test
    void orElseThrowRaisesRpcException() {
        final ApiResponse<String> response =
                ApiResponse.ofError("2.0", 0L, new JsonRpcError(-32011, "Repeated Commit", "already exists"));

        final RpcException ex = assertThrows(RpcException.class, response::orElseThrow);
        assertEquals(-32011, ex.code());
        assertEquals("already exists", ex.data());
        assertTrue(ex.isRepeatedCommit());
    }

    @Test
    void failureRejectsCodeZero() {
        assertThrows(IllegalArgumentException.class,
                () -> ApiResponse.ofError("2.0", 0L, new JsonRpcError(0, "", null)));
    }

    @Test
    void mapTransformsSuccessAndPassesFailureThrough() {
        assertEquals(4, ApiResponse.ofResult("2.0", 0L, "abcd").map(String::length).result());

        final ApiResponse<String> failure =
                ApiResponse.ofError("2.0", 0L, new JsonRpcError(-32602, "Invalid params", null));
        final ApiResponse<Integer> mapped = failure.map(String::length);
        assertTrue(mapped.isError());
        assertEquals(-32602, mapped.error().code());
    }
}
