// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class FactomConfigTest {

    @Test
    void defaultsPointAtLocalDaemons() {
        final FactomConfig config = FactomConfig.defaults();

        assertEquals("http://localhost:8089/v2", config.factomdUrl());
        assertEquals("http://localhost:8088/v2", config.walletdUrl());
    }

    @Test
    void httpsHostUsesDefaultPorts() {
        final FactomConfig config = FactomConfig.fromHttpsHost("node.example.com");

        assertEquals("https://node.example.com:8089/v2", config.endpoint(Daemon.FACTOMD));
        assertEquals("https://node.example.com:8088/v2", config.endpoint(Daemon.WALLETD));
    }

    @Test
    void explicitUrlsAreKeptVerbatim() {
        final FactomConfig config = FactomConfig.of("https://api.factomd.net/v2", "not a url");

        assertEquals("https://api.factomd.net/v2", config.endpoint(Daemon.FACTOMD));
        assertEquals("not a url", config.endpoint(Daemon.WALLETD));
    }

    @Test
    void rejectsNullUrl() {
        assertThrows(NullPointerException.class, () -> FactomConfig.of(null, "http://localhost:8088/v2"));
    }
}
