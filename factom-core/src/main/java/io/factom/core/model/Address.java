// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Factoid ({@code FA}/{@code Fs}) or Entry Credit ({@code EC}/{@code Es})
 * key pair held by factom-walletd.
 *
 * @param publicAddress the human readable public address
 * @param secret the human readable private key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Address(
        @JsonProperty("public") String publicAddress,
        String secret) {

    @Override
    public String toString() {
        return "Address[public=" + publicAddress + ", secret=***]";
    }
}
