// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An identity key pair ({@code idpub...} / {@code idsec...}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityKey(@JsonProperty("public") String publicKey, String secret) {

    @Override
    public String toString() {
        return "IdentityKey[public=" + publicKey + ", secret=***]";
    }
}
