// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An ed25519 signature produced by {@code sign-data}.
 *
 * @param pubkey the base64 encoded public key of the signer
 * @param signature the base64 encoded signature
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Signature(String pubkey, String signature) {}
