// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of {@code commit-chain}.
 *
 * @param message the daemon status message
 * @param txid the id of the paying entry credit transaction
 * @param entryhash the hash of the first entry of the new chain
 * @param chainid the id of the chain being created
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommitChain(String message, String txid, String entryhash, String chainid) {}
