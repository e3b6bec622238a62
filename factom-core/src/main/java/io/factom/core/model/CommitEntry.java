// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of {@code commit-entry}.
 *
 * @param message the daemon status message, e.g. "Entry Commit Success"
 * @param txid the id of the paying entry credit transaction
 * @param entryhash the hash of the entry being committed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommitEntry(String message, String txid, String entryhash) {}
