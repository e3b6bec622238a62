// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of {@code chain-head}.
 *
 * @param chainhead the key merkle root of the latest entry block of the chain
 * @param chaininprocesslist true if the chain head is still in the process list
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChainHead(String chainhead, boolean chaininprocesslist) {}
