// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of {@code reveal-entry} and {@code reveal-chain}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RevealEntry(String message, String entryhash, String chainid) {}
