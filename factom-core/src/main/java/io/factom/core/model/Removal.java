// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of {@code remove-address} and {@code remove-identity-key}. The wallet
 * reports the flag as a boolean for one call and as the string {@code "true"}
 * for the other; both map here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Removal(boolean success) {}
