// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of {@code factoid-submit}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FactoidSubmit(String message, String txid) {}
