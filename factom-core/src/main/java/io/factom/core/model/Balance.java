// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Balance of a single address. Factoid balances are in factoshis, entry credit
 * balances in entry credits.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Balance(long balance) {}
