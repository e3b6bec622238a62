// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Result of {@code multiple-fct-balances} and {@code multiple-ec-balances}.
 * Balances are in the same order as the requested addresses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MultipleBalances(long currentheight, long lastsavedheight, List<AccountBalance> balances) {}
