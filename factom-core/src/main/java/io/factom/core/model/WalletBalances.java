// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Total factoid and entry credit balances across all wallet addresses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletBalances(AccountBalance fctaccountbalances, AccountBalance ecaccountbalances) {}
