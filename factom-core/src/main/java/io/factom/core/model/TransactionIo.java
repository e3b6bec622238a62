// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One input or output of a factoid transaction as reported by factomd and by
 * the wallet transaction history.
 *
 * @param amount the amount in factoshis
 * @param address the raw address hash
 * @param useraddress the human readable FA or EC address
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionIo(long amount, String address, String useraddress) {}
