// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An input or output of a wallet working transaction.
 *
 * @param address the human readable address
 * @param amount the amount in factoshis
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AddressAmount(String address, long amount) {}
