// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The block height the wallet has synced to ({@code get-height}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletHeight(long height) {}
