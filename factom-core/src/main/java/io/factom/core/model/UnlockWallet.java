// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param success whether the wallet was unlocked
 * @param unlockeduntil Unix time in seconds at which the wallet locks again
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnlockWallet(boolean success, long unlockeduntil) {}
