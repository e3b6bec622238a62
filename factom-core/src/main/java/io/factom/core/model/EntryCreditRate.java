// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The number of factoshis needed to buy one entry credit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntryCreditRate(long rate) {}
