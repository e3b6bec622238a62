// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The signed commit and the reveal produced by {@code compose-entry} or
 * {@code compose-chain}. Send {@code commit} first, then {@code reveal}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComposedEntry(ComposedCall commit, ComposedCall reveal) {}
