// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Hex encoded raw bytes of an entry, transaction or block ({@code raw-data}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawData(String data) {}
