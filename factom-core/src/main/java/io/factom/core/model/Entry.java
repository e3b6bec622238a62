// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * An entry as returned by the {@code entry} call.
 *
 * <p>{@code content} and each element of {@code extids} are hex encoded.
 *
 * @param chainid the chain the entry belongs to
 * @param content the hex encoded entry content
 * @param extids the hex encoded external ids
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Entry(String chainid, String content, List<String> extids) {}
