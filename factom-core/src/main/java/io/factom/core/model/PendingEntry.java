// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * An entry that has been submitted but not yet recorded in a block.
 *
 * @param entryhash the entry hash
 * @param chainid the chain id, absent while only the commit is known
 * @param status the acknowledgement status, e.g. "TransactionACK"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingEntry(String entryhash, @Nullable String chainid, String status) {}
