// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * A balance reported both as acknowledged and as saved in the last block.
 *
 * @param ack the balance including acknowledged but unsaved transactions
 * @param saved the balance as of the last saved block
 * @param err a per-address error message, empty or absent when the lookup succeeded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountBalance(long ack, long saved, @Nullable String err) {

    public boolean hasError() {
        return err != null && !err.isEmpty();
    }
}
