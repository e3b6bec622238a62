// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Transaction history found by the wallet {@code transactions} search.
 *
 * <p>A search by transaction id does not report a height; {@code blockheight}
 * is {@code 0} in that case.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletTransactions(List<Item> transactions) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            long blockheight,
            long feespaid,
            boolean signed,
            long timestamp,
            long totalecoutputs,
            long totalinputs,
            long totaloutputs,
            List<TransactionIo> inputs,
            List<TransactionIo> outputs,
            List<TransactionIo> ecoutputs,
            String txid) {}
}
