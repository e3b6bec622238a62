// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The working transactions currently held by the wallet ({@code tmp-transactions}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemporaryTransactions(List<Item> transactions) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            @JsonProperty("tx-name") String txName,
            String txid,
            long totalinputs,
            long totaloutputs,
            long totalecoutputs) {}
}
