// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A factoid transaction known to factomd but not yet in a block
 * ({@code pending-transactions}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingTransaction(
        String transactionid,
        String status,
        List<TransactionIo> inputs,
        List<TransactionIo> outputs,
        List<TransactionIo> ecoutputs,
        long fees) {}
