// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Result of the {@code ack} call.
 *
 * <p>The shape depends on what was asked for. Entry acks fill
 * {@code committxid}, {@code entryhash}, {@code commitdata} and
 * {@code entrydata}. Factoid acks fill {@code txid} and the top level status
 * fields. Fields that do not apply are {@code null}.
 *
 * <p>Status values are {@code Unknown}, {@code NotConfirmed},
 * {@code TransactionACK} and {@code DBlockConfirmed}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Ack(
        @Nullable String committxid,
        @Nullable String entryhash,
        @Nullable Status commitdata,
        @Nullable Status entrydata,
        @Nullable String txid,
        @Nullable String transactiondate,
        @Nullable String transactiondatestring,
        @Nullable String blockdate,
        @Nullable String blockdatestring,
        @Nullable String status) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
            String status,
            @Nullable String transactiondate,
            @Nullable String transactiondatestring,
            @Nullable String blockdate,
            @Nullable String blockdatestring) {}
}
