// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A working transaction held by factom-walletd.
 *
 * <p>Returned by {@code new-transaction}, {@code add-input}, {@code add-output},
 * {@code add-ec-output}, {@code add-fee}, {@code sub-fee},
 * {@code sign-transaction} and {@code delete-transaction}. The {@code txid}
 * changes with every edit until the transaction is signed.
 *
 * @param feespaid factoshis paid in fees, absent before inputs are added
 * @param feesrequired factoshis required to cover the fee
 * @param signed whether the transaction has been signed
 * @param name the wallet-local transaction name
 * @param timestamp creation time in milliseconds
 * @param totalecoutputs sum of entry credit outputs in factoshis
 * @param totalinputs sum of inputs in factoshis
 * @param totaloutputs sum of factoid outputs in factoshis
 * @param inputs the inputs, may be absent
 * @param outputs the factoid outputs, may be absent
 * @param ecoutputs the entry credit outputs, may be absent
 * @param txid the current transaction id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletTransaction(
        long feespaid,
        long feesrequired,
        boolean signed,
        String name,
        long timestamp,
        long totalecoutputs,
        long totalinputs,
        long totaloutputs,
        @Nullable List<AddressAmount> inputs,
        @Nullable List<AddressAmount> outputs,
        @Nullable List<AddressAmount> ecoutputs,
        @Nullable String txid) {}
