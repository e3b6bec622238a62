// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import io.factom.core.model.Ack;
import io.factom.core.model.Balance;
import io.factom.core.model.ChainHead;
import io.factom.core.model.CommitChain;
import io.factom.core.model.CommitEntry;
import io.factom.core.model.CurrentMinute;
import io.factom.core.model.DirectoryBlock;
import io.factom.core.model.DirectoryBlockHead;
import io.factom.core.model.Entry;
import io.factom.core.model.EntryBlock;
import io.factom.core.model.EntryCreditRate;
import io.factom.core.model.FactoidSubmit;
import io.factom.core.model.FactomdProperties;
import io.factom.core.model.Heights;
import io.factom.core.model.MultipleBalances;
import io.factom.core.model.PendingEntry;
import io.factom.core.model.PendingTransaction;
import io.factom.core.model.RawData;
import io.factom.core.model.RawMessage;
import io.factom.core.model.Receipt;
import io.factom.core.model.RevealEntry;
import io.factom.core.model.Transaction;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Typed calls against the node daemon, factomd.
 *
 * <p>
 * Every method sends exactly one request and returns an {@link ApiResponse}.
 * A request the daemon declines comes back as {@link ApiResponse.Failure}.
 * Transport, serialization and envelope failures are thrown as
 * {@link io.factom.core.error.FactomException}.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations are stateless and can be
 * shared across threads.
 *
 * <p>
 * <strong>Usage Example:</strong>
 *
 * <pre>{@code
 * FactomdClient factomd = Factom.create().factomd();
 *
 * Heights heights = factomd.heights().orElseThrow();
 * System.out.println("Leader height " + heights.leaderheight());
 *
 * ApiResponse<Entry> entry = factomd.entry(entryHash);
 * }</pre>
 *
 * @see WalletdClient
 * @see Factom
 */
public interface FactomdClient {

    /**
     * Finds the status of a factoid transaction, an entry commit or an entry
     * reveal.
     *
     * <p>
     * {@code chainid} selects what {@code hash} refers to:
     * <ul>
     * <li>{@code f} - a factoid transaction id</li>
     * <li>{@code c} - an entry or chain commit transaction id</li>
     * <li>a chain id - an entry hash within that chain</li>
     * </ul>
     *
     * @param hash the transaction id or entry hash
     * @param chainid {@code f}, {@code c} or a chain id
     * @param fullTransaction the full marshaled transaction to hash instead, or null
     * @return the acknowledgement
     */
    ApiResponse<Ack> ack(String hash, String chainid, @Nullable String fullTransaction);

    /**
     * Returns the key merkle root of the latest entry block of a chain.
     */
    ApiResponse<ChainHead> chainHead(String chainId);

    /**
     * Submits a hex encoded chain commit message. The matching
     * {@link #revealChain} must follow.
     */
    ApiResponse<CommitChain> commitChain(String message);

    /**
     * Submits a hex encoded entry commit message.
     *
     * <p>
     * The message is usually produced by {@link WalletdClient#composeEntry}.
     * The matching {@link #revealEntry} must be sent afterwards; the client
     * does not enforce this order. Committing the same message twice is
     * declined by the daemon with a repeated-commit error, which is a
     * {@link ApiResponse.Failure} and not an exception; the caller can go
     * straight to the reveal in that case.
     *
     * @param message the hex encoded, signed commit
     * @return the commit outcome
     */
    ApiResponse<CommitEntry> commitEntry(String message);

    ApiResponse<CurrentMinute> currentMinute();

    ApiResponse<DirectoryBlock> directoryBlock(String keyMr);

    ApiResponse<DirectoryBlockHead> directoryBlockHead();

    /**
     * Fetches an entry by its hash.
     *
     * @param hash the entry hash
     * @return the entry with hex encoded content and external ids
     */
    ApiResponse<Entry> entry(String hash);

    ApiResponse<EntryBlock> entryBlock(String keyMr);

    /**
     * @param address a public entry credit address ({@code EC...})
     */
    ApiResponse<Balance> entryCreditBalance(String address);

    /**
     * Returns how many factoshis buy one entry credit.
     */
    ApiResponse<EntryCreditRate> entryCreditRate();

    /**
     * @param address a public factoid address ({@code FA...})
     */
    ApiResponse<Balance> factoidBalance(String address);

    /**
     * Submits a hex encoded, signed factoid transaction, usually produced by
     * {@link WalletdClient#composeTransaction}.
     */
    ApiResponse<FactoidSubmit> factoidSubmit(String transaction);

    ApiResponse<Heights> heights();

    ApiResponse<MultipleBalances> multipleEntryCreditBalances(List<String> addresses);

    ApiResponse<MultipleBalances> multipleFactoidBalances(List<String> addresses);

    /**
     * Lists entries that have been submitted but not yet recorded in a block.
     */
    ApiResponse<List<PendingEntry>> pendingEntries();

    /**
     * Lists factoid transactions known to the node but not yet in a block.
     *
     * @param address restricts the list to one address, or null for all
     * @return the pending transactions
     */
    ApiResponse<List<PendingTransaction>> pendingTransactions(@Nullable String address);

    ApiResponse<FactomdProperties> properties();

    /**
     * Fetches an entry, transaction or block in raw hex form.
     */
    ApiResponse<RawData> rawData(String hash);

    /**
     * Fetches the merkle proof anchoring an entry.
     *
     * @param hash the entry hash
     * @param includeRawEntry whether to include the raw entry, or null to let the daemon decide
     * @return the receipt
     */
    ApiResponse<Receipt> receipt(String hash, @Nullable Boolean includeRawEntry);

    ApiResponse<RevealEntry> revealChain(String entry);

    /**
     * Reveals an entry after its commit.
     *
     * @param entry the hex encoded entry
     * @return the reveal outcome
     */
    ApiResponse<RevealEntry> revealEntry(String entry);

    /**
     * Broadcasts an arbitrary hex encoded factomd message.
     */
    ApiResponse<RawMessage> sendRawMessage(String message);

    /**
     * Fetches a factoid transaction, or an entry, together with the blocks it
     * was included in.
     *
     * @param hash the transaction id or entry hash
     * @return the transaction
     */
    ApiResponse<Transaction> transaction(String hash);
}
