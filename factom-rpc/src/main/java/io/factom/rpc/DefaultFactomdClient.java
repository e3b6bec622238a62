// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static io.factom.rpc.internal.RpcUtils.type;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
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
import io.factom.rpc.internal.RpcInvoker;
import java.util.List;
import org.jspecify.annotations.Nullable;

final class DefaultFactomdClient implements FactomdClient {

    private static final JavaType PENDING_ENTRIES = type(new TypeReference<List<PendingEntry>>() {});
    private static final JavaType PENDING_TRANSACTIONS = type(new TypeReference<List<PendingTransaction>>() {});

    private final RpcInvoker invoker;

    DefaultFactomdClient(final RpcInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public ApiResponse<Ack> ack(final String hash, final String chainid, final @Nullable String fullTransaction) {
        final RpcParams params = RpcParams.of("hash", hash)
                .put("chainid", chainid)
                .putIfPresent("fulltransaction", fullTransaction);
        return call("ack", params, type(Ack.class));
    }

    @Override
    public ApiResponse<ChainHead> chainHead(final String chainId) {
        return call("chain-head", RpcParams.of("chainid", chainId), type(ChainHead.class));
    }

    @Override
    public ApiResponse<CommitChain> commitChain(final String message) {
        return call("commit-chain", RpcParams.of("message", message), type(CommitChain.class));
    }

    @Override
    public ApiResponse<CommitEntry> commitEntry(final String message) {
        return call("commit-entry", RpcParams.of("message", message), type(CommitEntry.class));
    }

    @Override
    public ApiResponse<CurrentMinute> currentMinute() {
        return call("current-minute", RpcParams.empty(), type(CurrentMinute.class));
    }

    @Override
    public ApiResponse<DirectoryBlock> directoryBlock(final String keyMr) {
        return call("directory-block", RpcParams.of("keymr", keyMr), type(DirectoryBlock.class));
    }

    @Override
    public ApiResponse<DirectoryBlockHead> directoryBlockHead() {
        return call("directory-block-head", RpcParams.empty(), type(DirectoryBlockHead.class));
    }

    @Override
    public ApiResponse<Entry> entry(final String hash) {
        return call("entry", RpcParams.of("hash", hash), type(Entry.class));
    }

    @Override
    public ApiResponse<EntryBlock> entryBlock(final String keyMr) {
        return call("entry-block", RpcParams.of("keymr", keyMr), type(EntryBlock.class));
    }

    @Override
    public ApiResponse<Balance> entryCreditBalance(final String address) {
        return call("entry-credit-balance", RpcParams.of("address", address), type(Balance.class));
    }

    @Override
    public ApiResponse<EntryCreditRate> entryCreditRate() {
        return call("entry-credit-rate", RpcParams.empty(), type(EntryCreditRate.class));
    }

    @Override
    public ApiResponse<Balance> factoidBalance(final String address) {
        return call("factoid-balance", RpcParams.of("address", address), type(Balance.class));
    }

    @Override
    public ApiResponse<FactoidSubmit> factoidSubmit(final String transaction) {
        return call("factoid-submit", RpcParams.of("transaction", transaction), type(FactoidSubmit.class));
    }

    @Override
    public ApiResponse<Heights> heights() {
        return call("heights", RpcParams.empty(), type(Heights.class));
    }

    @Override
    public ApiResponse<MultipleBalances> multipleEntryCreditBalances(final List<String> addresses) {
        return call("multiple-ec-balances", RpcParams.of("addresses", List.copyOf(addresses)),
                type(MultipleBalances.class));
    }

    @Override
    public ApiResponse<MultipleBalances> multipleFactoidBalances(final List<String> addresses) {
        return call("multiple-fct-balances", RpcParams.of("addresses", List.copyOf(addresses)),
                type(MultipleBalances.class));
    }

    @Override
    public ApiResponse<List<PendingEntry>> pendingEntries() {
        return call("pending-entries", RpcParams.empty(), PENDING_ENTRIES);
    }

    @Override
    public ApiResponse<List<PendingTransaction>> pendingTransactions(final @Nullable String address) {
        return call("pending-transactions", RpcParams.empty().putIfPresent("address", address),
                PENDING_TRANSACTIONS);
    }

    @Override
    public ApiResponse<FactomdProperties> properties() {
        return call("properties", RpcParams.empty(), type(FactomdProperties.class));
    }

    @Override
    public ApiResponse<RawData> rawData(final String hash) {
        return call("raw-data", RpcParams.of("hash", hash), type(RawData.class));
    }

    @Override
    public ApiResponse<Receipt> receipt(final String hash, final @Nullable Boolean includeRawEntry) {
        final RpcParams params = RpcParams.of("hash", hash)
                .putIfPresent("includerawentry", includeRawEntry);
        return call("receipt", params, type(Receipt.class));
    }

    @Override
    public ApiResponse<RevealEntry> revealChain(final String entry) {
        return call("reveal-chain", RpcParams.of("entry", entry), type(RevealEntry.class));
    }

    @Override
    public ApiResponse<RevealEntry> revealEntry(final String entry) {
        return call("reveal-entry", RpcParams.of("entry", entry), type(RevealEntry.class));
    }

    @Override
    public ApiResponse<RawMessage> sendRawMessage(final String message) {
        return call("send-raw-message", RpcParams.of("message", message), type(RawMessage.class));
    }

    @Override
    public ApiResponse<Transaction> transaction(final String hash) {
        return call("transaction", RpcParams.of("hash", hash), type(Transaction.class));
    }

    private <T> ApiResponse<T> call(final String method, final RpcParams params, final JavaType resultType) {
        return invoker.call(Daemon.FACTOMD, method, params, resultType);
    }
}
