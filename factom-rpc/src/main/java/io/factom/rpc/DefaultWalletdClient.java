// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static io.factom.rpc.internal.RpcUtils.type;

import com.fasterxml.jackson.databind.JavaType;
import io.factom.core.model.ActiveIdentityKeys;
import io.factom.core.model.Address;
import io.factom.core.model.Addresses;
import io.factom.core.model.ComposedCall;
import io.factom.core.model.ComposedEntry;
import io.factom.core.model.IdentityKey;
import io.factom.core.model.IdentityKeys;
import io.factom.core.model.Removal;
import io.factom.core.model.Signature;
import io.factom.core.model.TemporaryTransactions;
import io.factom.core.model.UnlockWallet;
import io.factom.core.model.WalletBackup;
import io.factom.core.model.WalletBalances;
import io.factom.core.model.WalletHeight;
import io.factom.core.model.WalletProperties;
import io.factom.core.model.WalletTransaction;
import io.factom.core.model.WalletTransactions;
import io.factom.rpc.internal.RpcInvoker;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

final class DefaultWalletdClient implements WalletdClient {

    private static final JavaType WALLET_TRANSACTION = type(WalletTransaction.class);

    private final RpcInvoker invoker;

    DefaultWalletdClient(final RpcInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public ApiResponse<ActiveIdentityKeys> activeIdentityKeys(final String chainId, final long height) {
        final RpcParams params = RpcParams.of("chainid", chainId).put("height", height);
        return call("active-identity-keys", params, type(ActiveIdentityKeys.class));
    }

    @Override
    public ApiResponse<WalletTransaction> addEntryCreditOutput(
            final String txName, final String address, final long amount) {
        return call("add-ec-output", transfer(txName, address, amount), WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<WalletTransaction> addFee(final String txName, final String address) {
        return call("add-fee", RpcParams.of("tx-name", txName).put("address", address), WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<WalletTransaction> addInput(final String txName, final String address, final long amount) {
        return call("add-input", transfer(txName, address, amount), WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<WalletTransaction> addOutput(final String txName, final String address, final long amount) {
        return call("add-output", transfer(txName, address, amount), WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<Address> address(final String address) {
        return call("address", RpcParams.of("address", address), type(Address.class));
    }

    @Override
    public ApiResponse<Addresses> allAddresses() {
        return call("all-addresses", RpcParams.empty(), type(Addresses.class));
    }

    @Override
    public ApiResponse<IdentityKeys> allIdentityKeys() {
        return call("all-identity-keys", RpcParams.empty(), type(IdentityKeys.class));
    }

    @Override
    public ApiResponse<ComposedEntry> composeChain(
            final List<String> extIds, final String content, final String ecPub) {
        final Map<String, Object> firstEntry = new LinkedHashMap<>();
        firstEntry.put("extids", List.copyOf(extIds));
        firstEntry.put("content", Objects.requireNonNull(content, "content"));
        final RpcParams params = RpcParams.of("chain", Map.of("firstentry", firstEntry))
                .put("ecpub", ecPub);
        return call("compose-chain", params, type(ComposedEntry.class));
    }

    @Override
    public ApiResponse<ComposedEntry> composeEntry(
            final String chainId, final List<String> extIds, final String content, final String ecPub) {
        final Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("chainid", Objects.requireNonNull(chainId, "chainId"));
        entry.put("extids", List.copyOf(extIds));
        entry.put("content", Objects.requireNonNull(content, "content"));
        final RpcParams params = RpcParams.of("entry", entry).put("ecpub", ecPub);
        return call("compose-entry", params, type(ComposedEntry.class));
    }

    @Override
    public ApiResponse<ComposedCall> composeTransaction(final String txName) {
        return call("compose-transaction", RpcParams.of("tx-name", txName), type(ComposedCall.class));
    }

    @Override
    public ApiResponse<WalletTransaction> deleteTransaction(final String txName) {
        return call("delete-transaction", RpcParams.of("tx-name", txName), WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<Address> generateEntryCreditAddress() {
        return call("generate-ec-address", RpcParams.empty(), type(Address.class));
    }

    @Override
    public ApiResponse<Address> generateFactoidAddress() {
        return call("generate-factoid-address", RpcParams.empty(), type(Address.class));
    }

    @Override
    public ApiResponse<IdentityKey> generateIdentityKey() {
        return call("generate-identity-key", RpcParams.empty(), type(IdentityKey.class));
    }

    @Override
    public ApiResponse<WalletHeight> getHeight() {
        return call("get-height", RpcParams.empty(), type(WalletHeight.class));
    }

    @Override
    public ApiResponse<IdentityKey> identityKey(final String publicKey) {
        return call("identity-key", RpcParams.of("public", publicKey), type(IdentityKey.class));
    }

    @Override
    public ApiResponse<Addresses> importAddresses(final List<String> secrets) {
        return call("import-addresses", RpcParams.of("addresses", secretList(secrets)), type(Addresses.class));
    }

    @Override
    public ApiResponse<IdentityKeys> importIdentityKeys(final List<String> secrets) {
        return call("import-identity-keys", RpcParams.of("keys", secretList(secrets)), type(IdentityKeys.class));
    }

    @Override
    public ApiResponse<WalletTransaction> newTransaction(final String txName) {
        return call("new-transaction", RpcParams.of("tx-name", txName), WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<WalletProperties> properties() {
        return call("properties", RpcParams.empty(), type(WalletProperties.class));
    }

    @Override
    public ApiResponse<Removal> removeAddress(final String address) {
        return call("remove-address", RpcParams.of("address", address), type(Removal.class));
    }

    @Override
    public ApiResponse<Removal> removeIdentityKey(final String publicKey) {
        return call("remove-identity-key", RpcParams.of("public", publicKey), type(Removal.class));
    }

    @Override
    public ApiResponse<Signature> signData(final String signer, final String data) {
        return call("sign-data", RpcParams.of("signer", signer).put("data", data), type(Signature.class));
    }

    @Override
    public ApiResponse<WalletTransaction> signTransaction(final String txName, final @Nullable Boolean force) {
        final RpcParams params = RpcParams.of("tx-name", txName).putIfPresent("force", force);
        return call("sign-transaction", params, WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<WalletTransaction> subFee(final String txName, final String address) {
        return call("sub-fee", RpcParams.of("tx-name", txName).put("address", address), WALLET_TRANSACTION);
    }

    @Override
    public ApiResponse<TemporaryTransactions> tmpTransactions() {
        return call("tmp-transactions", RpcParams.empty(), type(TemporaryTransactions.class));
    }

    @Override
    public ApiResponse<WalletTransactions> transactions(final TransactionSearch search) {
        final RpcParams params = RpcParams.empty();
        Objects.requireNonNull(search, "search").applyTo(params);
        return call("transactions", params, type(WalletTransactions.class));
    }

    @Override
    public ApiResponse<UnlockWallet> unlockWallet(final String passphrase, final long timeoutSeconds) {
        final RpcParams params = RpcParams.of("passphrase", passphrase).put("timeout", timeoutSeconds);
        return call("unlock-wallet", params, type(UnlockWallet.class));
    }

    @Override
    public ApiResponse<WalletBackup> walletBackup() {
        return call("wallet-backup", RpcParams.empty(), type(WalletBackup.class));
    }

    @Override
    public ApiResponse<WalletBalances> walletBalances() {
        return call("wallet-balances", RpcParams.empty(), type(WalletBalances.class));
    }

    private static RpcParams transfer(final String txName, final String address, final long amount) {
        return RpcParams.of("tx-name", txName).put("address", address).put("amount", amount);
    }

    private static List<Map<String, String>> secretList(final List<String> secrets) {
        final List<Map<String, String>> out = new ArrayList<>(secrets.size());
        for (String secret : secrets) {
            out.add(Map.of("secret", Objects.requireNonNull(secret, "secret")));
        }
        return out;
    }

    private <T> ApiResponse<T> call(final String method, final RpcParams params, final JavaType resultType) {
        return invoker.call(Daemon.WALLETD, method, params, resultType);
    }
}
