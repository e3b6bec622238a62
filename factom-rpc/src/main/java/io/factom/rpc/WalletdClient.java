// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Typed calls against the wallet daemon, factom-walletd.
 *
 * <p>
 * The wallet holds keys and working transactions. It signs but never
 * broadcasts: a composed transaction or entry is submitted to the node with
 * {@link FactomdClient}. If the wallet is encrypted it must be unlocked with
 * {@link #unlockWallet} before any call that touches a secret.
 *
 * <p>
 * <strong>Building a transaction:</strong>
 *
 * <pre>{@code
 * WalletdClient walletd = factom.walletd();
 * walletd.newTransaction("tx").orElseThrow();
 * walletd.addInput("tx", "FA2jK2Hc...", 100_000_000L).orElseThrow();
 * walletd.addOutput("tx", "FA3EPZYq...", 100_000_000L).orElseThrow();
 * walletd.subFee("tx", "FA3EPZYq...").orElseThrow();
 * walletd.signTransaction("tx", null).orElseThrow();
 *
 * ComposedCall submit = walletd.composeTransaction("tx").orElseThrow();
 * factom.factomd().factoidSubmit(submit.param("transaction"));
 * }</pre>
 *
 * @see FactomdClient
 */
public interface WalletdClient {

    /**
     * Returns the identity keys that are active for an identity chain at a
     * given directory block height.
     *
     * @param chainId the identity chain id
     * @param height the directory block height
     * @return the active public keys
     */
    ApiResponse<ActiveIdentityKeys> activeIdentityKeys(String chainId, long height);

    /**
     * Adds an entry credit output to a working transaction.
     *
     * @param txName the wallet-local transaction name
     * @param address the public entry credit address
     * @param amount the value in factoshis, not entry credits
     * @return the updated transaction
     */
    ApiResponse<WalletTransaction> addEntryCreditOutput(String txName, String address, long amount);

    /**
     * Increases the input from {@code address} to cover the transaction fee.
     */
    ApiResponse<WalletTransaction> addFee(String txName, String address);

    ApiResponse<WalletTransaction> addInput(String txName, String address, long amount);

    ApiResponse<WalletTransaction> addOutput(String txName, String address, long amount);

    /**
     * Looks up the key pair for a public address held by the wallet.
     */
    ApiResponse<Address> address(String address);

    ApiResponse<Addresses> allAddresses();

    ApiResponse<IdentityKeys> allIdentityKeys();

    /**
     * Builds and signs the {@code commit-chain} and {@code reveal-chain} calls
     * for a new chain.
     *
     * <p>
     * The chain id is derived by the daemon from the external ids of the first
     * entry. Content and external ids are hex encoded.
     *
     * @param extIds the hex encoded external ids of the first entry
     * @param content the hex encoded content of the first entry
     * @param ecPub the entry credit address that pays for the chain
     * @return the commit and reveal pair
     */
    ApiResponse<ComposedEntry> composeChain(List<String> extIds, String content, String ecPub);

    /**
     * Builds and signs the {@code commit-entry} and {@code reveal-entry}
     * calls for a new entry in an existing chain.
     *
     * @param chainId the target chain
     * @param extIds the hex encoded external ids
     * @param content the hex encoded content
     * @param ecPub the entry credit address that pays for the entry
     * @return the commit and reveal pair
     */
    ApiResponse<ComposedEntry> composeEntry(String chainId, List<String> extIds, String content, String ecPub);

    /**
     * Returns the {@code factoid-submit} call for a signed working
     * transaction.
     */
    ApiResponse<ComposedCall> composeTransaction(String txName);

    ApiResponse<WalletTransaction> deleteTransaction(String txName);

    ApiResponse<Address> generateEntryCreditAddress();

    ApiResponse<Address> generateFactoidAddress();

    ApiResponse<IdentityKey> generateIdentityKey();

    /**
     * Returns the block height the wallet has synced to.
     */
    ApiResponse<WalletHeight> getHeight();

    /**
     * @param publicKey the public identity key ({@code idpub...})
     */
    ApiResponse<IdentityKey> identityKey(String publicKey);

    /**
     * Imports key pairs from their private keys ({@code Fs...} or
     * {@code Es...}).
     *
     * @param secrets the private keys
     * @return the imported key pairs
     */
    ApiResponse<Addresses> importAddresses(List<String> secrets);

    /**
     * Imports identity keys from their private keys ({@code idsec...}).
     */
    ApiResponse<IdentityKeys> importIdentityKeys(List<String> secrets);

    /**
     * Starts a new, empty working transaction.
     *
     * @param txName the wallet-local name, unique among working transactions
     * @return the empty transaction
     */
    ApiResponse<WalletTransaction> newTransaction(String txName);

    ApiResponse<WalletProperties> properties();

    ApiResponse<Removal> removeAddress(String address);

    ApiResponse<Removal> removeIdentityKey(String publicKey);

    /**
     * Signs arbitrary data.
     *
     * @param signer a public factoid, entry credit or identity address held by the wallet
     * @param data the base64 encoded data
     * @return the signature and the signing public key
     */
    ApiResponse<Signature> signData(String signer, String data);

    /**
     * Signs a working transaction.
     *
     * @param txName the wallet-local transaction name
     * @param force sign even if the fee looks wrong, or null for the daemon default
     * @return the signed transaction
     */
    ApiResponse<WalletTransaction> signTransaction(String txName, @Nullable Boolean force);

    /**
     * Decreases the output to {@code address} to cover the transaction fee.
     */
    ApiResponse<WalletTransaction> subFee(String txName, String address);

    ApiResponse<TemporaryTransactions> tmpTransactions();

    /**
     * Searches the transactions the wallet knows about.
     *
     * @param search one of {@link TransactionSearch#byId}, {@link TransactionSearch#byAddress}
     *               or {@link TransactionSearch#byRange}
     * @return the matching transactions
     */
    ApiResponse<WalletTransactions> transactions(TransactionSearch search);

    /**
     * Unlocks an encrypted wallet for a while.
     *
     * @param passphrase the wallet passphrase
     * @param timeoutSeconds how long the wallet stays unlocked
     * @return the time at which it locks again
     */
    ApiResponse<UnlockWallet> unlockWallet(String passphrase, long timeoutSeconds);

    /**
     * Exports the wallet seed and every key pair. The result contains secrets.
     */
    ApiResponse<WalletBackup> walletBackup();

    ApiResponse<WalletBalances> walletBalances();
}
