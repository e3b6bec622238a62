// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The wallet seed and every address held by the wallet ({@code wallet-backup}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletBackup(@JsonProperty("wallet-seed") String walletSeed, List<Address> addresses) {

    @Override
    public String toString() {
        return "WalletBackup[walletSeed=***, addresses=" + (addresses == null ? 0 : addresses.size()) + "]";
    }
}
