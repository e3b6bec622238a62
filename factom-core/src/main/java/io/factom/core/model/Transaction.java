// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Result of the factomd {@code transaction} call.
 *
 * <p>If the hash is unknown the inclusion fields come back empty and
 * {@code includedindirectoryblockheight} is {@code -1}. The
 * {@code blockheight} inside {@link FactoidTransaction} is always {@code 0}
 * for this call.
 *
 * @param factoidtransaction the decoded transaction
 * @param includedintransactionblock the factoid block key merkle root
 * @param includedindirectoryblock the directory block key merkle root
 * @param includedindirectoryblockheight the directory block height, or -1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Transaction(
        FactoidTransaction factoidtransaction,
        String includedintransactionblock,
        String includedindirectoryblock,
        long includedindirectoryblockheight) {

    /**
     * @return true if the transaction has been recorded in a directory block
     */
    public boolean isIncluded() {
        return includedindirectoryblockheight >= 0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FactoidTransaction(
            long millitimestamp,
            List<TransactionIo> inputs,
            List<TransactionIo> outputs,
            List<TransactionIo> outecs,
            List<String> rcds,
            List<SignatureBlock> sigblocks,
            long blockheight) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SignatureBlock(List<String> signatures) {}
}
