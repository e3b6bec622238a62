// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Merkle proof that an entry is anchored in the directory block chain
 * ({@code receipt}).
 *
 * @param receipt the receipt body
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Receipt(Body receipt) {

    /**
     * @param entry the entry hash and, when requested, the raw entry
     * @param merklebranch the path from the entry hash up to the directory block key merkle root
     * @param bitcointransactionhash the anchoring bitcoin transaction, absent until anchored
     * @param bitcoinblockhash the anchoring bitcoin block, absent until anchored
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Body(
            EntryRef entry,
            List<MerkleNode> merklebranch,
            String entryblockkeymr,
            String directoryblockkeymr,
            @Nullable String bitcointransactionhash,
            @Nullable String bitcoinblockhash) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntryRef(String entryhash, @Nullable String raw) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MerkleNode(String left, String right, String top) {}
}
