// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A directory block ({@code directory-block}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectoryBlock(Header header, List<EntryBlockRef> entryblocklist) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Header(String prevblockkeymr, long sequencenumber, long timestamp) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntryBlockRef(String chainid, String keymr) {}
}
