// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * An entry block ({@code entry-block}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntryBlock(Header header, List<EntryRef> entrylist) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Header(long blocksequencenumber, String chainid, String prevkeymr, long timestamp, long dbheight) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntryRef(String entryhash, long timestamp) {}
}
