// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * The public keys of an identity that were active at a given directory block
 * height, in order of decreasing priority.
 *
 * @param chainid the identity chain id
 * @param height the directory block height the keys were evaluated at
 * @param keys the active {@code idpub} keys
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActiveIdentityKeys(String chainid, long height, List<String> keys) {}
