// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * All identity key pairs stored in the wallet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityKeys(List<IdentityKey> keys) {}
