// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Block heights known to factomd ({@code heights}).
 *
 * @param directoryblockheight the height of the last saved directory block
 * @param leaderheight the height the leaders are currently working on
 * @param entryblockheight the height up to which entry blocks have been fetched
 * @param entryheight the height up to which entries have been fetched
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Heights(long directoryblockheight, long leaderheight, long entryblockheight, long entryheight) {}
