// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Timing information about the block currently being built ({@code current-minute}).
 * Times are in nanoseconds since the Unix epoch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CurrentMinute(
        long leaderheight,
        long directoryblockheight,
        int minute,
        long currentblockstarttime,
        long currentminutestarttime,
        long currenttime,
        long directoryblockinseconds,
        boolean stalldetected,
        long faulttimeout,
        long roundtimeout) {}
