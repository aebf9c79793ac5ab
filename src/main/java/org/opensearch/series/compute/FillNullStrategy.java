/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.common.exception.SeriesConfigurationException;

import java.util.Locale;

/**
 * How {@code fill_none} replaces nulls.
 */
public enum FillNullStrategy {
    /** Carry the last preceding value forward; leading nulls stay null */
    FORWARD,
    /** Carry the next following value backward; trailing nulls stay null */
    BACKWARD,
    /** Replace nulls with the smallest value */
    MIN,
    /** Replace nulls with the largest value */
    MAX,
    /** Replace nulls with the mean, truncated toward zero for INT64 series */
    MEAN;

    public static FillNullStrategy fromString(String strategy) {
        return switch (strategy.toLowerCase(Locale.ROOT)) {
            case "forward" -> FORWARD;
            case "backward" -> BACKWARD;
            case "min" -> MIN;
            case "max" -> MAX;
            case "mean" -> MEAN;
            default -> throw new SeriesConfigurationException("unknown fill strategy [{}]", strategy);
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
