/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.stats;

import org.opensearch.series.common.exception.SeriesRangeException;

/**
 * Order statistics over sorted arrays.
 */
public final class PercentileUtils {

    private PercentileUtils() {}

    /**
     * Quantile by linear interpolation between the two closest ranks, at rank {@code quantile * (n - 1)}.
     *
     * @param sorted values in ascending order
     * @param quantile a value in {@code [0, 1]}
     * @return the interpolated quantile, or NaN for an empty array
     * @throws SeriesRangeException if {@code quantile} is outside {@code [0, 1]}
     */
    public static double calculateQuantile(double[] sorted, double quantile) {
        if (!(quantile >= 0.0 && quantile <= 1.0)) {
            throw new SeriesRangeException("quantile must be between 0 and 1, got [{}]", quantile);
        }
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double rank = quantile * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    /**
     * @param sorted values in ascending order
     * @return the middle value, or the mean of the two middle values for an even length; NaN when empty
     */
    public static double calculateMedian(double[] sorted) {
        return calculateQuantile(sorted, 0.5);
    }
}
