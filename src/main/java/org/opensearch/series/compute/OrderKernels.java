/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Sorting and local extrema.
 */
public final class OrderKernels {

    private OrderKernels() {}

    /**
     * Stable sort permutation. Ascending order puts nulls first, descending order puts them last.
     *
     * @param reverse true for descending order
     * @return positions of {@code series} in sorted order
     */
    public static int[] argsort(Series series, boolean reverse) {
        ValueBuffer values = series.getValues();
        Comparator<Integer> byValue = (a, b) -> {
            boolean aValid = series.isValid(a);
            boolean bValid = series.isValid(b);
            if (aValid && bValid) {
                return values.compare(a, b);
            }
            if (aValid == bValid) {
                return 0;
            }
            return aValid ? 1 : -1;
        };
        Integer[] order = new Integer[series.len()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, reverse ? byValue.reversed() : byValue);
        int[] result = new int[order.length];
        for (int i = 0; i < order.length; i++) {
            result[i] = order[i];
        }
        return result;
    }

    public static Series sort(Series series, boolean reverse) {
        return series.take(argsort(series, reverse));
    }

    /**
     * @return a BOOLEAN series, true where the value is strictly greater than both neighbours
     */
    public static Series peakMax(Series series) {
        return peaks(series, true);
    }

    /**
     * @return a BOOLEAN series, true where the value is strictly smaller than both neighbours
     */
    public static Series peakMin(Series series) {
        return peaks(series, false);
    }

    private static Series peaks(Series series, boolean max) {
        series.dtype().ensureOneOf(max ? "peak_max" : "peak_min", Dtype.INT64, Dtype.FLOAT64, Dtype.DATE32, Dtype.DATE64);
        ValueBuffer values = series.getValues();
        boolean[] result = new boolean[series.len()];
        for (int i = 1; i < result.length - 1; i++) {
            if (series.isValid(i - 1) && series.isValid(i) && series.isValid(i + 1)) {
                int sign = max ? 1 : -1;
                result[i] = sign * values.compare(i, i - 1) > 0 && sign * values.compare(i, i + 1) > 0;
            }
        }
        return new Series(series.getName(), Dtype.BOOLEAN, new BooleanValues(result), Validity.allValid(result.length));
    }
}
