/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;

/**
 * Running aggregates. Nulls are skipped by the running state and stay null in the output. With {@code reverse}
 * the aggregate runs from the last position towards the first.
 */
public final class CumulativeKernels {

    private CumulativeKernels() {}

    public static Series cumSum(Series series, boolean reverse) {
        series.dtype().ensureOneOf("cum_sum", Dtype.INT64, Dtype.FLOAT64);
        ValueBuffer values = series.getValues();
        int n = series.len();
        if (series.dtype() == Dtype.INT64) {
            long[] result = new long[n];
            long sum = 0;
            for (int k = 0; k < n; k++) {
                int i = reverse ? n - 1 - k : k;
                if (series.isValid(i)) {
                    sum += values.getLong(i);
                    result[i] = sum;
                }
            }
            return series.withData(new LongValues(result), series.getValidity().copy());
        }
        double[] result = new double[n];
        double sum = 0;
        for (int k = 0; k < n; k++) {
            int i = reverse ? n - 1 - k : k;
            if (series.isValid(i)) {
                sum += values.getDouble(i);
                result[i] = sum;
            }
        }
        return series.withData(new DoubleValues(result), series.getValidity().copy());
    }

    public static Series cumMax(Series series, boolean reverse) {
        return cumExtremum(series, reverse, true);
    }

    public static Series cumMin(Series series, boolean reverse) {
        return cumExtremum(series, reverse, false);
    }

    private static Series cumExtremum(Series series, boolean reverse, boolean max) {
        series.dtype().ensureOneOf(max ? "cum_max" : "cum_min", Dtype.INT64, Dtype.FLOAT64, Dtype.DATE32, Dtype.DATE64);
        ValueBuffer values = series.getValues();
        int n = series.len();
        int[] indices = new int[n];
        int best = -1;
        for (int k = 0; k < n; k++) {
            int i = reverse ? n - 1 - k : k;
            if (series.isValid(i) == false) {
                indices[i] = -1;
                continue;
            }
            if (best < 0) {
                best = i;
            } else {
                int order = values.compare(i, best);
                if (max ? order > 0 : order < 0) {
                    best = i;
                }
            }
            indices[i] = best;
        }
        return series.withData(values.take(indices), series.getValidity().take(indices));
    }
}
