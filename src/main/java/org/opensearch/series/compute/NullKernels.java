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
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

/**
 * Null inspection, removal and replacement.
 */
public final class NullKernels {

    private NullKernels() {}

    /**
     * @return a BOOLEAN series without nulls, true where {@code series} is null
     */
    public static Series isNull(Series series) {
        boolean[] result = new boolean[series.len()];
        for (int i = 0; i < result.length; i++) {
            result[i] = series.isValid(i) == false;
        }
        return new Series(series.getName(), Dtype.BOOLEAN, new BooleanValues(result), Validity.allValid(result.length));
    }

    /**
     * @return a BOOLEAN series without nulls, true where {@code series} holds a value
     */
    public static Series isNotNull(Series series) {
        boolean[] result = new boolean[series.len()];
        for (int i = 0; i < result.length; i++) {
            result[i] = series.isValid(i);
        }
        return new Series(series.getName(), Dtype.BOOLEAN, new BooleanValues(result), Validity.allValid(result.length));
    }

    public static Series dropNulls(Series series) {
        int[] indices = new int[series.len() - series.nullCount()];
        int count = 0;
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i)) {
                indices[count++] = i;
            }
        }
        return series.take(indices);
    }

    /**
     * Replace nulls according to {@code strategy}. A series without any value is returned unchanged.
     */
    public static Series fillNull(Series series, FillNullStrategy strategy) {
        if (strategy == FillNullStrategy.MEAN) {
            series.dtype().ensureOneOf("fill_none with mean", Dtype.INT64, Dtype.FLOAT64);
        }
        if (series.nullCount() == 0 || series.nullCount() == series.len()) {
            return series.deepCopy();
        }
        return switch (strategy) {
            case FORWARD -> gather(series, forwardIndices(series));
            case BACKWARD -> gather(series, backwardIndices(series));
            case MIN -> gather(series, extremumIndices(series, false));
            case MAX -> gather(series, extremumIndices(series, true));
            case MEAN -> fillWithMean(series);
        };
    }

    private static Series gather(Series series, int[] indices) {
        return series.withData(series.getValues().take(indices), series.getValidity().take(indices));
    }

    private static int[] forwardIndices(Series series) {
        int[] indices = new int[series.len()];
        int last = -1;
        for (int i = 0; i < indices.length; i++) {
            if (series.isValid(i)) {
                last = i;
            }
            indices[i] = last;
        }
        return indices;
    }

    private static int[] backwardIndices(Series series) {
        int[] indices = new int[series.len()];
        int next = -1;
        for (int i = indices.length - 1; i >= 0; i--) {
            if (series.isValid(i)) {
                next = i;
            }
            indices[i] = next;
        }
        return indices;
    }

    private static int[] extremumIndices(Series series, boolean max) {
        ValueBuffer values = series.getValues();
        int best = -1;
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i) == false) {
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
        }
        int[] indices = new int[series.len()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = series.isValid(i) ? i : best;
        }
        return indices;
    }

    private static Series fillWithMean(Series series) {
        ValueBuffer source = series.getValues();
        int count = series.len() - series.nullCount();
        Validity validity = Validity.allValid(series.len());
        if (series.dtype() == Dtype.INT64) {
            long sum = 0;
            for (int i = 0; i < series.len(); i++) {
                if (series.isValid(i)) {
                    sum += source.getLong(i);
                }
            }
            long mean = sum / count;
            long[] values = new long[series.len()];
            for (int i = 0; i < values.length; i++) {
                values[i] = series.isValid(i) ? source.getLong(i) : mean;
            }
            return series.withData(new LongValues(values), validity);
        }
        double sum = 0;
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i)) {
                sum += source.getDouble(i);
            }
        }
        double mean = sum / count;
        double[] values = new double[series.len()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.isValid(i) ? source.getDouble(i) : mean;
        }
        return series.withData(new DoubleValues(values), validity);
    }
}
