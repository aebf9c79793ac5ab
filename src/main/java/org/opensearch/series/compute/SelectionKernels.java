/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.common.exception.SeriesShapeException;
import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

import java.util.Arrays;

/**
 * Mask driven selection: filtering, conditional merging and true-position lookup.
 */
public final class SelectionKernels {

    private SelectionKernels() {}

    /**
     * Keep the positions where {@code mask} is true. Null mask entries do not select.
     *
     * @param series the series to filter
     * @param mask a BOOLEAN series of the same length
     * @return the selected values, in order
     */
    public static Series filter(Series series, Series mask) {
        mask.dtype().ensureOneOf("filter mask", Dtype.BOOLEAN);
        if (mask.len() != series.len()) {
            throw new SeriesShapeException("filter mask length [{}] does not match series length [{}]", mask.len(), series.len());
        }
        return series.take(truePositions(mask));
    }

    /**
     * Merge two series position by position: {@code series[i]} where {@code mask[i]} is true, {@code other[i]}
     * where it is false or null. The result is null where the chosen side is null.
     *
     * @param series values taken where the mask is true
     * @param mask a BOOLEAN series
     * @param other values taken elsewhere, of the same dtype as {@code series}
     * @return the merged series, named after {@code series}
     */
    public static Series zipWith(Series series, Series mask, Series other) {
        mask.dtype().ensureOneOf("zip_with mask", Dtype.BOOLEAN);
        if (series.dtype() != other.dtype()) {
            throw new SeriesTypeException("zip_with requires series of the same dtype, got [{}] and [{}]", series.dtype(), other.dtype());
        }
        int length = series.len();
        if (mask.len() != length || other.len() != length) {
            throw new SeriesShapeException(
                "zip_with requires series, mask and other of equal length, got [{}], [{}] and [{}]",
                length,
                mask.len(),
                other.len()
            );
        }
        BooleanValues flags = (BooleanValues) mask.getValues();
        int[] indices = new int[length];
        for (int i = 0; i < length; i++) {
            boolean selected = mask.isValid(i) && flags.get(i);
            indices[i] = selected ? i : length + i;
        }
        ValueBuffer combinedValues = series.getValues().append(other.getValues());
        Validity combinedValidity = series.getValidity().append(other.getValidity());
        return series.withData(combinedValues.take(indices), combinedValidity.take(indices));
    }

    /**
     * @param mask a BOOLEAN series
     * @return an INT64 series holding the positions where {@code mask} is true
     */
    public static Series argTrue(Series mask) {
        mask.dtype().ensureOneOf("arg_true", Dtype.BOOLEAN);
        int[] positions = truePositions(mask);
        long[] result = new long[positions.length];
        for (int i = 0; i < positions.length; i++) {
            result[i] = positions[i];
        }
        return new Series(mask.getName(), Dtype.INT64, new LongValues(result), Validity.allValid(result.length));
    }

    private static int[] truePositions(Series mask) {
        BooleanValues flags = (BooleanValues) mask.getValues();
        int[] positions = new int[mask.len()];
        int count = 0;
        for (int i = 0; i < mask.len(); i++) {
            if (mask.isValid(i) && flags.get(i)) {
                positions[count++] = i;
            }
        }
        return Arrays.copyOf(positions, count);
    }
}
