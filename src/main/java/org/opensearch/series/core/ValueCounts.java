/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core;

import org.opensearch.series.core.model.Scalar;

import java.util.Objects;

/**
 * Result of {@code value_counts}: the distinct values of a series and the number of times each occurs.
 * Both series have the same length; {@code counts} is an INT64 series named {@value #COUNTS_NAME}.
 *
 * @param values distinct values, null included, keeping the dtype and name of the counted series
 * @param counts occurrences of the value at the same position
 */
public record ValueCounts(Series values, Series counts) {

    public static final String COUNTS_NAME = "counts";

    public ValueCounts {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(counts, "counts must not be null");
    }

    public int len() {
        return values.len();
    }

    /**
     * @return the number of occurrences of the value at {@code index}
     */
    public long countAt(int index) {
        return ((Scalar.IntegerScalar) counts.get(index)).value();
    }
}
