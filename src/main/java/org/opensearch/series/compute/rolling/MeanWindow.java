/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

import org.opensearch.series.core.buffer.ValueBuffer;

/**
 * Mostly behave the same as {@link SumWindow}, except giving out an average value instead of sum
 */
public class MeanWindow extends SumWindow {

    public MeanWindow(ValueBuffer values) {
        super(values);
    }

    @Override
    public double value() {
        if (numNonNull == 0) {
            return Double.NaN;
        }
        return super.value() / numNonNull;
    }

    @Override
    public long longValue() {
        throw new UnsupportedOperationException("a rolling mean is always floating point");
    }
}
