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
 * Weighted mean over the window: the weighted sum divided by the sum of the weights of the non-null values.
 */
public class WeightedMeanWindow extends WeightedSumWindow {

    public WeightedMeanWindow(ValueBuffer values, double[] weights) {
        super(values, weights);
    }

    @Override
    public double value() {
        double total = weightTotal();
        if (getNonNullCount() == 0 || total == 0) {
            return Double.NaN;
        }
        return super.value() / total;
    }
}
