/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

import org.opensearch.series.common.exception.SeriesConfigurationException;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;

import java.util.Locale;

/**
 * Aggregations available over a rolling window.
 */
public enum RollingFunction {
    SUM,
    MEAN,
    MIN,
    MAX;

    /**
     * @param values the numeric buffer the window slides over
     * @param weights per-offset weights, or null; ignored by {@link #MIN} and {@link #MAX}
     */
    WindowTransformer createTransformer(ValueBuffer values, double[] weights) {
        return switch (this) {
            case SUM -> weights == null ? new SumWindow(values) : new WeightedSumWindow(values, weights);
            case MEAN -> weights == null ? new MeanWindow(values) : new WeightedMeanWindow(values, weights);
            case MIN -> new MinMaxQueue(values, true);
            case MAX -> new MinMaxQueue(values, false);
        };
    }

    /**
     * @return FLOAT64 for means and weighted sums, {@code input} otherwise
     */
    Dtype outputDtype(Dtype input, boolean weighted) {
        return switch (this) {
            case SUM -> weighted ? Dtype.FLOAT64 : input;
            case MEAN -> Dtype.FLOAT64;
            case MIN, MAX -> input;
        };
    }

    public static RollingFunction fromString(String function) {
        return switch (function.toLowerCase(Locale.ROOT)) {
            case "sum" -> SUM;
            case "mean" -> MEAN;
            case "min" -> MIN;
            case "max" -> MAX;
            default -> throw new SeriesConfigurationException("unknown rolling function [{}]", function);
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
