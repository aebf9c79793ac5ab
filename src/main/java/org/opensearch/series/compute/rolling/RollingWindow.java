/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

/**
 * Slides a trailing window over a numeric series and emits one aggregate per position.
 *
 * <p>The window ending at position {@code i} covers {@code [i - windowSize + 1, i]}, clipped at the start of the
 * series. The output at {@code i} is null unless the window holds at least {@code min_periods} periods. With
 * {@code ignore_null} only non-null values count as periods; without it every position of the clipped window
 * counts, and a single null in the window makes the output null.</p>
 */
public final class RollingWindow {

    private RollingWindow() {}

    /**
     * @param series an INT64 or FLOAT64 series
     * @param function the aggregation
     * @param options window parameters
     * @return a series of the same length and name
     */
    public static Series apply(Series series, RollingFunction function, RollingOptions options) {
        series.dtype().ensureOneOf("rolling_" + function, Dtype.INT64, Dtype.FLOAT64);
        options.validate();

        int windowSize = options.windowSize();
        int minPeriods = options.effectiveMinPeriods();
        double[] weights = function == RollingFunction.MIN || function == RollingFunction.MAX ? null : options.weights();
        Dtype outputDtype = function.outputDtype(series.dtype(), weights != null);
        ValueBuffer values = series.getValues();
        WindowTransformer window = function.createTransformer(values, weights);

        int n = series.len();
        double[] doubles = outputDtype == Dtype.FLOAT64 ? new double[n] : null;
        long[] longs = outputDtype == Dtype.INT64 ? new long[n] : null;
        Validity.Builder validity = Validity.builder(n);
        int nullsInWindow = 0;

        for (int i = 0; i < n; i++) {
            int expired = i - windowSize;
            if (expired >= 0) {
                if (series.isValid(expired)) {
                    window.remove(expired);
                } else {
                    window.removeNull(expired);
                    nullsInWindow--;
                }
            }
            if (series.isValid(i)) {
                window.add(i);
            } else {
                window.addNull(i);
                nullsInWindow++;
            }

            int nonNull = window.getNonNullCount();
            int periods = options.ignoreNull() ? nonNull : Math.min(i + 1, windowSize);
            boolean defined = nonNull > 0 && periods >= minPeriods && (options.ignoreNull() || nullsInWindow == 0);
            if (defined == false) {
                continue;
            }
            if (longs != null) {
                longs[i] = window.longValue();
            } else {
                doubles[i] = window.value();
            }
            validity.setValid(i);
        }

        ValueBuffer result = longs != null ? new LongValues(longs) : new DoubleValues(doubles);
        return new Series(series.getName(), outputDtype, result, validity.build());
    }
}
