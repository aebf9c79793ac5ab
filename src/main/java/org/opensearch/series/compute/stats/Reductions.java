/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.stats;

import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Scalar;
import org.opensearch.series.core.model.Validity;

import java.util.Arrays;

/**
 * Reductions of a series to a single value. Nulls are ignored; a series without any value reduces to
 * {@link Scalar#NULL}.
 *
 * <table>
 *   <caption>Supported dtypes</caption>
 *   <tr><th>Reduction</th><th>Dtypes</th><th>Result</th></tr>
 *   <tr><td>sum</td><td>BOOLEAN, INT64, FLOAT64</td><td>integer, float for FLOAT64</td></tr>
 *   <tr><td>mean</td><td>BOOLEAN, INT64, FLOAT64</td><td>float</td></tr>
 *   <tr><td>min, max</td><td>BOOLEAN, INT64, FLOAT64, DATE32, DATE64</td><td>integer, float for FLOAT64</td></tr>
 *   <tr><td>median, var, std, quantile</td><td>INT64, FLOAT64</td><td>float</td></tr>
 * </table>
 */
public final class Reductions {

    private Reductions() {}

    public static Scalar sum(Series series) {
        series.dtype().ensureOneOf("sum", Dtype.BOOLEAN, Dtype.INT64, Dtype.FLOAT64);
        if (series.nullCount() == series.len()) {
            return Scalar.NULL;
        }
        ValueBuffer values = series.getValues();
        if (series.dtype() == Dtype.FLOAT64) {
            double sum = 0;
            for (int i = 0; i < series.len(); i++) {
                if (series.isValid(i)) {
                    sum += values.getDouble(i);
                }
            }
            return Scalar.of(sum);
        }
        long sum = 0;
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i)) {
                sum += values.getLong(i);
            }
        }
        return Scalar.of(sum);
    }

    public static Scalar mean(Series series) {
        series.dtype().ensureOneOf("mean", Dtype.BOOLEAN, Dtype.INT64, Dtype.FLOAT64);
        int count = series.len() - series.nullCount();
        if (count == 0) {
            return Scalar.NULL;
        }
        return Scalar.of(validSum(series) / count);
    }

    public static Scalar min(Series series) {
        return extremum(series, false);
    }

    public static Scalar max(Series series) {
        return extremum(series, true);
    }

    public static Scalar median(Series series) {
        series.dtype().ensureOneOf("median", Dtype.INT64, Dtype.FLOAT64);
        double[] sorted = sortedValidValues(series);
        return sorted.length == 0 ? Scalar.NULL : Scalar.of(PercentileUtils.calculateMedian(sorted));
    }

    /**
     * Sample variance, with one degree of freedom subtracted.
     *
     * @return the variance, or {@link Scalar#NULL} with fewer than two values
     */
    public static Scalar var(Series series) {
        series.dtype().ensureOneOf("var", Dtype.INT64, Dtype.FLOAT64);
        int count = series.len() - series.nullCount();
        if (count < 2) {
            return Scalar.NULL;
        }
        return Scalar.of(sampleVariance(series, count));
    }

    /**
     * Sample standard deviation, with one degree of freedom subtracted.
     *
     * @return the standard deviation, or {@link Scalar#NULL} with fewer than two values
     */
    public static Scalar std(Series series) {
        series.dtype().ensureOneOf("std", Dtype.INT64, Dtype.FLOAT64);
        int count = series.len() - series.nullCount();
        if (count < 2) {
            return Scalar.NULL;
        }
        return Scalar.of(Math.sqrt(sampleVariance(series, count)));
    }

    /**
     * @param quantile a value in {@code [0, 1]}
     * @return a single element FLOAT64 series holding the interpolated quantile, null when the series has no value
     */
    public static Series quantile(Series series, double quantile) {
        series.dtype().ensureOneOf("quantile", Dtype.INT64, Dtype.FLOAT64);
        double value = PercentileUtils.calculateQuantile(sortedValidValues(series), quantile);
        boolean present = series.nullCount() < series.len();
        return new Series(
            series.getName(),
            Dtype.FLOAT64,
            new DoubleValues(new double[] { present ? value : 0.0 }),
            present ? Validity.allValid(1) : Validity.allNull(1)
        );
    }

    private static Scalar extremum(Series series, boolean max) {
        series.dtype()
            .ensureOneOf(max ? "max" : "min", Dtype.BOOLEAN, Dtype.INT64, Dtype.FLOAT64, Dtype.DATE32, Dtype.DATE64);
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
        if (best < 0) {
            return Scalar.NULL;
        }
        return series.dtype() == Dtype.FLOAT64 ? Scalar.of(values.getDouble(best)) : Scalar.of(values.getLong(best));
    }

    private static double validSum(Series series) {
        ValueBuffer values = series.getValues();
        double sum = 0;
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i)) {
                sum += values.getDouble(i);
            }
        }
        return sum;
    }

    private static double sampleVariance(Series series, int count) {
        ValueBuffer values = series.getValues();
        double mean = validSum(series) / count;
        double squares = 0;
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i)) {
                double deviation = values.getDouble(i) - mean;
                squares += deviation * deviation;
            }
        }
        return squares / (count - 1);
    }

    private static double[] sortedValidValues(Series series) {
        ValueBuffer values = series.getValues();
        double[] result = new double[series.len() - series.nullCount()];
        int count = 0;
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i)) {
                result[count++] = values.getDouble(i);
            }
        }
        Arrays.sort(result);
        return result;
    }
}
