/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

import org.opensearch.series.common.exception.SeriesConfigurationException;
import org.opensearch.series.common.exception.SeriesRangeException;
import org.opensearch.series.common.exception.SeriesShapeException;
import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.Series;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class RollingWindowTests extends OpenSearchTestCase {

    public void testRollingSumWithMinPeriods() {
        Series series = Series.ofLongs("a", 1L, 2L, 3L, 4L);

        Series result = series.rollingSum(RollingOptions.of(2).withMinPeriods(1).withIgnoreNull(true));
        assertEquals(Dtype.INT64, result.dtype());
        assertEquals(Arrays.asList(1L, 3L, 5L, 7L), result.toList());
    }

    public void testFullWindowRequiredByDefault() {
        Series series = Series.ofDoubles("f", 1.0, 2.0, 3.0, 4.0);

        assertEquals(Arrays.asList(null, null, 6.0, 9.0), series.rollingSum(RollingOptions.of(3)).toList());
        assertEquals(Arrays.asList(null, null, 2.0, 3.0), series.rollingMean(RollingOptions.of(3)).toList());
        assertEquals(Arrays.asList(null, null, 3.0, 4.0), series.rollingMax(RollingOptions.of(3)).toList());
        assertEquals(Arrays.asList(null, null, 1.0, 2.0), series.rollingMin(RollingOptions.of(3)).toList());
    }

    public void testWindowOfOneReturnsInput() {
        int length = randomIntBetween(1, 30);
        List<Double> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            values.add(randomDoubleBetween(-1000, 1000, true));
        }
        Series series = Series.ofDoubles("f", values);

        for (RollingFunction function : RollingFunction.values()) {
            assertEquals(values, series.rolling(function, RollingOptions.of(1)).toList());
        }
    }

    public void testNullPoisonsWindowUnlessIgnored() {
        Series series = Series.ofLongs("a", 1L, null, 3L, 4L, 5L);

        assertEquals(
            Arrays.asList(1L, null, null, 7L, 9L),
            series.rollingSum(RollingOptions.of(2).withMinPeriods(1)).toList()
        );
        assertEquals(
            Arrays.asList(1L, 1L, 3L, 7L, 9L),
            series.rollingSum(RollingOptions.of(2).withMinPeriods(1).withIgnoreNull(true)).toList()
        );
        assertEquals(
            Arrays.asList(null, null, null, 7L, 9L),
            series.rollingSum(RollingOptions.of(2).withIgnoreNull(true)).toList()
        );
    }

    public void testMinMaxAcrossSlidingWindow() {
        Series series = Series.ofLongs("a", 5L, 1L, 4L, 2L, 3L, 9L);
        RollingOptions options = RollingOptions.of(3).withMinPeriods(1);

        assertEquals(Arrays.asList(5L, 5L, 5L, 4L, 4L, 9L), series.rollingMax(options).toList());
        assertEquals(Arrays.asList(5L, 1L, 1L, 1L, 2L, 2L), series.rollingMin(options).toList());
    }

    public void testMeanIsFloatingPoint() {
        Series result = Series.ofLongs("a", 1L, 2L, null, 4L).rollingMean(RollingOptions.of(2).withMinPeriods(1).withIgnoreNull(true));

        assertEquals(Dtype.FLOAT64, result.dtype());
        assertEquals(Arrays.asList(1.0, 1.5, 2.0, 4.0), result.toList());
    }

    public void testFirstWeightAlignsWithOldestValue() {
        Series series = Series.ofLongs("a", 1L, 2L, 3L);
        RollingOptions options = RollingOptions.of(2).withWeights(0.5, 2.0).withMinPeriods(1);

        Series sum = series.rollingSum(options);
        assertEquals(Dtype.FLOAT64, sum.dtype());
        // the first window is clipped and uses only the first weight
        assertEquals(Arrays.asList(0.5, 4.5, 7.0), sum.toList());

        Series mean = series.rollingMean(options);
        assertEquals(Arrays.asList(1.0, 1.8, 2.8), mean.toList());

        // weights do not apply to extrema
        assertEquals(Arrays.asList(1L, 2L, 3L), series.rollingMax(options).toList());
    }

    public void testClippedWindowsUseHeadOfWeights() {
        Series series = Series.ofLongs("a", 1L, 2L, 3L, 4L);
        RollingOptions options = RollingOptions.of(3).withWeights(1.0, 10.0, 100.0).withMinPeriods(1);

        assertEquals(Arrays.asList(1.0, 21.0, 321.0, 432.0), series.rollingSum(options).toList());
    }

    public void testNaNLeavesTheWindow() {
        Series series = Series.ofDoubles("f", 1.0, Double.NaN, 2.0, 3.0);

        List<Object> sums = series.rollingSum(RollingOptions.of(2)).toList();
        assertNull(sums.get(0));
        assertTrue(Double.isNaN((Double) sums.get(1)));
        assertTrue(Double.isNaN((Double) sums.get(2)));
        assertEquals(5.0, (Double) sums.get(3), 0.0);
    }

    public void testValidation() {
        Series series = Series.ofLongs("a", 1L, 2L);

        expectThrows(SeriesRangeException.class, () -> series.rollingSum(RollingOptions.of(0)));
        expectThrows(SeriesRangeException.class, () -> series.rollingSum(RollingOptions.of(2).withMinPeriods(3)));
        expectThrows(SeriesRangeException.class, () -> series.rollingSum(RollingOptions.of(2).withMinPeriods(0)));
        expectThrows(SeriesShapeException.class, () -> series.rollingSum(RollingOptions.of(2).withWeights(1.0)));
        expectThrows(SeriesTypeException.class, () -> Series.ofStrings("s", "a").rollingSum(RollingOptions.of(1)));
    }

    public void testFunctionNames() {
        assertEquals(RollingFunction.MEAN, RollingFunction.fromString("Mean"));
        assertEquals("max", RollingFunction.MAX.toString());
        expectThrows(SeriesConfigurationException.class, () -> RollingFunction.fromString("median"));
    }

    public void testOptionsEquality() {
        RollingOptions options = RollingOptions.of(3).withWeights(1.0, 2.0, 3.0);

        assertEquals(options, RollingOptions.of(3).withWeights(1.0, 2.0, 3.0));
        assertEquals(options.hashCode(), RollingOptions.of(3).withWeights(1.0, 2.0, 3.0).hashCode());
        assertNotEquals(options, RollingOptions.of(3));
        assertEquals(3, options.effectiveMinPeriods());
    }
}
