/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.stats;

import org.opensearch.series.common.exception.SeriesRangeException;
import org.opensearch.test.OpenSearchTestCase;

public class PercentileUtilsTests extends OpenSearchTestCase {

    /**
     * Test median calculation.
     */
    public void testCalculateMedian() {
        // Test empty array
        assertEquals(Double.NaN, PercentileUtils.calculateMedian(new double[0]), 0.0);

        // Test single value
        assertEquals(5.0, PercentileUtils.calculateMedian(new double[] { 5.0 }), 0.0);

        // Test even number of values averages the middle pair
        assertEquals(1.5, PercentileUtils.calculateMedian(new double[] { 1.0, 2.0 }), 0.0);
        assertEquals(2.5, PercentileUtils.calculateMedian(new double[] { 1.0, 2.0, 3.0, 4.0 }), 0.0);

        // Test odd number of values
        assertEquals(3.0, PercentileUtils.calculateMedian(new double[] { 1.0, 2.0, 3.0, 4.0, 5.0 }), 0.0);
    }

    /**
     * Test quantile calculation with linear interpolation.
     */
    public void testCalculateQuantile() {
        double[] values = { 1.0, 2.0, 3.0, 4.0, 5.0 };

        assertEquals(1.0, PercentileUtils.calculateQuantile(values, 0.0), 0.0);
        assertEquals(2.0, PercentileUtils.calculateQuantile(values, 0.25), 0.0);
        // rank 0.1 * 4 = 0.4 interpolates between the first two values
        assertEquals(1.4, PercentileUtils.calculateQuantile(values, 0.1), 1e-9);
        assertEquals(4.6, PercentileUtils.calculateQuantile(values, 0.9), 1e-9);
        assertEquals(5.0, PercentileUtils.calculateQuantile(values, 1.0), 0.0);
    }

    public void testQuantileOutOfRange() {
        double[] values = { 1.0 };
        expectThrows(SeriesRangeException.class, () -> PercentileUtils.calculateQuantile(values, -0.1));
        expectThrows(SeriesRangeException.class, () -> PercentileUtils.calculateQuantile(values, 1.5));
        expectThrows(SeriesRangeException.class, () -> PercentileUtils.calculateQuantile(values, Double.NaN));
    }
}
