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
import org.opensearch.series.core.model.Dtype;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Arrays;

public class ArithmeticKernelsTests extends OpenSearchTestCase {

    public void testIntegerArithmeticStaysInteger() {
        Series left = Series.ofLongs("a", 1L, 2L, null);
        Series right = Series.ofLongs("b", 10L, 20L, 30L);

        Series sum = ArithmeticKernels.add(left, right);
        assertEquals(Dtype.INT64, sum.dtype());
        assertEquals("a", sum.getName());
        assertEquals(Arrays.asList(11L, 22L, null), sum.toList());
        assertEquals(Arrays.asList(-9L, -18L, null), left.sub(right).toList());
        assertEquals(Arrays.asList(10L, 40L, null), left.mul(right).toList());
    }

    public void testDivisionIsFloatingPoint() {
        Series quotient = Series.ofLongs("a", 1L, 3L).div(Series.ofLongs("b", 2L, 0L));

        assertEquals(Dtype.FLOAT64, quotient.dtype());
        assertEquals(Arrays.asList(0.5, Double.POSITIVE_INFINITY), quotient.toList());

        Series extreme = Series.ofLongs("a", Long.MIN_VALUE).div(Series.ofLongs("b", -1L));
        assertEquals(Dtype.FLOAT64, extreme.dtype());
        assertEquals(Arrays.asList(9.223372036854775807E18), extreme.toList());
    }

    public void testMixedOperandsPromote() {
        Series result = Series.ofLongs("a", 1L, 2L).add(Series.ofDoubles("b", 0.5, 0.25));

        assertEquals(Dtype.FLOAT64, result.dtype());
        assertEquals(Arrays.asList(1.5, 2.25), result.toList());
    }

    public void testLengthOneBroadcasts() {
        Series values = Series.ofLongs("a", 1L, 2L, 3L);
        Series scalar = Series.ofLongs("k", 10L);

        assertEquals(Arrays.asList(10L, 20L, 30L), values.mul(scalar).toList());
        assertEquals(Arrays.asList(9L, 8L, 7L), scalar.sub(values).toList());
        assertEquals(Arrays.asList(null, null, null), values.add(Series.ofLongs("n", (Long) null)).toList());
    }

    public void testShapeMismatch() {
        SeriesShapeException e = expectThrows(
            SeriesShapeException.class,
            () -> Series.ofLongs("a", 1L, 2L).add(Series.ofLongs("b", 1L, 2L, 3L))
        );
        assertTrue(e.getMessage().contains("[2] and [3]"));
    }

    public void testUnsupportedDtypes() {
        expectThrows(SeriesTypeException.class, () -> Series.ofStrings("a", "x").add(Series.ofStrings("b", "y")));
        expectThrows(SeriesTypeException.class, () -> Series.ofBooleans("a", true).mul(Series.ofLongs("b", 1L)));
        expectThrows(SeriesTypeException.class, () -> Series.ofDate64("a", Arrays.asList(1L)).add(Series.ofLongs("b", 1L)));
    }

    public void testPow() {
        Series result = Series.ofLongs("a", 2L, null, 3L).pow(2);

        assertEquals(Dtype.FLOAT64, result.dtype());
        assertEquals(Arrays.asList(4.0, null, 9.0), result.toList());
        expectThrows(SeriesTypeException.class, () -> Series.ofStrings("s", "x").pow(2));
    }
}
