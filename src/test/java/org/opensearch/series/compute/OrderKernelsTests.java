/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.Series;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class OrderKernelsTests extends OpenSearchTestCase {

    public void testSortPlacesNullsFirstAscending() {
        Series series = Series.ofLongs("a", 3L, null, 1L, 2L);

        assertEquals(Arrays.asList(null, 1L, 2L, 3L), series.sort(false).toList());
        assertEquals(Arrays.asList(3L, 2L, 1L, null), series.sort(true).toList());
    }

    public void testArgsortIsStable() {
        Series series = Series.ofStrings("s", "b", "a", "b", "a");

        assertArrayEquals(new int[] { 1, 3, 0, 2 }, series.argsort(false));
        assertArrayEquals(new int[] { 0, 2, 1, 3 }, series.argsort(true));
    }

    public void testTakeOfArgsortIsSort() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < randomIntBetween(0, 30); i++) {
            values.add(randomBoolean() ? null : randomDoubleBetween(-10, 10, true));
        }
        Series series = Series.ofDoubles("f", values);
        boolean reverse = randomBoolean();

        assertEquals(series.sort(reverse), series.take(series.argsort(reverse)));
    }

    public void testPeaks() {
        Series series = Series.ofLongs("a", 1L, 3L, 2L, 2L, 0L, 5L, null, 4L, 1L);

        assertEquals(Arrays.asList(false, true, false, false, false, false, false, false, false), series.peakMax().toList());
        assertEquals(Arrays.asList(false, false, false, false, true, false, false, false, false), series.peakMin().toList());
        expectThrows(SeriesTypeException.class, () -> Series.ofStrings("s", "a").peakMax());
    }
}
