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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class SelectionKernelsTests extends OpenSearchTestCase {

    public void testFilterSkipsNullMaskEntries() {
        Series series = Series.ofStrings("s", "a", "b", "c", null);
        Series mask = Series.ofBooleans("m", true, null, true, true);

        assertEquals(Arrays.asList("a", "c", null), series.filter(mask).toList());
    }

    public void testFilterLengthMatchesTrueCount() {
        int length = randomIntBetween(0, 50);
        List<Long> values = new ArrayList<>();
        List<Boolean> flags = new ArrayList<>();
        int trueCount = 0;
        for (int i = 0; i < length; i++) {
            values.add(randomBoolean() ? null : randomLong());
            boolean flag = randomBoolean();
            trueCount += flag ? 1 : 0;
            flags.add(flag);
        }

        Series filtered = Series.ofLongs("v", values).filter(Series.ofBooleans("m", flags));
        assertEquals(trueCount, filtered.len());
    }

    public void testFilterValidation() {
        Series series = Series.ofLongs("a", 1L, 2L);
        expectThrows(SeriesTypeException.class, () -> series.filter(Series.ofLongs("m", 1L, 0L)));
        expectThrows(SeriesShapeException.class, () -> series.filter(Series.ofBooleans("m", true)));
    }

    public void testZipWithNullMaskSelectsOther() {
        Series series = Series.ofLongs("a", 1L, 2L, 3L, null);
        Series mask = Series.ofBooleans("m", true, false, null, true);
        Series other = Series.ofLongs("b", 10L, null, 30L, 40L);

        Series zipped = series.zipWith(mask, other);
        assertEquals("a", zipped.getName());
        assertEquals(Arrays.asList(1L, null, 30L, null), zipped.toList());
    }

    public void testZipWithValidation() {
        Series series = Series.ofLongs("a", 1L);
        expectThrows(SeriesTypeException.class, () -> series.zipWith(Series.ofBooleans("m", true), Series.ofDoubles("b", 1.0)));
        expectThrows(
            SeriesShapeException.class,
            () -> series.zipWith(Series.ofBooleans("m", true, false), Series.ofLongs("b", 1L))
        );
    }

    public void testArgTrue() {
        Series positions = Series.ofBooleans("m", false, true, null, true).argTrue();

        assertEquals(Dtype.INT64, positions.dtype());
        assertEquals(Arrays.asList(1L, 3L), positions.toList());
    }
}
