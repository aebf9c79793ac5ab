/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core;

import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.series.common.exception.SeriesRangeException;
import org.opensearch.series.common.exception.SeriesShapeException;
import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Scalar;
import org.opensearch.series.core.model.Validity;
import org.opensearch.test.AbstractWireSerializingTestCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class SeriesTests extends AbstractWireSerializingTestCase<Series> {

    public void testConstructionFromBoxedValues() {
        Series series = Series.ofLongs("a", 1L, null, 3L);

        assertEquals("a", series.getName());
        assertEquals(Dtype.INT64, series.dtype());
        assertEquals(3, series.len());
        assertEquals(1, series.nullCount());
        assertEquals(Scalar.of(1L), series.get(0));
        assertTrue(series.get(1).isNull());
        assertEquals(Arrays.asList(1L, null, 3L), series.toList());
    }

    public void testConstructionOfEveryDtype() {
        assertEquals(Arrays.asList(true, null), Series.ofBooleans("b", true, null).toList());
        assertEquals(Arrays.asList(1.5, null), Series.ofDoubles("f", 1.5, null).toList());
        assertEquals(Arrays.asList("x", null), Series.ofStrings("s", "x", null).toList());
        assertEquals(Arrays.asList(18262, null), Series.ofDate32("d", Arrays.asList(18262, null)).toList());
        assertEquals(Arrays.asList(1577836800000L, null), Series.ofDate64("t", Arrays.asList(1577836800000L, null)).toList());
        assertEquals(Scalar.of(18262L), Series.ofDate32("d", List.of(18262)).get(0));
    }

    public void testParseDateFactories() {
        Series days = Series.parseDate32("d", Arrays.asList("2020-01-01", "not a date", null));
        assertEquals(Dtype.DATE32, days.dtype());
        assertEquals(Arrays.asList(18262, null, null), days.toList());

        Series millis = Series.parseDate64("t", Arrays.asList("2020-01-01T00:00:00Z", "1577836800000", "garbage"));
        assertEquals(Dtype.DATE64, millis.dtype());
        assertEquals(Arrays.asList(1577836800000L, 1577836800000L, null), millis.toList());
    }

    public void testConstructorRejectsInconsistentParts() {
        expectThrows(
            SeriesTypeException.class,
            () -> new Series("x", Dtype.INT64, new DoubleValues(new double[] { 1.0 }), Validity.allValid(1))
        );
        expectThrows(
            SeriesShapeException.class,
            () -> new Series("x", Dtype.INT64, new LongValues(new long[] { 1L, 2L }), Validity.allValid(3))
        );
    }

    public void testDeepCopyIsIndependentAndEqual() {
        Series series = Series.ofStrings("s", "a", null, "c");
        Series copy = series.deepCopy();

        assertEquals(series, copy);
        assertNotSame(series.getValues(), copy.getValues());
        assertNotSame(series.getValidity(), copy.getValidity());
        copy.rename("other");
        assertEquals("s", series.getName());
    }

    public void testRenameMutatesInPlace() {
        Series series = Series.ofLongs("a", 1L);
        assertSame(series, series.rename("b"));
        assertEquals("b", series.getName());
    }

    public void testSlice() {
        Series series = sequence(10);

        assertEquals(Arrays.asList(2L, 3L, 4L), series.slice(2, 3).toList());
        assertEquals(Arrays.asList(7L, 8L, 9L), series.slice(-3, 10).toList());
        assertEquals(Arrays.asList(8L, 9L), series.slice(8, 5).toList());
        assertEquals(0, series.slice(20, 2).len());
        assertEquals(Arrays.asList(0L, 1L), series.slice(-50, 2).toList());
        expectThrows(SeriesRangeException.class, () -> series.slice(0, -1));
    }

    public void testHeadTailAndLimit() {
        Series series = sequence(15);

        assertEquals(Series.DEFAULT_HEAD_LENGTH, series.head().len());
        assertEquals(Series.DEFAULT_HEAD_LENGTH, series.tail().len());
        assertEquals(Arrays.asList(0L, 1L), series.head(2).toList());
        assertEquals(Arrays.asList(12L, 13L, 14L), series.tail(3).toList());
        assertEquals(15, series.tail(100).len());
        assertEquals(Arrays.asList(0L, 1L, 2L), series.limit(3).toList());
    }

    public void testAppend() {
        Series left = Series.ofLongs("left", 1L, null);
        Series right = Series.ofLongs("right", 3L);

        Series appended = left.append(right);
        assertEquals("left", appended.getName());
        assertEquals(Arrays.asList(1L, null, 3L), appended.toList());
        expectThrows(SeriesTypeException.class, () -> left.append(Series.ofDoubles("f", 1.0)));
    }

    public void testTake() {
        Series series = Series.ofStrings("s", "a", "b", null);

        assertEquals(Arrays.asList(null, "a", "a"), series.take(new int[] { 2, 0, 0 }).toList());
        expectThrows(SeriesRangeException.class, () -> series.take(new int[] { 3 }));
        expectThrows(SeriesRangeException.class, () -> series.take(new int[] { -1 }));
        expectThrows(SeriesRangeException.class, () -> series.get(5));
    }

    public void testTakeEveryAndReverse() {
        Series series = sequence(7);

        assertEquals(Arrays.asList(0L, 3L, 6L), series.takeEvery(3).toList());
        assertEquals(7, series.takeEvery(1).len());
        expectThrows(SeriesRangeException.class, () -> series.takeEvery(0));
        assertEquals(Arrays.asList(0L), series.takeEvery(Integer.MAX_VALUE).toList());
        assertEquals(0, sequence(0).takeEvery(Integer.MAX_VALUE).len());
        assertEquals(Arrays.asList(2L, 1L, 0L), sequence(3).reverse().toList());
    }

    public void testShift() {
        Series series = Series.ofLongs("a", 1L, 2L, 3L);

        assertEquals(Arrays.asList(null, 1L, 2L), series.shift(1).toList());
        assertEquals(Arrays.asList(2L, 3L, null), series.shift(-1).toList());
        assertEquals(Arrays.asList(null, null, null), series.shift(5).toList());
        assertEquals(series, series.shift(0));
    }

    public void testSampleIsReproducible() {
        Series series = sequence(50);
        long seed = randomLong();

        assertEquals(series.sample(10, false, seed), series.sample(10, false, seed));
        assertEquals(series.sample(10, true, seed), series.sample(10, true, seed));
        assertEquals(10, series.sample(10, false, seed).nUnique());
    }

    public void testSeriesEqual() {
        Series a = Series.ofLongs("a", 1L, null);
        Series b = Series.ofLongs("b", 1L, null);

        assertTrue(a.seriesEqual(b, true));
        assertFalse(a.seriesEqual(b, false));
        assertTrue(Series.ofLongs("a", 1L).seriesEqual(Series.ofLongs("b", 1L), false));
        assertFalse(a.seriesEqual(Series.ofLongs("a", 1L, 2L), true));
        assertFalse(a.seriesEqual(Series.ofDoubles("a", 1.0, null), true));
        assertNotEquals(a, b);
    }

    public void testToStringShowsValues() {
        assertEquals("Series{name='a', dtype=i64, values=[1, null]}", Series.ofLongs("a", 1L, null).toString());
    }

    private static Series sequence(int length) {
        List<Long> values = new ArrayList<>();
        for (long i = 0; i < length; i++) {
            values.add(i);
        }
        return Series.ofLongs("seq", values);
    }

    @Override
    protected Writeable.Reader<Series> instanceReader() {
        return Series::new;
    }

    @Override
    protected Series createTestInstance() {
        return randomSeries(randomAlphaOfLengthBetween(1, 10), randomFrom(Dtype.values()), randomIntBetween(0, 20));
    }

    @Override
    protected Series mutateInstance(Series instance) {
        return instance.deepCopy().rename(instance.getName() + "_mutated");
    }

    /**
     * Build a series of random values with roughly one null in five.
     */
    static Series randomSeries(String name, Dtype dtype, int length) {
        List<Object> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            if (randomIntBetween(0, 4) == 0) {
                values.add(null);
                continue;
            }
            values.add(switch (dtype) {
                case BOOLEAN -> randomBoolean();
                case INT64, DATE64 -> randomLong();
                case FLOAT64 -> randomDouble();
                case UTF8 -> randomAlphaOfLengthBetween(0, 8);
                case DATE32 -> randomInt();
            });
        }
        return switch (dtype) {
            case BOOLEAN -> Series.ofBooleans(name, cast(values));
            case INT64 -> Series.ofLongs(name, cast(values));
            case FLOAT64 -> Series.ofDoubles(name, cast(values));
            case UTF8 -> Series.ofStrings(name, cast(values));
            case DATE32 -> Series.ofDate32(name, cast(values));
            case DATE64 -> Series.ofDate64(name, cast(values));
        };
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> cast(List<Object> values) {
        return (List<T>) (List<?>) values;
    }
}
