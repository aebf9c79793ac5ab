/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.series.common.SeriesEngineConfig;
import org.opensearch.series.common.exception.SeriesRangeException;
import org.opensearch.series.common.exception.SeriesShapeException;
import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.compute.ArithmeticKernels;
import org.opensearch.series.compute.CastKernels;
import org.opensearch.series.compute.CastTarget;
import org.opensearch.series.compute.ComparisonKernels;
import org.opensearch.series.compute.CumulativeKernels;
import org.opensearch.series.compute.DistinctKernels;
import org.opensearch.series.compute.FillNullStrategy;
import org.opensearch.series.compute.NullKernels;
import org.opensearch.series.compute.OrderKernels;
import org.opensearch.series.compute.SelectionKernels;
import org.opensearch.series.compute.StringKernels;
import org.opensearch.series.compute.rolling.RollingFunction;
import org.opensearch.series.compute.rolling.RollingOptions;
import org.opensearch.series.compute.rolling.RollingWindow;
import org.opensearch.series.compute.sampling.RandomIndices;
import org.opensearch.series.compute.stats.Reductions;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.IntValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.Utf8Values;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Scalar;
import org.opensearch.series.core.model.Validity;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed, null-aware column of values.
 *
 * <p>A series pairs a {@link ValueBuffer} with a {@link Validity} bitmap of the same length and a {@link Dtype}
 * fixed for its lifetime. Every operation returns a new series, a {@link Scalar} or an index array and leaves
 * its inputs untouched.</p>
 *
 * <h2>Thread Safety:</h2>
 * <p>A series may be read concurrently from any number of threads. {@link #rename(String)} is the only
 * mutating method; it must not run concurrently with any other access to the same series.</p>
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * Series s = Series.ofLongs("a", 1L, null, 3L);
 * s.sum();                               // IntegerScalar[value=4]
 * s.fillNull("forward");                 // [1, 1, 3]
 * s.rollingSum(RollingOptions.of(2).withMinPeriods(1));
 * }</pre>
 */
public final class Series implements Writeable {

    /** Rows returned by {@link #head()} and {@link #tail()} */
    public static final int DEFAULT_HEAD_LENGTH = 10;

    private String name;
    private final Dtype dtype;
    private final ValueBuffer values;
    private final Validity validity;

    /**
     * Assemble a series from parts it takes ownership of.
     *
     * @param name the series name
     * @param dtype the element type
     * @param values a buffer of the class backing {@code dtype}
     * @param validity a bitmap of the same length as {@code values}
     */
    public Series(String name, Dtype dtype, ValueBuffer values, Validity validity) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dtype = Objects.requireNonNull(dtype, "dtype must not be null");
        this.values = Objects.requireNonNull(values, "values must not be null");
        this.validity = Objects.requireNonNull(validity, "validity must not be null");
        if (dtype.accepts(values) == false) {
            throw new SeriesTypeException("buffer [{}] cannot back dtype [{}]", values.getClass().getSimpleName(), dtype);
        }
        if (values.size() != validity.length()) {
            throw new SeriesShapeException("values length [{}] does not match validity length [{}]", values.size(), validity.length());
        }
    }

    /**
     * Deserialize a series.
     *
     * @param in the input stream
     * @throws IOException if an I/O error occurs
     */
    public Series(StreamInput in) throws IOException {
        this.name = in.readString();
        this.dtype = Dtype.readFrom(in);
        this.validity = Validity.readFrom(in);
        this.values = dtype.readValues(in);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(name);
        dtype.writeTo(out);
        validity.writeTo(out);
        values.writeTo(out);
    }

    // ---------------------------------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------------------------------

    public static Series ofBooleans(String name, List<Boolean> values) {
        boolean[] data = new boolean[values.size()];
        Validity.Builder validity = Validity.builder(data.length);
        for (int i = 0; i < data.length; i++) {
            Boolean value = values.get(i);
            if (value != null) {
                data[i] = value;
                validity.setValid(i);
            }
        }
        return new Series(name, Dtype.BOOLEAN, new BooleanValues(data), validity.build());
    }

    public static Series ofBooleans(String name, Boolean... values) {
        return ofBooleans(name, Arrays.asList(values));
    }

    public static Series ofLongs(String name, List<Long> values) {
        return new Series(name, Dtype.INT64, toLongValues(values), validityOf(values));
    }

    public static Series ofLongs(String name, Long... values) {
        return ofLongs(name, Arrays.asList(values));
    }

    public static Series ofDoubles(String name, List<Double> values) {
        double[] data = new double[values.size()];
        for (int i = 0; i < data.length; i++) {
            Double value = values.get(i);
            if (value != null) {
                data[i] = value;
            }
        }
        return new Series(name, Dtype.FLOAT64, new DoubleValues(data), validityOf(values));
    }

    public static Series ofDoubles(String name, Double... values) {
        return ofDoubles(name, Arrays.asList(values));
    }

    public static Series ofStrings(String name, List<String> values) {
        return new Series(name, Dtype.UTF8, new Utf8Values(values.toArray(new String[0])), validityOf(values));
    }

    public static Series ofStrings(String name, String... values) {
        return ofStrings(name, Arrays.asList(values));
    }

    /**
     * @param name the series name
     * @param days days since the epoch, null for a missing value
     * @return a DATE32 series
     */
    public static Series ofDate32(String name, List<Integer> days) {
        int[] data = new int[days.size()];
        for (int i = 0; i < data.length; i++) {
            Integer value = days.get(i);
            if (value != null) {
                data[i] = value;
            }
        }
        return new Series(name, Dtype.DATE32, new IntValues(data), validityOf(days));
    }

    /**
     * @param name the series name
     * @param millis milliseconds since the epoch, null for a missing value
     * @return a DATE64 series
     */
    public static Series ofDate64(String name, List<Long> millis) {
        return new Series(name, Dtype.DATE64, toLongValues(millis), validityOf(millis));
    }

    /**
     * Build a DATE32 series by parsing strings with the default date format. Strings that fail to parse
     * become nulls.
     */
    public static Series parseDate32(String name, List<String> values) {
        return StringKernels.parseDate32(ofStrings(name, values), null, SeriesEngineConfig.defaultConfig());
    }

    /**
     * Build a DATE64 series by parsing strings with the default datetime format. Strings that fail to parse
     * become nulls.
     */
    public static Series parseDate64(String name, List<String> values) {
        return StringKernels.parseDate64(ofStrings(name, values), null, SeriesEngineConfig.defaultConfig());
    }

    private static LongValues toLongValues(List<Long> values) {
        long[] data = new long[values.size()];
        for (int i = 0; i < data.length; i++) {
            Long value = values.get(i);
            if (value != null) {
                data[i] = value;
            }
        }
        return new LongValues(data);
    }

    private static Validity validityOf(List<?> values) {
        Validity.Builder validity = Validity.builder(values.size());
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) != null) {
                validity.setValid(i);
            }
        }
        return validity.build();
    }

    // ---------------------------------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------------------------------

    public String getName() {
        return name;
    }

    /**
     * Change the name of this series in place. This is the only mutating operation; it requires exclusive
     * access to this series.
     *
     * @param newName the new name
     * @return this series
     */
    public Series rename(String newName) {
        this.name = Objects.requireNonNull(newName, "name must not be null");
        return this;
    }

    public Dtype dtype() {
        return dtype;
    }

    public int len() {
        return values.size();
    }

    public boolean isEmpty() {
        return len() == 0;
    }

    public int nullCount() {
        return validity.nullCount();
    }

    public boolean isValid(int index) {
        return validity.isValid(index);
    }

    public ValueBuffer getValues() {
        return values;
    }

    public Validity getValidity() {
        return validity;
    }

    /**
     * @param index a position in {@code [0, len())}
     * @return the value at {@code index}, or {@link Scalar#NULL}
     * @throws SeriesRangeException if {@code index} is out of bounds
     */
    public Scalar get(int index) {
        checkIndex(index);
        if (validity.isNull(index)) {
            return Scalar.NULL;
        }
        return switch (dtype) {
            case BOOLEAN -> Scalar.of(((BooleanValues) values).get(index));
            case INT64, DATE64 -> Scalar.of(((LongValues) values).get(index));
            case FLOAT64 -> Scalar.of(((DoubleValues) values).get(index));
            case UTF8 -> Scalar.of(((Utf8Values) values).get(index));
            case DATE32 -> Scalar.of((long) ((IntValues) values).get(index));
        };
    }

    /**
     * @return the values boxed, with {@code null} at null positions
     */
    public List<Object> toList() {
        List<Object> result = new ArrayList<>(len());
        for (int i = 0; i < len(); i++) {
            result.add(validity.isValid(i) ? values.getObject(i) : null);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return an independent copy of this series, buffer and bitmap included
     */
    public Series deepCopy() {
        return new Series(name, dtype, values.copy(), validity.copy());
    }

    /**
     * Build a series of the same name and dtype from parts.
     */
    public Series withData(ValueBuffer newValues, Validity newValidity) {
        return new Series(name, dtype, newValues, newValidity);
    }

    // ---------------------------------------------------------------------------------------------
    // Structural operations
    // ---------------------------------------------------------------------------------------------

    /**
     * Gather values by position.
     *
     * @param indices positions in {@code [0, len())}
     * @return the gathered series
     * @throws SeriesRangeException if any index is out of bounds
     */
    public Series take(int[] indices) {
        for (int index : indices) {
            checkIndex(index);
        }
        return withData(values.take(indices), validity.take(indices));
    }

    /**
     * @param offset start position; negative values count from the end
     * @param length maximum number of elements
     * @return the elements in {@code [offset, offset + length)}, clipped to the series bounds
     */
    public Series slice(long offset, int length) {
        if (length < 0) {
            throw new SeriesRangeException("slice length must be non-negative, got [{}]", length);
        }
        long start = offset < 0 ? Math.max(0L, len() + offset) : Math.min(offset, len());
        int from = (int) start;
        int to = (int) Math.min((long) from + length, len());
        return withData(values.slice(from, to), validity.slice(from, to));
    }

    public Series head(int length) {
        return slice(0, length);
    }

    public Series head() {
        return head(DEFAULT_HEAD_LENGTH);
    }

    public Series tail(int length) {
        if (length < 0) {
            throw new SeriesRangeException("tail length must be non-negative, got [{}]", length);
        }
        int from = Math.max(0, len() - length);
        return withData(values.slice(from, len()), validity.slice(from, len()));
    }

    public Series tail() {
        return tail(DEFAULT_HEAD_LENGTH);
    }

    public Series limit(int length) {
        return head(length);
    }

    /**
     * @param other a series of the same dtype
     * @return this series followed by {@code other}, keeping this series' name
     */
    public Series append(Series other) {
        if (other.dtype != dtype) {
            throw new SeriesTypeException("cannot append a [{}] series to a [{}] series", other.dtype, dtype);
        }
        return withData(values.append(other.values), validity.append(other.validity));
    }

    /**
     * @param n step between taken positions, at least 1
     * @return positions {@code 0, n, 2n, ...}
     */
    public Series takeEvery(int n) {
        if (n < 1) {
            throw new SeriesRangeException("take_every step must be at least 1, got [{}]", n);
        }
        int[] indices = new int[len() == 0 ? 0 : (len() - 1) / n + 1];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i * n;
        }
        return take(indices);
    }

    public Series reverse() {
        int[] indices = new int[len()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = indices.length - 1 - i;
        }
        return take(indices);
    }

    /**
     * Shift values by {@code periods} positions, filling vacated positions with nulls. Positive periods move
     * values towards the end.
     */
    public Series shift(int periods) {
        int[] indices = new int[len()];
        for (int i = 0; i < indices.length; i++) {
            long source = (long) i - periods;
            indices[i] = source >= 0 && source < indices.length ? (int) source : -1;
        }
        return withData(values.take(indices), validity.take(indices));
    }

    /**
     * Draw a reproducible random sample of this series.
     *
     * @see RandomIndices#seedableRandomIndices(int, int, boolean, long, SeriesEngineConfig)
     */
    public Series sample(int nSamples, boolean withReplacement, long seed, SeriesEngineConfig config) {
        return take(RandomIndices.seedableRandomIndices(len(), nSamples, withReplacement, seed, config));
    }

    public Series sample(int nSamples, boolean withReplacement, long seed) {
        return sample(nSamples, withReplacement, seed, SeriesEngineConfig.defaultConfig());
    }

    // ---------------------------------------------------------------------------------------------
    // Nulls
    // ---------------------------------------------------------------------------------------------

    public Series isNull() {
        return NullKernels.isNull(this);
    }

    public Series isNotNull() {
        return NullKernels.isNotNull(this);
    }

    public Series dropNulls() {
        return NullKernels.dropNulls(this);
    }

    public Series fillNull(FillNullStrategy strategy) {
        return NullKernels.fillNull(this, strategy);
    }

    /**
     * @param strategy one of {@code forward, backward, min, max, mean}
     */
    public Series fillNull(String strategy) {
        return fillNull(FillNullStrategy.fromString(strategy));
    }

    // ---------------------------------------------------------------------------------------------
    // Elementwise kernels
    // ---------------------------------------------------------------------------------------------

    public Series add(Series other) {
        return ArithmeticKernels.add(this, other);
    }

    public Series sub(Series other) {
        return ArithmeticKernels.sub(this, other);
    }

    public Series mul(Series other) {
        return ArithmeticKernels.mul(this, other);
    }

    public Series div(Series other) {
        return ArithmeticKernels.div(this, other);
    }

    public Series pow(double exponent) {
        return ArithmeticKernels.pow(this, exponent);
    }

    public Series eq(Series other) {
        return ComparisonKernels.eq(this, other);
    }

    public Series neq(Series other) {
        return ComparisonKernels.neq(this, other);
    }

    public Series gt(Series other) {
        return ComparisonKernels.gt(this, other);
    }

    public Series gtEq(Series other) {
        return ComparisonKernels.gtEq(this, other);
    }

    public Series lt(Series other) {
        return ComparisonKernels.lt(this, other);
    }

    public Series ltEq(Series other) {
        return ComparisonKernels.ltEq(this, other);
    }

    public Series not() {
        return ComparisonKernels.not(this);
    }

    public Series filter(Series mask) {
        return SelectionKernels.filter(this, mask);
    }

    public Series zipWith(Series mask, Series other) {
        return SelectionKernels.zipWith(this, mask, other);
    }

    public Series argTrue() {
        return SelectionKernels.argTrue(this);
    }

    public Series peakMax() {
        return OrderKernels.peakMax(this);
    }

    public Series peakMin() {
        return OrderKernels.peakMin(this);
    }

    public Series cast(Dtype target) {
        return CastKernels.cast(this, target, SeriesEngineConfig.defaultConfig());
    }

    /**
     * @param target one of {@code float, integer, date, datetime, boolean, string}
     */
    public Series cast(String target) {
        return cast(CastTarget.fromString(target).getDtype());
    }

    // ---------------------------------------------------------------------------------------------
    // Strings
    // ---------------------------------------------------------------------------------------------

    public Series strLengths() {
        return StringKernels.lengths(this, SeriesEngineConfig.defaultConfig());
    }

    public Series strContains(String pattern) {
        return StringKernels.contains(this, pattern);
    }

    public Series strReplace(String pattern, String value) {
        return StringKernels.replace(this, pattern, value);
    }

    public Series strReplaceAll(String pattern, String value) {
        return StringKernels.replaceAll(this, pattern, value);
    }

    public Series toUppercase() {
        return StringKernels.toUppercase(this);
    }

    public Series toLowercase() {
        return StringKernels.toLowercase(this);
    }

    /**
     * @param format a date format, or null for the default one
     */
    public Series strParseDate32(String format) {
        return StringKernels.parseDate32(this, format, SeriesEngineConfig.defaultConfig());
    }

    /**
     * @param format a date format, or null for the default one
     */
    public Series strParseDate64(String format) {
        return StringKernels.parseDate64(this, format, SeriesEngineConfig.defaultConfig());
    }

    // ---------------------------------------------------------------------------------------------
    // Ordering and distinct values
    // ---------------------------------------------------------------------------------------------

    public Series sort(boolean reverse) {
        return OrderKernels.sort(this, reverse);
    }

    public int[] argsort(boolean reverse) {
        return OrderKernels.argsort(this, reverse);
    }

    public Series unique() {
        return DistinctKernels.unique(this);
    }

    public int nUnique() {
        return DistinctKernels.nUnique(this);
    }

    public ValueCounts valueCounts() {
        return DistinctKernels.valueCounts(this);
    }

    public Series isUnique() {
        return DistinctKernels.isUnique(this);
    }

    public Series isDuplicated() {
        return DistinctKernels.isDuplicated(this);
    }

    public List<Series> toDummies() {
        return DistinctKernels.toDummies(this);
    }

    // ---------------------------------------------------------------------------------------------
    // Cumulative and rolling windows
    // ---------------------------------------------------------------------------------------------

    public Series cumSum(boolean reverse) {
        return CumulativeKernels.cumSum(this, reverse);
    }

    public Series cumMax(boolean reverse) {
        return CumulativeKernels.cumMax(this, reverse);
    }

    public Series cumMin(boolean reverse) {
        return CumulativeKernels.cumMin(this, reverse);
    }

    public Series rolling(RollingFunction function, RollingOptions options) {
        return RollingWindow.apply(this, function, options);
    }

    public Series rollingSum(RollingOptions options) {
        return rolling(RollingFunction.SUM, options);
    }

    public Series rollingMean(RollingOptions options) {
        return rolling(RollingFunction.MEAN, options);
    }

    public Series rollingMax(RollingOptions options) {
        return rolling(RollingFunction.MAX, options);
    }

    public Series rollingMin(RollingOptions options) {
        return rolling(RollingFunction.MIN, options);
    }

    // ---------------------------------------------------------------------------------------------
    // Reductions
    // ---------------------------------------------------------------------------------------------

    public Scalar sum() {
        return Reductions.sum(this);
    }

    public Scalar min() {
        return Reductions.min(this);
    }

    public Scalar max() {
        return Reductions.max(this);
    }

    public Scalar mean() {
        return Reductions.mean(this);
    }

    public Scalar median() {
        return Reductions.median(this);
    }

    public Scalar var() {
        return Reductions.var(this);
    }

    public Scalar std() {
        return Reductions.std(this);
    }

    public Series quantile(double quantile) {
        return Reductions.quantile(this, quantile);
    }

    // ---------------------------------------------------------------------------------------------
    // Equality
    // ---------------------------------------------------------------------------------------------

    /**
     * Compare values with another series, ignoring names.
     *
     * @param other the series to compare with
     * @param nullEqual when true, nulls at the same position compare equal; when false, any null makes the
     *                  series unequal
     * @return true if both series hold the same values
     */
    public boolean seriesEqual(Series other, boolean nullEqual) {
        if (dtype != other.dtype || len() != other.len()) {
            return false;
        }
        if (nullEqual == false && (validity.hasNulls() || other.validity.hasNulls())) {
            return false;
        }
        return validity.equals(other.validity) && validValuesEqual(other);
    }

    private boolean validValuesEqual(Series other) {
        for (int i = 0; i < len(); i++) {
            if (validity.isValid(i) && values.compare(i, other.values, i) != 0) {
                return false;
            }
        }
        return true;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= len()) {
            throw new SeriesRangeException("index [{}] is out of bounds for series [{}] of length [{}]", index, name, len());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Series that = (Series) o;
        return name.equals(that.name) && seriesEqual(that, true);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, dtype, validity);
        for (int i = 0; i < len(); i++) {
            if (validity.isValid(i)) {
                result = 31 * result + values.getObject(i).hashCode();
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Series{" + "name='" + name + '\'' + ", dtype=" + dtype + ", values=" + toList() + '}';
    }
}
