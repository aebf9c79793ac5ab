/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core.buffer;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;

import java.io.IOException;
import java.util.Arrays;

/**
 * {@code long} storage, backing INT64 and DATE64 series.
 */
public final class LongValues implements ValueBuffer {

    private final long[] values;

    /**
     * Wrap an array without copying. The caller hands over ownership of {@code values}.
     */
    public LongValues(long[] values) {
        this.values = values;
    }

    public long get(int index) {
        return values[index];
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public Long getObject(int index) {
        return values[index];
    }

    @Override
    public double getDouble(int index) {
        return values[index];
    }

    @Override
    public long getLong(int index) {
        return values[index];
    }

    @Override
    public int compare(int index, ValueBuffer other, int otherIndex) {
        return Long.compare(values[index], ((LongValues) other).values[otherIndex]);
    }

    @Override
    public LongValues take(int[] indices) {
        long[] result = new long[indices.length];
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] >= 0) {
                result[i] = values[indices[i]];
            }
        }
        return new LongValues(result);
    }

    @Override
    public LongValues slice(int from, int to) {
        return new LongValues(Arrays.copyOfRange(values, from, to));
    }

    @Override
    public LongValues append(ValueBuffer other) {
        long[] tail = ((LongValues) other).values;
        long[] result = Arrays.copyOf(values, values.length + tail.length);
        System.arraycopy(tail, 0, result, values.length, tail.length);
        return new LongValues(result);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeLongArray(values);
    }

    public static LongValues readFrom(StreamInput in) throws IOException {
        return new LongValues(in.readLongArray());
    }
}
