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
 * {@code int} storage, backing DATE32 series.
 */
public final class IntValues implements ValueBuffer {

    private final int[] values;

    /**
     * Wrap an array without copying. The caller hands over ownership of {@code values}.
     */
    public IntValues(int[] values) {
        this.values = values;
    }

    public int get(int index) {
        return values[index];
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public Integer getObject(int index) {
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
        return Integer.compare(values[index], ((IntValues) other).values[otherIndex]);
    }

    @Override
    public IntValues take(int[] indices) {
        int[] result = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] >= 0) {
                result[i] = values[indices[i]];
            }
        }
        return new IntValues(result);
    }

    @Override
    public IntValues slice(int from, int to) {
        return new IntValues(Arrays.copyOfRange(values, from, to));
    }

    @Override
    public IntValues append(ValueBuffer other) {
        int[] tail = ((IntValues) other).values;
        int[] result = Arrays.copyOf(values, values.length + tail.length);
        System.arraycopy(tail, 0, result, values.length, tail.length);
        return new IntValues(result);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeIntArray(values);
    }

    public static IntValues readFrom(StreamInput in) throws IOException {
        return new IntValues(in.readIntArray());
    }
}
