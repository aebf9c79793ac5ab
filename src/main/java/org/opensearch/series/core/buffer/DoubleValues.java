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
 * {@code double} storage, backing FLOAT64 series. Ordering follows {@link Double#compare(double, double)},
 * so NaN sorts above every other value.
 */
public final class DoubleValues implements ValueBuffer {

    private final double[] values;

    /**
     * Wrap an array without copying. The caller hands over ownership of {@code values}.
     */
    public DoubleValues(double[] values) {
        this.values = values;
    }

    public double get(int index) {
        return values[index];
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public Double getObject(int index) {
        return values[index];
    }

    @Override
    public double getDouble(int index) {
        return values[index];
    }

    @Override
    public long getLong(int index) {
        return (long) values[index];
    }

    @Override
    public int compare(int index, ValueBuffer other, int otherIndex) {
        return Double.compare(values[index], ((DoubleValues) other).values[otherIndex]);
    }

    @Override
    public DoubleValues take(int[] indices) {
        double[] result = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] >= 0) {
                result[i] = values[indices[i]];
            }
        }
        return new DoubleValues(result);
    }

    @Override
    public DoubleValues slice(int from, int to) {
        return new DoubleValues(Arrays.copyOfRange(values, from, to));
    }

    @Override
    public DoubleValues append(ValueBuffer other) {
        double[] tail = ((DoubleValues) other).values;
        double[] result = Arrays.copyOf(values, values.length + tail.length);
        System.arraycopy(tail, 0, result, values.length, tail.length);
        return new DoubleValues(result);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeDoubleArray(values);
    }

    public static DoubleValues readFrom(StreamInput in) throws IOException {
        return new DoubleValues(in.readDoubleArray());
    }
}
