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
 * {@code boolean} storage, backing BOOLEAN series. {@code false} orders before {@code true}.
 */
public final class BooleanValues implements ValueBuffer {

    private final boolean[] values;

    /**
     * Wrap an array without copying. The caller hands over ownership of {@code values}.
     */
    public BooleanValues(boolean[] values) {
        this.values = values;
    }

    public boolean get(int index) {
        return values[index];
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public Boolean getObject(int index) {
        return values[index];
    }

    @Override
    public double getDouble(int index) {
        return values[index] ? 1.0 : 0.0;
    }

    @Override
    public long getLong(int index) {
        return values[index] ? 1L : 0L;
    }

    @Override
    public int compare(int index, ValueBuffer other, int otherIndex) {
        return Boolean.compare(values[index], ((BooleanValues) other).values[otherIndex]);
    }

    @Override
    public BooleanValues take(int[] indices) {
        boolean[] result = new boolean[indices.length];
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] >= 0) {
                result[i] = values[indices[i]];
            }
        }
        return new BooleanValues(result);
    }

    @Override
    public BooleanValues slice(int from, int to) {
        return new BooleanValues(Arrays.copyOfRange(values, from, to));
    }

    @Override
    public BooleanValues append(ValueBuffer other) {
        boolean[] tail = ((BooleanValues) other).values;
        boolean[] result = Arrays.copyOf(values, values.length + tail.length);
        System.arraycopy(tail, 0, result, values.length, tail.length);
        return new BooleanValues(result);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVInt(values.length);
        for (boolean value : values) {
            out.writeBoolean(value);
        }
    }

    public static BooleanValues readFrom(StreamInput in) throws IOException {
        boolean[] values = new boolean[in.readVInt()];
        for (int i = 0; i < values.length; i++) {
            values[i] = in.readBoolean();
        }
        return new BooleanValues(values);
    }
}
