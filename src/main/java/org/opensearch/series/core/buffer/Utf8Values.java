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
 * {@code String} storage, backing UTF8 series. Slots at null positions hold {@code null}. Ordering is
 * lexicographic by UTF-16 code unit, as {@link String#compareTo(String)}.
 */
public final class Utf8Values implements ValueBuffer {

    private final String[] values;

    /**
     * Wrap an array without copying. The caller hands over ownership of {@code values}.
     */
    public Utf8Values(String[] values) {
        this.values = values;
    }

    public String get(int index) {
        return values[index];
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public String getObject(int index) {
        return values[index];
    }

    @Override
    public double getDouble(int index) {
        throw new UnsupportedOperationException("string values have no numeric view");
    }

    @Override
    public long getLong(int index) {
        throw new UnsupportedOperationException("string values have no numeric view");
    }

    @Override
    public int compare(int index, ValueBuffer other, int otherIndex) {
        return values[index].compareTo(((Utf8Values) other).values[otherIndex]);
    }

    @Override
    public Utf8Values take(int[] indices) {
        String[] result = new String[indices.length];
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] >= 0) {
                result[i] = values[indices[i]];
            }
        }
        return new Utf8Values(result);
    }

    @Override
    public Utf8Values slice(int from, int to) {
        return new Utf8Values(Arrays.copyOfRange(values, from, to));
    }

    @Override
    public Utf8Values append(ValueBuffer other) {
        String[] tail = ((Utf8Values) other).values;
        String[] result = Arrays.copyOf(values, values.length + tail.length);
        System.arraycopy(tail, 0, result, values.length, tail.length);
        return new Utf8Values(result);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVInt(values.length);
        for (String value : values) {
            out.writeOptionalString(value);
        }
    }

    public static Utf8Values readFrom(StreamInput in) throws IOException {
        String[] values = new String[in.readVInt()];
        for (int i = 0; i < values.length; i++) {
            values[i] = in.readOptionalString();
        }
        return new Utf8Values(values);
    }
}
