/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core.buffer;

import org.opensearch.core.common.io.stream.StreamOutput;

import java.io.IOException;

/**
 * Typed, fixed-length storage behind a series. A buffer knows nothing about nulls: the series pairs it with a
 * validity bitmap, and the content of a buffer slot at a null position is unspecified.
 *
 * <p>Buffers are never modified after construction. Every transformation returns a new buffer.</p>
 */
public sealed interface ValueBuffer permits BooleanValues, LongValues, IntValues, DoubleValues, Utf8Values {

    /**
     * @return number of slots
     */
    int size();

    /**
     * @param index the slot
     * @return the slot boxed as {@link Boolean}, {@link Long}, {@link Integer}, {@link Double} or {@link String}
     */
    Object getObject(int index);

    /**
     * Numeric view of a slot. Booleans read as 0 or 1.
     *
     * @throws UnsupportedOperationException for string buffers
     */
    double getDouble(int index);

    /**
     * Integral view of a slot. Booleans read as 0 or 1, doubles are truncated.
     *
     * @throws UnsupportedOperationException for string buffers
     */
    long getLong(int index);

    /**
     * Natural-order comparison of a slot of this buffer with a slot of another buffer of the same class.
     */
    int compare(int index, ValueBuffer other, int otherIndex);

    /**
     * Natural-order comparison of two slots of this buffer.
     */
    default int compare(int i, int j) {
        return compare(i, this, j);
    }

    /**
     * Gather slots. An index of {@code -1} produces a slot with unspecified content.
     *
     * @param indices slots to gather, already bounds-checked
     * @return a new buffer of {@code indices.length} slots
     */
    ValueBuffer take(int[] indices);

    /**
     * @param from first slot, inclusive
     * @param to last slot, exclusive
     * @return a copy of slots {@code [from, to)}
     */
    ValueBuffer slice(int from, int to);

    /**
     * @param other a buffer of the same class
     * @return a buffer holding the slots of this buffer followed by those of {@code other}
     */
    ValueBuffer append(ValueBuffer other);

    /**
     * @return a deep copy
     */
    default ValueBuffer copy() {
        return slice(0, size());
    }

    void writeTo(StreamOutput out) throws IOException;
}
