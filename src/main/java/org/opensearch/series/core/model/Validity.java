/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core.model;

import org.apache.lucene.util.FixedBitSet;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;

/**
 * Per-element presence bitmap of a series. A set bit means the value at that position is present, a clear
 * bit means it is null.
 *
 * <p>Instances are immutable; use {@link #builder(int)} to assemble a new bitmap.</p>
 */
public final class Validity implements Writeable {

    private final FixedBitSet bits;

    private Validity(FixedBitSet bits) {
        this.bits = bits;
    }

    /**
     * @param length number of elements
     * @return a bitmap with every position present
     */
    public static Validity allValid(int length) {
        FixedBitSet bits = new FixedBitSet(length);
        bits.set(0, length);
        return new Validity(bits);
    }

    /**
     * @param length number of elements
     * @return a bitmap with every position null
     */
    public static Validity allNull(int length) {
        return new Validity(new FixedBitSet(length));
    }

    /**
     * @param present presence flag per position
     * @return a bitmap mirroring {@code present}
     */
    public static Validity fromMask(boolean[] present) {
        FixedBitSet bits = new FixedBitSet(present.length);
        for (int i = 0; i < present.length; i++) {
            if (present[i]) {
                bits.set(i);
            }
        }
        return new Validity(bits);
    }

    /**
     * @param length number of elements
     * @return a builder with every position initially null
     */
    public static Builder builder(int length) {
        return new Builder(length);
    }

    public int length() {
        return bits.length();
    }

    public boolean isValid(int index) {
        return bits.get(index);
    }

    public boolean isNull(int index) {
        return bits.get(index) == false;
    }

    public int validCount() {
        return bits.cardinality();
    }

    public int nullCount() {
        return bits.length() - bits.cardinality();
    }

    public boolean hasNulls() {
        return nullCount() > 0;
    }

    /**
     * Gather positions from this bitmap. An index of {@code -1} yields a null position.
     *
     * @param indices positions to gather, already bounds-checked
     * @return the gathered bitmap
     */
    public Validity take(int[] indices) {
        FixedBitSet result = new FixedBitSet(indices.length);
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] >= 0 && bits.get(indices[i])) {
                result.set(i);
            }
        }
        return new Validity(result);
    }

    /**
     * @param from first position, inclusive
     * @param to last position, exclusive
     * @return the bitmap of positions {@code [from, to)}
     */
    public Validity slice(int from, int to) {
        FixedBitSet result = new FixedBitSet(to - from);
        for (int i = from; i < to; i++) {
            if (bits.get(i)) {
                result.set(i - from);
            }
        }
        return new Validity(result);
    }

    /**
     * @param other the bitmap to place after this one
     * @return the concatenation of both bitmaps
     */
    public Validity append(Validity other) {
        int length = length();
        FixedBitSet result = new FixedBitSet(length + other.length());
        for (int i = 0; i < length; i++) {
            if (bits.get(i)) {
                result.set(i);
            }
        }
        for (int i = 0; i < other.length(); i++) {
            if (other.bits.get(i)) {
                result.set(length + i);
            }
        }
        return new Validity(result);
    }

    /**
     * @return a deep copy of this bitmap
     */
    public Validity copy() {
        return new Validity(bits.clone());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVInt(bits.length());
        out.writeLongArray(bits.getBits());
    }

    /**
     * Read a Validity from the input stream.
     *
     * @param in the input stream
     * @return the bitmap
     * @throws IOException if an I/O error occurs
     */
    public static Validity readFrom(StreamInput in) throws IOException {
        int length = in.readVInt();
        long[] words = in.readLongArray();
        return new Validity(new FixedBitSet(words, length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return bits.equals(((Validity) o).bits);
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public String toString() {
        return "Validity{length=" + length() + ", nullCount=" + nullCount() + '}';
    }

    /**
     * Mutable assembly of a bitmap. The builder must not be used after {@link #build()}.
     */
    public static final class Builder {
        private final FixedBitSet bits;

        private Builder(int length) {
            this.bits = new FixedBitSet(length);
        }

        public Builder setValid(int index) {
            bits.set(index);
            return this;
        }

        public Builder set(int index, boolean valid) {
            if (valid) {
                bits.set(index);
            } else {
                bits.clear(index);
            }
            return this;
        }

        public Validity build() {
            return new Validity(bits);
        }
    }
}
