/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.IntValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.Utf8Values;
import org.opensearch.series.core.buffer.ValueBuffer;

import java.io.IOException;

/**
 * The closed set of element types a series can hold.
 *
 * <p>Every per-dtype dispatch in the engine is a {@code switch} expression over this enum without a
 * {@code default} branch, so adding a constant fails compilation wherever it has to be handled.</p>
 */
public enum Dtype implements Writeable {
    /** Booleans, stored as {@code boolean[]} */
    BOOLEAN((byte) 0, "bool"),
    /** 64-bit signed integers, stored as {@code long[]} */
    INT64((byte) 1, "i64"),
    /** 64-bit floats, stored as {@code double[]} */
    FLOAT64((byte) 2, "f64"),
    /** Strings, stored as {@code String[]} */
    UTF8((byte) 3, "str"),
    /** Days since the epoch, stored as {@code int[]} */
    DATE32((byte) 4, "date32"),
    /** Milliseconds since the epoch, stored as {@code long[]} */
    DATE64((byte) 5, "date64");

    private final byte id;
    private final String displayName;

    Dtype(byte id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * @return the byte identifier used on the wire
     */
    public byte getId() {
        return id;
    }

    /**
     * @return true for INT64 and FLOAT64
     */
    public boolean isNumeric() {
        return this == INT64 || this == FLOAT64;
    }

    /**
     * @return true for DATE32 and DATE64
     */
    public boolean isTemporal() {
        return this == DATE32 || this == DATE64;
    }

    /**
     * Check that this dtype is one of {@code allowed}.
     *
     * @param operation the operation name, used in the error message
     * @param allowed the accepted dtypes
     * @throws SeriesTypeException if this dtype is not accepted
     */
    public void ensureOneOf(String operation, Dtype... allowed) {
        for (Dtype dtype : allowed) {
            if (dtype == this) {
                return;
            }
        }
        throw new SeriesTypeException("{} is not supported for dtype [{}]", operation, this);
    }

    /**
     * Read the value buffer of a series of this dtype.
     *
     * @param in the input stream
     * @return the buffer
     * @throws IOException if an I/O error occurs
     */
    public ValueBuffer readValues(StreamInput in) throws IOException {
        return switch (this) {
            case BOOLEAN -> BooleanValues.readFrom(in);
            case INT64, DATE64 -> LongValues.readFrom(in);
            case FLOAT64 -> DoubleValues.readFrom(in);
            case UTF8 -> Utf8Values.readFrom(in);
            case DATE32 -> IntValues.readFrom(in);
        };
    }

    /**
     * Check that {@code values} is the buffer type backing this dtype.
     *
     * @param values the buffer to check
     * @return true if the buffer can back a series of this dtype
     */
    public boolean accepts(ValueBuffer values) {
        return switch (this) {
            case BOOLEAN -> values instanceof BooleanValues;
            case INT64, DATE64 -> values instanceof LongValues;
            case FLOAT64 -> values instanceof DoubleValues;
            case UTF8 -> values instanceof Utf8Values;
            case DATE32 -> values instanceof IntValues;
        };
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeByte(id);
    }

    /**
     * Read a Dtype from the input stream.
     *
     * @param in the input stream
     * @return the dtype
     * @throws IOException if an I/O error occurs or the id is unknown
     */
    public static Dtype readFrom(StreamInput in) throws IOException {
        return fromId(in.readByte());
    }

    /**
     * Get a Dtype by its byte ID.
     *
     * @param id the byte identifier
     * @return the dtype
     * @throws IllegalArgumentException if the ID is not recognized
     */
    public static Dtype fromId(byte id) {
        for (Dtype dtype : values()) {
            if (dtype.id == id) {
                return dtype;
            }
        }
        throw new IllegalArgumentException("Unknown dtype ID: " + id);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
