/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.core.model;

/**
 * A single value handed back to the caller by a reduction or by {@code get(index)}.
 *
 * <p>Callers switch on {@link #kind()} to decode. DATE32 and DATE64 values are reported as integers
 * (days and milliseconds since the epoch).</p>
 */
public sealed interface Scalar permits Scalar.NullScalar, Scalar.BooleanScalar, Scalar.StringScalar, Scalar.IntegerScalar,
    Scalar.FloatScalar {

    /** The shared null scalar */
    Scalar NULL = new NullScalar();

    /**
     * Variant tag of a scalar.
     */
    enum Kind {
        NULL,
        BOOLEAN,
        STRING,
        INTEGER,
        FLOAT
    }

    Kind kind();

    /**
     * @return the value boxed as a Java object, or null
     */
    Object toObject();

    default boolean isNull() {
        return kind() == Kind.NULL;
    }

    static Scalar of(boolean value) {
        return new BooleanScalar(value);
    }

    static Scalar of(long value) {
        return new IntegerScalar(value);
    }

    static Scalar of(double value) {
        return new FloatScalar(value);
    }

    static Scalar of(String value) {
        return value == null ? NULL : new StringScalar(value);
    }

    record NullScalar() implements Scalar {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public Object toObject() {
            return null;
        }
    }

    record BooleanScalar(boolean value) implements Scalar {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public Object toObject() {
            return value;
        }
    }

    record StringScalar(String value) implements Scalar {
        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public Object toObject() {
            return value;
        }
    }

    record IntegerScalar(long value) implements Scalar {
        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }

        @Override
        public Object toObject() {
            return value;
        }
    }

    record FloatScalar(double value) implements Scalar {
        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public Object toObject() {
            return value;
        }
    }
}
