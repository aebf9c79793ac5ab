/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * Elementwise arithmetic over INT64 and FLOAT64 series.
 *
 * <p>Two INT64 operands produce INT64 (wrapping on overflow), except for division which always produces
 * FLOAT64. A FLOAT64 operand on either side promotes the result to FLOAT64. The result is null wherever either
 * operand is null, and takes the name of the left operand.</p>
 */
public final class ArithmeticKernels {

    private ArithmeticKernels() {}

    private enum Operator {
        ADD("add", (a, b) -> a + b, (a, b) -> a + b),
        SUB("sub", (a, b) -> a - b, (a, b) -> a - b),
        MUL("mul", (a, b) -> a * b, (a, b) -> a * b),
        DIV("div", null, (a, b) -> a / b);

        private final String operation;
        // null when the operator always produces floating point
        private final LongBinaryOperator integral;
        private final DoubleBinaryOperator floating;

        Operator(String operation, LongBinaryOperator integral, DoubleBinaryOperator floating) {
            this.operation = operation;
            this.integral = integral;
            this.floating = floating;
        }

        boolean promotesToFloat() {
            return integral == null;
        }
    }

    public static Series add(Series left, Series right) {
        return apply(Operator.ADD, left, right);
    }

    public static Series sub(Series left, Series right) {
        return apply(Operator.SUB, left, right);
    }

    public static Series mul(Series left, Series right) {
        return apply(Operator.MUL, left, right);
    }

    public static Series div(Series left, Series right) {
        return apply(Operator.DIV, left, right);
    }

    /**
     * Raise every value to {@code exponent}.
     *
     * @return a FLOAT64 series
     */
    public static Series pow(Series series, double exponent) {
        series.dtype().ensureOneOf("pow", Dtype.INT64, Dtype.FLOAT64);
        ValueBuffer values = series.getValues();
        double[] result = new double[series.len()];
        for (int i = 0; i < result.length; i++) {
            if (series.isValid(i)) {
                result[i] = Math.pow(values.getDouble(i), exponent);
            }
        }
        return new Series(series.getName(), Dtype.FLOAT64, new DoubleValues(result), series.getValidity().copy());
    }

    private static Series apply(Operator operator, Series left, Series right) {
        left.dtype().ensureOneOf(operator.operation, Dtype.INT64, Dtype.FLOAT64);
        right.dtype().ensureOneOf(operator.operation, Dtype.INT64, Dtype.FLOAT64);
        BinaryOperands operands = BinaryOperands.of(operator.operation, left, right);
        Validity validity = operands.validity();
        ValueBuffer l = left.getValues();
        ValueBuffer r = right.getValues();

        if (operator.promotesToFloat() == false && left.dtype() == Dtype.INT64 && right.dtype() == Dtype.INT64) {
            long[] result = new long[operands.length];
            for (int i = 0; i < result.length; i++) {
                if (validity.isValid(i)) {
                    result[i] = operator.integral.applyAsLong(l.getLong(operands.leftIndex(i)), r.getLong(operands.rightIndex(i)));
                }
            }
            return new Series(left.getName(), Dtype.INT64, new LongValues(result), validity);
        }

        double[] result = new double[operands.length];
        for (int i = 0; i < result.length; i++) {
            if (validity.isValid(i)) {
                result[i] = operator.floating.applyAsDouble(l.getDouble(operands.leftIndex(i)), r.getDouble(operands.rightIndex(i)));
            }
        }
        return new Series(left.getName(), Dtype.FLOAT64, new DoubleValues(result), validity);
    }
}
