/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

/**
 * Elementwise comparisons producing BOOLEAN series.
 *
 * <p>Numeric operands compare with each other regardless of integer or floating point representation; any other
 * dtype only compares with itself. Floating point comparisons follow IEEE 754, so NaN is unequal to everything
 * including itself.</p>
 */
public final class ComparisonKernels {

    private ComparisonKernels() {}

    private enum Comparison {
        EQ("eq") {
            @Override
            boolean test(int order) {
                return order == 0;
            }

            @Override
            boolean test(double a, double b) {
                return a == b;
            }
        },
        NEQ("neq") {
            @Override
            boolean test(int order) {
                return order != 0;
            }

            @Override
            boolean test(double a, double b) {
                return a != b;
            }
        },
        GT("gt") {
            @Override
            boolean test(int order) {
                return order > 0;
            }

            @Override
            boolean test(double a, double b) {
                return a > b;
            }
        },
        GT_EQ("gt_eq") {
            @Override
            boolean test(int order) {
                return order >= 0;
            }

            @Override
            boolean test(double a, double b) {
                return a >= b;
            }
        },
        LT("lt") {
            @Override
            boolean test(int order) {
                return order < 0;
            }

            @Override
            boolean test(double a, double b) {
                return a < b;
            }
        },
        LT_EQ("lt_eq") {
            @Override
            boolean test(int order) {
                return order <= 0;
            }

            @Override
            boolean test(double a, double b) {
                return a <= b;
            }
        };

        private final String operation;

        Comparison(String operation) {
            this.operation = operation;
        }

        abstract boolean test(int order);

        abstract boolean test(double a, double b);
    }

    public static Series eq(Series left, Series right) {
        return compare(Comparison.EQ, left, right);
    }

    public static Series neq(Series left, Series right) {
        return compare(Comparison.NEQ, left, right);
    }

    public static Series gt(Series left, Series right) {
        return compare(Comparison.GT, left, right);
    }

    public static Series gtEq(Series left, Series right) {
        return compare(Comparison.GT_EQ, left, right);
    }

    public static Series lt(Series left, Series right) {
        return compare(Comparison.LT, left, right);
    }

    public static Series ltEq(Series left, Series right) {
        return compare(Comparison.LT_EQ, left, right);
    }

    /**
     * Logical negation of a BOOLEAN series. Nulls stay null.
     */
    public static Series not(Series series) {
        series.dtype().ensureOneOf("not", Dtype.BOOLEAN);
        BooleanValues values = (BooleanValues) series.getValues();
        boolean[] result = new boolean[series.len()];
        for (int i = 0; i < result.length; i++) {
            result[i] = series.isValid(i) && values.get(i) == false;
        }
        return new Series(series.getName(), Dtype.BOOLEAN, new BooleanValues(result), series.getValidity().copy());
    }

    private static Series compare(Comparison comparison, Series left, Series right) {
        boolean numeric = left.dtype().isNumeric() && right.dtype().isNumeric();
        if (numeric == false && left.dtype() != right.dtype()) {
            throw new SeriesTypeException("cannot {} a [{}] series with a [{}] series", comparison.operation, left.dtype(), right.dtype());
        }
        BinaryOperands operands = BinaryOperands.of(comparison.operation, left, right);
        Validity validity = operands.validity();
        ValueBuffer l = left.getValues();
        ValueBuffer r = right.getValues();
        boolean floating = numeric && (left.dtype() == Dtype.FLOAT64 || right.dtype() == Dtype.FLOAT64);

        boolean[] result = new boolean[operands.length];
        for (int i = 0; i < result.length; i++) {
            if (validity.isNull(i)) {
                continue;
            }
            int li = operands.leftIndex(i);
            int ri = operands.rightIndex(i);
            if (floating) {
                result[i] = comparison.test(l.getDouble(li), r.getDouble(ri));
            } else {
                result[i] = comparison.test(l.compare(li, r, ri));
            }
        }
        return new Series(left.getName(), Dtype.BOOLEAN, new BooleanValues(result), validity);
    }
}
