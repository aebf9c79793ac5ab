/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.common.exception.SeriesShapeException;
import org.opensearch.series.core.Series;
import org.opensearch.series.core.model.Validity;

/**
 * Length resolution for elementwise binary kernels. Operands of equal length pair up position by position; a
 * length-1 operand is broadcast against the other one.
 */
final class BinaryOperands {

    final Series left;
    final Series right;
    final int length;

    private BinaryOperands(Series left, Series right, int length) {
        this.left = left;
        this.right = right;
        this.length = length;
    }

    /**
     * @throws SeriesShapeException if the lengths differ and neither operand has length 1
     */
    static BinaryOperands of(String operation, Series left, Series right) {
        int length;
        if (left.len() == right.len()) {
            length = left.len();
        } else if (left.len() == 1) {
            length = right.len();
        } else if (right.len() == 1) {
            length = left.len();
        } else {
            throw new SeriesShapeException(
                "{} requires operands of equal length or of length 1, got [{}] and [{}]",
                operation,
                left.len(),
                right.len()
            );
        }
        return new BinaryOperands(left, right, length);
    }

    int leftIndex(int i) {
        return left.len() == 1 ? 0 : i;
    }

    int rightIndex(int i) {
        return right.len() == 1 ? 0 : i;
    }

    /**
     * @return a bitmap that is valid where both operands are valid
     */
    Validity validity() {
        Validity.Builder builder = Validity.builder(length);
        for (int i = 0; i < length; i++) {
            if (left.isValid(leftIndex(i)) && right.isValid(rightIndex(i))) {
                builder.setValid(i);
            }
        }
        return builder.build();
    }
}
