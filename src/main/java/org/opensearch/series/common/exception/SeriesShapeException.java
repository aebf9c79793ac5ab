/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common.exception;

/**
 * Thrown when the length of an operand, mask or weight vector does not match the length the operation requires.
 */
public class SeriesShapeException extends SeriesException {

    public SeriesShapeException(String msg, Object... args) {
        super(msg, args);
    }

    public SeriesShapeException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
