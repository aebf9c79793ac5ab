/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common.exception;

/**
 * Thrown when an operation is applied to a dtype it does not support, or when the dtypes of two operands cannot
 * be combined.
 */
public class SeriesTypeException extends SeriesException {

    public SeriesTypeException(String msg, Object... args) {
        super(msg, args);
    }

    public SeriesTypeException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
