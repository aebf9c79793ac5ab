/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common.exception;

/**
 * Thrown when a numeric argument falls outside the range an operation accepts, such as a quantile outside [0,
 * 1], an out-of-bounds index or a non-positive window size.
 */
public class SeriesRangeException extends SeriesException {

    public SeriesRangeException(String msg, Object... args) {
        super(msg, args);
    }

    public SeriesRangeException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
