/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common.exception;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;

/**
 * Base class of every error raised by a series operation.
 *
 * <p>Series operations validate their inputs before building a result, so an operation that throws a
 * {@code SeriesException} never produces a partially populated series. Messages accept {@code {}}
 * placeholders that are filled with the trailing arguments.</p>
 *
 * <p>Per-element conversion failures during a cast or a parse are not reported through this hierarchy;
 * they surface as nulls in the result.</p>
 */
public abstract class SeriesException extends OpenSearchException {

    /**
     * @param msg the message, with {@code {}} placeholders
     * @param args the placeholder arguments
     */
    protected SeriesException(String msg, Object... args) {
        super(msg, args);
    }

    /**
     * @param msg the message, with {@code {}} placeholders
     * @param cause the underlying failure
     * @param args the placeholder arguments
     */
    protected SeriesException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
