/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common.exception;

/**
 * Thrown for an unrecognized configuration token, such as a fill strategy, cast target, rolling function,
 * regular expression or date format. The message always names the offending token.
 */
public class SeriesConfigurationException extends SeriesException {

    public SeriesConfigurationException(String msg, Object... args) {
        super(msg, args);
    }

    public SeriesConfigurationException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
