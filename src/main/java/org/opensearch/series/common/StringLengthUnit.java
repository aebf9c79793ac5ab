/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common;

import org.opensearch.series.common.exception.SeriesConfigurationException;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Unit in which string lengths are reported.
 */
public enum StringLengthUnit {
    /** Length of the UTF-8 encoding in bytes */
    BYTES,
    /** Number of Unicode code points */
    CHARS;

    /**
     * Measure a string in this unit.
     *
     * @param value a non-null string
     * @return the length of {@code value}
     */
    public long lengthOf(String value) {
        return switch (this) {
            case BYTES -> value.getBytes(StandardCharsets.UTF_8).length;
            case CHARS -> value.codePointCount(0, value.length());
        };
    }

    public static StringLengthUnit fromString(String unit) {
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "bytes" -> BYTES;
            case "chars" -> CHARS;
            default -> throw new SeriesConfigurationException("unknown string length unit [{}]", unit);
        };
    }
}
