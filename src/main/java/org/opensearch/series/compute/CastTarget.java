/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.common.exception.SeriesConfigurationException;
import org.opensearch.series.core.model.Dtype;

import java.util.Locale;

/**
 * Names accepted by {@code cast}, each mapped to the dtype it produces.
 */
public enum CastTarget {
    FLOAT("float", Dtype.FLOAT64),
    INTEGER("integer", Dtype.INT64),
    DATE("date", Dtype.DATE32),
    DATETIME("datetime", Dtype.DATE64),
    BOOLEAN("boolean", Dtype.BOOLEAN),
    STRING("string", Dtype.UTF8);

    private final String name;
    private final Dtype dtype;

    CastTarget(String name, Dtype dtype) {
        this.name = name;
        this.dtype = dtype;
    }

    public Dtype getDtype() {
        return dtype;
    }

    /**
     * @param target one of {@code float, integer, date, datetime, boolean, string}, case-insensitive
     * @throws SeriesConfigurationException for any other name
     */
    public static CastTarget fromString(String target) {
        return switch (target.toLowerCase(Locale.ROOT)) {
            case "float" -> FLOAT;
            case "integer" -> INTEGER;
            case "date" -> DATE;
            case "datetime" -> DATETIME;
            case "boolean" -> BOOLEAN;
            case "string" -> STRING;
            default -> throw new SeriesConfigurationException("unknown cast target [{}]", target);
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
