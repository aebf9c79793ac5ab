/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.common.time.DateFormatter;
import org.opensearch.common.time.DateFormatters;
import org.opensearch.series.common.exception.SeriesConfigurationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Date parsing and printing shared by the string and cast kernels.
 */
final class DateParsers {

    static final long MILLIS_PER_DAY = 86_400_000L;

    private static final DateFormatter DATE_PRINTER = DateFormatter.forPattern("strict_date");
    private static final DateFormatter DATETIME_PRINTER = DateFormatter.forPattern("strict_date_optional_time");

    private DateParsers() {}

    /**
     * @param pattern a named format or a Java pattern, alternatives separated by {@code ||}
     * @throws SeriesConfigurationException if the pattern is not a valid date format
     */
    static DateFormatter formatter(String pattern) {
        try {
            return DateFormatter.forPattern(pattern);
        } catch (IllegalArgumentException e) {
            throw new SeriesConfigurationException("invalid date format [{}]", e, pattern);
        }
    }

    /**
     * @return milliseconds since the epoch in UTC, or null when {@code text} does not match the format
     */
    static Long parseMillis(DateFormatter formatter, String text) {
        ZonedDateTime dateTime = parse(formatter, text);
        return dateTime == null ? null : dateTime.toInstant().toEpochMilli();
    }

    /**
     * @return days since the epoch in UTC, or null when {@code text} does not match the format
     */
    static Integer parseDays(DateFormatter formatter, String text) {
        ZonedDateTime dateTime = parse(formatter, text);
        if (dateTime == null) {
            return null;
        }
        return toDays(dateTime.toLocalDate().toEpochDay());
    }

    /**
     * @return {@code days} as an int, or null when it does not fit
     */
    static Integer toDays(long days) {
        if (days < Integer.MIN_VALUE || days > Integer.MAX_VALUE) {
            return null;
        }
        return (int) days;
    }

    static String formatDate32(int days) {
        return DATE_PRINTER.format(LocalDate.ofEpochDay(days).atStartOfDay(ZoneOffset.UTC));
    }

    static String formatDate64(long millis) {
        return DATETIME_PRINTER.format(Instant.ofEpochMilli(millis).atZone(ZoneOffset.UTC));
    }

    private static ZonedDateTime parse(DateFormatter formatter, String text) {
        try {
            return DateFormatters.from(formatter.parse(text));
        } catch (DateTimeException | IllegalArgumentException e) {
            return null;
        }
    }
}
