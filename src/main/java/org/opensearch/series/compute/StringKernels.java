/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.time.DateFormatter;
import org.opensearch.series.common.SeriesEngineConfig;
import org.opensearch.series.common.StringLengthUnit;
import org.opensearch.series.common.exception.SeriesConfigurationException;
import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.IntValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.Utf8Values;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Kernels over UTF8 series. Nulls pass through every kernel unchanged.
 *
 * <p>Patterns are Java regular expressions. Replacement values are inserted literally, so {@code $} and
 * {@code \\} carry no special meaning in them.</p>
 */
public final class StringKernels {

    private static final Logger logger = LogManager.getLogger(StringKernels.class);

    private StringKernels() {}

    /**
     * @param config supplies the length unit
     * @return an INT64 series of string lengths
     */
    public static Series lengths(Series series, SeriesEngineConfig config) {
        series.dtype().ensureOneOf("str_lengths", Dtype.UTF8);
        StringLengthUnit unit = config.stringLengthUnit();
        Utf8Values values = (Utf8Values) series.getValues();
        long[] result = new long[series.len()];
        for (int i = 0; i < result.length; i++) {
            if (series.isValid(i)) {
                result[i] = unit.lengthOf(values.get(i));
            }
        }
        return new Series(series.getName(), Dtype.INT64, new LongValues(result), series.getValidity().copy());
    }

    /**
     * @param pattern a regular expression
     * @return a BOOLEAN series, true where {@code pattern} matches anywhere in the string
     */
    public static Series contains(Series series, String pattern) {
        series.dtype().ensureOneOf("str_contains", Dtype.UTF8);
        Pattern compiled = compile(pattern);
        Utf8Values values = (Utf8Values) series.getValues();
        boolean[] result = new boolean[series.len()];
        for (int i = 0; i < result.length; i++) {
            if (series.isValid(i)) {
                result[i] = compiled.matcher(values.get(i)).find();
            }
        }
        return new Series(series.getName(), Dtype.BOOLEAN, new BooleanValues(result), series.getValidity().copy());
    }

    /**
     * Replace the first match of {@code pattern} with the literal {@code value}.
     */
    public static Series replace(Series series, String pattern, String value) {
        series.dtype().ensureOneOf("str_replace", Dtype.UTF8);
        Pattern compiled = compile(pattern);
        String replacement = Matcher.quoteReplacement(value);
        return map(series, s -> compiled.matcher(s).replaceFirst(replacement));
    }

    /**
     * Replace every match of {@code pattern} with the literal {@code value}.
     */
    public static Series replaceAll(Series series, String pattern, String value) {
        series.dtype().ensureOneOf("str_replace_all", Dtype.UTF8);
        Pattern compiled = compile(pattern);
        String replacement = Matcher.quoteReplacement(value);
        return map(series, s -> compiled.matcher(s).replaceAll(replacement));
    }

    public static Series toUppercase(Series series) {
        series.dtype().ensureOneOf("to_uppercase", Dtype.UTF8);
        return map(series, s -> s.toUpperCase(Locale.ROOT));
    }

    public static Series toLowercase(Series series) {
        series.dtype().ensureOneOf("to_lowercase", Dtype.UTF8);
        return map(series, s -> s.toLowerCase(Locale.ROOT));
    }

    /**
     * Parse strings into days since the epoch. Strings that do not match the format become nulls.
     *
     * @param format a date format, or null to use {@link SeriesEngineConfig#dateFormat()}
     * @return a DATE32 series
     * @throws SeriesConfigurationException if the format is invalid
     */
    public static Series parseDate32(Series series, String format, SeriesEngineConfig config) {
        series.dtype().ensureOneOf("parse_date32", Dtype.UTF8);
        DateFormatter formatter = DateParsers.formatter(format == null ? config.dateFormat() : format);
        Utf8Values values = (Utf8Values) series.getValues();
        int[] result = new int[series.len()];
        Validity.Builder validity = Validity.builder(result.length);
        int failures = 0;
        for (int i = 0; i < result.length; i++) {
            if (series.isValid(i)) {
                Integer days = DateParsers.parseDays(formatter, values.get(i));
                if (days == null) {
                    failures++;
                } else {
                    result[i] = days;
                    validity.setValid(i);
                }
            }
        }
        logFailures(series, Dtype.DATE32, failures);
        return new Series(series.getName(), Dtype.DATE32, new IntValues(result), validity.build());
    }

    /**
     * Parse strings into milliseconds since the epoch. Strings that do not match the format become nulls.
     *
     * @param format a date format, or null to use {@link SeriesEngineConfig#datetimeFormat()}
     * @return a DATE64 series
     * @throws SeriesConfigurationException if the format is invalid
     */
    public static Series parseDate64(Series series, String format, SeriesEngineConfig config) {
        series.dtype().ensureOneOf("parse_date64", Dtype.UTF8);
        DateFormatter formatter = DateParsers.formatter(format == null ? config.datetimeFormat() : format);
        Utf8Values values = (Utf8Values) series.getValues();
        long[] result = new long[series.len()];
        Validity.Builder validity = Validity.builder(result.length);
        int failures = 0;
        for (int i = 0; i < result.length; i++) {
            if (series.isValid(i)) {
                Long millis = DateParsers.parseMillis(formatter, values.get(i));
                if (millis == null) {
                    failures++;
                } else {
                    result[i] = millis;
                    validity.setValid(i);
                }
            }
        }
        logFailures(series, Dtype.DATE64, failures);
        return new Series(series.getName(), Dtype.DATE64, new LongValues(result), validity.build());
    }

    private static void logFailures(Series series, Dtype target, int failures) {
        if (failures > 0 && logger.isDebugEnabled()) {
            logger.debug("Parsing series [{}] as [{}] turned {} unparseable values into nulls", series.getName(), target, failures);
        }
    }

    private static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new SeriesConfigurationException("invalid pattern [{}]", e, pattern);
        }
    }

    private static Series map(Series series, UnaryOperator<String> function) {
        Utf8Values values = (Utf8Values) series.getValues();
        String[] result = new String[series.len()];
        for (int i = 0; i < result.length; i++) {
            if (series.isValid(i)) {
                result[i] = function.apply(values.get(i));
            }
        }
        return series.withData(new Utf8Values(result), series.getValidity().copy());
    }
}
