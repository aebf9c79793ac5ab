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
import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.Series;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.DoubleValues;
import org.opensearch.series.core.buffer.IntValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.buffer.Utf8Values;
import org.opensearch.series.core.buffer.ValueBuffer;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

import java.util.Locale;

/**
 * Conversion of a series to another dtype.
 *
 * <p>Conversions between BOOLEAN and the temporal dtypes are rejected with a {@link SeriesTypeException}. Every
 * other pair is supported; a value that cannot be represented in the target dtype (an unparseable string, a
 * non-finite or out of range float) becomes null.</p>
 */
public final class CastKernels {

    private static final Logger logger = LogManager.getLogger(CastKernels.class);

    // Bounds of the doubles that truncate into a long without saturating
    private static final double LONG_LOWER_BOUND = -0x1p63;
    private static final double LONG_UPPER_BOUND = 0x1p63;

    private CastKernels() {}

    /**
     * @param series the series to convert
     * @param target the dtype to convert to
     * @param config supplies the formats used to parse strings into dates
     * @return a new series of dtype {@code target}
     */
    public static Series cast(Series series, Dtype target, SeriesEngineConfig config) {
        Dtype source = series.dtype();
        if (source == target) {
            return series.deepCopy();
        }
        if ((source == Dtype.BOOLEAN && target.isTemporal()) || (source.isTemporal() && target == Dtype.BOOLEAN)) {
            throw new SeriesTypeException("cannot cast a [{}] series to [{}]", source, target);
        }
        Converter converter = new Converter(series);
        Series result = switch (target) {
            case FLOAT64 -> converter.toFloat64();
            case INT64 -> converter.toInt64();
            case DATE32 -> converter.toDate32(config);
            case DATE64 -> converter.toDate64(config);
            case BOOLEAN -> converter.toBoolean();
            case UTF8 -> converter.toUtf8();
        };
        if (converter.failures > 0 && logger.isDebugEnabled()) {
            logger.debug(
                "Casting series [{}] from [{}] to [{}] turned {} values into nulls",
                series.getName(),
                source,
                target,
                converter.failures
            );
        }
        return result;
    }

    /**
     * Converts a single series, counting the values that could not be represented.
     */
    private static final class Converter {
        private final Series series;
        private final Dtype source;
        private final ValueBuffer values;
        private final Validity.Builder validity;
        private int failures;

        Converter(Series series) {
            this.series = series;
            this.source = series.dtype();
            this.values = series.getValues();
            this.validity = Validity.builder(series.len());
        }

        Series toFloat64() {
            double[] result = new double[series.len()];
            for (int i = 0; i < result.length; i++) {
                if (series.isValid(i) == false) {
                    continue;
                }
                if (source == Dtype.UTF8) {
                    Double parsed = parseDouble(((Utf8Values) values).get(i));
                    if (record(i, parsed != null)) {
                        result[i] = parsed;
                    }
                } else {
                    result[i] = values.getDouble(i);
                    validity.setValid(i);
                }
            }
            return build(Dtype.FLOAT64, new DoubleValues(result));
        }

        Series toInt64() {
            long[] result = new long[series.len()];
            for (int i = 0; i < result.length; i++) {
                if (series.isValid(i) == false) {
                    continue;
                }
                Long converted = switch (source) {
                    case BOOLEAN, INT64, DATE32, DATE64 -> values.getLong(i);
                    case FLOAT64 -> truncate(((DoubleValues) values).get(i));
                    case UTF8 -> parseLong(((Utf8Values) values).get(i));
                };
                if (record(i, converted != null)) {
                    result[i] = converted;
                }
            }
            return build(Dtype.INT64, new LongValues(result));
        }

        Series toDate32(SeriesEngineConfig config) {
            DateFormatter formatter = source == Dtype.UTF8 ? DateParsers.formatter(config.dateFormat()) : null;
            int[] result = new int[series.len()];
            for (int i = 0; i < result.length; i++) {
                if (series.isValid(i) == false) {
                    continue;
                }
                Integer converted = switch (source) {
                    case INT64 -> DateParsers.toDays(values.getLong(i));
                    case FLOAT64 -> {
                        Long truncated = truncate(((DoubleValues) values).get(i));
                        yield truncated == null ? null : DateParsers.toDays(truncated);
                    }
                    case UTF8 -> DateParsers.parseDays(formatter, ((Utf8Values) values).get(i));
                    case DATE64 -> DateParsers.toDays(Math.floorDiv(values.getLong(i), DateParsers.MILLIS_PER_DAY));
                    case DATE32 -> ((IntValues) values).get(i);
                    case BOOLEAN -> throw new IllegalStateException("boolean to date casts are rejected upfront");
                };
                if (record(i, converted != null)) {
                    result[i] = converted;
                }
            }
            return build(Dtype.DATE32, new IntValues(result));
        }

        Series toDate64(SeriesEngineConfig config) {
            DateFormatter formatter = source == Dtype.UTF8 ? DateParsers.formatter(config.datetimeFormat()) : null;
            long[] result = new long[series.len()];
            for (int i = 0; i < result.length; i++) {
                if (series.isValid(i) == false) {
                    continue;
                }
                Long converted = switch (source) {
                    case INT64, DATE64 -> values.getLong(i);
                    case FLOAT64 -> truncate(((DoubleValues) values).get(i));
                    case UTF8 -> DateParsers.parseMillis(formatter, ((Utf8Values) values).get(i));
                    case DATE32 -> ((IntValues) values).get(i) * DateParsers.MILLIS_PER_DAY;
                    case BOOLEAN -> throw new IllegalStateException("boolean to date casts are rejected upfront");
                };
                if (record(i, converted != null)) {
                    result[i] = converted;
                }
            }
            return build(Dtype.DATE64, new LongValues(result));
        }

        Series toBoolean() {
            boolean[] result = new boolean[series.len()];
            for (int i = 0; i < result.length; i++) {
                if (series.isValid(i) == false) {
                    continue;
                }
                Boolean converted = switch (source) {
                    case INT64 -> ((LongValues) values).get(i) != 0;
                    case FLOAT64 -> ((DoubleValues) values).get(i) != 0;
                    case UTF8 -> parseBoolean(((Utf8Values) values).get(i));
                    case BOOLEAN -> ((BooleanValues) values).get(i);
                    case DATE32, DATE64 -> throw new IllegalStateException("date to boolean casts are rejected upfront");
                };
                if (record(i, converted != null)) {
                    result[i] = converted;
                }
            }
            return build(Dtype.BOOLEAN, new BooleanValues(result));
        }

        Series toUtf8() {
            String[] result = new String[series.len()];
            for (int i = 0; i < result.length; i++) {
                if (series.isValid(i) == false) {
                    continue;
                }
                result[i] = switch (source) {
                    case BOOLEAN -> Boolean.toString(((BooleanValues) values).get(i));
                    case INT64 -> Long.toString(((LongValues) values).get(i));
                    case FLOAT64 -> Double.toString(((DoubleValues) values).get(i));
                    case UTF8 -> ((Utf8Values) values).get(i);
                    case DATE32 -> DateParsers.formatDate32(((IntValues) values).get(i));
                    case DATE64 -> DateParsers.formatDate64(((LongValues) values).get(i));
                };
                validity.setValid(i);
            }
            return build(Dtype.UTF8, new Utf8Values(result));
        }

        private boolean record(int index, boolean converted) {
            if (converted) {
                validity.setValid(index);
            } else {
                failures++;
            }
            return converted;
        }

        private Series build(Dtype target, ValueBuffer converted) {
            return new Series(series.getName(), target, converted, validity.build());
        }
    }

    private static Long truncate(double value) {
        if (Double.isFinite(value) == false || value < LONG_LOWER_BOUND || value >= LONG_UPPER_BOUND) {
            return null;
        }
        return (long) value;
    }

    private static Long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Boolean parseBoolean(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> null;
        };
    }
}
