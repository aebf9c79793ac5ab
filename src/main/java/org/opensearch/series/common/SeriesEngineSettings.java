/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common;

import org.opensearch.common.settings.Setting;

import java.util.List;
import java.util.function.Function;

/**
 * Settings understood by the series engine. They are read once into a {@link SeriesEngineConfig}.
 */
public final class SeriesEngineSettings {

    /**
     * When sampling without replacement asks for more indices than exist, clamp the sample to the series
     * length instead of failing.
     */
    public static final Setting<Boolean> SAMPLING_CLAMP_OVERSIZED = Setting.boolSetting(
        "series.sampling.clamp_oversized",
        false,
        Setting.Property.NodeScope
    );

    /**
     * Unit reported by {@code str_lengths}: {@code bytes} (UTF-8) or {@code chars} (code points).
     */
    public static final Setting<StringLengthUnit> STRING_LENGTH_UNIT = new Setting<>(
        "series.string.length_unit",
        "bytes",
        StringLengthUnit::fromString,
        Setting.Property.NodeScope
    );

    /**
     * Date format used to parse DATE32 values when the caller does not supply one.
     */
    public static final Setting<String> DATE_FORMAT = new Setting<>(
        "series.date.format",
        "strict_date_optional_time",
        Function.identity(),
        Setting.Property.NodeScope
    );

    /**
     * Date format used to parse DATE64 values when the caller does not supply one.
     */
    public static final Setting<String> DATETIME_FORMAT = new Setting<>(
        "series.datetime.format",
        "strict_date_optional_time||epoch_millis",
        Function.identity(),
        Setting.Property.NodeScope
    );

    private SeriesEngineSettings() {}

    /**
     * @return every setting declared by the engine
     */
    public static List<Setting<?>> getSettings() {
        return List.of(SAMPLING_CLAMP_OVERSIZED, STRING_LENGTH_UNIT, DATE_FORMAT, DATETIME_FORMAT);
    }
}
