/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.common;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;

import java.util.Objects;

/**
 * Immutable snapshot of the engine settings, passed explicitly to the operations that depend on it.
 *
 * <p>Operations that are called without a config use {@link #defaultConfig()}. The engine keeps no
 * process-wide mutable configuration.</p>
 *
 * @param clampOversizedSamples see {@link SeriesEngineSettings#SAMPLING_CLAMP_OVERSIZED}
 * @param stringLengthUnit see {@link SeriesEngineSettings#STRING_LENGTH_UNIT}
 * @param dateFormat see {@link SeriesEngineSettings#DATE_FORMAT}
 * @param datetimeFormat see {@link SeriesEngineSettings#DATETIME_FORMAT}
 */
public record SeriesEngineConfig(
    boolean clampOversizedSamples,
    StringLengthUnit stringLengthUnit,
    String dateFormat,
    String datetimeFormat
) {

    private static final Logger logger = LogManager.getLogger(SeriesEngineConfig.class);

    private static final SeriesEngineConfig DEFAULT = new SeriesEngineConfig(
        SeriesEngineSettings.SAMPLING_CLAMP_OVERSIZED.getDefault(Settings.EMPTY),
        SeriesEngineSettings.STRING_LENGTH_UNIT.getDefault(Settings.EMPTY),
        SeriesEngineSettings.DATE_FORMAT.getDefault(Settings.EMPTY),
        SeriesEngineSettings.DATETIME_FORMAT.getDefault(Settings.EMPTY)
    );

    public SeriesEngineConfig {
        Objects.requireNonNull(stringLengthUnit, "stringLengthUnit must not be null");
        Objects.requireNonNull(dateFormat, "dateFormat must not be null");
        Objects.requireNonNull(datetimeFormat, "datetimeFormat must not be null");
    }

    /**
     * Build a config from node settings.
     *
     * @param settings the settings to read
     * @return the resulting config
     */
    public static SeriesEngineConfig fromSettings(Settings settings) {
        SeriesEngineConfig config = new SeriesEngineConfig(
            SeriesEngineSettings.SAMPLING_CLAMP_OVERSIZED.get(settings),
            SeriesEngineSettings.STRING_LENGTH_UNIT.get(settings),
            SeriesEngineSettings.DATE_FORMAT.get(settings),
            SeriesEngineSettings.DATETIME_FORMAT.get(settings)
        );
        logger.info(
            "Initialized series engine config: clampOversizedSamples={}, stringLengthUnit={}, dateFormat={}, datetimeFormat={}",
            config.clampOversizedSamples(),
            config.stringLengthUnit(),
            config.dateFormat(),
            config.datetimeFormat()
        );
        return config;
    }

    /**
     * @return the config built from the default value of every setting
     */
    public static SeriesEngineConfig defaultConfig() {
        return DEFAULT;
    }
}
