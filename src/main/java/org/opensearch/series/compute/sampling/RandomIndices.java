/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.sampling;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.series.common.SeriesEngineConfig;
import org.opensearch.series.common.exception.SeriesRangeException;

import java.util.SplittableRandom;

/**
 * Reproducible random position generation. Every call draws from a generator seeded with the given seed and
 * shares no state with other calls, so equal arguments always produce equal positions.
 */
public final class RandomIndices {

    private static final Logger logger = LogManager.getLogger(RandomIndices.class);

    private RandomIndices() {}

    public static int[] seedableRandomIndices(int length, int nSamples, boolean withReplacement, long seed) {
        return seedableRandomIndices(length, nSamples, withReplacement, seed, SeriesEngineConfig.defaultConfig());
    }

    /**
     * Draw positions in {@code [0, length)}.
     *
     * <p>With replacement every position is drawn uniformly and independently. Without replacement the positions
     * are distinct and chosen by reservoir sampling, in reservoir order.</p>
     *
     * @param length number of positions to draw from
     * @param nSamples number of positions to draw
     * @param withReplacement whether a position may be drawn more than once
     * @param seed generator seed
     * @param config decides whether an oversized sample without replacement is clamped to {@code length}
     * @return the drawn positions
     * @throws SeriesRangeException if {@code nSamples} is negative or cannot be drawn from {@code length}
     */
    public static int[] seedableRandomIndices(int length, int nSamples, boolean withReplacement, long seed, SeriesEngineConfig config) {
        if (length < 0 || nSamples < 0) {
            throw new SeriesRangeException("length and sample size must be non-negative, got [{}] and [{}]", length, nSamples);
        }
        SplittableRandom random = new SplittableRandom(seed);
        if (withReplacement) {
            if (length == 0 && nSamples > 0) {
                throw new SeriesRangeException("cannot draw [{}] samples from an empty series", nSamples);
            }
            int[] indices = new int[nSamples];
            for (int i = 0; i < nSamples; i++) {
                indices[i] = random.nextInt(length);
            }
            return indices;
        }

        int size = nSamples;
        if (nSamples > length) {
            if (config.clampOversizedSamples() == false) {
                throw new SeriesRangeException(
                    "cannot draw [{}] samples without replacement from [{}] values",
                    nSamples,
                    length
                );
            }
            logger.debug("Clamping sample size [{}] to the [{}] available values", nSamples, length);
            size = length;
        }
        int[] reservoir = new int[size];
        for (int i = 0; i < size; i++) {
            reservoir[i] = i;
        }
        for (int i = size; i < length; i++) {
            int j = random.nextInt(i + 1);
            if (j < size) {
                reservoir[j] = i;
            }
        }
        return reservoir;
    }
}
