/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

import org.opensearch.series.common.exception.SeriesRangeException;
import org.opensearch.series.common.exception.SeriesShapeException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Parameters of a rolling aggregation.
 *
 * @param windowSize number of positions in the trailing window, at least 1
 * @param weights one weight per window offset, oldest first, or null for an unweighted window
 * @param ignoreNull when true nulls are skipped and do not count as periods; when false a null anywhere in the
 *                   window makes the output null
 * @param minPeriods smallest number of periods that yields a value, or null to require a full window
 */
public record RollingOptions(int windowSize, double[] weights, boolean ignoreNull, Integer minPeriods) {

    /**
     * @return options for an unweighted window of {@code windowSize} that does not ignore nulls
     */
    public static RollingOptions of(int windowSize) {
        return new RollingOptions(windowSize, null, false, null);
    }

    public RollingOptions withWeights(double... newWeights) {
        return new RollingOptions(windowSize, newWeights, ignoreNull, minPeriods);
    }

    public RollingOptions withIgnoreNull(boolean newIgnoreNull) {
        return new RollingOptions(windowSize, weights, newIgnoreNull, minPeriods);
    }

    public RollingOptions withMinPeriods(Integer newMinPeriods) {
        return new RollingOptions(windowSize, weights, ignoreNull, newMinPeriods);
    }

    public int effectiveMinPeriods() {
        return minPeriods == null ? windowSize : minPeriods;
    }

    /**
     * @throws SeriesRangeException if the window size or min periods are out of range
     * @throws SeriesShapeException if the weights do not match the window size
     */
    public void validate() {
        if (windowSize < 1) {
            throw new SeriesRangeException("window_size must be at least 1, got [{}]", windowSize);
        }
        int periods = effectiveMinPeriods();
        if (periods < 1 || periods > windowSize) {
            throw new SeriesRangeException("min_periods must be between 1 and window_size [{}], got [{}]", windowSize, periods);
        }
        if (weights != null && weights.length != windowSize) {
            throw new SeriesShapeException("expected [{}] weights for window_size [{}], got [{}]", windowSize, windowSize, weights.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollingOptions that = (RollingOptions) o;
        return windowSize == that.windowSize
            && ignoreNull == that.ignoreNull
            && Arrays.equals(weights, that.weights)
            && Objects.equals(minPeriods, that.minPeriods);
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowSize, Arrays.hashCode(weights), ignoreNull, minPeriods);
    }

    @Override
    public String toString() {
        return "RollingOptions{windowSize="
            + windowSize
            + ", weights="
            + Arrays.toString(weights)
            + ", ignoreNull="
            + ignoreNull
            + ", minPeriods="
            + minPeriods
            + '}';
    }
}
