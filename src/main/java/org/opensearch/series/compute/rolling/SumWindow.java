/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

import org.opensearch.series.core.buffer.ValueBuffer;

/**
 * Handles running sum logic. Integer and floating point sums are kept apart so that an INT64 window sums
 * exactly.
 *
 * NaN and infinite values are counted instead of being added, as they would contaminate the running sum
 * (once you add a NaN, you are not able to escape the NaN state forever). They still count towards the
 * non-null count, while nulls don't (This become important in {@link MeanWindow})
 */
public class SumWindow implements WindowTransformer {

    protected final ValueBuffer values;
    protected double runningSum;
    protected long runningLongSum;
    protected int numNonNull;
    private int numNaN;
    private int numPositiveInfinity;
    private int numNegativeInfinity;

    public SumWindow(ValueBuffer values) {
        this.values = values;
    }

    @Override
    public void add(int position) {
        numNonNull++;
        runningLongSum += values.getLong(position);
        double value = values.getDouble(position);
        if (Double.isFinite(value)) {
            runningSum += value;
        } else {
            countNonFinite(value, 1);
        }
    }

    @Override
    public void remove(int position) {
        numNonNull--;
        runningLongSum -= values.getLong(position);
        double value = values.getDouble(position);
        if (Double.isFinite(value)) {
            runningSum -= value;
        } else {
            countNonFinite(value, -1);
        }
        if (numNonNull == 0) {
            runningSum = 0;
        }
    }

    @Override
    public void addNull(int position) {}

    @Override
    public void removeNull(int position) {}

    @Override
    public double value() {
        if (numNaN > 0 || (numPositiveInfinity > 0 && numNegativeInfinity > 0)) {
            return Double.NaN;
        }
        if (numPositiveInfinity > 0) {
            return Double.POSITIVE_INFINITY;
        }
        if (numNegativeInfinity > 0) {
            return Double.NEGATIVE_INFINITY;
        }
        return runningSum;
    }

    @Override
    public long longValue() {
        return runningLongSum;
    }

    @Override
    public int getNonNullCount() {
        return numNonNull;
    }

    private void countNonFinite(double value, int delta) {
        if (Double.isNaN(value)) {
            numNaN += delta;
        } else if (value > 0) {
            numPositiveInfinity += delta;
        } else {
            numNegativeInfinity += delta;
        }
    }
}
