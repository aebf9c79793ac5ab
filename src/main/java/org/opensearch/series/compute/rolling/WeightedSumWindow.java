/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

import org.opensearch.series.core.buffer.ValueBuffer;

import java.util.ArrayDeque;

/**
 * Weighted sum over the window. The first weight aligns with the oldest position of the window, so a window
 * clipped at the start of the series uses the head of the weight vector.
 *
 * <p>Each position's weight changes as the window slides, so the aggregate is recomputed from the positions
 * in the window on every read.</p>
 */
public class WeightedSumWindow implements WindowTransformer {

    protected final ValueBuffer values;
    protected final double[] weights;
    private final ArrayDeque<Integer> positions = new ArrayDeque<>();
    private int newest = -1;

    public WeightedSumWindow(ValueBuffer values, double[] weights) {
        this.values = values;
        this.weights = weights;
    }

    @Override
    public void add(int position) {
        positions.addLast(position);
        newest = position;
    }

    @Override
    public void remove(int position) {
        if (!positions.isEmpty() && positions.peekFirst() == position) {
            positions.removeFirst();
        }
    }

    @Override
    public void addNull(int position) {
        newest = position;
    }

    @Override
    public void removeNull(int position) {}

    @Override
    public double value() {
        int start = windowStart();
        double sum = 0;
        for (int position : positions) {
            sum += weights[position - start] * values.getDouble(position);
        }
        return sum;
    }

    @Override
    public long longValue() {
        throw new UnsupportedOperationException("a weighted rolling aggregate is always floating point");
    }

    @Override
    public int getNonNullCount() {
        return positions.size();
    }

    /**
     * @return sum of the weights of the non-null values in the window
     */
    protected double weightTotal() {
        int start = windowStart();
        double total = 0;
        for (int position : positions) {
            total += weights[position - start];
        }
        return total;
    }

    private int windowStart() {
        return Math.max(0, newest - weights.length + 1);
    }
}
