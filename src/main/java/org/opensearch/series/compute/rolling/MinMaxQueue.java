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
 * A FIFO queue of positions that maintains the min/max value in the window
 * <br>
 * Using max queue to explain the algorithm -- The main idea is to keep the next possible max value
 * in case the current max being removed, so eventually we will maintain a queue whose values are
 * monotonically decreasing. E.g. given following data points in the window: <br>
 * 1, 2, 3, 5, 1, 2, 3, 6, 2, 3, 4, 3, 1
 * <br>
 * our internal queue would hold the positions of <br>
 * 6, 4, 3, 1 <br>
 * such that before 6 is being popped out our max is always 6, then 4, 3, 1 after each of max being popped out eventually
 * <br>
 * Min queue implementation simply flips the comparison.
 * <br>
 * The time complexity of each insert/remove is amortized O(1) since each position is at most inserted and removed once
 * from the internal queue. And getting the min/max is always reading the head of the queue which is O(1)
 * <br>
 * Values are ordered with the buffer's natural order, in which NaN is greater than any other double.
 */
public class MinMaxQueue implements WindowTransformer {
    private final ArrayDeque<Integer> queue = new ArrayDeque<>();
    private final ValueBuffer values;
    private final boolean isMinQueue;
    private int numNonNull;

    public MinMaxQueue(ValueBuffer values) {
        this(values, false);
    }

    public MinMaxQueue(ValueBuffer values, boolean isMinQueue) {
        this.values = values;
        this.isMinQueue = isMinQueue;
    }

    @Override
    public void add(int position) {
        numNonNull++;
        while (!queue.isEmpty() && dominates(position, queue.peekLast())) {
            queue.removeLast();
        }
        queue.addLast(position);
    }

    @Override
    public void remove(int position) {
        numNonNull--;
        if (!queue.isEmpty() && queue.peekFirst() == position) {
            queue.removeFirst();
        }
    }

    @Override
    public void addNull(int position) {
        // do nothing
    }

    @Override
    public void removeNull(int position) {
        // do nothing
    }

    @Override
    public double value() {
        if (queue.isEmpty()) {
            return Double.NaN;
        }
        return values.getDouble(queue.peekFirst());
    }

    @Override
    public long longValue() {
        if (queue.isEmpty()) {
            throw new IllegalStateException("empty window has no extremum");
        }
        return values.getLong(queue.peekFirst());
    }

    @Override
    public int getNonNullCount() {
        return numNonNull;
    }

    private boolean dominates(int position, int queued) {
        int order = values.compare(position, queued);
        return isMinQueue ? order < 0 : order > 0;
    }
}
