/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.rolling;

/**
 * Running aggregate over a trailing window of a numeric buffer.
 *
 * <p>Transformers address values by position in the underlying buffer, so an implementation can read the value
 * back when it leaves the window or weight it by its offset in the window. The driver calls {@link #add(int)}
 * or {@link #addNull(int)} once per position in increasing order, and the matching remove method once the
 * position falls out of the window.</p>
 *
 * <h2>Null Handling</h2>
 * <ul>
 *   <li><strong>Sum / Mean:</strong> nulls contribute nothing to the sum and are not counted</li>
 *   <li><strong>Min / Max:</strong> nulls never become the extremum</li>
 *   <li><strong>Weighted:</strong> a null's weight is left out, including from the weight total of a mean</li>
 * </ul>
 * Whether a null poisons the whole window is decided by the driver, not by the transformer.
 */
public interface WindowTransformer {
    /**
     * Add the value at {@code position} to the window.
     * @param position a position holding a value
     */
    void add(int position);

    /**
     * Remove the value at {@code position} from the window.
     * @param position a position previously passed to {@link #add(int)}
     */
    void remove(int position);

    /**
     * Add a null position to the window.
     */
    void addNull(int position);

    /**
     * Remove a null position from the window.
     */
    void removeNull(int position);

    /**
     * Get the current aggregate as a double.
     * @return the aggregate, undefined when {@link #getNonNullCount()} is 0
     */
    double value();

    /**
     * Get the current aggregate of an integer window without going through floating point.
     * @return the aggregate, undefined when {@link #getNonNullCount()} is 0
     */
    long longValue();

    /**
     * Get the count of non-null values currently in the window.
     * @return the number of non-null values in the window
     */
    int getNonNullCount();
}
