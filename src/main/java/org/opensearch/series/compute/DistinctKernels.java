/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.core.Series;
import org.opensearch.series.core.ValueCounts;
import org.opensearch.series.core.buffer.BooleanValues;
import org.opensearch.series.core.buffer.LongValues;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.series.core.model.Validity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Distinct value analysis. Values are grouped by equality of their boxed form, so {@code NaN} groups with
 * {@code NaN}. Null forms a group of its own everywhere except in {@link #nUnique(Series)}.
 */
public final class DistinctKernels {

    private DistinctKernels() {}

    /**
     * @return the distinct values in order of first occurrence, including at most one null
     */
    public static Series unique(Series series) {
        Map<Object, Group> groups = group(series);
        int[] indices = new int[groups.size()];
        int i = 0;
        for (Group group : groups.values()) {
            indices[i++] = group.firstIndex;
        }
        return series.take(indices);
    }

    /**
     * @return the number of distinct non-null values
     */
    public static int nUnique(Series series) {
        Set<Object> seen = new HashSet<>();
        for (int i = 0; i < series.len(); i++) {
            if (series.isValid(i)) {
                seen.add(series.getValues().getObject(i));
            }
        }
        return seen.size();
    }

    /**
     * Count occurrences of every distinct value, null included. Groups are ordered by descending count, ties in
     * order of first occurrence.
     */
    public static ValueCounts valueCounts(Series series) {
        List<Group> groups = new ArrayList<>(group(series).values());
        groups.sort(Comparator.comparingInt((Group g) -> g.count).reversed());
        int[] indices = new int[groups.size()];
        long[] counts = new long[groups.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = groups.get(i).firstIndex;
            counts[i] = groups.get(i).count;
        }
        Series values = series.take(indices);
        Series countSeries = new Series(ValueCounts.COUNTS_NAME, Dtype.INT64, new LongValues(counts), Validity.allValid(counts.length));
        return new ValueCounts(values, countSeries);
    }

    /**
     * @return a BOOLEAN series, true where the value occurs exactly once
     */
    public static Series isUnique(Series series) {
        return occurrenceMask(series, true);
    }

    /**
     * @return a BOOLEAN series, true where the value occurs more than once
     */
    public static Series isDuplicated(Series series) {
        return occurrenceMask(series, false);
    }

    /**
     * One-hot encode a series: one INT64 indicator series per distinct value, in order of first occurrence,
     * named {@code <name>_<value>} or {@code <name>_null}.
     */
    public static List<Series> toDummies(Series series) {
        Map<Object, Group> groups = group(series);
        List<Series> result = new ArrayList<>(groups.size());
        for (Map.Entry<Object, Group> entry : groups.entrySet()) {
            Object key = entry.getKey();
            long[] indicator = new long[series.len()];
            for (int i = 0; i < indicator.length; i++) {
                if (entry.getValue() == groups.get(keyAt(series, i))) {
                    indicator[i] = 1;
                }
            }
            String name = series.getName() + "_" + (key == null ? "null" : key.toString());
            result.add(new Series(name, Dtype.INT64, new LongValues(indicator), Validity.allValid(indicator.length)));
        }
        return result;
    }

    private static Series occurrenceMask(Series series, boolean unique) {
        Map<Object, Group> groups = group(series);
        boolean[] result = new boolean[series.len()];
        for (int i = 0; i < result.length; i++) {
            int count = groups.get(keyAt(series, i)).count;
            result[i] = unique ? count == 1 : count > 1;
        }
        return new Series(series.getName(), Dtype.BOOLEAN, new BooleanValues(result), Validity.allValid(result.length));
    }

    private static Map<Object, Group> group(Series series) {
        Map<Object, Group> groups = new LinkedHashMap<>();
        for (int i = 0; i < series.len(); i++) {
            final int index = i;
            groups.computeIfAbsent(keyAt(series, i), k -> new Group(index)).count++;
        }
        return groups;
    }

    private static Object keyAt(Series series, int index) {
        return series.isValid(index) ? series.getValues().getObject(index) : null;
    }

    private static final class Group {
        final int firstIndex;
        int count;

        Group(int firstIndex) {
            this.firstIndex = firstIndex;
        }
    }
}
