/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute.sampling;

import org.opensearch.series.common.SeriesEngineConfig;
import org.opensearch.series.common.StringLengthUnit;
import org.opensearch.series.common.exception.SeriesRangeException;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

public class RandomIndicesTests extends OpenSearchTestCase {

    public void testWithoutReplacementIsReproducibleAndDistinct() {
        int[] first = RandomIndices.seedableRandomIndices(10, 5, false, 42);
        int[] second = RandomIndices.seedableRandomIndices(10, 5, false, 42);

        assertArrayEquals(first, second);
        assertEquals(5, first.length);
        Set<Integer> distinct = new HashSet<>();
        for (int index : first) {
            assertTrue(index >= 0 && index < 10);
            distinct.add(index);
        }
        assertEquals(5, distinct.size());
    }

    public void testWithReplacementStaysInRange() {
        int length = randomIntBetween(1, 20);
        int samples = randomIntBetween(0, 100);
        long seed = randomLong();

        int[] indices = RandomIndices.seedableRandomIndices(length, samples, true, seed);
        assertEquals(samples, indices.length);
        for (int index : indices) {
            assertTrue(index >= 0 && index < length);
        }
        assertArrayEquals(indices, RandomIndices.seedableRandomIndices(length, samples, true, seed));
    }

    public void testFullSampleIsPermutationOfAllPositions() {
        int[] indices = RandomIndices.seedableRandomIndices(8, 8, false, randomLong());
        Arrays.sort(indices);
        assertArrayEquals(new int[] { 0, 1, 2, 3, 4, 5, 6, 7 }, indices);
    }

    public void testOversizedSample() {
        expectThrows(SeriesRangeException.class, () -> RandomIndices.seedableRandomIndices(3, 4, false, 1));

        SeriesEngineConfig clamping = new SeriesEngineConfig(true, StringLengthUnit.BYTES, "strict_date", "epoch_millis");
        int[] clamped = RandomIndices.seedableRandomIndices(3, 4, false, 1, clamping);
        Arrays.sort(clamped);
        assertArrayEquals(new int[] { 0, 1, 2 }, clamped);
    }

    public void testEmptyInput() {
        assertEquals(0, RandomIndices.seedableRandomIndices(0, 0, true, 7).length);
        assertEquals(0, RandomIndices.seedableRandomIndices(0, 0, false, 7).length);
        expectThrows(SeriesRangeException.class, () -> RandomIndices.seedableRandomIndices(0, 1, true, 7));
        expectThrows(SeriesRangeException.class, () -> RandomIndices.seedableRandomIndices(5, -1, true, 7));
    }
}
