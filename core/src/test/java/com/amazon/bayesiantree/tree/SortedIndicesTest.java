/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.bayesiantree.tree;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.bayesiantree.input.FeatureMatrices;

public class SortedIndicesTest {

    @Test
    public void testSortByDimensionIsStable() {
        int[][] sorted = SortedIndices.sortByDimension(
                FeatureMatrices.of(new double[][] { { 3.0, 1.0 }, { 1.0, 1.0 }, { 2.0, 0.0 }, { 1.0, 1.0 } }));

        assertEquals(2, sorted.length);
        assertArrayEquals(new int[] { 1, 3, 2, 0 }, sorted[0]);
        assertArrayEquals(new int[] { 2, 0, 1, 3 }, sorted[1]);
    }

    @Test
    public void testFilterPreservesOrder() {
        int[][] sorted = { { 4, 0, 3, 1, 2 }, { 2, 1, 0, 4, 3 } };
        boolean[] active = SortedIndices.mask(new int[] { 3, 0, 2 }, 5);

        int[][] filtered = SortedIndices.filter(sorted, active, 3);

        assertArrayEquals(new int[] { 0, 3, 2 }, filtered[0]);
        assertArrayEquals(new int[] { 2, 0, 3 }, filtered[1]);
    }

    @Test
    public void testFilterWithWrongSize() {
        int[][] sorted = { { 0, 1, 2 } };
        boolean[] active = SortedIndices.mask(new int[] { 1 }, 3);
        assertThrows(IllegalStateException.class, () -> SortedIndices.filter(sorted, active, 2));
    }
}
