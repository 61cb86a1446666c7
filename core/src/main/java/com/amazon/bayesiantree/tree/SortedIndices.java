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

import static com.amazon.bayesiantree.CommonUtils.checkState;

import java.util.Comparator;
import java.util.stream.IntStream;

import com.amazon.bayesiantree.input.IFeatureMatrix;

/**
 * Per-dimension orderings of the rows that reach a node during induction. The
 * orderings are computed once for the full data set; the orderings of a child
 * are obtained by filtering those of its parent, which keeps them sorted
 * without sorting again.
 */
final class SortedIndices {

    private SortedIndices() {
    }

    /**
     * Computes, for every column, the row indices in ascending order of that
     * column. Rows with equal values keep their original order.
     *
     * @param data the feature matrix
     * @return an array of shape [columns][rows]
     */
    static int[][] sortByDimension(IFeatureMatrix data) {
        int[][] result = new int[data.getNumberOfColumns()][];
        for (int dim = 0; dim < result.length; dim++) {
            double[] column = data.getColumn(dim);
            result[dim] = IntStream.range(0, column.length).boxed()
                    .sorted(Comparator.comparingDouble(i -> column[i])).mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    /**
     * Keeps, in every dimension, the indices marked as active, preserving their
     * order.
     *
     * @param sortedIndicesByDim the orderings of the parent
     * @param active             membership mask over original row indices
     * @param size               the number of active rows
     * @return the orderings restricted to the active rows
     */
    static int[][] filter(int[][] sortedIndicesByDim, boolean[] active, int size) {
        int[][] result = new int[sortedIndicesByDim.length][];
        for (int dim = 0; dim < sortedIndicesByDim.length; dim++) {
            int[] filtered = new int[size];
            int position = 0;
            for (int index : sortedIndicesByDim[dim]) {
                if (active[index]) {
                    filtered[position++] = index;
                }
            }
            checkState(position == size, "active mask does not match the number of active rows");
            result[dim] = filtered;
        }
        return result;
    }

    /**
     * Builds a membership mask marking the given indices.
     *
     * @param indices      row indices
     * @param numberOfRows number of rows of the full data set
     * @return a mask over original row indices
     */
    static boolean[] mask(int[] indices, int numberOfRows) {
        boolean[] active = new boolean[numberOfRows];
        for (int index : indices) {
            active[index] = true;
        }
        return active;
    }
}
