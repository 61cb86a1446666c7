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

package com.amazon.bayesiantree.input;

/**
 * A read-only numeric matrix with random access, used as the feature input of a
 * tree. Rows are samples and columns are features.
 */
public interface IFeatureMatrix {

    int getNumberOfRows();

    int getNumberOfColumns();

    double getValue(int row, int column);

    /**
     * Returns a copy of one column.
     *
     * @param column the column index
     * @return the values of the column, one per row
     */
    default double[] getColumn(int column) {
        double[] result = new double[getNumberOfRows()];
        for (int row = 0; row < result.length; row++) {
            result[row] = getValue(row, column);
        }
        return result;
    }
}
