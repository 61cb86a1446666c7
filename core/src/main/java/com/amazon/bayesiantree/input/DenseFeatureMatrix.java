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

import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A dense row-major feature matrix. The input rows are copied.
 */
public class DenseFeatureMatrix implements IFeatureMatrix {

    private final double[][] data;
    private final int numberOfColumns;

    public DenseFeatureMatrix(double[][] data) {
        checkNotNull(data, "data must not be null");
        this.numberOfColumns = (data.length == 0) ? 0 : checkNotNull(data[0], "rows must not be null").length;
        this.data = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            checkNotNull(data[i], "rows must not be null");
            int row = i;
            checkArgument(data[i].length == numberOfColumns, () -> String.format(
                    "X must be rectangular: row %d has %d columns, expected %d", row, data[row].length,
                    numberOfColumns));
            this.data[i] = Arrays.copyOf(data[i], numberOfColumns);
        }
    }

    @Override
    public int getNumberOfRows() {
        return data.length;
    }

    @Override
    public int getNumberOfColumns() {
        return numberOfColumns;
    }

    @Override
    public double getValue(int row, int column) {
        return data[row][column];
    }
}
