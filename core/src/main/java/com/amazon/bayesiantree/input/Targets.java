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
 * Converts target inputs to a one dimensional {@code double} array.
 */
public class Targets {

    private Targets() {
    }

    public static double[] of(double[] targets) {
        checkNotNull(targets, "y must not be null");
        return Arrays.copyOf(targets, targets.length);
    }

    public static double[] of(int[] targets) {
        checkNotNull(targets, "y must not be null");
        return Arrays.stream(targets).asDoubleStream().toArray();
    }

    public static double[] of(long[] targets) {
        checkNotNull(targets, "y must not be null");
        double[] result = new double[targets.length];
        for (int i = 0; i < targets.length; i++) {
            result[i] = FeatureMatrices.toDouble(targets[i]);
        }
        return result;
    }

    /**
     * Squeezes a column vector ({@code n x 1}) or a row vector ({@code 1 x n}) into
     * a one dimensional array.
     *
     * @param targets the targets as a matrix
     * @return the targets as a vector
     */
    public static double[] squeeze(double[][] targets) {
        checkNotNull(targets, "y must not be null");
        if (targets.length == 1) {
            return of(targets[0]);
        }
        double[] result = new double[targets.length];
        for (int i = 0; i < targets.length; i++) {
            int row = i;
            checkArgument(targets[i] != null && targets[i].length == 1,
                    () -> String.format("y must be one dimensional but row %d is not a single value", row));
            result[i] = targets[i][0];
        }
        return result;
    }
}
