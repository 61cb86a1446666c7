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

package com.amazon.bayesiantree.returntypes;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One decision on the way from the root of a tree to a leaf: the split that was
 * evaluated and the side that was taken.
 */
@Getter
@AllArgsConstructor
public class PredictionStep {

    /**
     * The 0-based index of the feature that was tested.
     */
    private final int dimension;

    private final String featureName;

    /**
     * The split threshold.
     */
    private final double threshold;

    /**
     * True if the feature value was greater than or equal to the threshold, that
     * is if the second child was taken.
     */
    private final boolean greaterOrEqual;

    @Override
    public String toString() {
        return String.format("PredictionStep(%d, %s, %s, %s)", dimension, featureName, threshold, greaterOrEqual);
    }
}
