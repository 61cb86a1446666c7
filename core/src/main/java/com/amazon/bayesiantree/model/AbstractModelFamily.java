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

package com.amazon.bayesiantree.model;

import static com.amazon.bayesiantree.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Holds the partition prior shared by all model families, that is the prior
 * probability of a node being split. The prior of not splitting a node is
 * {@code 1 - partitionPrior}; the prior of one particular split is
 * {@code partitionPrior} spread uniformly over all candidate splits of all
 * dimensions.
 *
 * @param <P> the representation of a prior or posterior distribution
 */
@Getter
public abstract class AbstractModelFamily<P> implements IModelFamily<P> {

    public static final double DEFAULT_PARTITION_PRIOR = 0.9;

    protected final double partitionPrior;

    protected AbstractModelFamily(double partitionPrior) {
        checkArgument(partitionPrior > 0 && partitionPrior < 1,
                () -> String.format("partitionPrior must be in (0, 1) but was %s", partitionPrior));
        this.partitionPrior = partitionPrior;
    }

    protected double logPriorNoSplit() {
        return Math.log(1 - partitionPrior);
    }

    protected double logPriorSplit(int numberOfSplits, int nDim) {
        return Math.log(partitionPrior / ((double) numberOfSplits * nDim));
    }
}
