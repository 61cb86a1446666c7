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

import lombok.Getter;

/**
 * A node of a Bayesian decision tree. Nodes are immutable; a node is either a
 * {@link LeafNode} or a {@link SplitNode}, which owns exactly two children.
 *
 * @param <P> the representation of prior and posterior distributions
 */
@Getter
public abstract class Node<P> {

    /**
     * Depth of this node, the root is at level 0.
     */
    protected final int level;

    /**
     * The prior this node was fitted with.
     */
    protected final P prior;

    /**
     * The posterior computed from the training data reaching this node.
     */
    protected final P posterior;

    /**
     * The number of training rows reaching this node.
     */
    protected final int nData;

    protected Node(int level, P prior, P posterior, int nData) {
        this.level = level;
        this.prior = prior;
        this.posterior = posterior;
        this.nData = nData;
    }

    public abstract boolean isLeaf();

    /**
     * @return the maximum level of all leaves in this subtree
     */
    public abstract int getDepth();

    /**
     * @return the number of leaves in this subtree
     */
    public abstract int getNumberOfLeaves();

    /**
     * Adds the log likelihood gain of every split in this subtree to the entry of
     * the split dimension.
     *
     * @param featureImportance the accumulator, one entry per feature
     */
    public abstract void addFeatureImportance(double[] featureImportance);
}
