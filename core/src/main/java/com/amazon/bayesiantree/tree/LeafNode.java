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

/**
 * A terminal node. Every row routed here receives the prediction derived from
 * the posterior of this node.
 *
 * @param <P> the representation of prior and posterior distributions
 */
public final class LeafNode<P> extends Node<P> {

    public LeafNode(int level, P prior, P posterior, int nData) {
        super(level, prior, posterior, nData);
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public int getDepth() {
        return level;
    }

    @Override
    public int getNumberOfLeaves() {
        return 1;
    }

    @Override
    public void addFeatureImportance(double[] featureImportance) {
    }
}
