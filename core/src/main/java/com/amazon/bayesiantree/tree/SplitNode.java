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

import static com.amazon.bayesiantree.CommonUtils.checkNotNull;
import static com.amazon.bayesiantree.CommonUtils.checkState;

import lombok.Getter;

/**
 * An internal node that divides space with an axis-aligned split. Rows whose
 * value in {@link #splitDimension} is less than {@link #splitValue} belong to
 * {@link #child1}, all others to {@link #child2}.
 *
 * @param <P> the representation of prior and posterior distributions
 */
@Getter
public final class SplitNode<P> extends Node<P> {

    private final int splitDimension;
    private final double splitValue;
    private final String splitFeatureName;

    /**
     * Log marginal likelihood of the data of this node as a single leaf.
     */
    private final double logPDataNoSplit;

    /**
     * Log marginal likelihood of the data of this node under the chosen split;
     * always greater than {@link #logPDataNoSplit}.
     */
    private final double bestLogPDataSplit;

    private final Node<P> child1;
    private final Node<P> child2;

    public SplitNode(int level, P prior, P posterior, int nData, int splitDimension, double splitValue,
            String splitFeatureName, double logPDataNoSplit, double bestLogPDataSplit, Node<P> child1,
            Node<P> child2) {
        super(level, prior, posterior, nData);
        this.child1 = checkNotNull(child1, "child1 must not be null");
        this.child2 = checkNotNull(child2, "child2 must not be null");
        checkState(splitDimension >= 0, "splitDimension must not be negative");
        checkState(child1.getNData() + child2.getNData() == nData,
                "the children of a split must partition the data of their parent");
        this.splitDimension = splitDimension;
        this.splitValue = splitValue;
        this.splitFeatureName = splitFeatureName;
        this.logPDataNoSplit = logPDataNoSplit;
        this.bestLogPDataSplit = bestLogPDataSplit;
    }

    /**
     * @param value the value of a row in {@link #splitDimension}
     * @return true if the row belongs to {@link #child1}
     */
    public boolean isLeftOf(double value) {
        return value < splitValue;
    }

    /**
     * @return the increase in log marginal likelihood obtained by this split
     */
    public double getLogLikelihoodGain() {
        return bestLogPDataSplit - logPDataNoSplit;
    }

    /**
     * Returns a split node with the same split and the given children; this node
     * itself if the children are unchanged.
     */
    SplitNode<P> withChildren(Node<P> newChild1, Node<P> newChild2) {
        if (newChild1 == child1 && newChild2 == child2) {
            return this;
        }
        return new SplitNode<>(level, prior, posterior, nData, splitDimension, splitValue, splitFeatureName,
                logPDataNoSplit, bestLogPDataSplit, newChild1, newChild2);
    }

    /**
     * @return a leaf carrying the level, prior, posterior and data count of this
     *         node
     */
    LeafNode<P> toLeaf() {
        return new LeafNode<>(level, prior, posterior, nData);
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public int getDepth() {
        return Math.max(child1.getDepth(), child2.getDepth());
    }

    @Override
    public int getNumberOfLeaves() {
        return child1.getNumberOfLeaves() + child2.getNumberOfLeaves();
    }

    @Override
    public void addFeatureImportance(double[] featureImportance) {
        featureImportance[splitDimension] += getLogLikelihoodGain();
        child1.addFeatureImportance(featureImportance);
        child2.addFeatureImportance(featureImportance);
    }
}
