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

import com.amazon.bayesiantree.model.IModelFamily;

/**
 * Removes splits that do not change any prediction. A split whose two children
 * are leaves with identical point predictions is replaced by a leaf built from
 * the split node itself, provided the split node's own posterior predicts that
 * same value. Equality is exact, so regression trees only merge children
 * predicting exactly the same value.
 */
public class TreePruner {

    private TreePruner() {
    }

    /**
     * Prunes the subtree rooted at {@code node}, bottom-up. Whenever pruning
     * changes the depth or the number of leaves of a subtree, the subtree is
     * pruned again, because collapsing a lower split can leave its parent with
     * two identical leaves.
     *
     * @param node        the root of the subtree
     * @param modelFamily the model family providing point predictions
     * @param <P>         the representation of prior and posterior distributions
     * @return the pruned subtree; {@code node} itself if nothing was pruned
     */
    public static <P> Node<P> prune(Node<P> node, IModelFamily<P> modelFamily) {
        if (node.isLeaf()) {
            return node;
        }

        SplitNode<P> split = (SplitNode<P>) node;
        int depthStart = split.getDepth();
        int leavesStart = split.getNumberOfLeaves();

        Node<P> result;
        Node<P> child1 = split.getChild1();
        Node<P> child2 = split.getChild2();
        if (child1.isLeaf() && child2.isLeaf()) {
            double prediction1 = modelFamily.predictLeafValue(child1.getPosterior());
            double prediction2 = modelFamily.predictLeafValue(child2.getPosterior());
            double ownPrediction = modelFamily.predictLeafValue(split.getPosterior());
            result = (prediction1 == prediction2 && ownPrediction == prediction1) ? split.toLeaf() : split;
        } else {
            result = split.withChildren(prune(child1, modelFamily), prune(child2, modelFamily));
        }

        if (result.getDepth() != depthStart || result.getNumberOfLeaves() != leavesStart) {
            return prune(result, modelFamily);
        }
        return result;
    }
}
