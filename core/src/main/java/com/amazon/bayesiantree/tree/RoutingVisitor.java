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
 * A visitor that is submitted to
 * {@link TreePredictor#route(Node, com.amazon.bayesiantree.input.IFeatureMatrix, int[], RoutingVisitor)}.
 * Rows are routed through the tree as a batch; the visitor sees every split
 * together with the rows sent to each side, and every leaf together with the
 * rows that end there.
 *
 * @param <P> the representation of prior and posterior distributions
 */
public interface RoutingVisitor<P> {

    /**
     * Visit a split in the routing. By default nothing happens.
     *
     * @param node  the split node
     * @param rows1 rows sent to {@link SplitNode#getChild1()}
     * @param rows2 rows sent to {@link SplitNode#getChild2()}
     */
    default void acceptSplit(SplitNode<P> node, int[] rows1, int[] rows2) {
    }

    /**
     * Visit a leaf in the routing.
     *
     * @param leaf the leaf node
     * @param rows the rows ending in this leaf, never empty
     */
    void acceptLeaf(LeafNode<P> leaf, int[] rows);
}
