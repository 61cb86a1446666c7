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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import com.amazon.bayesiantree.input.IFeatureMatrix;
import com.amazon.bayesiantree.model.IModelFamily;
import com.amazon.bayesiantree.returntypes.PredictionStep;

/**
 * Answers queries against a fitted tree by routing rows from the root to the
 * leaves. Rows with a value less than the split value go to the first child,
 * all others to the second child, matching the convention used during
 * induction. Results are written at the original row positions.
 *
 * @param <P> the representation of prior and posterior distributions
 */
public class TreePredictor<P> {

    private final IModelFamily<P> modelFamily;

    public TreePredictor(IModelFamily<P> modelFamily) {
        this.modelFamily = checkNotNull(modelFamily, "modelFamily must not be null");
    }

    /**
     * @param root the root of a fitted tree
     * @param data the rows to predict
     * @return one point prediction per row
     */
    public double[] predict(Node<P> root, IFeatureMatrix data) {
        double[] result = new double[data.getNumberOfRows()];
        route(root, data, allRows(data), (leaf, rows) -> {
            double value = modelFamily.predictLeafValue(leaf.getPosterior());
            for (int row : rows) {
                result[row] = value;
            }
        });
        return result;
    }

    /**
     * @param root the root of a fitted tree
     * @param data the rows to predict
     * @return the posterior mean of the leaf of every row
     */
    public double[][] predictProbabilities(Node<P> root, IFeatureMatrix data) {
        double[][] result = new double[data.getNumberOfRows()][];
        route(root, data, allRows(data), (leaf, rows) -> {
            double[] mean = modelFamily.computePosteriorMean(leaf.getPosterior());
            for (int row : rows) {
                result[row] = Arrays.copyOf(mean, mean.length);
            }
        });
        return result;
    }

    /**
     * @param root the root of a fitted tree
     * @param data the rows to explain
     * @return for every row the decisions from the root to its leaf, in that
     *         order
     */
    public List<List<PredictionStep>> predictionPaths(Node<P> root, IFeatureMatrix data) {
        List<List<PredictionStep>> paths = new ArrayList<>(data.getNumberOfRows());
        for (int i = 0; i < data.getNumberOfRows(); i++) {
            paths.add(new ArrayList<>());
        }
        route(root, data, allRows(data), new RoutingVisitor<P>() {
            @Override
            public void acceptSplit(SplitNode<P> node, int[] rows1, int[] rows2) {
                append(paths, rows1, node, false);
                append(paths, rows2, node, true);
            }

            @Override
            public void acceptLeaf(LeafNode<P> leaf, int[] rows) {
            }
        });
        return paths;
    }

    /**
     * Routes rows through the subtree rooted at {@code node}. Each row reaches
     * exactly one leaf; empty row sets are not routed further.
     *
     * @param node    the root of the subtree
     * @param data    the feature matrix
     * @param rows    the rows of {@code data} that reached {@code node}
     * @param visitor the visitor collecting results
     * @param <P>     the representation of prior and posterior distributions
     */
    public static <P> void route(Node<P> node, IFeatureMatrix data, int[] rows, RoutingVisitor<P> visitor) {
        if (rows.length == 0) {
            return;
        }
        if (node.isLeaf()) {
            visitor.acceptLeaf((LeafNode<P>) node, rows);
            return;
        }

        SplitNode<P> split = (SplitNode<P>) node;
        int[] rows1 = new int[rows.length];
        int[] rows2 = new int[rows.length];
        int n1 = 0;
        int n2 = 0;
        for (int row : rows) {
            if (split.isLeftOf(data.getValue(row, split.getSplitDimension()))) {
                rows1[n1++] = row;
            } else {
                rows2[n2++] = row;
            }
        }
        rows1 = Arrays.copyOf(rows1, n1);
        rows2 = Arrays.copyOf(rows2, n2);

        visitor.acceptSplit(split, rows1, rows2);
        route(split.getChild1(), data, rows1, visitor);
        route(split.getChild2(), data, rows2, visitor);
    }

    private static <P> void append(List<List<PredictionStep>> paths, int[] rows, SplitNode<P> node,
            boolean greaterOrEqual) {
        if (rows.length == 0) {
            return;
        }
        PredictionStep step = new PredictionStep(node.getSplitDimension(), node.getSplitFeatureName(),
                node.getSplitValue(), greaterOrEqual);
        for (int row : rows) {
            paths.get(row).add(step);
        }
    }

    private static int[] allRows(IFeatureMatrix data) {
        return IntStream.range(0, data.getNumberOfRows()).toArray();
    }
}
