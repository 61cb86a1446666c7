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

import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;
import static com.amazon.bayesiantree.CommonUtils.checkState;
import static com.amazon.bayesiantree.CommonUtils.gather;
import static com.amazon.bayesiantree.CommonUtils.hasDistinctValues;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.bayesiantree.input.IFeatureMatrix;
import com.amazon.bayesiantree.model.IModelFamily;

/**
 * Induces a tree by recursive partitioning. At every node the log marginal
 * likelihood of not splitting is compared with the best log marginal likelihood
 * over all axis-aligned splits of all dimensions, and the node is split only if
 * a split is strictly more likely.
 * <p>
 * Induction works on per-dimension sorted row indices that are computed once
 * for the whole data set and filtered on the way down, so that every dimension
 * is sorted exactly once regardless of the depth of the tree. Splits are only
 * considered between rows with different feature values.
 *
 * @param <P> the representation of prior and posterior distributions
 */
public class TreeInducer<P> {

    private static final Logger LOG = LoggerFactory.getLogger(TreeInducer.class);

    private final IModelFamily<P> modelFamily;
    private final boolean verbose;

    public TreeInducer(IModelFamily<P> modelFamily, boolean verbose) {
        this.modelFamily = checkNotNull(modelFamily, "modelFamily must not be null");
        this.verbose = verbose;
    }

    /**
     * Induces a tree from the given training data.
     *
     * @param data         the features, one row per sample
     * @param targets      the targets, one per row
     * @param delta        the prior strengthening with depth, in [0, 1]; 0 uses
     *                     the global prior at every node
     * @param featureNames one name per column
     * @return the root of the induced tree
     */
    public Node<P> induce(IFeatureMatrix data, double[] targets, double delta, List<String> featureNames) {
        checkNotNull(data, "data must not be null");
        checkNotNull(targets, "targets must not be null");
        checkArgument(data.getNumberOfRows() == targets.length, () -> String
                .format("Invalid shapes: X has %d rows, y has %d", data.getNumberOfRows(), targets.length));
        checkArgument(data.getNumberOfRows() > 0, "X must contain at least one row");
        checkArgument(data.getNumberOfColumns() > 0, "X must contain at least one column");
        checkArgument(featureNames.size() == data.getNumberOfColumns(), "featureNames must have one entry per column");
        checkArgument(delta >= 0.0 && delta <= 1.0,
                () -> String.format("Delta must be between 0.0 and 1.0 but was %s.", delta));

        double[][] columns = new double[data.getNumberOfColumns()][];
        for (int dim = 0; dim < columns.length; dim++) {
            columns[dim] = data.getColumn(dim);
        }
        P prior = modelFamily.getPrior();
        if (targets.length < 2 || !hasDistinctValues(targets)) {
            LOG.debug("Sealing root with {} data points as a leaf", targets.length);
            return new LeafNode<>(0, prior, modelFamily.computePosterior(targets, prior, 1), targets.length);
        }
        Context context = new Context(columns, targets, featureNames, delta);
        return induce(context, SortedIndices.sortByDimension(data), prior, 0, "root");
    }

    private Node<P> induce(Context context, int[][] sortedIndicesByDim, P prior, int level, String side) {
        int nData = sortedIndicesByDim[0].length;
        if (verbose) {
            LOG.info("Training level {} {} with {} data points", level, side, nData);
        } else {
            LOG.debug("Training level {} {} with {} data points", level, side, nData);
        }

        // the order of the targets is irrelevant when not splitting
        double[] activeTargets = gather(context.targets, sortedIndicesByDim[0]);
        double logPDataNoSplit = modelFamily.computeNoSplitLogLikelihood(activeTargets, prior);
        P posterior = modelFamily.computePosterior(activeTargets, prior, 1);

        SplitCandidate best = findBestSplit(context, sortedIndicesByDim, prior, logPDataNoSplit);
        if (best == null) {
            return new LeafNode<>(level, prior, posterior, nData);
        }

        int dim = best.dimension;
        int[] sorted = sortedIndicesByDim[dim];
        int[] indices1 = Arrays.copyOfRange(sorted, 0, best.position);
        int[] indices2 = Arrays.copyOfRange(sorted, best.position, nData);
        double lower = context.columns[dim][indices1[indices1.length - 1]];
        double upper = context.columns[dim][indices2[0]];
        double splitValue = 0.5 * lower + 0.5 * upper;
        if (splitValue <= lower) {
            // adjacent doubles, the midpoint rounds down
            splitValue = upper;
        }

        Node<P> child1 = induceChild(context, sortedIndicesByDim, indices1, prior, level + 1, "LHS");
        Node<P> child2 = induceChild(context, sortedIndicesByDim, indices2, prior, level + 1, "RHS");
        return new SplitNode<>(level, prior, posterior, nData, dim, splitValue, context.featureNames.get(dim),
                logPDataNoSplit, best.logLikelihood, child1, child2);
    }

    private Node<P> induceChild(Context context, int[][] sortedIndicesByDim, int[] indices, P parentPrior,
            int level, String side) {
        double[] childTargets = gather(context.targets, indices);
        P childPrior = (context.delta != 0) ? modelFamily.computePosterior(childTargets, parentPrior, context.delta)
                : parentPrior;

        // a single row, or rows sharing one target, can never justify another split
        if (indices.length > 1 && hasDistinctValues(childTargets)) {
            boolean[] active = SortedIndices.mask(indices, context.targets.length);
            int[][] childSortedIndices = SortedIndices.filter(sortedIndicesByDim, active, indices.length);
            return induce(context, childSortedIndices, childPrior, level, side);
        }
        P posterior = modelFamily.computePosterior(childTargets, parentPrior, 1);
        return new LeafNode<>(level, childPrior, posterior, indices.length);
    }

    /**
     * Searches all dimensions for the split with the highest log marginal
     * likelihood. Ties are resolved in favor of the lower dimension and then the
     * lower position.
     *
     * @return the best split, or null if no split beats not splitting
     */
    SplitCandidate findBestSplit(Context context, int[][] sortedIndicesByDim, P prior, double logPDataNoSplit) {
        int nDim = sortedIndicesByDim.length;
        int nData = sortedIndicesByDim[0].length;
        SplitCandidate best = null;
        double bestLogLikelihood = logPDataNoSplit;

        for (int dim = 0; dim < nDim; dim++) {
            int[] sorted = sortedIndicesByDim[dim];
            double[] values = gather(context.columns[dim], sorted);
            int[] splitPositions = candidateSplitPositions(values);
            if (splitPositions.length == 0) {
                continue;
            }

            double[] sortedTargets = gather(context.targets, sorted);
            double[] logLikelihoods = modelFamily.computeSplitLogLikelihoods(sortedTargets, splitPositions, nDim,
                    prior);
            int iMax = 0;
            for (int i = 1; i < logLikelihoods.length; i++) {
                if (logLikelihoods[i] > logLikelihoods[iMax]) {
                    iMax = i;
                }
            }
            if (logLikelihoods[iMax] > bestLogLikelihood) {
                bestLogLikelihood = logLikelihoods[iMax];
                best = new SplitCandidate(dim, splitPositions[iMax], logLikelihoods[iMax]);
            }
        }

        if (best != null) {
            checkState(best.position > 0 && best.position < nData, "split position out of range");
        }
        return best;
    }

    /**
     * @param sortedValues the values of one feature in ascending order
     * @return every position k with {@code sortedValues[k] != sortedValues[k - 1]}
     */
    static int[] candidateSplitPositions(double[] sortedValues) {
        int[] positions = new int[Math.max(0, sortedValues.length - 1)];
        int count = 0;
        for (int k = 1; k < sortedValues.length; k++) {
            if (sortedValues[k] != sortedValues[k - 1]) {
                positions[count++] = k;
            }
        }
        return Arrays.copyOf(positions, count);
    }

    static final class SplitCandidate {
        final int dimension;
        final int position;
        final double logLikelihood;

        SplitCandidate(int dimension, int position, double logLikelihood) {
            this.dimension = dimension;
            this.position = position;
            this.logLikelihood = logLikelihood;
        }
    }

    /**
     * The data shared by all nodes of one induction.
     */
    static final class Context {
        final double[][] columns;
        final double[] targets;
        final List<String> featureNames;
        final double delta;

        Context(double[][] columns, double[] targets, List<String> featureNames, double delta) {
            this.columns = columns;
            this.targets = targets;
            this.featureNames = featureNames;
            this.delta = delta;
        }
    }
}
