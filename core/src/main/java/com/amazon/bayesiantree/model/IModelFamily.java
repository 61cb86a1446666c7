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

/**
 * The conjugate Bayesian model that supplies marginal likelihoods and
 * posteriors to the tree induction engine. The engine itself never inspects a
 * prior or posterior; it only hands them back to the model family.
 *
 * @param <P> the representation of a prior or posterior distribution
 */
public interface IModelFamily<P> {

    /**
     * @return the global prior used at the root of a tree
     */
    P getPrior();

    /**
     * Checks that the target values are legal for this model family.
     *
     * @param targets the training targets
     * @throws com.amazon.bayesiantree.exception.ValidationException if a target is
     *                                                               not legal
     */
    void validateTargets(double[] targets);

    /**
     * Computes the log marginal likelihood of treating all targets as a single
     * leaf, including the prior probability of not splitting. The order of the
     * targets does not matter.
     *
     * @param targets the targets reaching a node
     * @param prior   the prior of that node
     * @return the log marginal likelihood of not splitting
     */
    double computeNoSplitLogLikelihood(double[] targets, P prior);

    /**
     * Computes the log marginal likelihood of every candidate split. A split at
     * position k separates {@code sortedTargets[0..k-1]} from
     * {@code sortedTargets[k..]}.
     *
     * @param sortedTargets  the targets ordered by the feature being split
     * @param splitPositions the candidate positions, strictly increasing, each in
     *                       [1, sortedTargets.length - 1]
     * @param nDim           the number of features of the data set
     * @param prior          the prior of the node being split
     * @return one log marginal likelihood per candidate position
     */
    double[] computeSplitLogLikelihoods(double[] sortedTargets, int[] splitPositions, int nDim, P prior);

    /**
     * Updates a prior with observed targets. A {@code delta} of 1 is the regular
     * Bayesian update; smaller values weaken the influence of the data, which is
     * used to derive child priors when annealing is enabled.
     *
     * @param targets the observed targets
     * @param prior   the prior to update
     * @param delta   the weight of each observation
     * @return the posterior
     */
    P computePosterior(double[] targets, P prior, double delta);

    /**
     * @param posterior a posterior
     * @return the mean of the predictive distribution; class probabilities for
     *         classification, a single value for regression
     */
    double[] computePosteriorMean(P posterior);

    /**
     * @param posterior a posterior
     * @return the point prediction, a class label or a regression value
     */
    double predictLeafValue(P posterior);

    /**
     * @return true for regression families, false for classification
     */
    boolean isRegression();

    /**
     * Flattens a prior or posterior into parameters for state mapping.
     *
     * @param distribution a prior or posterior
     * @return the parameters
     */
    double[] toParameters(P distribution);

    /**
     * Inverse of {@link #toParameters(Object)}.
     *
     * @param parameters flat parameters
     * @return the prior or posterior
     */
    P fromParameters(double[] parameters);
}
