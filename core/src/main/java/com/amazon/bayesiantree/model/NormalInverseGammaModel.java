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
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;

import org.apache.commons.math3.special.Gamma;

/**
 * The Normal-inverse-gamma model used for regression. Targets are modelled as
 * normally distributed with unknown mean and variance; the prior over both is a
 * {@link NormalInverseGamma} distribution.
 */
public class NormalInverseGammaModel extends AbstractModelFamily<NormalInverseGamma> {

    private static final double LOG_2_PI = Math.log(2 * Math.PI);

    private final NormalInverseGamma prior;

    public NormalInverseGammaModel(NormalInverseGamma prior) {
        this(DEFAULT_PARTITION_PRIOR, prior);
    }

    public NormalInverseGammaModel(double partitionPrior, NormalInverseGamma prior) {
        super(partitionPrior);
        this.prior = checkNotNull(prior, "prior must not be null");
    }

    @Override
    public NormalInverseGamma getPrior() {
        return prior;
    }

    @Override
    public void validateTargets(double[] targets) {
        for (double target : targets) {
            checkArgument(Double.isFinite(target),
                    () -> String.format("y should contain finite values but contained %s", target));
        }
    }

    @Override
    public double computeNoSplitLogLikelihood(double[] targets, NormalInverseGamma prior) {
        double sum = 0;
        double sumOfSquares = 0;
        for (double target : targets) {
            sum += target;
            sumOfSquares += target * target;
        }
        return logPriorNoSplit() + logMarginal(prior, targets.length, sum, sumOfSquares);
    }

    @Override
    public double[] computeSplitLogLikelihoods(double[] sortedTargets, int[] splitPositions, int nDim,
            NormalInverseGamma prior) {
        int n = sortedTargets.length;
        double totalSum = 0;
        double totalSumOfSquares = 0;
        for (double target : sortedTargets) {
            totalSum += target;
            totalSumOfSquares += target * target;
        }
        double logPriorSplit = logPriorSplit(splitPositions.length, nDim);

        double[] result = new double[splitPositions.length];
        double sum = 0;
        double sumOfSquares = 0;
        int position = 0;
        for (int i = 0; i < splitPositions.length; i++) {
            while (position < splitPositions[i]) {
                double target = sortedTargets[position++];
                sum += target;
                sumOfSquares += target * target;
            }
            int n1 = splitPositions[i];
            result[i] = logPriorSplit + logMarginal(prior, n1, sum, sumOfSquares)
                    + logMarginal(prior, n - n1, totalSum - sum, totalSumOfSquares - sumOfSquares);
        }
        return result;
    }

    @Override
    public NormalInverseGamma computePosterior(double[] targets, NormalInverseGamma prior, double delta) {
        if (delta == 0 || targets.length == 0) {
            return prior;
        }
        double sum = 0;
        double sumOfSquares = 0;
        for (double target : targets) {
            sum += target;
            sumOfSquares += target * target;
        }
        return update(prior, targets.length, sum, sumOfSquares, delta);
    }

    @Override
    public double[] computePosteriorMean(NormalInverseGamma posterior) {
        return new double[] { posterior.getMu() };
    }

    @Override
    public double predictLeafValue(NormalInverseGamma posterior) {
        return posterior.getMu();
    }

    @Override
    public boolean isRegression() {
        return true;
    }

    @Override
    public double[] toParameters(NormalInverseGamma distribution) {
        return new double[] { distribution.getMu(), distribution.getKappa(), distribution.getAlpha(),
                distribution.getBeta() };
    }

    @Override
    public NormalInverseGamma fromParameters(double[] parameters) {
        checkArgument(parameters.length == 4,
                () -> String.format("expected 4 parameters (mu, kappa, alpha, beta) but got %d", parameters.length));
        return new NormalInverseGamma(parameters[0], parameters[1], parameters[2], parameters[3]);
    }

    /**
     * Posterior update, Murphy (2007) equations (86) to (89), with every
     * observation weighted by {@code delta}.
     */
    static NormalInverseGamma update(NormalInverseGamma prior, int n, double sum, double sumOfSquares,
            double delta) {
        double mu = prior.getMu();
        double kappa = prior.getKappa();
        double mean = sum / n;
        double nDelta = n * delta;
        double scatter = Math.max(0, sumOfSquares - sum * mean);

        double kappaPost = kappa + nDelta;
        double muPost = (kappa * mu + nDelta * mean) / kappaPost;
        double alphaPost = prior.getAlpha() + 0.5 * nDelta;
        double betaPost = prior.getBeta() + 0.5 * delta * scatter
                + 0.5 * kappa * nDelta * (mean - mu) * (mean - mu) / (kappa + nDelta);
        return new NormalInverseGamma(muPost, kappaPost, alphaPost, betaPost);
    }

    /**
     * Log marginal likelihood, Murphy (2007) equation (95).
     */
    static double logMarginal(NormalInverseGamma prior, int n, double sum, double sumOfSquares) {
        NormalInverseGamma posterior = update(prior, n, sum, sumOfSquares, 1);
        return Gamma.logGamma(posterior.getAlpha()) - Gamma.logGamma(prior.getAlpha())
                + prior.getAlpha() * Math.log(prior.getBeta()) - posterior.getAlpha() * Math.log(posterior.getBeta())
                + 0.5 * Math.log(prior.getKappa() / posterior.getKappa()) - 0.5 * n * LOG_2_PI;
    }
}
