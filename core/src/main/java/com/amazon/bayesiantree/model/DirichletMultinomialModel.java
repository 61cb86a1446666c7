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

import static com.amazon.bayesiantree.CommonUtils.argMax;
import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;

import java.util.Arrays;

import org.apache.commons.math3.special.Gamma;

/**
 * The Dirichlet-multinomial model used for classification. Class labels are the
 * integers 0, 1, ..., K-1 where K is the length of the Dirichlet concentration
 * vector that serves as prior and posterior.
 * <p>
 * The marginal likelihood of a set of labels with class counts k under a
 * Dirichlet prior a is B(a + k) / B(a), where B is the multivariate beta
 * function.
 */
public class DirichletMultinomialModel extends AbstractModelFamily<double[]> {

    private final double[] prior;

    public DirichletMultinomialModel(double[] prior) {
        this(DEFAULT_PARTITION_PRIOR, prior);
    }

    public DirichletMultinomialModel(double partitionPrior, double[] prior) {
        super(partitionPrior);
        checkNotNull(prior, "prior must not be null");
        checkArgument(prior.length > 0, "prior must contain at least one class");
        for (double alpha : prior) {
            checkArgument(alpha > 0 && Double.isFinite(alpha),
                    () -> "prior concentrations must be positive and finite: " + Arrays.toString(prior));
        }
        this.prior = Arrays.copyOf(prior, prior.length);
    }

    @Override
    public double[] getPrior() {
        return Arrays.copyOf(prior, prior.length);
    }

    public int getNumberOfClasses() {
        return prior.length;
    }

    @Override
    public void validateTargets(double[] targets) {
        for (double target : targets) {
            checkArgument(Double.isFinite(target) && target == Math.rint(target),
                    () -> String.format("y should contain integer class labels but contained %s", target));
            checkArgument(target >= 0 && target < prior.length, () -> String.format(
                    "y should contain class labels in [0, %d) but contained %d", prior.length, (long) target));
        }
    }

    @Override
    public double computeNoSplitLogLikelihood(double[] targets, double[] prior) {
        double[] counts = countClasses(targets, prior.length);
        double betaPrior = multivariateLogBeta(prior);
        return logPriorNoSplit() + logMarginal(prior, counts, betaPrior);
    }

    @Override
    public double[] computeSplitLogLikelihoods(double[] sortedTargets, int[] splitPositions, int nDim,
            double[] prior) {
        int numberOfClasses = prior.length;
        double[] total = countClasses(sortedTargets, numberOfClasses);
        double[] left = new double[numberOfClasses];
        double[] right = new double[numberOfClasses];
        double betaPrior = multivariateLogBeta(prior);
        double logPriorSplit = logPriorSplit(splitPositions.length, nDim);

        double[] result = new double[splitPositions.length];
        int position = 0;
        for (int i = 0; i < splitPositions.length; i++) {
            while (position < splitPositions[i]) {
                left[(int) sortedTargets[position++]] += 1;
            }
            for (int c = 0; c < numberOfClasses; c++) {
                right[c] = total[c] - left[c];
            }
            result[i] = logPriorSplit + logMarginal(prior, left, betaPrior) + logMarginal(prior, right, betaPrior);
        }
        return result;
    }

    @Override
    public double[] computePosterior(double[] targets, double[] prior, double delta) {
        if (delta == 0) {
            return prior;
        }
        double[] counts = countClasses(targets, prior.length);
        double[] posterior = new double[prior.length];
        for (int c = 0; c < prior.length; c++) {
            posterior[c] = prior[c] + delta * counts[c];
        }
        return posterior;
    }

    @Override
    public double[] computePosteriorMean(double[] posterior) {
        double sum = 0;
        for (double alpha : posterior) {
            sum += alpha;
        }
        double[] mean = new double[posterior.length];
        for (int c = 0; c < posterior.length; c++) {
            mean[c] = posterior[c] / sum;
        }
        return mean;
    }

    @Override
    public double predictLeafValue(double[] posterior) {
        return argMax(posterior);
    }

    @Override
    public boolean isRegression() {
        return false;
    }

    @Override
    public double[] toParameters(double[] distribution) {
        return Arrays.copyOf(distribution, distribution.length);
    }

    @Override
    public double[] fromParameters(double[] parameters) {
        checkArgument(parameters.length == prior.length,
                () -> String.format("expected %d concentrations but got %d", prior.length, parameters.length));
        return Arrays.copyOf(parameters, parameters.length);
    }

    static double[] countClasses(double[] targets, int numberOfClasses) {
        double[] counts = new double[numberOfClasses];
        for (double target : targets) {
            counts[(int) target] += 1;
        }
        return counts;
    }

    /**
     * log B(a) = sum_i logGamma(a_i) - logGamma(sum_i a_i)
     */
    static double multivariateLogBeta(double[] alpha) {
        double sumOfLogGamma = 0;
        double sum = 0;
        for (double a : alpha) {
            sumOfLogGamma += Gamma.logGamma(a);
            sum += a;
        }
        return sumOfLogGamma - Gamma.logGamma(sum);
    }

    private static double logMarginal(double[] prior, double[] counts, double betaPrior) {
        double[] updated = new double[prior.length];
        for (int c = 0; c < prior.length; c++) {
            updated[c] = prior[c] + counts[c];
        }
        return multivariateLogBeta(updated) - betaPrior;
    }
}
