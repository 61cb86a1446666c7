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

import lombok.Getter;

/**
 * A Normal-inverse-gamma distribution over the mean and variance of normally
 * distributed data, parameterized as in Murphy, "Conjugate Bayesian analysis of
 * the Gaussian distribution" (2007), section 6.
 */
@Getter
public class NormalInverseGamma {

    private final double mu;
    private final double kappa;
    private final double alpha;
    private final double beta;

    public NormalInverseGamma(double mu, double kappa, double alpha, double beta) {
        checkArgument(Double.isFinite(mu), "mu must be finite");
        checkArgument(kappa > 0, "kappa must be positive");
        checkArgument(alpha > 0, "alpha must be positive");
        checkArgument(beta > 0, "beta must be positive");
        this.mu = mu;
        this.kappa = kappa;
        this.alpha = alpha;
        this.beta = beta;
    }

    @Override
    public String toString() {
        return String.format("NormalInverseGamma(mu=%s, kappa=%s, alpha=%s, beta=%s)", mu, kappa, alpha, beta);
    }
}
