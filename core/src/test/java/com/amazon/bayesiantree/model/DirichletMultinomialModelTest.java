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

import static com.amazon.bayesiantree.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.bayesiantree.exception.ValidationException;

public class DirichletMultinomialModelTest {

    private DirichletMultinomialModel model;

    @BeforeEach
    public void setUp() {
        model = new DirichletMultinomialModel(new double[] { 1.0, 1.0 });
    }

    @Test
    public void testNewModelWithInvalidArgs() {
        assertThrows(NullPointerException.class, () -> new DirichletMultinomialModel(null));
        assertThrows(ValidationException.class, () -> new DirichletMultinomialModel(new double[0]));
        assertThrows(ValidationException.class, () -> new DirichletMultinomialModel(new double[] { 1.0, 0.0 }));
        assertThrows(ValidationException.class,
                () -> new DirichletMultinomialModel(new double[] { 1.0, Double.POSITIVE_INFINITY }));
        assertThrows(ValidationException.class, () -> new DirichletMultinomialModel(0.0, new double[] { 1.0 }));
        assertThrows(ValidationException.class, () -> new DirichletMultinomialModel(1.0, new double[] { 1.0 }));
    }

    @Test
    public void testDefaults() {
        assertEquals(AbstractModelFamily.DEFAULT_PARTITION_PRIOR, model.getPartitionPrior());
        assertEquals(2, model.getNumberOfClasses());
        assertFalse(model.isRegression());
    }

    @Test
    public void testGetPriorReturnsCopy() {
        double[] prior = model.getPrior();
        prior[0] = 100.0;
        assertArrayEquals(new double[] { 1.0, 1.0 }, model.getPrior());
    }

    @Test
    public void testValidateTargets() {
        assertDoesNotThrow(() -> model.validateTargets(new double[] { 0, 1, 1, 0 }));
        assertDoesNotThrow(() -> model.validateTargets(new double[0]));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.5, 2, -1, Double.NaN, Double.POSITIVE_INFINITY })
    public void testInvalidTargets(double target) {
        assertThrows(ValidationException.class, () -> model.validateTargets(new double[] { 0, target }));
    }

    @Test
    public void testNoSplitLogLikelihood() {
        // log(1 - 0.9) + log B(3, 3) - log B(1, 1) = log(0.1 / 30)
        double expected = -Math.log(300);
        assertEquals(expected, model.computeNoSplitLogLikelihood(new double[] { 0, 1, 0, 1 }, model.getPrior()),
                EPSILON);
    }

    @Test
    public void testSplitLogLikelihoods() {
        double[] sortedTargets = { 0, 0, 1, 1 };
        int[] positions = { 1, 2, 3 };

        double[] result = model.computeSplitLogLikelihoods(sortedTargets, positions, 1, model.getPrior());

        assertEquals(3, result.length);
        // log(0.9 / 3) + log B(2, 1) + log B(2, 3)
        assertEquals(Math.log(0.3 / 24), result[0], EPSILON);
        // log(0.9 / 3) + 2 log B(3, 1)
        assertEquals(-Math.log(30), result[1], EPSILON);
        assertEquals(result[0], result[2], EPSILON);

        double[] twoDimensions = model.computeSplitLogLikelihoods(sortedTargets, positions, 2, model.getPrior());
        for (int i = 0; i < result.length; i++) {
            assertEquals(result[i] - Math.log(2), twoDimensions[i], EPSILON);
        }
    }

    @Test
    public void testSplitLogLikelihoodsWithPartitionPrior() {
        DirichletMultinomialModel strict = new DirichletMultinomialModel(0.5, new double[] { 1.0, 1.0 });
        double[] result = strict.computeSplitLogLikelihoods(new double[] { 0, 0, 1, 1 }, new int[] { 2 }, 1,
                strict.getPrior());
        assertEquals(Math.log(0.5) - 2 * Math.log(3), result[0], EPSILON);
        assertEquals(Math.log(0.5) - Math.log(30),
                strict.computeNoSplitLogLikelihood(new double[] { 0, 0, 1, 1 }, strict.getPrior()), EPSILON);
    }

    @Test
    public void testComputePosterior() {
        double[] prior = model.getPrior();
        double[] targets = { 0, 0, 1 };

        assertThat(model.computePosterior(targets, prior, 0), is(sameInstance(prior)));
        assertArrayEquals(new double[] { 3.0, 2.0 }, model.computePosterior(targets, prior, 1), EPSILON);
        assertArrayEquals(new double[] { 2.0, 1.5 }, model.computePosterior(targets, prior, 0.5), EPSILON);
        assertThat(model.computePosterior(targets, prior, 1), is(not(sameInstance(prior))));
    }

    @Test
    public void testPosteriorMeanAndPrediction() {
        assertArrayEquals(new double[] { 0.75, 0.25 }, model.computePosteriorMean(new double[] { 3.0, 1.0 }),
                EPSILON);
        assertEquals(1.0, model.predictLeafValue(new double[] { 1.0, 3.0 }));
        // ties go to the lowest class
        assertEquals(0.0, model.predictLeafValue(new double[] { 7.0, 7.0 }));
    }

    @Test
    public void testParameters() {
        double[] parameters = model.toParameters(new double[] { 4.0, 2.0 });
        assertArrayEquals(new double[] { 4.0, 2.0 }, model.fromParameters(parameters));
        assertThrows(ValidationException.class, () -> model.fromParameters(new double[] { 1.0, 2.0, 3.0 }));
    }

    @Test
    public void testMultivariateLogBeta() {
        assertEquals(0.0, DirichletMultinomialModel.multivariateLogBeta(new double[] { 1.0, 1.0 }), EPSILON);
        assertEquals(-Math.log(12), DirichletMultinomialModel.multivariateLogBeta(new double[] { 2.0, 3.0 }),
                EPSILON);
        assertArrayEquals(new double[] { 1.0, 0.0, 2.0 },
                DirichletMultinomialModel.countClasses(new double[] { 2, 0, 2 }, 3));
    }
}
