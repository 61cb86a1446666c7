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

package com.amazon.bayesiantree.testutils;

import java.util.Random;

/**
 * Synthetic data sets with a known structure. Every generator is deterministic
 * for a given seed.
 */
public class ExampleDataSets {

    private ExampleDataSets() {
    }

    /**
     * Uniform features in [0, 1); the class is 1 if the informative feature is at
     * least the threshold, else 0. All other features are noise.
     *
     * @param numberOfRows         number of samples
     * @param numberOfColumns      number of features
     * @param informativeDimension the feature that determines the class
     * @param threshold            the class boundary
     * @param seed                 random seed
     * @return the samples and their classes
     */
    public static LabeledData generateThresholdClasses(int numberOfRows, int numberOfColumns,
            int informativeDimension, double threshold, long seed) {
        Random rng = new Random(seed);
        double[][] data = new double[numberOfRows][numberOfColumns];
        double[] targets = new double[numberOfRows];
        for (int i = 0; i < numberOfRows; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                data[i][j] = rng.nextDouble();
            }
            targets[i] = (data[i][informativeDimension] >= threshold) ? 1 : 0;
        }
        return new LabeledData(data, targets);
    }

    /**
     * Gaussian blobs, one per class, centered at {@code separation * c} in every
     * dimension for class c.
     *
     * @param numberPerClass  samples per class
     * @param numberOfClasses number of classes
     * @param numberOfColumns number of features
     * @param separation      distance between adjacent class centers
     * @param seed            random seed
     * @return the samples and their classes, class by class
     */
    public static LabeledData generateGaussianBlobs(int numberPerClass, int numberOfClasses, int numberOfColumns,
            double separation, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        int numberOfRows = numberPerClass * numberOfClasses;
        double[][] data = new double[numberOfRows][numberOfColumns];
        double[] targets = new double[numberOfRows];
        for (int c = 0; c < numberOfClasses; c++) {
            for (int k = 0; k < numberPerClass; k++) {
                int i = c * numberPerClass + k;
                for (int j = 0; j < numberOfColumns; j++) {
                    data[i][j] = dist.nextDouble(separation * c, 1.0);
                }
                targets[i] = c;
            }
        }
        return new LabeledData(data, targets);
    }

    /**
     * A piecewise constant function of the first feature plus Gaussian noise: the
     * target is {@code low} below the step and {@code high} at or above it.
     *
     * @param numberOfRows    number of samples
     * @param numberOfColumns number of features
     * @param step            location of the step in the first feature
     * @param low             value left of the step
     * @param high            value right of the step
     * @param noise           standard deviation of the noise
     * @param seed            random seed
     * @return the samples and their targets
     */
    public static LabeledData generateStepFunction(int numberOfRows, int numberOfColumns, double step, double low,
            double high, double noise, long seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(new Random(seed + 1));
        double[][] data = new double[numberOfRows][numberOfColumns];
        double[] targets = new double[numberOfRows];
        for (int i = 0; i < numberOfRows; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                data[i][j] = rng.nextDouble();
            }
            targets[i] = dist.nextDouble((data[i][0] < step) ? low : high, noise);
        }
        return new LabeledData(data, targets);
    }
}
