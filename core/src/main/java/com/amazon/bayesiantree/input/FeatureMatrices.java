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

package com.amazon.bayesiantree.input;

import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.bayesiantree.exception.PrecisionLossException;

/**
 * Converts the supported input representations into an {@link IFeatureMatrix}
 * and resolves feature names. Conversions never change a value: integral inputs
 * that cannot be represented exactly as {@code double} are rejected with a
 * {@link PrecisionLossException}.
 */
public class FeatureMatrices {

    private FeatureMatrices() {
    }

    public static IFeatureMatrix of(double[][] data) {
        return new DenseFeatureMatrix(data);
    }

    /**
     * A single sample is treated as a matrix with one row.
     *
     * @param row the feature values of one sample
     * @return a matrix with one row
     */
    public static IFeatureMatrix ofRow(double[] row) {
        checkNotNull(row, "row must not be null");
        return new DenseFeatureMatrix(new double[][] { row });
    }

    public static IFeatureMatrix of(int[][] data) {
        checkNotNull(data, "data must not be null");
        double[][] converted = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            checkNotNull(data[i], "rows must not be null");
            converted[i] = new double[data[i].length];
            for (int j = 0; j < data[i].length; j++) {
                converted[i][j] = data[i][j];
            }
        }
        return new DenseFeatureMatrix(converted);
    }

    public static IFeatureMatrix of(long[][] data) {
        checkNotNull(data, "data must not be null");
        double[][] converted = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            checkNotNull(data[i], "rows must not be null");
            converted[i] = new double[data[i].length];
            for (int j = 0; j < data[i].length; j++) {
                converted[i][j] = toDouble(data[i][j]);
            }
        }
        return new DenseFeatureMatrix(converted);
    }

    public static IFeatureMatrix of(Number[][] data) {
        checkNotNull(data, "data must not be null");
        double[][] converted = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            checkNotNull(data[i], "rows must not be null");
            converted[i] = new double[data[i].length];
            for (int j = 0; j < data[i].length; j++) {
                converted[i][j] = toDouble(data[i][j]);
            }
        }
        return new DenseFeatureMatrix(converted);
    }

    /**
     * Converts a value to {@code double}, failing if the conversion is lossy.
     *
     * @param value a number
     * @return the same number as a double
     * @throws PrecisionLossException if the value cannot be represented exactly
     */
    public static double toDouble(Number value) {
        checkNotNull(value, "values must not be null");
        if (value instanceof Double || value instanceof Float || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return value.doubleValue();
        }
        if (value instanceof Long) {
            return toDouble(value.longValue());
        }
        if (value instanceof BigInteger) {
            double converted = value.doubleValue();
            if (!Double.isFinite(converted)
                    || new BigDecimal(converted).toBigIntegerExact().compareTo((BigInteger) value) != 0) {
                throw precisionLoss(value);
            }
            return converted;
        }
        if (value instanceof BigDecimal) {
            double converted = value.doubleValue();
            if (!Double.isFinite(converted) || new BigDecimal(converted).compareTo((BigDecimal) value) != 0) {
                throw precisionLoss(value);
            }
            return converted;
        }
        double converted = value.doubleValue();
        if (!Double.isNaN(converted) && new BigDecimal(value.toString()).compareTo(new BigDecimal(converted)) != 0) {
            throw precisionLoss(value);
        }
        return converted;
    }

    public static double toDouble(long value) {
        double converted = (double) value;
        if (converted >= 0x1p63 || (long) converted != value) {
            throw precisionLoss(value);
        }
        return converted;
    }

    /**
     * Returns the feature names to use for a matrix with the given number of
     * columns: the supplied names if present, otherwise {@code x0, x1, ...}.
     *
     * @param featureNames    optional feature names, may be null
     * @param numberOfColumns the number of features
     * @return an unmodifiable list of names
     */
    public static List<String> resolveFeatureNames(List<String> featureNames, int numberOfColumns) {
        if (featureNames == null) {
            return defaultFeatureNames(numberOfColumns);
        }
        checkArgument(featureNames.size() == numberOfColumns, () -> String.format(
                "featureNames must have %d entries but has %d", numberOfColumns, featureNames.size()));
        return Collections.unmodifiableList(new ArrayList<>(featureNames));
    }

    public static List<String> defaultFeatureNames(int numberOfColumns) {
        List<String> names = new ArrayList<>(numberOfColumns);
        for (int i = 0; i < numberOfColumns; i++) {
            names.add("x" + i);
        }
        return Collections.unmodifiableList(names);
    }

    private static PrecisionLossException precisionLoss(Object value) {
        return new PrecisionLossException(String.format(
                "Cannot convert %s to double without loss of precision. Please check your data.", value));
    }
}
