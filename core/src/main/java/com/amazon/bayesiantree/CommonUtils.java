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

package com.amazon.bayesiantree;

import java.util.Objects;
import java.util.function.Supplier;

import com.amazon.bayesiantree.exception.NotFittedException;
import com.amazon.bayesiantree.exception.ValidationException;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws a {@link ValidationException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code ValidationException} if {@code condition} is false.
     * @throws ValidationException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new ValidationException(message);
        }
    }

    /**
     * Throws a {@link ValidationException} with the supplied message if the
     * specified input is false. The message is only built when the check fails.
     *
     * @param condition       A condition to test.
     * @param messageSupplier A supplier of the error message.
     * @throws ValidationException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, Supplier<String> messageSupplier) {
        if (!condition) {
            throw new ValidationException(messageSupplier.get());
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NotFittedException} if the model has not been fitted yet.
     *
     * @param fitted true if a fitted tree is available
     * @throws NotFittedException if {@code fitted} is false.
     */
    public static void checkFitted(boolean fitted) {
        if (!fitted) {
            throw new NotFittedException("Cannot predict on an untrained model; call fit() first");
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Gathers the values of {@code source} at the given positions.
     *
     * @param source  the values
     * @param indices positions into {@code source}
     * @return an array with {@code source[indices[i]]} at position i
     */
    public static double[] gather(double[] source, int[] indices) {
        double[] result = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            result[i] = source[indices[i]];
        }
        return result;
    }

    /**
     * Returns true if the values contain at least two distinct entries.
     *
     * @param values an array of values
     * @return true if not all values are equal
     */
    public static boolean hasDistinctValues(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the position of the first maximum of a non-empty array.
     *
     * @param values an array of values
     * @return the smallest index holding the maximal value
     */
    public static int argMax(double[] values) {
        checkArgument(values.length > 0, "values must not be empty");
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
