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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.bayesiantree.exception.PrecisionLossException;
import com.amazon.bayesiantree.exception.ValidationException;

public class TargetsTest {

    @Test
    public void testConversions() {
        double[] targets = { 0.5, 1.5 };
        assertArrayEquals(targets, Targets.of(targets));
        assertNotSame(targets, Targets.of(targets));
        assertArrayEquals(new double[] { 0, 2, 1 }, Targets.of(new int[] { 0, 2, 1 }));
        assertArrayEquals(new double[] { 3, 4 }, Targets.of(new long[] { 3L, 4L }));
        assertThrows(PrecisionLossException.class, () -> Targets.of(new long[] { Long.MAX_VALUE - 1 }));
    }

    @Test
    public void testSqueeze() {
        assertArrayEquals(new double[] { 1, 2, 3 }, Targets.squeeze(new double[][] { { 1 }, { 2 }, { 3 } }));
        assertArrayEquals(new double[] { 1, 2, 3 }, Targets.squeeze(new double[][] { { 1, 2, 3 } }));
        assertThrows(ValidationException.class, () -> Targets.squeeze(new double[][] { { 1, 2 }, { 3, 4 } }));
    }
}
