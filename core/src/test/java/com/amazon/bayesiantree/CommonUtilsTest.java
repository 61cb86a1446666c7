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

import static com.amazon.bayesiantree.CommonUtils.argMax;
import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkFitted;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;
import static com.amazon.bayesiantree.CommonUtils.checkState;
import static com.amazon.bayesiantree.CommonUtils.gather;
import static com.amazon.bayesiantree.CommonUtils.hasDistinctValues;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.bayesiantree.exception.NotFittedException;
import com.amazon.bayesiantree.exception.ValidationException;

public class CommonUtilsTest {

    @Test
    public void testCheckArgument() {
        assertDoesNotThrow(() -> checkArgument(true, "unused"));
        ValidationException exception = assertThrows(ValidationException.class,
                () -> checkArgument(false, "bad argument"));
        assertEquals("bad argument", exception.getMessage());
        assertThrows(IllegalArgumentException.class, () -> checkArgument(false, () -> "lazy message"));
    }

    @Test
    public void testCheckState() {
        assertDoesNotThrow(() -> checkState(true, "unused"));
        assertThrows(IllegalStateException.class, () -> checkState(false, "bad state"));
    }

    @Test
    public void testCheckFitted() {
        assertDoesNotThrow(() -> checkFitted(true));
        NotFittedException exception = assertThrows(NotFittedException.class, () -> checkFitted(false));
        assertTrue(exception.getMessage().contains("call fit() first"));
    }

    @Test
    public void testCheckNotNull() {
        String value = "value";
        assertSame(value, checkNotNull(value, "unused"));
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "null value"));
    }

    @Test
    public void testGather() {
        double[] source = { 10.0, 11.0, 12.0, 13.0 };
        assertArrayEquals(new double[] { 13.0, 10.0, 10.0 }, gather(source, new int[] { 3, 0, 0 }));
        assertEquals(0, gather(source, new int[0]).length);
    }

    @Test
    public void testHasDistinctValues() {
        assertFalse(hasDistinctValues(new double[0]));
        assertFalse(hasDistinctValues(new double[] { 2.0 }));
        assertFalse(hasDistinctValues(new double[] { 2.0, 2.0, 2.0 }));
        assertTrue(hasDistinctValues(new double[] { 2.0, 2.0, 3.0 }));
    }

    @Test
    public void testArgMaxReturnsFirstMaximum() {
        assertEquals(1, argMax(new double[] { 1.0, 5.0, 5.0, 2.0 }));
        assertEquals(0, argMax(new double[] { 7.0, 7.0 }));
        assertThrows(ValidationException.class, () -> argMax(new double[0]));
    }
}
