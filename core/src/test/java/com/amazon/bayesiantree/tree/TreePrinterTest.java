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

package com.amazon.bayesiantree.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.amazon.bayesiantree.input.FeatureMatrices;
import com.amazon.bayesiantree.model.DirichletMultinomialModel;
import com.amazon.bayesiantree.model.NormalInverseGamma;
import com.amazon.bayesiantree.model.NormalInverseGammaModel;

public class TreePrinterTest {

    @Test
    public void testRenderLeaf() {
        DirichletMultinomialModel model = new DirichletMultinomialModel(new double[] { 1.0, 1.0, 1.0 });
        LeafNode<double[]> leaf = new LeafNode<>(0, model.getPrior(), new double[] { 1.0, 2.0, 1.0 }, 1);
        assertEquals("y=1, n=1, p(y)=[0.25, 0.5, 0.25]", TreePrinter.render(leaf, model));
    }

    @Test
    public void testRenderNestedClassificationTree() {
        DirichletMultinomialModel model = new DirichletMultinomialModel(new double[] { 3.0, 1.0 });
        Node<double[]> root = new TreeInducer<>(model, false).induce(
                FeatureMatrices.of(new double[][] { { 1 }, { 2 }, { 3 }, { 4 }, { 5 }, { 6 }, { 7 }, { 8 } }),
                new double[] { 0, 0, 0, 0, 0, 0, 1, 0 }, 0, Collections.singletonList("age"));

        String expected = "age=6.5\n" //
                + " ├ <6.5: y=0, n=6, p(y)=[0.9, 0.1]\n" //
                + " └ ≥6.5: age=7.5\n" //
                + "    ├ <7.5: y=0, n=1, p(y)=[0.6, 0.4]\n" //
                + "    └ ≥7.5: y=0, n=1, p(y)=[0.8, 0.2]";
        assertEquals(expected, TreePrinter.render(root, model));
    }

    @Test
    public void testRenderRegressionTree() {
        NormalInverseGamma prior = new NormalInverseGamma(0, 1, 1, 1);
        NormalInverseGammaModel model = new NormalInverseGammaModel(prior);
        SplitNode<NormalInverseGamma> root = new SplitNode<>(0, prior, prior, 3, 0, 0.5, "x0", -5.0, -4.0,
                new LeafNode<>(1, prior, new NormalInverseGamma(-1.5, 2, 1.5, 1), 1),
                new LeafNode<>(1, prior, new NormalInverseGamma(2.0, 3, 2, 1), 2));

        String expected = "x0=0.5\n" //
                + " ├ <0.5: y=-1.5, n=1\n" //
                + " └ ≥0.5: y=2.0, n=2";
        assertEquals(expected, TreePrinter.render(root, model));
    }
}
