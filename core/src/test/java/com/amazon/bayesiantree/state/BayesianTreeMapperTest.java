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

package com.amazon.bayesiantree.state;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.amazon.bayesiantree.BayesianTree;
import com.amazon.bayesiantree.exception.ValidationException;
import com.amazon.bayesiantree.model.DirichletMultinomialModel;
import com.amazon.bayesiantree.model.NormalInverseGamma;
import com.amazon.bayesiantree.model.NormalInverseGammaModel;
import com.amazon.bayesiantree.testutils.ExampleDataSets;
import com.amazon.bayesiantree.testutils.LabeledData;
import com.amazon.bayesiantree.tree.SplitNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

public class BayesianTreeMapperTest {

    private static final double[] PRIOR = { 1.0, 1.0, 1.0 };

    @Test
    public void testRoundTripClassifier() {
        LabeledData data = ExampleDataSets.generateGaussianBlobs(30, 3, 2, 3.0, 3);
        BayesianTree<double[]> tree = BayesianTree.classifier(PRIOR).delta(0.25).verbose(true)
                .featureNames(Arrays.asList("a", "b")).build().fit(data.data, data.targets);
        BayesianTreeMapper<double[]> mapper = new BayesianTreeMapper<>();

        BayesianTreeState state = mapper.toState(tree);
        BayesianTree<double[]> restored = mapper.toModel(state, new DirichletMultinomialModel(PRIOR));

        assertEquals(Version.V1_0, state.getVersion());
        assertFalse(state.isRegression());
        assertEquals(0.25, restored.getDelta());
        assertTrue(restored.isVerbose());
        assertThat(restored.getFeatureNames(), contains("a", "b"));
        assertEquals(tree.getNumberOfLeaves(), restored.getNumberOfLeaves());
        assertEquals(tree.toString(), restored.toString());
        assertArrayEquals(tree.predict(data.data), restored.predict(data.data));
        assertArrayEquals(tree.featureImportance(), restored.featureImportance());
    }

    @Test
    public void testRoundTripUnfittedTree() {
        BayesianTreeMapper<double[]> mapper = new BayesianTreeMapper<>();
        BayesianTreeState state = mapper.toState(BayesianTree.classifier(PRIOR).pruneEnabled(true).build());

        assertThat(state.getRoot(), nullValue());
        BayesianTree<double[]> restored = mapper.toModel(state, new DirichletMultinomialModel(PRIOR));
        assertFalse(restored.isFitted());
        assertTrue(restored.isPruneEnabled());
    }

    @Test
    public void testJsonRoundTripRegressor() throws JsonProcessingException {
        LabeledData data = ExampleDataSets.generateStepFunction(100, 2, 0.3, -2.0, 2.0, 0.2, 8);
        NormalInverseGamma prior = new NormalInverseGamma(0, 1, 2, 1);
        BayesianTree<NormalInverseGamma> tree = BayesianTree.regressor(prior).build().fit(data.data,
                data.targets);
        BayesianTreeMapper<NormalInverseGamma> mapper = new BayesianTreeMapper<>();

        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(tree));
        BayesianTreeState state = jsonMapper.readValue(json, BayesianTreeState.class);
        BayesianTree<NormalInverseGamma> restored = mapper.toModel(state, new NormalInverseGammaModel(prior));

        assertTrue(state.isRegression());
        assertEquals(4, state.getRoot().getPrior().length);
        assertEquals(tree.toString(), restored.toString());
        assertArrayEquals(tree.predict(data.data), restored.predict(data.data));
    }

    @Test
    public void testStateFromJsonResource() throws JsonProcessingException {
        String json = getStateFromFile("/state/classifier_1_0.json");
        assertNotNull(json);
        ObjectMapper jsonMapper = new ObjectMapper();
        jsonMapper.configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, true);
        BayesianTreeState state = jsonMapper.readValue(json, BayesianTreeState.class);

        BayesianTree<double[]> tree = new BayesianTreeMapper<double[]>().toModel(state,
                new DirichletMultinomialModel(new double[] { 1.0, 1.0 }));

        assertEquals(2, tree.getNumberOfLeaves());
        assertEquals(2.5, ((SplitNode<double[]>) tree.getRoot()).getSplitValue());
        assertArrayEquals(new double[] { 0, 0, 1, 1 }, tree.predict(new double[][] { { 1 }, { 2 }, { 3 }, { 4 } }));
        assertArrayEquals(new double[] { 1.0 }, tree.featureImportance());
    }

    @Test
    public void testInvalidStates() {
        BayesianTreeMapper<double[]> mapper = new BayesianTreeMapper<>();
        DirichletMultinomialModel family = new DirichletMultinomialModel(PRIOR);
        BayesianTreeState state = mapper.toState(BayesianTree.classifier(PRIOR).build());

        state.setVersion("0.9");
        assertThrows(ValidationException.class, () -> mapper.toModel(state, family));

        state.setVersion(Version.V1_0);
        state.setRegression(true);
        assertThrows(ValidationException.class, () -> mapper.toModel(state, family));
        assertThrows(NullPointerException.class, () -> mapper.toModel(null, family));
    }

    @Test
    public void testInvalidNodeStates() {
        BayesianTreeMapper<double[]> mapper = new BayesianTreeMapper<>();
        DirichletMultinomialModel family = new DirichletMultinomialModel(PRIOR);

        NodeState leaf = new NodeState();
        leaf.setPrior(PRIOR);
        leaf.setPosterior(PRIOR);
        leaf.setChild1(new NodeState());
        assertThrows(ValidationException.class, () -> mapper.toNode(leaf, family));

        NodeState split = new NodeState();
        split.setPrior(PRIOR);
        split.setPosterior(PRIOR);
        split.setSplitDimension(0);
        assertThrows(ValidationException.class, () -> mapper.toNode(split, family));

        NodeState wrongParameters = new NodeState();
        wrongParameters.setPrior(new double[] { 1.0 });
        wrongParameters.setPosterior(PRIOR);
        assertThrows(ValidationException.class, () -> mapper.toNode(wrongParameters, family));
    }

    private String getStateFromFile(String resourceFile) {
        try (InputStream is = BayesianTreeMapperTest.class.getResourceAsStream(resourceFile);
                BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
