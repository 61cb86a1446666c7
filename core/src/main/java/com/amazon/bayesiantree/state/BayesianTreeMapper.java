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

import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;

import java.util.ArrayList;

import com.amazon.bayesiantree.BayesianTree;
import com.amazon.bayesiantree.model.IModelFamily;
import com.amazon.bayesiantree.tree.LeafNode;
import com.amazon.bayesiantree.tree.Node;
import com.amazon.bayesiantree.tree.SplitNode;

/**
 * Maps a {@link BayesianTree} to a {@link BayesianTreeState} and back. The model
 * family is not part of the state; it is passed as context when rebuilding the
 * tree, and its parameter encoding is used for priors and posteriors.
 *
 * @param <P> the representation of prior and posterior distributions
 */
public class BayesianTreeMapper<P>
        implements IContextualStateMapper<BayesianTree<P>, BayesianTreeState, IModelFamily<P>> {

    @Override
    public BayesianTreeState toState(BayesianTree<P> model) {
        checkNotNull(model, "model must not be null");
        IModelFamily<P> family = model.getModelFamily();
        BayesianTreeState state = new BayesianTreeState();
        state.setVersion(Version.V1_0);
        state.setRegression(family.isRegression());
        state.setDelta(model.getDelta());
        state.setPruneEnabled(model.isPruneEnabled());
        state.setVerbose(model.isVerbose());
        if (model.isFitted()) {
            state.setNumberOfDimensions(model.getNDim());
            state.setFeatureNames(new ArrayList<>(model.getFeatureNames()));
            state.setRoot(toNodeState(model.getRoot(), family));
        }
        return state;
    }

    @Override
    public BayesianTree<P> toModel(BayesianTreeState state, IModelFamily<P> modelFamily) {
        checkNotNull(state, "state must not be null");
        checkNotNull(modelFamily, "modelFamily must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()),
                () -> "unsupported state version " + state.getVersion());
        checkArgument(state.isRegression() == modelFamily.isRegression(),
                "the model family does not match the kind of tree in the state");

        BayesianTree.Builder<P> builder = BayesianTree.<P>builder().modelFamily(modelFamily).delta(state.getDelta())
                .pruneEnabled(state.isPruneEnabled()).verbose(state.isVerbose());
        if (state.getRoot() != null) {
            checkArgument(state.getFeatureNames() != null
                    && state.getFeatureNames().size() == state.getNumberOfDimensions(),
                    "featureNames must have one entry per dimension");
            builder.featureNames(state.getFeatureNames()).root(toNode(state.getRoot(), modelFamily));
        }
        return builder.build();
    }

    NodeState toNodeState(Node<P> node, IModelFamily<P> family) {
        NodeState state = new NodeState();
        state.setLevel(node.getLevel());
        state.setPrior(family.toParameters(node.getPrior()));
        state.setPosterior(family.toParameters(node.getPosterior()));
        state.setNumberOfData(node.getNData());
        if (!node.isLeaf()) {
            SplitNode<P> split = (SplitNode<P>) node;
            state.setSplitDimension(split.getSplitDimension());
            state.setSplitValue(split.getSplitValue());
            state.setSplitFeatureName(split.getSplitFeatureName());
            state.setLogPDataNoSplit(split.getLogPDataNoSplit());
            state.setBestLogPDataSplit(split.getBestLogPDataSplit());
            state.setChild1(toNodeState(split.getChild1(), family));
            state.setChild2(toNodeState(split.getChild2(), family));
        }
        return state;
    }

    Node<P> toNode(NodeState state, IModelFamily<P> family) {
        P prior = family.fromParameters(state.getPrior());
        P posterior = family.fromParameters(state.getPosterior());
        if (state.getSplitDimension() < 0) {
            checkArgument(state.getChild1() == null && state.getChild2() == null, "a leaf must not have children");
            return new LeafNode<>(state.getLevel(), prior, posterior, state.getNumberOfData());
        }
        checkArgument(state.getChild1() != null && state.getChild2() != null, "a split must have two children");
        return new SplitNode<>(state.getLevel(), prior, posterior, state.getNumberOfData(),
                state.getSplitDimension(), state.getSplitValue(), state.getSplitFeatureName(),
                state.getLogPDataNoSplit(), state.getBestLogPDataSplit(), toNode(state.getChild1(), family),
                toNode(state.getChild2(), family));
    }
}
