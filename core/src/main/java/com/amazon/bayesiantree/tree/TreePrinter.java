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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.bayesiantree.model.IModelFamily;

/**
 * Renders a tree as text, one node per line. An internal node is shown as
 * {@code name=threshold}; its children follow, indented with branch drawing
 * characters and prefixed with the side of the split they cover. A leaf shows
 * its prediction and the number of training rows, and for classification the
 * posterior class probabilities.
 *
 * <pre>
 * x0=2.5
 *  ├ &lt;2.5: y=0, n=2, p(y)=[0.75, 0.25]
 *  └ ≥2.5: y=1, n=2, p(y)=[0.25, 0.75]
 * </pre>
 */
public class TreePrinter {

    static final String VERTICAL_RIGHT = "├";
    static final String DOWN_RIGHT = "└";
    static final String BAR = "│";
    static final String GREATER_OR_EQUAL = "≥";

    private TreePrinter() {
    }

    public static <P> String render(Node<P> root, IModelFamily<P> modelFamily) {
        StringBuilder builder = new StringBuilder();
        render(root, modelFamily, new ArrayList<>(), Double.NaN, null, builder);
        return builder.toString();
    }

    private static <P> void render(Node<P> node, IModelFamily<P> modelFamily, List<String> anchor,
            double parentSplitValue, Boolean isLeftChild, StringBuilder builder) {
        if (isLeftChild != null) {
            for (String a : anchor) {
                builder.append(' ').append(a);
            }
            builder.append(' ').append(isLeftChild ? "<" : GREATER_OR_EQUAL).append(parentSplitValue).append(": ");
        }

        if (node.isLeaf()) {
            double prediction = modelFamily.predictLeafValue(node.getPosterior());
            builder.append("y=");
            if (modelFamily.isRegression()) {
                builder.append(prediction);
            } else {
                builder.append((long) prediction);
            }
            builder.append(", n=").append(node.getNData());
            if (!modelFamily.isRegression()) {
                builder.append(", p(y)=")
                        .append(Arrays.toString(modelFamily.computePosteriorMean(node.getPosterior())));
            }
            return;
        }

        SplitNode<P> split = (SplitNode<P>) node;
        builder.append(split.getSplitFeatureName()).append('=').append(split.getSplitValue());

        builder.append('\n');
        render(split.getChild1(), modelFamily, childAnchor(anchor, isLeftChild, VERTICAL_RIGHT),
                split.getSplitValue(), true, builder);

        builder.append('\n');
        render(split.getChild2(), modelFamily, childAnchor(anchor, isLeftChild, DOWN_RIGHT), split.getSplitValue(),
                false, builder);
    }

    private static List<String> childAnchor(List<String> anchor, Boolean isLeftChild, String branch) {
        List<String> result = new ArrayList<>();
        if (!anchor.isEmpty()) {
            result.addAll(anchor.subList(0, anchor.size() - 1));
            result.add(Boolean.TRUE.equals(isLeftChild) ? BAR : "  ");
        }
        result.add(branch);
        return result;
    }
}
