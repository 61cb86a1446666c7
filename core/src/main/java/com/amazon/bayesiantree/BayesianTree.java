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

import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkFitted;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Optional;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.bayesiantree.config.Config;
import com.amazon.bayesiantree.config.IDynamicConfig;
import com.amazon.bayesiantree.exception.ValidationException;
import com.amazon.bayesiantree.input.FeatureMatrices;
import com.amazon.bayesiantree.input.IFeatureMatrix;
import com.amazon.bayesiantree.input.Targets;
import com.amazon.bayesiantree.model.DirichletMultinomialModel;
import com.amazon.bayesiantree.model.IModelFamily;
import com.amazon.bayesiantree.model.NormalInverseGamma;
import com.amazon.bayesiantree.model.NormalInverseGammaModel;
import com.amazon.bayesiantree.returntypes.PredictionStep;
import com.amazon.bayesiantree.tree.Node;
import com.amazon.bayesiantree.tree.TreeInducer;
import com.amazon.bayesiantree.tree.TreePredictor;
import com.amazon.bayesiantree.tree.TreePrinter;
import com.amazon.bayesiantree.tree.TreePruner;

/**
 * The BayesianTree class is the interface to the algorithms in this package. A
 * Bayesian tree is a binary decision tree whose splits are chosen by comparing
 * exact marginal likelihoods: a node is split along the axis-aligned split with
 * the highest marginal likelihood if, and only if, that likelihood is higher
 * than the marginal likelihood of not splitting. The marginal likelihoods,
 * posteriors and predictions are supplied by an {@link IModelFamily}; use
 * {@link #classifier(double[])} or {@link #regressor(NormalInverseGamma)} for
 * the bundled families.
 * <p>
 * A fitted tree can be queried concurrently, but fitting, pruning and changing
 * the configuration must not run at the same time as any other call.
 *
 * @param <P> the representation of prior and posterior distributions of the
 *            model family
 */
public class BayesianTree<P> implements IDynamicConfig {

    private static final Logger LOG = LoggerFactory.getLogger(BayesianTree.class);

    /**
     * Default prior strengthening with depth: none.
     */
    public static final double DEFAULT_DELTA = 0.0;

    /**
     * By default splits with identical child predictions are kept.
     */
    public static final boolean DEFAULT_PRUNE_ENABLED = false;

    public static final boolean DEFAULT_VERBOSE = false;

    @Getter
    private final IModelFamily<P> modelFamily;

    @Getter
    private double delta;

    @Getter
    private boolean pruneEnabled;

    @Getter
    private boolean verbose;

    /**
     * Feature names supplied through the builder, used by fits that do not
     * name features themselves.
     */
    private final List<String> configuredFeatureNames;

    /**
     * The number of features of the data the tree was fitted to; 0 if unfitted.
     */
    @Getter
    private int nDim;

    /**
     * The resolved feature names of the last fit.
     */
    @Getter
    private List<String> featureNames;

    private Node<P> root;

    protected BayesianTree(Builder<P> builder) {
        checkNotNull(builder.modelFamily, "modelFamily must not be null");
        checkArgument(builder.delta >= 0.0 && builder.delta <= 1.0,
                () -> String.format("Delta must be between 0.0 and 1.0 but was %s.", builder.delta));
        modelFamily = builder.modelFamily;
        delta = builder.delta;
        pruneEnabled = builder.pruneEnabled;
        verbose = builder.verbose;
        configuredFeatureNames = builder.featureNames.orElse(null);
        if (builder.root != null) {
            checkArgument(configuredFeatureNames != null, "featureNames are required to restore a fitted tree");
            root = builder.root;
            featureNames = FeatureMatrices.resolveFeatureNames(configuredFeatureNames, configuredFeatureNames.size());
            nDim = featureNames.size();
        }
    }

    /**
     * Fits the tree with the configured delta, pruning and feature names.
     *
     * @param data    the training samples, one row each
     * @param targets the target of every row
     * @return this tree
     */
    public BayesianTree<P> fit(double[][] data, double[] targets) {
        return fit(FeatureMatrices.of(data), Targets.of(targets));
    }

    public BayesianTree<P> fit(double[][] data, int[] targets) {
        return fit(FeatureMatrices.of(data), Targets.of(targets));
    }

    public BayesianTree<P> fit(IFeatureMatrix data, double[] targets) {
        return fit(data, targets, delta, pruneEnabled, configuredFeatureNames);
    }

    public BayesianTree<P> fit(IFeatureMatrix data, int[] targets) {
        return fit(data, Targets.of(targets));
    }

    /**
     * Fits the tree to targets given as a single column or a single row.
     *
     * @param data    the training samples, one row each
     * @param targets an n x 1 or 1 x n matrix of targets
     * @return this tree
     */
    public BayesianTree<P> fit(IFeatureMatrix data, double[][] targets) {
        return fit(data, Targets.squeeze(targets));
    }

    /**
     * Trains this tree on the training set (data, targets), replacing any earlier
     * fit.
     *
     * @param data         the training samples, one row each
     * @param targets      the target of every row; class labels 0, 1, ..., K-1
     *                     for classification, finite values for regression
     * @param delta        the strengthening of the prior as the tree grows
     *                     deeper, in [0, 1]
     * @param prune        whether splits that do not change any prediction are
     *                     removed after fitting
     * @param featureNames optional feature names; {@code x0, x1, ...} if null
     * @return this tree
     * @throws ValidationException if the arguments are not valid
     */
    public BayesianTree<P> fit(IFeatureMatrix data, double[] targets, double delta, boolean prune,
            List<String> featureNames) {
        checkNotNull(data, "X must not be null");
        checkNotNull(targets, "y must not be null");
        modelFamily.validateTargets(targets);
        checkArgument(delta >= 0.0 && delta <= 1.0,
                () -> String.format("Delta must be between 0.0 and 1.0 but was %s.", delta));
        checkArgument(data.getNumberOfRows() == targets.length, () -> String.format(
                "Invalid shapes: X has %d rows, y has %d", data.getNumberOfRows(), targets.length));
        for (int dim = 0; dim < data.getNumberOfColumns(); dim++) {
            for (double value : data.getColumn(dim)) {
                checkArgument(!Double.isNaN(value), "X must not contain NaN");
            }
        }
        List<String> names = FeatureMatrices.resolveFeatureNames(featureNames, data.getNumberOfColumns());

        LOG.debug("Fitting {} tree to {} rows and {} features, delta={}",
                modelFamily.isRegression() ? "regression" : "classification", data.getNumberOfRows(),
                data.getNumberOfColumns(), delta);
        Node<P> fitted = new TreeInducer<>(modelFamily, verbose).induce(data, targets, delta, names);
        if (prune) {
            fitted = TreePruner.prune(fitted, modelFamily);
        }

        root = fitted;
        nDim = data.getNumberOfColumns();
        this.featureNames = names;
        LOG.debug("Fitted tree with depth {} and {} leaves", root.getDepth(), root.getNumberOfLeaves());
        return this;
    }

    /**
     * Removes all splits whose children are leaves with identical predictions,
     * repeatedly, until no such split remains.
     *
     * @return this tree
     */
    public BayesianTree<P> prune() {
        checkFitted(isFitted());
        root = TreePruner.prune(root, modelFamily);
        return this;
    }

    /**
     * Predicts the class (classification) or value (regression) of every row.
     *
     * @param data the samples to predict
     * @return one prediction per row
     */
    public double[] predict(double[][] data) {
        return predict(FeatureMatrices.of(data));
    }

    public double[] predict(IFeatureMatrix data) {
        checkQuery(data);
        return new TreePredictor<>(modelFamily).predict(root, data);
    }

    /**
     * Predicts the posterior mean of every row; class probabilities for
     * classification and a single value for regression.
     *
     * @param data the samples to predict
     * @return one posterior mean per row
     */
    public double[][] predictProbabilities(double[][] data) {
        return predictProbabilities(FeatureMatrices.of(data));
    }

    public double[][] predictProbabilities(IFeatureMatrix data) {
        checkQuery(data);
        return new TreePredictor<>(modelFamily).predictProbabilities(root, data);
    }

    /**
     * Returns for every row the splits evaluated from the root down to the leaf
     * that the row ends in.
     *
     * @param data the samples to explain
     * @return one path per row, in root to leaf order
     */
    public List<List<PredictionStep>> predictionPaths(double[][] data) {
        return predictionPaths(FeatureMatrices.of(data));
    }

    public List<List<PredictionStep>> predictionPaths(IFeatureMatrix data) {
        checkQuery(data);
        return new TreePredictor<>(modelFamily).predictionPaths(root, data);
    }

    /**
     * The feature importance of a feature is the sum of the increases in log
     * marginal likelihood over all splits of that feature, normalized so that all
     * importances sum to 1. A tree without splits has all importances equal to 0.
     *
     * @return one importance per feature
     */
    public double[] featureImportance() {
        checkFitted(isFitted());
        double[] importance = new double[nDim];
        root.addFeatureImportance(importance);
        double sum = 0;
        for (double value : importance) {
            sum += value;
        }
        if (sum > 0) {
            for (int i = 0; i < importance.length; i++) {
                importance[i] /= sum;
            }
        }
        return importance;
    }

    /**
     * @return the maximum level of all leaves; 0 for a tree that is a single leaf
     */
    public int getDepth() {
        checkFitted(isFitted());
        return root.getDepth();
    }

    public int getNumberOfLeaves() {
        checkFitted(isFitted());
        return root.getNumberOfLeaves();
    }

    public boolean isFitted() {
        return root != null;
    }

    /**
     * @return the root of the fitted tree
     */
    public Node<P> getRoot() {
        checkFitted(isFitted());
        return root;
    }

    @Override
    public <T> void setConfig(String name, T value, Class<T> clazz) {
        if (Config.DELTA.equals(name)) {
            checkArgument(Double.class.isAssignableFrom(clazz),
                    () -> String.format("Setting '%s' must be a double value", name));
            double newDelta = (Double) value;
            checkArgument(newDelta >= 0.0 && newDelta <= 1.0,
                    () -> String.format("Delta must be between 0.0 and 1.0 but was %s.", newDelta));
            delta = newDelta;
        } else if (Config.PRUNE.equals(name)) {
            checkArgument(Boolean.class.isAssignableFrom(clazz),
                    () -> String.format("Setting '%s' must be a boolean value", name));
            pruneEnabled = (Boolean) value;
        } else if (Config.VERBOSE.equals(name)) {
            checkArgument(Boolean.class.isAssignableFrom(clazz),
                    () -> String.format("Setting '%s' must be a boolean value", name));
            verbose = (Boolean) value;
        } else {
            throw new ValidationException("Unsupported configuration setting: " + name);
        }
    }

    @Override
    public <T> T getConfig(String name, Class<T> clazz) {
        checkNotNull(clazz, "clazz must not be null");
        if (Config.DELTA.equals(name)) {
            checkArgument(clazz.isAssignableFrom(Double.class),
                    () -> String.format("Setting '%s' must be a double value", name));
            return clazz.cast(delta);
        } else if (Config.PRUNE.equals(name)) {
            checkArgument(clazz.isAssignableFrom(Boolean.class),
                    () -> String.format("Setting '%s' must be a boolean value", name));
            return clazz.cast(pruneEnabled);
        } else if (Config.VERBOSE.equals(name)) {
            checkArgument(clazz.isAssignableFrom(Boolean.class),
                    () -> String.format("Setting '%s' must be a boolean value", name));
            return clazz.cast(verbose);
        } else {
            throw new ValidationException("Unsupported configuration setting: " + name);
        }
    }

    @Override
    public String toString() {
        if (!isFitted()) {
            return "Unfitted model";
        }
        return TreePrinter.render(root, modelFamily);
    }

    private void checkQuery(IFeatureMatrix data) {
        checkNotNull(data, "X must not be null");
        checkFitted(isFitted());
        checkArgument(data.getNumberOfColumns() == nDim || data.getNumberOfRows() == 0, () -> String
                .format("Bad input dimensions: Expected %d, got %d", nDim, data.getNumberOfColumns()));
    }

    /**
     * @param prior the Dirichlet concentration of each class
     * @return a builder for a classification tree
     */
    public static Builder<double[]> classifier(double[] prior) {
        return new Builder<double[]>().modelFamily(new DirichletMultinomialModel(prior));
    }

    /**
     * @param prior the Normal-inverse-gamma prior over mean and variance
     * @return a builder for a regression tree
     */
    public static Builder<NormalInverseGamma> regressor(NormalInverseGamma prior) {
        return new Builder<NormalInverseGamma>().modelFamily(new NormalInverseGammaModel(prior));
    }

    public static <P> Builder<P> builder() {
        return new Builder<>();
    }

    public static class Builder<P> {

        private IModelFamily<P> modelFamily;
        private double delta = DEFAULT_DELTA;
        private boolean pruneEnabled = DEFAULT_PRUNE_ENABLED;
        private boolean verbose = DEFAULT_VERBOSE;
        private Optional<List<String>> featureNames = Optional.empty();
        private Node<P> root;

        public Builder<P> modelFamily(IModelFamily<P> modelFamily) {
            this.modelFamily = modelFamily;
            return this;
        }

        public Builder<P> delta(double delta) {
            this.delta = delta;
            return this;
        }

        public Builder<P> pruneEnabled(boolean pruneEnabled) {
            this.pruneEnabled = pruneEnabled;
            return this;
        }

        public Builder<P> verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder<P> featureNames(List<String> featureNames) {
            this.featureNames = Optional.ofNullable(featureNames);
            return this;
        }

        /**
         * Restores a fitted tree, for example from a state object. Requires
         * {@link #featureNames(List)}.
         *
         * @param root the root of a fitted tree
         * @return this builder
         */
        public Builder<P> root(Node<P> root) {
            this.root = root;
            return this;
        }

        public BayesianTree<P> build() {
            return new BayesianTree<>(this);
        }
    }
}
