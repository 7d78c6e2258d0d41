package com.ventture.credit.engine.model;

import com.ventture.credit.engine.NormalizedVector;

import java.util.List;

/**
 * Random-forest style ensemble: the probability is the mean of the trees' leaf probabilities.
 * Exposes no additive structure, so it is explained by perturbation.
 */
public final class TreeEnsembleScoringModel implements ScoringModel {

    private final String version;
    private final int featureCount;
    private final List<DecisionTree> trees;
    private final List<String> featureNames;

    public TreeEnsembleScoringModel(String version, int featureCount, List<DecisionTree> trees, List<String> featureNames) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("tree ensemble needs at least one tree");
        }
        if (featureCount <= 0) {
            throw new IllegalArgumentException("featureCount must be positive");
        }
        for (DecisionTree t : trees) {
            if (t.maxFeatureIndex() >= featureCount) {
                throw new IllegalArgumentException("tree splits on feature " + t.maxFeatureIndex()
                        + " but model has " + featureCount + " features");
            }
        }
        if (featureNames != null && !featureNames.isEmpty() && featureNames.size() != featureCount) {
            throw new IllegalArgumentException("tree ensemble declares " + featureNames.size()
                    + " feature names for " + featureCount + " features");
        }
        this.version = version == null ? "unversioned" : version;
        this.featureCount = featureCount;
        this.trees = List.copyOf(trees);
        this.featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public int featureCount() {
        return featureCount;
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }

    public int treeCount() {
        return trees.size();
    }

    @Override
    public double score(NormalizedVector vector) {
        double sum = 0.0;
        for (DecisionTree t : trees) {
            sum += t.predict(vector);
        }
        return sum / trees.size();
    }
}
