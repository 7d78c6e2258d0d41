package com.ventture.credit.engine.model;

import com.ventture.credit.engine.NormalizedVector;

/**
 * Binary decision tree stored as flat node arrays. A node with {@code left == -1} is a leaf
 * holding the positive-class probability in {@code value}; otherwise samples with
 * {@code x[feature] <= threshold} go left.
 */
public final class DecisionTree {

    public static final int LEAF = -1;

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[] value;

    public DecisionTree(int[] feature, double[] threshold, int[] left, int[] right, double[] value) {
        int n = feature.length;
        if (n == 0 || threshold.length != n || left.length != n || right.length != n || value.length != n) {
            throw new IllegalArgumentException("tree node arrays must be non-empty and of equal length");
        }
        for (int i = 0; i < n; i++) {
            if (left[i] == LEAF) {
                if (!(value[i] >= 0.0 && value[i] <= 1.0)) {
                    throw new IllegalArgumentException("leaf " + i + " probability out of [0,1]: " + value[i]);
                }
                continue;
            }
            // children always come after their parent, so traversal terminates
            if (left[i] <= i || right[i] <= i || left[i] >= n || right[i] >= n) {
                throw new IllegalArgumentException("node " + i + " has invalid children " + left[i] + "/" + right[i]);
            }
            if (feature[i] < 0) {
                throw new IllegalArgumentException("node " + i + " splits on negative feature index");
            }
        }
        this.feature = feature.clone();
        this.threshold = threshold.clone();
        this.left = left.clone();
        this.right = right.clone();
        this.value = value.clone();
    }

    /** Highest feature index any split refers to, or -1 for a single-leaf tree. */
    public int maxFeatureIndex() {
        int max = -1;
        for (int i = 0; i < feature.length; i++) {
            if (left[i] != LEAF) max = Math.max(max, feature[i]);
        }
        return max;
    }

    public double predict(NormalizedVector x) {
        int node = 0;
        while (left[node] != LEAF) {
            node = x.get(feature[node]) <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }
}
