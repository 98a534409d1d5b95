package com.auditsentinel.core.detection.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Isolation forest trained on one batch.
 *
 * <p>
 * Scores follow the usual definition {@code s(x) = 2^(-E(h(x)) / c(n))}: close
 * to 1 for points isolated after few splits, around 0.5 or lower for points
 * inside the bulk of the data. Training is deterministic for a given seed.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = List.copyOf(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * Train a forest.
     *
     * @param data       training rows, all of equal length; must not be empty
     * @param numTrees   number of trees, at least 1
     * @param sampleSize sub-sample size per tree, capped at the number of rows
     * @param seed       random seed
     * @return the trained forest
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on an empty batch");
        }
        if (numTrees < 1 || sampleSize < 1) {
            throw new IllegalArgumentException(
                    "numTrees and sampleSize must be >= 1, got: " + numTrees + ", " + sampleSize);
        }

        int effectiveSample = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(effectiveSample, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.build(subsample(data, effectiveSample, random), maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSample);
    }

    /**
     * @param point feature row of the training dimensionality
     * @return anomaly score in (0, 1]; 0 when the forest was trained on one row
     */
    public double anomalyScore(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    /**
     * Score every row of {@code data}.
     */
    public double[] anomalyScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    /**
     * How much each feature pushes {@code point} toward being anomalous: the
     * drop in score when that feature alone is replaced by its mean, floored
     * at 0.
     *
     * @param point        the row to explain
     * @param featureMeans per-feature replacement values
     * @return one non-negative contribution per feature
     */
    public double[] featureContributions(double[] point, double[] featureMeans) {
        double baseScore = anomalyScore(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = featureMeans[i];
            contributions[i] = Math.max(0.0, baseScore - anomalyScore(modified));
        }
        return contributions;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    // Partial Fisher-Yates shuffle over row indices.
    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
