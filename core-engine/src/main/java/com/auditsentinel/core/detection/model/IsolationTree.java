package com.auditsentinel.core.detection.model;

import java.util.Random;

/**
 * One randomly split isolation tree.
 *
 * @since 1.0.0
 */
final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * Grow a tree on {@code sample} until every leaf is a single point, all
     * points in a leaf are identical, or {@code maxDepth} is reached.
     */
    static IsolationTree build(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int maxDepth, Random random) {
        if (rows.length <= 1 || depth >= maxDepth) {
            return IsolationNode.leaf(rows.length);
        }

        int dimensions = rows[0].length;
        int[] candidates = new int[dimensions];
        double[] mins = new double[dimensions];
        double[] maxs = new double[dimensions];
        int splittable = 0;
        for (int f = 0; f < dimensions; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min = Math.min(min, row[f]);
                max = Math.max(max, row[f]);
            }
            if (max > min) {
                candidates[splittable] = f;
                mins[splittable] = min;
                maxs[splittable] = max;
                splittable++;
            }
        }
        if (splittable == 0) {
            return IsolationNode.leaf(rows.length);
        }

        int pick = random.nextInt(splittable);
        int feature = candidates[pick];
        double value = mins[pick] + random.nextDouble() * (maxs[pick] - mins[pick]);

        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < value) {
                leftCount++;
            }
        }
        double[][] left = new double[leftCount][];
        double[][] right = new double[rows.length - leftCount][];
        int l = 0;
        int r = 0;
        for (double[] row : rows) {
            if (row[feature] < value) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }

        return IsolationNode.split(feature, value,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    /**
     * Depth at which {@code point} lands, adjusted by {@code c(size)} for
     * leaves that were not fully isolated.
     */
    double pathLength(double[] point) {
        IsolationNode node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.getSplitFeature()] < node.getSplitValue() ? node.getLeft() : node.getRight();
            depth++;
        }
        return depth + IsolationNode.averagePathLength(node.getSize());
    }
}
