package com.auditsentinel.core.detection.model;

/**
 * Node of an {@link IsolationTree}: either a split on one feature or a leaf
 * holding the number of training points that reached it.
 *
 * @since 1.0.0
 */
final class IsolationNode {

    /** Euler-Mascheroni constant, used to approximate harmonic numbers. */
    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode split(int feature, double value, IsolationNode left, IsolationNode right) {
        return new IsolationNode(feature, value, left, right, 0);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    boolean isLeaf() {
        return left == null;
    }

    int getSplitFeature() {
        return splitFeature;
    }

    double getSplitValue() {
        return splitValue;
    }

    IsolationNode getLeft() {
        return left;
    }

    IsolationNode getRight() {
        return right;
    }

    int getSize() {
        return size;
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * of {@code n} points: {@code c(n) = 2H(n-1) - 2(n-1)/n}.
     *
     * @param n number of points
     * @return {@code c(n)}, 0 for {@code n <= 1}
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }
}
