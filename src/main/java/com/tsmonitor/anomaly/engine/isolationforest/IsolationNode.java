package com.tsmonitor.anomaly.engine.isolationforest;

/**
 * Node of an isolation tree: either an internal split on one feature or a leaf that
 * remembers how many training points reached it.
 */
public final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;
    private final boolean external;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right,
                          int size, boolean external) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
        this.external = external;
    }

    static IsolationNode internalNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0, false);
    }

    static IsolationNode externalNode(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size, true);
    }

    double pathLength(double[] point, int currentDepth) {
        IsolationNode node = this;
        int depth = currentDepth;
        while (!node.external) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        // Unresolved points in a leaf are credited the expected depth of a BST of that size
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n with H(i) ~ ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }
}
