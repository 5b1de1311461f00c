package com.powerguard.anomaly.engine.detector.isolationforest;

/**
 * Node of an isolation tree. Trees live for a single detection run and are never persisted,
 * so nodes are immutable values.
 */
public interface IsolationNode {

    /**
     * Rows with {@code row[feature] < threshold} go to {@code below}, the rest to {@code atOrAbove}.
     */
    record Split(int feature, double threshold, IsolationNode below, IsolationNode atOrAbove)
            implements IsolationNode {}

    /**
     * Terminal node holding the number of training rows that reached it.
     */
    record Leaf(int size) implements IsolationNode {}

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }
}
