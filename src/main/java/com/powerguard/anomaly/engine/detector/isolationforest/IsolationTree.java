package com.powerguard.anomaly.engine.detector.isolationforest;

import java.util.Random;

/**
 * One randomly grown isolation tree over a subsample of feature rows.
 *
 * Splits only choose among features that still vary inside the partition, so a partition of
 * identical rows becomes a leaf immediately instead of by chance.
 */
public final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] rows, int maxDepth, Random random) {
        return new IsolationTree(grow(rows, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || rows.length <= 1) {
            return new IsolationNode.Leaf(rows.length);
        }

        int columns = rows[0].length;
        double[] min = new double[columns];
        double[] max = new double[columns];
        for (int j = 0; j < columns; j++) {
            min[j] = Double.POSITIVE_INFINITY;
            max[j] = Double.NEGATIVE_INFINITY;
        }
        for (double[] row : rows) {
            for (int j = 0; j < columns; j++) {
                min[j] = Math.min(min[j], row[j]);
                max[j] = Math.max(max[j], row[j]);
            }
        }

        int[] varying = new int[columns];
        int varyingCount = 0;
        for (int j = 0; j < columns; j++) {
            if (max[j] > min[j]) varying[varyingCount++] = j;
        }
        if (varyingCount == 0) {
            return new IsolationNode.Leaf(rows.length);
        }

        int feature = varying[random.nextInt(varyingCount)];
        double threshold = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int belowCount = 0;
        for (double[] row : rows) {
            if (row[feature] < threshold) belowCount++;
        }
        double[][] below = new double[belowCount][];
        double[][] atOrAbove = new double[rows.length - belowCount][];
        int b = 0, a = 0;
        for (double[] row : rows) {
            if (row[feature] < threshold) {
                below[b++] = row;
            } else {
                atOrAbove[a++] = row;
            }
        }

        return new IsolationNode.Split(feature, threshold,
                grow(below, depth + 1, maxDepth, random),
                grow(atOrAbove, depth + 1, maxDepth, random));
    }

    /**
     * Edges from the root to the point's leaf, plus the expected remaining depth of that leaf.
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int depth = 0;
        while (node instanceof IsolationNode.Split) {
            IsolationNode.Split split = (IsolationNode.Split) node;
            node = point[split.feature()] < split.threshold() ? split.below() : split.atOrAbove();
            depth++;
        }
        return depth + IsolationNode.averagePathLength(((IsolationNode.Leaf) node).size());
    }

    IsolationNode getRoot() {
        return root;
    }
}
