package com.powerguard.anomaly.engine.detector.isolationforest;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

public class IsolationForest {

    private List<IsolationTree> trees = List.of();
    private int sampleSize;

    /**
     * Train the forest on the given data.
     *
     * Every tree draws from its own generator, seeded up front from the master seed, so trees can be
     * built in parallel and the forest is identical for identical input and seed.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256)
     * @param seed       random seed for reproducibility
     */
    public void train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on zero samples");
        }
        this.sampleSize = Math.min(sampleSize, data.length);
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2)));

        Random master = new Random(seed);
        long[] treeSeeds = new long[numTrees];
        for (int i = 0; i < numTrees; i++) {
            treeSeeds[i] = master.nextLong();
        }

        this.trees = IntStream.range(0, numTrees)
                .parallel()
                .mapToObj(i -> {
                    Random random = new Random(treeSeeds[i]);
                    double[][] sample = subsample(data, this.sampleSize, random);
                    return IsolationTree.build(sample, maxDepth, random);
                })
                .toList();
    }

    /**
     * Anomaly score of a single point: s(x, n) = 2^(-E(h(x)) / c(n)).
     *
     * @return score in (0, 1]; higher = easier to isolate = more anomalous
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
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
