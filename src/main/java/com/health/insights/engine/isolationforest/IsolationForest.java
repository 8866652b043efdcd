package com.health.insights.engine.isolationforest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of randomized isolation trees fitted on one metric's feature vectors.
 * Identical data, parameters and seed always produce identical scores.
 */
public class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data       rows of standardized feature vectors
     * @param numTrees   number of trees
     * @param sampleSize sub-sample drawn for each tree, capped at the row count
     * @param seed       random seed
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, long seed) {
        int effectiveSample = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(2, effectiveSample)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.grow(subsample(data, effectiveSample, random), maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), effectiveSample);
    }

    /** Mean depth at which the point is isolated across all trees. */
    public double meanPathLength(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return total / trees.size();
    }

    /**
     * s(x, n) = 2^(-E[h(x)] / c(n)). Close to 1 for points isolated early, around
     * 0.5 or below for ordinary points.
     */
    public double score(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (trees.isEmpty() || c <= 0) return 0.0;
        return Math.pow(2.0, -meanPathLength(point) / c);
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        // Partial Fisher-Yates
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
