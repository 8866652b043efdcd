package com.health.insights.engine.isolationforest;

import java.util.Random;

final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int maxDepth, Random random) {
        int n = rows.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int feature = random.nextInt(rows[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        // Constant along the chosen feature: nothing left to isolate here
        if (min >= max) {
            return IsolationNode.leaf(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < splitValue) leftCount++;
        }
        double[][] left = new double[leftCount][];
        double[][] right = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : rows) {
            if (row[feature] < splitValue) {
                left[li++] = row;
            } else {
                right[ri++] = row;
            }
        }

        return IsolationNode.split(feature, splitValue,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
