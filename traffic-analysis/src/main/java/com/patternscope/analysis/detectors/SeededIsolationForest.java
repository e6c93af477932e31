package com.patternscope.analysis.detectors;

import smile.math.MathEx;

import java.util.Random;

/**
 * Isolation forest whose every random draw comes from one {@link Random} seeded by the caller,
 * so a seed reproduces the trees exactly. Scores follow Liu et al.: {@code 2^(-E[h(x)] / c(psi))},
 * higher meaning more anomalous, about 0.5 for unremarkable rows.
 */
final class SeededIsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node[] trees;
    private final double normalizer;

    private SeededIsolationForest(Node[] trees, int subsampleSize) {
        this.trees = trees;
        this.normalizer = averagePathLength(subsampleSize);
    }

    /**
     * @param subsampleSize rows drawn without replacement per tree, capped at the row count
     */
    static SeededIsolationForest fit(double[][] data, int treeCount, int subsampleSize, long seed) {
        if (data.length == 0 || treeCount < 1 || subsampleSize < 1) {
            throw new IllegalArgumentException("Isolation forest needs rows, trees and a positive subsample size");
        }
        int psi = Math.min(subsampleSize, data.length);
        int heightLimit = (int) Math.ceil(MathEx.log2(psi));
        Random random = new Random(seed);
        int[] order = new int[data.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }

        Node[] trees = new Node[treeCount];
        for (int t = 0; t < treeCount; t++) {
            // partial Fisher-Yates: the first psi slots become the sample
            for (int i = 0; i < psi; i++) {
                int j = i + random.nextInt(order.length - i);
                int swap = order[i];
                order[i] = order[j];
                order[j] = swap;
            }
            double[][] sample = new double[psi][];
            for (int i = 0; i < psi; i++) {
                sample[i] = data[order[i]];
            }
            trees[t] = grow(sample, 0, heightLimit, random);
        }
        return new SeededIsolationForest(trees, psi);
    }

    double score(double[] x) {
        if (normalizer == 0) {
            return 0.5;
        }
        double total = 0;
        for (Node tree : trees) {
            total += pathLength(tree, x);
        }
        return Math.pow(2, -(total / trees.length) / normalizer);
    }

    private static Node grow(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int features = rows[0].length;
        double[] min = new double[features];
        double[] max = new double[features];
        int splittable = 0;
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min[f] = Math.min(min[f], row[f]);
                max[f] = Math.max(max[f], row[f]);
            }
            if (max[f] > min[f]) {
                splittable++;
            }
        }
        if (splittable == 0) {
            return Node.leaf(rows.length);
        }

        int pick = random.nextInt(splittable);
        int feature = -1;
        for (int f = 0; f < features; f++) {
            if (max[f] > min[f] && pick-- == 0) {
                feature = f;
                break;
            }
        }
        double split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                leftCount++;
            }
        }
        double[][] left = new double[leftCount][];
        double[][] right = new double[rows.length - leftCount][];
        int l = 0;
        int r = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }
        return Node.split(feature, split,
                grow(left, depth + 1, heightLimit, random),
                grow(right, depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double[] x) {
        int depth = 0;
        while (node.left != null) {
            node = x[node.feature] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /** Average path length of an unsuccessful BST search over {@code n} keys. */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2 * (Math.log(n - 1) + EULER_GAMMA) - 2.0 * (n - 1) / n;
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0, null, null, size);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, 0);
        }
    }
}
