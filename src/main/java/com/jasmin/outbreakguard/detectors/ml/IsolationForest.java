package com.jasmin.outbreakguard.detectors.ml;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Isolation forest (Liu, Ting and Zhou, 2008). Anomalous points are isolated by
 * fewer random axis-parallel splits, so short average path lengths mean high scores.
 * Scores lie in (0, 1]; values near 1 are outliers, values well below 0.5 are normal.
 * <p>
 * Fitting is the only random step and is driven entirely by the given seed.
 */
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<Node> trees;
    private final double normalizer;

    private IsolationForest(List<Node> trees, int sampleSize) {
        this.trees = trees;
        this.normalizer = averagePathLength(sampleSize);
    }

    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("cannot fit on empty data");
        }
        RandomGenerator rng = new MersenneTwister(seed);
        int psi = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));

        List<Node> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            int[] sample = sampleWithoutReplacement(data.length, psi, rng);
            trees.add(build(data, sample, 0, heightLimit, rng));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), psi);
    }

    /** Anomaly score s(x) = 2^(-E[h(x)] / c(psi)). */
    public double score(double[] x) {
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(x, tree, 0);
        }
        double mean = total / trees.size();
        if (normalizer <= 0.0) {
            return 0.5;
        }
        return Math.pow(2.0, -mean / normalizer);
    }

    /** Expected path length of an unsuccessful BST search among n points. */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static double pathLength(double[] x, Node node, int depth) {
        if (node.leaf) {
            return depth + averagePathLength(node.size);
        }
        Node next = x[node.feature] < node.split ? node.left : node.right;
        return pathLength(x, next, depth + 1);
    }

    private static Node build(double[][] data, int[] idx, int depth, int heightLimit, RandomGenerator rng) {
        if (depth >= heightLimit || idx.length <= 1) {
            return Node.leaf(idx.length);
        }
        int dims = data[idx[0]].length;
        double[] min = new double[dims];
        double[] max = new double[dims];
        for (int d = 0; d < dims; d++) {
            min[d] = Double.POSITIVE_INFINITY;
            max[d] = Double.NEGATIVE_INFINITY;
        }
        for (int i : idx) {
            for (int d = 0; d < dims; d++) {
                min[d] = Math.min(min[d], data[i][d]);
                max[d] = Math.max(max[d], data[i][d]);
            }
        }
        List<Integer> splittable = new ArrayList<>();
        for (int d = 0; d < dims; d++) {
            if (max[d] > min[d]) splittable.add(d);
        }
        if (splittable.isEmpty()) {
            return Node.leaf(idx.length);
        }

        int feature = splittable.get(rng.nextInt(splittable.size()));
        double split = min[feature] + rng.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (int i : idx) {
            if (data[i][feature] < split) leftCount++;
        }
        int[] left = new int[leftCount];
        int[] right = new int[idx.length - leftCount];
        int l = 0;
        int r = 0;
        for (int i : idx) {
            if (data[i][feature] < split) left[l++] = i;
            else right[r++] = i;
        }
        return Node.split(feature, split,
                build(data, left, depth + 1, heightLimit, rng),
                build(data, right, depth + 1, heightLimit, rng));
    }

    /** Partial Fisher-Yates shuffle returning the first k of n indices. */
    private static int[] sampleWithoutReplacement(int n, int k, RandomGenerator rng) {
        int[] all = new int[n];
        for (int i = 0; i < n; i++) all[i] = i;
        for (int i = 0; i < k; i++) {
            int j = i + rng.nextInt(n - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] out = new int[k];
        System.arraycopy(all, 0, out, 0, k);
        return out;
    }

    private static final class Node {
        final boolean leaf;
        final int size;
        final int feature;
        final double split;
        final Node left;
        final Node right;

        private Node(boolean leaf, int size, int feature, double split, Node left, Node right) {
            this.leaf = leaf;
            this.size = size;
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
        }

        static Node leaf(int size) {
            return new Node(true, size, -1, 0.0, null, null);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(false, 0, feature, split, left, right);
        }
    }
}
