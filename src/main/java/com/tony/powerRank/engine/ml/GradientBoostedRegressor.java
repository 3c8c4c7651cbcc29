package com.tony.powerRank.engine.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Gradient boosting (perte quadratique) sur arbres de régression.
 * Déterministe à graine fixée : même entrée, mêmes prédictions.
 */
public class GradientBoostedRegressor implements ResidualModel {

    private final int trees;
    private final int maxDepth;
    private final double learningRate;
    private final double subsample;
    private final int minSamplesLeaf;
    private final long seed;

    private final List<RegressionTree> ensemble = new ArrayList<>();
    private double baseline;

    public GradientBoostedRegressor(int trees, int maxDepth, double learningRate,
                                    double subsample, int minSamplesLeaf, long seed) {
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.learningRate = learningRate;
        this.subsample = subsample;
        this.minSamplesLeaf = minSamplesLeaf;
        this.seed = seed;
    }

    @Override
    public void fit(double[][] x, double[] y) {
        ensemble.clear();
        int n = y.length;
        if (n == 0) {
            baseline = 0.0;
            return;
        }
        double sum = 0;
        for (double v : y) sum += v;
        baseline = sum / n;

        FeatureBins bins = FeatureBins.of(x);
        Random random = new Random(seed);
        double[] current = new double[n];
        Arrays.fill(current, baseline);
        double[] residual = new double[n];

        for (int t = 0; t < trees; t++) {
            for (int i = 0; i < n; i++) residual[i] = y[i] - current[i];

            RegressionTree tree = new RegressionTree(maxDepth, minSamplesLeaf);
            tree.fit(residual, sampleRows(n, random), bins);
            ensemble.add(tree);
            for (int i = 0; i < n; i++) {
                current[i] += learningRate * tree.predict(x[i]);
            }
        }
    }

    @Override
    public double predict(double[] x) {
        double out = baseline;
        for (RegressionTree tree : ensemble) {
            out += learningRate * tree.predict(x);
        }
        return out;
    }

    private int[] sampleRows(int n, Random random) {
        if (subsample >= 1.0) {
            int[] all = new int[n];
            for (int i = 0; i < n; i++) all[i] = i;
            return all;
        }
        int[] buffer = new int[n];
        int size = 0;
        for (int i = 0; i < n; i++) {
            if (random.nextDouble() < subsample) buffer[size++] = i;
        }
        if (size == 0) {
            buffer[size++] = random.nextInt(n);
        }
        return Arrays.copyOf(buffer, size);
    }
}
