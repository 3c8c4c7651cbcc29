package com.tony.powerRank.engine.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Forêt aléatoire (bagging) : chaque arbre apprend sur un échantillon bootstrap
 * des lignes, la prédiction est la moyenne des arbres.
 * Toutes les features sont candidates à chaque split.
 */
public class RandomForestRegressor implements ResidualModel {

    private final int trees;
    private final int maxDepth;
    private final int minSamplesLeaf;
    private final long seed;

    private final List<RegressionTree> forest = new ArrayList<>();
    private double fallback;

    public RandomForestRegressor(int trees, int maxDepth, int minSamplesLeaf, long seed) {
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = minSamplesLeaf;
        this.seed = seed;
    }

    @Override
    public void fit(double[][] x, double[] y) {
        forest.clear();
        int n = y.length;
        if (n == 0) {
            fallback = 0.0;
            return;
        }
        double sum = 0;
        for (double v : y) sum += v;
        fallback = sum / n;

        FeatureBins bins = FeatureBins.of(x);
        Random random = new Random(seed);
        for (int t = 0; t < trees; t++) {
            RegressionTree tree = new RegressionTree(maxDepth, minSamplesLeaf);
            tree.fit(y, bootstrap(n, random), bins);
            forest.add(tree);
        }
    }

    @Override
    public double predict(double[] x) {
        if (forest.isEmpty()) return fallback;
        double sum = 0;
        for (RegressionTree tree : forest) {
            sum += tree.predict(x);
        }
        return sum / forest.size();
    }

    // Tirage avec remise de n lignes
    private static int[] bootstrap(int n, Random random) {
        int[] rows = new int[n];
        for (int i = 0; i < n; i++) {
            rows[i] = random.nextInt(n);
        }
        return rows;
    }
}
