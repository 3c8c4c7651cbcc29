package com.tony.powerRank.engine.ml;

import java.util.Arrays;

/**
 * Discrétisation des features en seuils candidats (au plus MAX_BINS par feature).
 * Calculée une fois par apprentissage, partagée par tous les arbres.
 */
final class FeatureBins {

    static final int MAX_BINS = 32;

    // cuts[f] : seuils triés ; x <= cuts[f][k] part à gauche
    final double[][] cuts;
    // bin[i][f] : indice du premier seuil >= x[i][f]
    final int[][] bin;

    private FeatureBins(double[][] cuts, int[][] bin) {
        this.cuts = cuts;
        this.bin = bin;
    }

    static FeatureBins of(double[][] x) {
        int n = x.length;
        int features = n == 0 ? 0 : x[0].length;
        double[][] cuts = new double[features][];
        for (int f = 0; f < features; f++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) column[i] = x[i][f];
            cuts[f] = cutPoints(column);
        }
        int[][] bin = new int[n][features];
        for (int i = 0; i < n; i++) {
            for (int f = 0; f < features; f++) {
                int pos = Arrays.binarySearch(cuts[f], x[i][f]);
                bin[i][f] = pos >= 0 ? pos : Math.min(-pos - 1, cuts[f].length - 1);
            }
        }
        return new FeatureBins(cuts, bin);
    }

    int features() {
        return cuts.length;
    }

    private static double[] cutPoints(double[] column) {
        double[] distinct = Arrays.stream(column).sorted().distinct().toArray();
        if (distinct.length <= MAX_BINS) return distinct;
        double[] sorted = column.clone();
        Arrays.sort(sorted);
        double[] q = new double[MAX_BINS];
        for (int k = 0; k < MAX_BINS; k++) {
            int idx = (int) Math.ceil((k + 1) * sorted.length / (double) MAX_BINS) - 1;
            q[k] = sorted[Math.max(0, Math.min(sorted.length - 1, idx))];
        }
        return Arrays.stream(q).distinct().toArray();
    }
}
