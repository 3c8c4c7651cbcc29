package com.tony.powerRank.engine.ml;

/**
 * Régresseur de la marge de buts attendue.
 */
public interface ResidualModel {

    void fit(double[][] x, double[] y);

    double predict(double[] x);

    default double[] predictAll(double[][] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = predict(x[i]);
        }
        return out;
    }
}
