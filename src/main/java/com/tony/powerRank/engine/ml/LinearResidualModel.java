package com.tony.powerRank.engine.ml;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayList;
import java.util.List;

/**
 * Modèle de repli : moindres carrés ordinaires.
 * La feature "diff" (combinaison linéaire des deux forces) et les colonnes constantes
 * sont écartées pour garder une matrice inversible.
 */
@Slf4j
public class LinearResidualModel implements ResidualModel {

    private int[] columns = new int[0];
    private double[] beta = new double[]{0.0};

    @Override
    public void fit(double[][] x, double[] y) {
        int n = y.length;
        double mean = 0;
        for (double v : y) mean += v;
        mean = n == 0 ? 0.0 : mean / n;
        columns = new int[0];
        beta = new double[]{mean};
        if (n == 0) return;

        List<Integer> usable = new ArrayList<>();
        for (int f = 0; f < x[0].length; f++) {
            if (f == GameFeatures.POWER_DIFF) continue;
            if (!isConstant(x, f)) usable.add(f);
        }
        if (usable.isEmpty() || n <= usable.size() + 1) return;

        double[][] design = new double[n][usable.size()];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < usable.size(); k++) {
                design[i][k] = x[i][usable.get(k)];
            }
        }
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
            ols.newSampleData(y, design);
            beta = ols.estimateRegressionParameters();
            columns = usable.stream().mapToInt(Integer::intValue).toArray();
        } catch (SingularMatrixException e) {
            log.warn("⚠️ Régression linéaire singulière, repli sur la moyenne : {}", e.getMessage());
        }
    }

    @Override
    public double predict(double[] x) {
        double out = beta[0];
        for (int k = 0; k < columns.length; k++) {
            out += beta[k + 1] * x[columns[k]];
        }
        return out;
    }

    private static boolean isConstant(double[][] x, int f) {
        double first = x[0][f];
        for (double[] row : x) {
            if (row[f] != first) return false;
        }
        return true;
    }
}
