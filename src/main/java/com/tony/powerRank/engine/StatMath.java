package com.tony.powerRank.engine;

import com.tony.powerRank.config.NormMode;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import java.util.Arrays;

/**
 * Outils statistiques communs aux étapes du moteur.
 * Toutes les normalisations renvoient 0.5 (point milieu) quand l'échantillon
 * ne permet pas d'étaler les valeurs (n < 2 ou variance nulle).
 */
public final class StatMath {

    public static final double MIDPOINT = 0.5;

    private static final NaturalRanking AVERAGE_RANKING = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE);
    private static final NaturalRanking MIN_RANKING = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.MINIMUM);

    private StatMath() {
    }

    public static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clipUnit(double value) {
        return clip(value, 0.0, 1.0);
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.mean(values);
    }

    /** Écart-type corrigé (n-1). 0 si moins de deux valeurs. */
    public static double std(double[] values) {
        return values.length < 2 ? 0.0 : new StandardDeviation().evaluate(values);
    }

    /** Rangs moyens 1..n (ex-aequo = moyenne des rangs). */
    public static double[] averageRanks(double[] values) {
        return AVERAGE_RANKING.rank(values);
    }

    /** Rangs "min" 1..n (ex-aequo = plus petit rang). */
    public static double[] minRanks(double[] values) {
        return MIN_RANKING.rank(values);
    }

    /**
     * Percentile = rang moyen / n, dans ]0,1].
     */
    public static double[] percentile(double[] values) {
        int n = values.length;
        double[] out = new double[n];
        if (n < 2) {
            Arrays.fill(out, MIDPOINT);
            return out;
        }
        double[] ranks = averageRanks(values);
        for (int i = 0; i < n; i++) {
            out[i] = ranks[i] / n;
        }
        return out;
    }

    /**
     * Percentile étalé sur [0,1] : (rang - 1) / (n - 1).
     * Utilisé pour le SOS par composante, où le plus faible doit valoir 0 et le plus fort 1.
     */
    public static double[] spreadPercentile(double[] values) {
        int n = values.length;
        double[] out = new double[n];
        if (n < 2) {
            Arrays.fill(out, MIDPOINT);
            return out;
        }
        double[] ranks = averageRanks(values);
        for (int i = 0; i < n; i++) {
            out[i] = (ranks[i] - 1.0) / (n - 1.0);
        }
        return out;
    }

    /**
     * Z-score puis sigmoïde. Variance nulle : tout le monde au point milieu.
     */
    public static double[] zSigmoid(double[] values) {
        int n = values.length;
        double[] out = new double[n];
        double sd = std(values);
        if (n < 2 || sd <= 0 || Double.isNaN(sd)) {
            Arrays.fill(out, MIDPOINT);
            return out;
        }
        double mu = mean(values);
        for (int i = 0; i < n; i++) {
            out[i] = sigmoid((values[i] - mu) / sd);
        }
        return out;
    }

    public static double[] normalize(double[] values, NormMode mode) {
        return mode == NormMode.ZSCORE ? zSigmoid(values) : percentile(values);
    }

    /**
     * Écrête les valeurs à moyenne ± z·sd (échantillons d'au moins 3 valeurs, sd > 0).
     */
    public static double[] clipToZ(double[] values, double z) {
        double[] out = values.clone();
        if (values.length < 3) return out;
        double sd = std(values);
        if (sd <= 0 || Double.isNaN(sd)) return out;
        double mu = mean(values);
        double lo = mu - z * sd;
        double hi = mu + z * sd;
        for (int i = 0; i < out.length; i++) {
            out[i] = clip(out[i], lo, hi);
        }
        return out;
    }

    public static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
