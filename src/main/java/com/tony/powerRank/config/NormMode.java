package com.tony.powerRank.config;

/**
 * Mode de normalisation intra-cohorte.
 * PERCENTILE : rang moyen / n. ZSCORE : sigmoïde du z-score.
 */
public enum NormMode {
    PERCENTILE,
    ZSCORE
}
