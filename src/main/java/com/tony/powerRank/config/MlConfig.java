package com.tony.powerRank.config;

import lombok.Builder;
import lombok.Value;

/**
 * Réglages de la couche prédictive (résidus de score).
 */
@Value
@Builder(toBuilder = true)
public class MlConfig {

    @Builder.Default boolean enabled = true;
    // Poids du signal ML dans le mélange final
    @Builder.Default double alpha = 0.12;
    // Décroissance exp(-lambda * (rang - 1)) des résidus par match
    @Builder.Default double recencyDecayLambda = 0.06;
    @Builder.Default int minTeamGamesForResidual = 6;
    @Builder.Default double residualClipGoals = 3.5;
    @Builder.Default int minTrainingRows = 30;
    @Builder.Default int holdoutDays = 30;
    @Builder.Default NormMode normMode = NormMode.PERCENTILE;

    // --- Modèle ---
    @Builder.Default ResidualModelType model = ResidualModelType.GRADIENT_BOOSTING;
    @Builder.Default int trees = 220;
    @Builder.Default int maxDepth = 5;
    @Builder.Default double learningRate = 0.08;
    @Builder.Default double subsample = 0.9;
    @Builder.Default int minSamplesLeaf = 5;
    @Builder.Default long seed = 42L;

    // --- Forêt aléatoire (repli) ---
    @Builder.Default int forestTrees = 240;
    @Builder.Default int forestMaxDepth = 18;
    @Builder.Default int forestMinSamplesLeaf = 2;

    public static MlConfig defaults() {
        return MlConfig.builder().build();
    }
}
