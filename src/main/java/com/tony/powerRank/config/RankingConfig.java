package com.tony.powerRank.config;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Configuration immuable d'un calcul de classement.
 * Construite une fois (voir {@link RankingConfiguration}), validée, puis passée
 * telle quelle à chaque étape du moteur.
 */
@Value
@Builder(toBuilder = true)
public class RankingConfig {

    public static final Map<Integer, Double> DEFAULT_AGE_ANCHORS = Map.of(
            10, 0.400,
            11, 0.475,
            12, 0.550,
            13, 0.625,
            14, 0.700,
            15, 0.775,
            16, 0.850,
            17, 0.925,
            18, 1.000,
            19, 1.000
    );

    private static final double WEIGHT_TOLERANCE = 1e-9;

    // --- 1. Fenêtre & agrégation ---
    @Builder.Default int windowDays = 365;
    @Builder.Default int inactiveHideDays = 180;
    @Builder.Default int maxGamesForRank = 30;
    @Builder.Default int goalDiffCap = 6;
    @Builder.Default double outlierGuardZscore = 2.5;
    @Builder.Default double recencyWeightDecay = 0.05;
    @Builder.Default double ridgeGa = 0.25;

    // --- 2. Shrinkage ---
    @Builder.Default double shrinkTau = 8.0;
    @Builder.Default double teamOutlierGuardZscore = 2.5;
    @Builder.Default NormMode normMode = NormMode.PERCENTILE;

    // --- 3. Ajustement adverse ---
    @Builder.Default boolean opponentAdjustEnabled = true;
    @Builder.Default double opponentAdjustClipMin = 0.4;
    @Builder.Default double opponentAdjustClipMax = 1.6;

    // --- 4. SOS ---
    @Builder.Default double recencyDecayRate = 0.002;
    @Builder.Default double adaptK = 0.05;
    @Builder.Default int sosRepeatCap = 2;
    @Builder.Default int sosIterations = 1;
    @Builder.Default double sosTransitivityLambda = 0.0;
    @Builder.Default double unrankedSosBase = 0.35;

    // --- 5. Détection de bulles régionales (SCF) ---
    @Builder.Default boolean scfEnabled = true;
    @Builder.Default double scfDiversityDivisor = 3.0;
    @Builder.Default double scfFloor = 0.4;
    @Builder.Default int scfMinUniqueStates = 2;
    @Builder.Default int minBridgeGames = 2;
    @Builder.Default boolean isolationPenaltyEnabled = true;
    @Builder.Default double isolationSosCap = 0.70;
    @Builder.Default boolean pagerankDampeningEnabled = true;
    @Builder.Default double pagerankAlpha = 0.85;
    @Builder.Default int minComponentSizeForFullSos = 30;
    @Builder.Default int minGamesForTopSos = 10;
    @Builder.Default int minGamesForSosRank = 10;

    // --- 6. PowerScore ---
    @Builder.Default double offWeight = 0.25;
    @Builder.Default double defWeight = 0.25;
    @Builder.Default double sosWeight = 0.40;
    @Builder.Default double perfBlendWeight = 0.10;

    // --- 7. Signal de performance ---
    @Builder.Default double performanceGoalScale = 5.0;
    @Builder.Default double performanceThreshold = 2.0;
    @Builder.Default double performanceDecayRate = 0.08;
    @Builder.Default double perfGameScale = 0.15;

    // --- 8. Provisoire & ancrage ---
    @Builder.Default int minGamesProvisional = 5;
    @Builder.Default int provisionalFullGames = 15;
    @Builder.Default double provisionalLowMultiplier = 0.85;
    @Builder.Default double provisionalMidMultiplier = 0.95;
    @Builder.Default Map<Integer, Double> ageAnchors = DEFAULT_AGE_ANCHORS;
    @Builder.Default double defaultAnchor = 0.70;

    // --- 9. Historique ---
    @Builder.Default int historyToleranceDays = 3;

    @Builder.Default MlConfig ml = MlConfig.defaults();

    public static RankingConfig defaults() {
        return RankingConfig.builder().build();
    }

    public double anchorFor(int age) {
        Double anchor = ageAnchors.get(age);
        return anchor != null ? anchor : defaultAnchor;
    }

    public double provisionalMultiplier(int gamesPlayed) {
        if (gamesPlayed < minGamesProvisional) return provisionalLowMultiplier;
        if (gamesPlayed < provisionalFullGames) return provisionalMidMultiplier;
        return 1.0;
    }

    /**
     * Vérifie les invariants. Appelée au démarrage : une configuration
     * incohérente doit empêcher tout calcul.
     *
     * @return this, pour chaîner
     * @throws InvalidRankingConfigException si un invariant est violé
     */
    public RankingConfig validate() {
        double weightSum = offWeight + defWeight + sosWeight + perfBlendWeight;
        require(Math.abs(weightSum - 1.0) <= WEIGHT_TOLERANCE,
                "Les poids OFF+DEF+SOS+PERF doivent sommer à 1.0 (actuel : " + weightSum + ")");
        requireUnit(offWeight, "offWeight");
        requireUnit(defWeight, "defWeight");
        requireUnit(sosWeight, "sosWeight");
        requireUnit(perfBlendWeight, "perfBlendWeight");

        require(windowDays > 0, "windowDays doit être > 0");
        require(inactiveHideDays > 0, "inactiveHideDays doit être > 0");
        require(maxGamesForRank > 0, "maxGamesForRank doit être > 0");
        require(goalDiffCap > 0, "goalDiffCap doit être > 0");
        require(shrinkTau > 0, "shrinkTau doit être > 0");
        require(ridgeGa > 0, "ridgeGa doit être > 0");
        require(opponentAdjustClipMin > 0 && opponentAdjustClipMin <= opponentAdjustClipMax,
                "Bornes d'ajustement adverse invalides");

        require(sosRepeatCap >= 1, "sosRepeatCap doit être >= 1");
        require(sosIterations >= 1, "sosIterations doit être >= 1");
        requireUnit(sosTransitivityLambda, "sosTransitivityLambda");
        requireUnit(pagerankAlpha, "pagerankAlpha");
        requireUnit(unrankedSosBase, "unrankedSosBase");
        requireUnit(scfFloor, "scfFloor");
        requireUnit(isolationSosCap, "isolationSosCap");
        require(scfDiversityDivisor > 0, "scfDiversityDivisor doit être > 0");
        require(minComponentSizeForFullSos >= 1, "minComponentSizeForFullSos doit être >= 1");
        require(minGamesForTopSos >= 1, "minGamesForTopSos doit être >= 1");

        require(recencyWeightDecay >= 0, "recencyWeightDecay doit être >= 0");
        require(recencyDecayRate >= 0, "recencyDecayRate doit être >= 0");
        require(adaptK >= 0, "adaptK doit être >= 0");
        require(performanceDecayRate >= 0, "performanceDecayRate doit être >= 0");

        requireUnit(provisionalLowMultiplier, "provisionalLowMultiplier");
        requireUnit(provisionalMidMultiplier, "provisionalMidMultiplier");
        require(ageAnchors != null, "La table d'ancrage par âge est obligatoire");
        ageAnchors.forEach((age, anchor) -> require(anchor != null && anchor >= 0 && anchor <= 1,
                "Ancrage hors [0,1] pour U" + age + " : " + anchor));
        requireUnit(defaultAnchor, "defaultAnchor");
        require(historyToleranceDays >= 0, "historyToleranceDays doit être >= 0");

        require(ml != null, "La configuration ML est obligatoire");
        require(ml.getAlpha() >= 0, "ml.alpha doit être >= 0");
        require(ml.getRecencyDecayLambda() >= 0, "ml.recencyDecayLambda doit être >= 0");
        require(ml.getResidualClipGoals() > 0, "ml.residualClipGoals doit être > 0");
        require(ml.getMinTrainingRows() >= 1, "ml.minTrainingRows doit être >= 1");
        require(ml.getHoldoutDays() >= 0, "ml.holdoutDays doit être >= 0");
        require(ml.getTrees() >= 1, "ml.trees doit être >= 1");
        require(ml.getMaxDepth() >= 1, "ml.maxDepth doit être >= 1");
        require(ml.getSubsample() > 0 && ml.getSubsample() <= 1, "ml.subsample doit être dans ]0,1]");
        require(ml.getForestTrees() >= 1, "ml.forestTrees doit être >= 1");
        require(ml.getForestMaxDepth() >= 1, "ml.forestMaxDepth doit être >= 1");
        return this;
    }

    private static void requireUnit(double value, String name) {
        require(value >= 0 && value <= 1, name + " doit être dans [0,1] (actuel : " + value + ")");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidRankingConfigException(message);
        }
    }
}
