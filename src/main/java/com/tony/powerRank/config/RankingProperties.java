package com.tony.powerRank.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Réglages externes du moteur (préfixe "ranking" dans application.yml).
 * Les valeurs par défaut sont celles de {@link RankingConfig}.
 */
@Configuration
@ConfigurationProperties(prefix = "ranking")
@Validated
@Data
public class RankingProperties {

    private static final RankingConfig D = RankingConfig.defaults();
    private static final MlConfig ML = MlConfig.defaults();

    // --- Fenêtre & agrégation ---
    @Positive
    private int windowDays = D.getWindowDays();
    @Positive
    private int inactiveHideDays = D.getInactiveHideDays();
    @Positive
    private int maxGamesForRank = D.getMaxGamesForRank();
    private int goalDiffCap = D.getGoalDiffCap();
    private double outlierGuardZscore = D.getOutlierGuardZscore();
    private double recencyWeightDecay = D.getRecencyWeightDecay();
    private double ridgeGa = D.getRidgeGa();

    // --- Shrinkage ---
    private double shrinkTau = D.getShrinkTau();
    private double teamOutlierGuardZscore = D.getTeamOutlierGuardZscore();
    @NotNull
    private NormMode normMode = D.getNormMode();

    private boolean opponentAdjustEnabled = D.isOpponentAdjustEnabled();
    private double opponentAdjustClipMin = D.getOpponentAdjustClipMin();
    private double opponentAdjustClipMax = D.getOpponentAdjustClipMax();

    // --- SOS ---
    private double recencyDecayRate = D.getRecencyDecayRate();
    private double adaptK = D.getAdaptK();
    private int sosRepeatCap = D.getSosRepeatCap();
    @Min(1)
    private int sosIterations = D.getSosIterations();
    private double sosTransitivityLambda = D.getSosTransitivityLambda();
    private double unrankedSosBase = D.getUnrankedSosBase();

    // --- Bulles régionales ---
    private boolean scfEnabled = D.isScfEnabled();
    private double scfDiversityDivisor = D.getScfDiversityDivisor();
    private double scfFloor = D.getScfFloor();
    private int scfMinUniqueStates = D.getScfMinUniqueStates();
    private int minBridgeGames = D.getMinBridgeGames();
    private boolean isolationPenaltyEnabled = D.isIsolationPenaltyEnabled();
    private double isolationSosCap = D.getIsolationSosCap();
    private boolean pagerankDampeningEnabled = D.isPagerankDampeningEnabled();
    private double pagerankAlpha = D.getPagerankAlpha();
    private int minComponentSizeForFullSos = D.getMinComponentSizeForFullSos();
    private int minGamesForTopSos = D.getMinGamesForTopSos();
    private int minGamesForSosRank = D.getMinGamesForSosRank();

    // --- PowerScore ---
    private double offWeight = D.getOffWeight();
    private double defWeight = D.getDefWeight();
    private double sosWeight = D.getSosWeight();
    private double perfBlendWeight = D.getPerfBlendWeight();

    private double performanceGoalScale = D.getPerformanceGoalScale();
    private double performanceThreshold = D.getPerformanceThreshold();
    private double performanceDecayRate = D.getPerformanceDecayRate();
    private double perfGameScale = D.getPerfGameScale();

    private int minGamesProvisional = D.getMinGamesProvisional();
    private int provisionalFullGames = D.getProvisionalFullGames();
    private double provisionalLowMultiplier = D.getProvisionalLowMultiplier();
    private double provisionalMidMultiplier = D.getProvisionalMidMultiplier();
    private Map<Integer, Double> ageAnchors = new HashMap<>(RankingConfig.DEFAULT_AGE_ANCHORS);
    private double defaultAnchor = D.getDefaultAnchor();

    @Valid
    private Ml ml = new Ml();
    @Valid
    private Persistence persistence = new Persistence();
    @Valid
    private History history = new History();
    private Engine engine = new Engine();
    private Cache cache = new Cache();
    private Job job = new Job();

    @Data
    public static class Ml {
        private boolean enabled = ML.isEnabled();
        private double alpha = ML.getAlpha();
        private double recencyDecayLambda = ML.getRecencyDecayLambda();
        private int minTeamGamesForResidual = ML.getMinTeamGamesForResidual();
        private double residualClipGoals = ML.getResidualClipGoals();
        private int minTrainingRows = ML.getMinTrainingRows();
        private int holdoutDays = ML.getHoldoutDays();
        private NormMode normMode = ML.getNormMode();
        private ResidualModelType model = ML.getModel();
        @Positive
        private int trees = ML.getTrees();
        private int maxDepth = ML.getMaxDepth();
        private double learningRate = ML.getLearningRate();
        private double subsample = ML.getSubsample();
        private int minSamplesLeaf = ML.getMinSamplesLeaf();
        private long seed = ML.getSeed();
        @Positive
        private int forestTrees = ML.getForestTrees();
        @Positive
        private int forestMaxDepth = ML.getForestMaxDepth();
        private int forestMinSamplesLeaf = ML.getForestMinSamplesLeaf();
    }

    @Data
    public static class Persistence {
        @Positive
        private int batchSize = 500;
        @Min(1)
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class History {
        @Positive
        private int retentionDays = 90;
        private int toleranceDays = D.getHistoryToleranceDays();
        @Positive
        private int lookupBatchSize = 150;
    }

    @Data
    public static class Engine {
        // 0 = nombre de processeurs disponibles
        private int parallelism = 0;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 8;
    }

    @Data
    public static class Job {
        private boolean enabled = true;
        private String cron = "0 0 6 * * *";
        private String cleanupCron = "0 30 6 * * SUN";
        private String providerFilter;
    }
}
