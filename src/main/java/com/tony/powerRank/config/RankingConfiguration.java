package com.tony.powerRank.config;

import com.tony.powerRank.engine.RankingStageCache;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class RankingConfiguration {

    /**
     * Configuration immuable du moteur, validée au démarrage (fail fast).
     */
    @Bean
    public RankingConfig rankingConfig(RankingProperties props) {
        RankingConfig config = toRankingConfig(props).validate();
        log.info("⚙️ Config classement chargée : fenêtre {} j, poids OFF/DEF/SOS/PERF = {}/{}/{}/{}, ML {}",
                config.getWindowDays(), config.getOffWeight(), config.getDefWeight(),
                config.getSosWeight(), config.getPerfBlendWeight(),
                config.getMl().isEnabled() ? "actif" : "inactif");
        return config;
    }

    /**
     * Pool borné pour le calcul par cohorte.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService rankingExecutor(RankingProperties props) {
        int threads = props.getEngine().getParallelism() > 0
                ? props.getEngine().getParallelism()
                : Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "ranking-cohort-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    /**
     * Retry des écritures par lot : backoff exponentiel borné.
     */
    @Bean
    public Retry persistenceRetry(RankingProperties props) {
        RankingProperties.Persistence p = props.getPersistence();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(p.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        p.getInitialBackoff().toMillis(), p.getBackoffMultiplier()))
                .build();
        return Retry.of("ranking-persistence", retryConfig);
    }

    @Bean
    public RankingStageCache rankingStageCache(RankingProperties props) {
        return new RankingStageCache(props.getCache().isEnabled(), props.getCache().getMaxEntries());
    }

    static RankingConfig toRankingConfig(RankingProperties p) {
        RankingProperties.Ml m = p.getMl();
        MlConfig ml = MlConfig.builder()
                .enabled(m.isEnabled())
                .alpha(m.getAlpha())
                .recencyDecayLambda(m.getRecencyDecayLambda())
                .minTeamGamesForResidual(m.getMinTeamGamesForResidual())
                .residualClipGoals(m.getResidualClipGoals())
                .minTrainingRows(m.getMinTrainingRows())
                .holdoutDays(m.getHoldoutDays())
                .normMode(m.getNormMode())
                .model(m.getModel())
                .trees(m.getTrees())
                .maxDepth(m.getMaxDepth())
                .learningRate(m.getLearningRate())
                .subsample(m.getSubsample())
                .minSamplesLeaf(m.getMinSamplesLeaf())
                .seed(m.getSeed())
                .forestTrees(m.getForestTrees())
                .forestMaxDepth(m.getForestMaxDepth())
                .forestMinSamplesLeaf(m.getForestMinSamplesLeaf())
                .build();

        Map<Integer, Double> anchors = p.getAgeAnchors() == null ? null
                : Map.copyOf(new TreeMap<>(p.getAgeAnchors()));

        return RankingConfig.builder()
                .windowDays(p.getWindowDays())
                .inactiveHideDays(p.getInactiveHideDays())
                .maxGamesForRank(p.getMaxGamesForRank())
                .goalDiffCap(p.getGoalDiffCap())
                .outlierGuardZscore(p.getOutlierGuardZscore())
                .recencyWeightDecay(p.getRecencyWeightDecay())
                .ridgeGa(p.getRidgeGa())
                .shrinkTau(p.getShrinkTau())
                .teamOutlierGuardZscore(p.getTeamOutlierGuardZscore())
                .normMode(p.getNormMode())
                .opponentAdjustEnabled(p.isOpponentAdjustEnabled())
                .opponentAdjustClipMin(p.getOpponentAdjustClipMin())
                .opponentAdjustClipMax(p.getOpponentAdjustClipMax())
                .recencyDecayRate(p.getRecencyDecayRate())
                .adaptK(p.getAdaptK())
                .sosRepeatCap(p.getSosRepeatCap())
                .sosIterations(p.getSosIterations())
                .sosTransitivityLambda(p.getSosTransitivityLambda())
                .unrankedSosBase(p.getUnrankedSosBase())
                .scfEnabled(p.isScfEnabled())
                .scfDiversityDivisor(p.getScfDiversityDivisor())
                .scfFloor(p.getScfFloor())
                .scfMinUniqueStates(p.getScfMinUniqueStates())
                .minBridgeGames(p.getMinBridgeGames())
                .isolationPenaltyEnabled(p.isIsolationPenaltyEnabled())
                .isolationSosCap(p.getIsolationSosCap())
                .pagerankDampeningEnabled(p.isPagerankDampeningEnabled())
                .pagerankAlpha(p.getPagerankAlpha())
                .minComponentSizeForFullSos(p.getMinComponentSizeForFullSos())
                .minGamesForTopSos(p.getMinGamesForTopSos())
                .minGamesForSosRank(p.getMinGamesForSosRank())
                .offWeight(p.getOffWeight())
                .defWeight(p.getDefWeight())
                .sosWeight(p.getSosWeight())
                .perfBlendWeight(p.getPerfBlendWeight())
                .performanceGoalScale(p.getPerformanceGoalScale())
                .performanceThreshold(p.getPerformanceThreshold())
                .performanceDecayRate(p.getPerformanceDecayRate())
                .perfGameScale(p.getPerfGameScale())
                .minGamesProvisional(p.getMinGamesProvisional())
                .provisionalFullGames(p.getProvisionalFullGames())
                .provisionalLowMultiplier(p.getProvisionalLowMultiplier())
                .provisionalMidMultiplier(p.getProvisionalMidMultiplier())
                .ageAnchors(anchors)
                .defaultAnchor(p.getDefaultAnchor())
                .historyToleranceDays(p.getHistory().getToleranceDays())
                .ml(ml)
                .build();
    }
}
