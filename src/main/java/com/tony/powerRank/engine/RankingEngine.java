package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.engine.ml.MlLayerResult;
import com.tony.powerRank.engine.ml.PredictiveResidualLayer;
import com.tony.powerRank.model.CohortKey;
import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.RankingRunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Orchestrateur du moteur :
 * Agrégation → [par cohorte, en parallèle] Shrinkage + force → carte de force globale →
 * [par cohorte] SOS + PowerScore → fusion dans l'ordre des cohortes → couche ML.
 * <p>
 * Aucun état partagé entre deux passages : même entrée + même config + même today = même sortie.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingEngine {

    private final FeatureAggregator aggregator;
    private final ShrinkageNormalizer normalizer;
    private final SosEngine sosEngine;
    private final PowerScoreComposer composer;
    private final PredictiveResidualLayer residualLayer;
    private final RankingStageCache stageCache;
    private final ExecutorService rankingExecutor;

    public RankingRunResult run(RankingInput input, RankingConfig config, boolean forceRebuild) {
        config.validate();
        long start = System.currentTimeMillis();

        String key = stageCache.keyFor(input, config);
        Optional<StageOutput> cached = forceRebuild ? Optional.empty() : stageCache.get(key);
        StageOutput stages;
        if (cached.isPresent()) {
            stages = cached.get();
            log.info("♻️ Étapes SOS/PowerScore reprises du cache ({}…)", key.substring(0, 12));
        } else {
            stages = computeStages(input, config);
            stageCache.put(key, stages);
        }

        // Jamais en cache : dépend de la coupure temporelle d'apprentissage
        MlLayerResult ml = residualLayer.apply(stages.teams(), stages.games(), config);

        log.info("✅ Classement calculé : {} équipes, {} matchs, ML {} ({} ms)",
                ml.teams().size(), stages.games().size(), ml.status(), System.currentTimeMillis() - start);

        return RankingRunResult.builder()
                .today(input.today())
                .teams(ml.teams())
                .gamesUsed(stages.sosEdges())
                .gameResiduals(ml.gameResiduals())
                .ingestion(stages.report())
                .mlApplied(ml.applied())
                .mlStatus(ml.status())
                .mlTrainingRows(ml.trainingRows())
                .fromCache(cached.isPresent())
                .build();
    }

    StageOutput computeStages(RankingInput input, RankingConfig config) {
        AggregationResult agg = aggregator.aggregate(input.games(), input.today(), config);

        Map<CohortKey, List<TeamCohortStat>> cohorts = new TreeMap<>();
        agg.teams().forEach(t -> cohorts.computeIfAbsent(t.getCohort(), k -> new ArrayList<>()).add(t));
        Map<CohortKey, List<WeightedGame>> gamesByCohort = new HashMap<>();
        agg.games().forEach(g -> gamesByCohort.computeIfAbsent(g.getCohort(), k -> new ArrayList<>()).add(g));
        log.info("🧮 {} cohortes à calculer", cohorts.size());

        // Phase 1 : force (shrinkage + normalisation + ancrage)
        Map<CohortKey, List<TeamCohortStat>> strength = perCohort(cohorts,
                (cohort, teams) -> normalizer.normalize(teams, config));

        if (config.isOpponentAdjustEnabled()) {
            Map<String, Double> firstEstimate = strengthMap(strength);
            strength = perCohort(strength, (cohort, teams) -> normalizer.normalize(
                    aggregator.reaggregate(teams, gamesOf(gamesByCohort, cohort), firstEstimate, config), config));
        }

        // Carte de force inter-cohortes (adversaires d'un autre âge/genre)
        Map<String, Double> globalStrength = strengthMap(strength);

        // Phase 2 : SOS + PowerScore
        AtomicInteger sosEdges = new AtomicInteger();
        Map<CohortKey, List<TeamCohortStat>> scored = perCohort(strength, (cohort, teams) -> {
            List<WeightedGame> games = gamesOf(gamesByCohort, cohort);
            SosEngine.SosResult sos = sosEngine.compute(teams, games, globalStrength, input.teamStates(), config);
            sosEdges.addAndGet(sos.edgesUsed());
            return composer.compose(sos.teams(), games, input.today(), config);
        });

        List<TeamCohortStat> merged = new ArrayList<>(agg.teams().size());
        scored.values().forEach(merged::addAll);
        return new StageOutput(List.copyOf(merged), List.copyOf(agg.games()), agg.report(), sosEdges.get());
    }

    /**
     * Exécute fn pour chaque cohorte sur le pool, résultats fusionnés dans l'ordre des clés.
     */
    private <T> Map<CohortKey, T> perCohort(Map<CohortKey, List<TeamCohortStat>> cohorts,
                                            BiFunction<CohortKey, List<TeamCohortStat>, T> fn) {
        Map<CohortKey, Future<T>> futures = new LinkedHashMap<>();
        cohorts.forEach((cohort, teams) -> futures.put(cohort, rankingExecutor.submit(() -> fn.apply(cohort, teams))));

        Map<CohortKey, T> out = new TreeMap<>();
        for (Map.Entry<CohortKey, Future<T>> entry : futures.entrySet()) {
            try {
                out.put(entry.getKey(), entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new RankingComputationException("Calcul interrompu sur la cohorte " + entry.getKey(), e);
            } catch (ExecutionException e) {
                futures.values().forEach(f -> f.cancel(true));
                throw new RankingComputationException("Échec du calcul de la cohorte " + entry.getKey(), e.getCause());
            }
        }
        return out;
    }

    private static Map<String, Double> strengthMap(Map<CohortKey, List<TeamCohortStat>> cohorts) {
        Map<String, Double> map = new HashMap<>();
        cohorts.values().forEach(teams -> teams.forEach(t -> map.putIfAbsent(t.getTeamId(), t.getAbsStrength())));
        return Map.copyOf(map);
    }

    private static List<WeightedGame> gamesOf(Map<CohortKey, List<WeightedGame>> gamesByCohort, CohortKey cohort) {
        return gamesByCohort.getOrDefault(cohort, List.of());
    }
}
