package com.tony.powerRank.engine.ml;

import com.tony.powerRank.config.MlConfig;
import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.engine.PowerScoreComposer;
import com.tony.powerRank.engine.StatMath;
import com.tony.powerRank.engine.WeightedGame;
import com.tony.powerRank.model.CohortKey;
import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.GameResidual;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Étape 5 (optionnelle) : sur/sous-performance par rapport à ce que la seule
 * différence de force prédit, réinjectée comme petite correction du PowerScore.
 * <p>
 * Garde-fou de fuite : apprentissage uniquement sur les matchs strictement antérieurs
 * à (date max - holdoutDays). Si ce jeu est trop petit, la couche est désactivée
 * pour tout le passage (aucune application partielle).
 */
@Service
@Slf4j
public class PredictiveResidualLayer {

    public MlLayerResult apply(List<TeamCohortStat> teams, List<WeightedGame> games, RankingConfig config) {
        MlConfig ml = config.getMl();
        if (!ml.isEnabled()) {
            return passThrough(teams, "désactivée (config)", 0);
        }
        if (teams.isEmpty()) {
            return passThrough(teams, "aucune équipe", 0);
        }

        // Force de base (core) par équipe
        Map<String, Double> power = new HashMap<>();
        teams.forEach(t -> power.putIfAbsent(t.getTeamId(), t.getPowerscoreCore()));

        List<WeightedGame> rows = games.stream().filter(g -> power.containsKey(g.getTeamId())).toList();
        if (rows.isEmpty()) {
            return passThrough(teams, "aucun match", 0);
        }

        LocalDate maxDate = rows.stream().map(WeightedGame::getDate).max(Comparator.naturalOrder()).orElseThrow();
        LocalDate cutoff = maxDate.minusDays(ml.getHoldoutDays());

        double[][] x = new double[rows.size()][];
        double[] y = new double[rows.size()];
        List<Integer> trainIdx = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            WeightedGame g = rows.get(i);
            x[i] = GameFeatures.of(g, power);
            y[i] = g.rawMargin();
            if (g.getDate().isBefore(cutoff)) trainIdx.add(i);
        }

        if (trainIdx.size() < ml.getMinTrainingRows()) {
            log.warn("⚠️ Couche ML désactivée : {} lignes d'entraînement avant le {} (minimum {})",
                    trainIdx.size(), cutoff, ml.getMinTrainingRows());
            return passThrough(teams, "désactivée (" + trainIdx.size() + " lignes d'entraînement)", trainIdx.size());
        }

        double[][] trainX = new double[trainIdx.size()][];
        double[] trainY = new double[trainIdx.size()];
        for (int k = 0; k < trainIdx.size(); k++) {
            trainX[k] = x[trainIdx.get(k)];
            trainY[k] = y[trainIdx.get(k)];
        }
        ResidualModel model = ResidualModels.create(ml);
        model.fit(trainX, trainY);
        log.info("🤖 Modèle {} entraîné sur {} lignes (coupure {}), {} lignes scorées",
                ml.getModel(), trainIdx.size(), cutoff, rows.size());

        // Résidu sur TOUS les matchs (entraînement + holdout)
        double[] residual = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            residual[i] = y[i] - model.predict(x[i]);
        }

        Map<String, Double> overperf = aggregateResiduals(rows, residual, ml);
        List<TeamCohortStat> blended = blend(teams, overperf, ml);
        List<GameResidual> gameResiduals = homeResiduals(rows, residual);

        return new MlLayerResult(blended, gameResiduals, true, "appliquée", trainIdx.size());
    }

    /**
     * Moyenne pondérée exp(-lambda·(rang-1)) des résidus par équipe, écrêtée.
     * Moins de minTeamGamesForResidual matchs : résidu nul.
     */
    Map<String, Double> aggregateResiduals(List<WeightedGame> rows, double[] residual, MlConfig ml) {
        Map<String, double[]> acc = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            WeightedGame g = rows.get(i);
            double w = Math.exp(-ml.getRecencyDecayLambda() * (g.getRankRecency() - 1));
            double[] a = acc.computeIfAbsent(key(g.getTeamId(), g.getCohort()), k -> new double[3]);
            a[0] += w * residual[i];
            a[1] += w;
            a[2] += 1;
        }
        Map<String, Double> out = new HashMap<>();
        acc.forEach((k, a) -> {
            double value = a[2] < ml.getMinTeamGamesForResidual() || a[1] <= 0 ? 0.0 : a[0] / a[1];
            out.put(k, StatMath.clip(value, -ml.getResidualClipGoals(), ml.getResidualClipGoals()));
        });
        return out;
    }

    private List<TeamCohortStat> blend(List<TeamCohortStat> teams, Map<String, Double> overperf, MlConfig ml) {
        double alpha = ml.getAlpha();
        List<TeamCohortStat> out = new ArrayList<>(teams.size());
        for (List<TeamCohortStat> cohort : byCohort(teams).values()) {
            double[] raw = cohort.stream()
                    .mapToDouble(t -> overperf.getOrDefault(key(t.getTeamId(), t.getCohort()), 0.0))
                    .toArray();
            double[] norm = StatMath.normalize(raw, ml.getNormMode());

            List<TeamCohortStat> scored = new ArrayList<>(cohort.size());
            for (int i = 0; i < cohort.size(); i++) {
                TeamCohortStat t = cohort.get(i);
                double mlNorm = norm[i] - StatMath.MIDPOINT;
                // Dénominateur : ml_norm vaut au plus +0.5, on évite l'entassement au plafond
                double score = StatMath.clipUnit((t.getPowerscoreCore() + alpha * mlNorm) / (1 + 0.5 * alpha));
                scored.add(t.toBuilder()
                        .mlOverperf(raw[i])
                        .mlNorm(mlNorm)
                        .powerscoreMl(score)
                        .build());
            }
            out.addAll(PowerScoreComposer.rank(scored, t -> t.getPowerscoreMl() * t.getProvisionalMult(), true));
        }
        return out;
    }

    /**
     * Un résidu par match, côté domicile ; l'extérieur en est l'opposé.
     */
    private List<GameResidual> homeResiduals(List<WeightedGame> rows, double[] residual) {
        Map<String, Double> byGame = new TreeMap<>();
        for (int i = 0; i < rows.size(); i++) {
            WeightedGame g = rows.get(i);
            if (g.getHomeTeamId() != null && g.isHomePerspective()) {
                byGame.putIfAbsent(g.getGameId(), residual[i]);
            }
        }
        List<GameResidual> out = new ArrayList<>(byGame.size());
        byGame.forEach((id, r) -> out.add(new GameResidual(id, r)));
        return out;
    }

    private MlLayerResult passThrough(List<TeamCohortStat> teams, String reason, int trainingRows) {
        List<TeamCohortStat> out = new ArrayList<>(teams.size());
        for (TeamCohortStat t : teams) {
            out.add(t.toBuilder()
                    .mlOverperf(0.0)
                    .mlNorm(0.0)
                    .powerscoreMl(t.getPowerscoreCore())
                    .rankInCohortMl(t.getRankInCohort())
                    .build());
        }
        return new MlLayerResult(out, List.of(), false, reason, trainingRows);
    }

    private static Map<CohortKey, List<TeamCohortStat>> byCohort(List<TeamCohortStat> teams) {
        Map<CohortKey, List<TeamCohortStat>> map = new TreeMap<>();
        for (TeamCohortStat t : teams) {
            map.computeIfAbsent(t.getCohort(), k -> new ArrayList<>()).add(t);
        }
        return map;
    }

    private static String key(String teamId, CohortKey cohort) {
        return teamId + "|" + cohort;
    }
}
