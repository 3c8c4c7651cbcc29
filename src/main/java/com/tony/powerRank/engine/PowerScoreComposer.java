package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.TeamStatus;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Étape 4 : PowerScore = OFF·off + DEF·def + SOS·sos_norm + PERF·perf_centered,
 * puis provisoire, ancrage d'âge, statut et rang de cohorte.
 * Travaille sur UNE cohorte.
 */
@Service
public class PowerScoreComposer {

    public List<TeamCohortStat> compose(List<TeamCohortStat> cohort,
                                        List<WeightedGame> games,
                                        LocalDate today,
                                        RankingConfig config) {
        int n = cohort.size();
        if (n == 0) return List.of();

        // 1. Signal de performance : écart au résultat attendu par la différence de force
        Map<String, Double> power = new HashMap<>();
        cohort.forEach(t -> power.put(t.getTeamId(), t.getPowerPresos()));
        Map<String, Double> perfRaw = performanceByTeam(games, power, config);

        double[] perf = new double[n];
        for (int i = 0; i < n; i++) {
            perf[i] = perfRaw.getOrDefault(cohort.get(i).getTeamId(), 0.0);
        }
        // Percentile étalé : des valeurs toutes égales donnent exactement 0.5, donc un bonus nul
        double[] perfCentered = StatMath.spreadPercentile(perf);

        LocalDate activeSince = today.minusDays(config.getInactiveHideDays());
        List<TeamCohortStat> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            TeamCohortStat t = cohort.get(i);
            double centered = perfCentered[i] - StatMath.MIDPOINT;
            double core = StatMath.clipUnit(
                    config.getOffWeight() * t.getOffNorm()
                            + config.getDefWeight() * t.getDefNorm()
                            + config.getSosWeight() * t.getSosNorm()
                            + config.getPerfBlendWeight() * centered);
            double provisional = config.provisionalMultiplier(t.getGamesPlayed());
            double adj = core * provisional;
            double anchor = t.getAnchor() > 0 ? t.getAnchor() : config.anchorFor(t.age());
            double finalScore = StatMath.clipUnit(Math.min(adj * anchor, anchor));

            scored.add(t.toBuilder()
                    .perfRaw(perf[i])
                    .perfCentered(centered)
                    .powerscoreCore(core)
                    .provisionalMult(provisional)
                    .powerscoreAdj(adj)
                    .anchor(anchor)
                    .powerScoreFinal(finalScore)
                    .status(statusOf(t, activeSince, config))
                    .build());
        }

        return rank(scored, TeamCohortStat::getPowerScoreFinal, false);
    }

    /**
     * Classe les équipes ACTIVE par score décroissant, SOS décroissant, puis id.
     * Les autres statuts n'ont pas de rang.
     *
     * @param ml true pour remplir rankInCohortMl, false pour rankInCohort
     */
    public static List<TeamCohortStat> rank(List<TeamCohortStat> cohort,
                                            ToDoubleFunction<TeamCohortStat> score,
                                            boolean ml) {
        Comparator<TeamCohortStat> order = Comparator
                .comparingDouble(score).reversed()
                .thenComparing(Comparator.comparingDouble(TeamCohortStat::getSos).reversed())
                .thenComparing(TeamCohortStat::getTeamId);

        List<TeamCohortStat> active = cohort.stream()
                .filter(t -> t.getStatus() == TeamStatus.ACTIVE)
                .sorted(order)
                .toList();
        Map<String, Integer> ranks = new HashMap<>();
        for (int i = 0; i < active.size(); i++) {
            ranks.put(active.get(i).getTeamId(), i + 1);
        }

        List<TeamCohortStat> out = new ArrayList<>(cohort.size());
        for (TeamCohortStat t : cohort) {
            Integer r = ranks.get(t.getTeamId());
            out.add(ml ? t.toBuilder().rankInCohortMl(r).build() : t.toBuilder().rankInCohort(r).build());
        }
        return out;
    }

    Map<String, Double> performanceByTeam(List<WeightedGame> games, Map<String, Double> power, RankingConfig config) {
        Map<String, Double> perf = new HashMap<>();
        for (WeightedGame g : games) {
            Double teamPower = power.get(g.getTeamId());
            if (teamPower == null) continue;
            double oppPower = power.getOrDefault(g.getOpponentId(), StatMath.MIDPOINT);
            double expected = config.getPerformanceGoalScale() * (teamPower - oppPower);
            double delta = g.getGoalDiff() - expected;
            if (Math.abs(delta) < config.getPerformanceThreshold()) continue;
            double decay = Math.exp(-config.getPerformanceDecayRate() * (g.getRankRecency() - 1));
            double contribution = config.getPerfGameScale() * delta * decay * g.getWeight();
            perf.merge(g.getTeamId(), contribution, Double::sum);
        }
        return perf;
    }

    private TeamStatus statusOf(TeamCohortStat t, LocalDate activeSince, RankingConfig config) {
        if (t.getLastGameDate() == null || t.getLastGameDate().isBefore(activeSince)) {
            return TeamStatus.INACTIVE;
        }
        if (t.getGamesLast180Days() < config.getMinGamesProvisional()) {
            return TeamStatus.NOT_ENOUGH_RANKED_GAMES;
        }
        return TeamStatus.ACTIVE;
    }
}
