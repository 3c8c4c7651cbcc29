package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.model.CohortKey;
import com.tony.powerRank.model.GameRecord;
import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.IngestionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Étape 1 : GameRecord (perspective) → statistiques brutes par équipe × cohorte.
 */
@Service
@Slf4j
public class FeatureAggregator {

    // Plus récent d'abord ; gameId pour départager deux matchs du même jour
    private static final Comparator<GameRecord> MOST_RECENT_FIRST = Comparator
            .comparing(GameRecord::getDate, Comparator.reverseOrder())
            .thenComparing(GameRecord::getGameId);

    private static final Comparator<TeamKey> TEAM_ORDER = Comparator
            .comparing(TeamKey::cohort)
            .thenComparing(TeamKey::teamId);

    private record TeamKey(String teamId, CohortKey cohort) {
    }

    public AggregationResult aggregate(List<GameRecord> records, LocalDate today, RankingConfig config) {
        LocalDate cutoff = today.minusDays(config.getWindowDays());
        LocalDate activeSince = today.minusDays(config.getInactiveHideDays());

        int accepted = 0;
        int missingScore = 0;
        int missingDate = 0;
        int unresolved = 0;
        int outOfWindow = 0;

        // 1. Filtrage + regroupement en un seul passage, ordre déterministe
        Map<TeamKey, List<GameRecord>> byTeam = new TreeMap<>(TEAM_ORDER);
        for (GameRecord r : records) {
            if (r.getTeamId() == null || r.getOpponentId() == null || r.getAge() == null
                    || r.getGender() == null || r.getGameId() == null) {
                unresolved++;
                continue;
            }
            if (r.getDate() == null) {
                missingDate++;
                continue;
            }
            if (r.getGoalsFor() == null || r.getGoalsAgainst() == null) {
                missingScore++;
                continue;
            }
            if (r.getDate().isBefore(cutoff) || r.getDate().isAfter(today)) {
                outOfWindow++;
                continue;
            }
            accepted++;
            byTeam.computeIfAbsent(new TeamKey(r.getTeamId(), r.cohort()), k -> new ArrayList<>()).add(r);
        }

        // 2. Agrégation par équipe
        List<TeamCohortStat> teams = new ArrayList<>(byTeam.size());
        List<WeightedGame> games = new ArrayList<>();
        for (Map.Entry<TeamKey, List<GameRecord>> entry : byTeam.entrySet()) {
            List<GameRecord> rows = entry.getValue();
            rows.sort(MOST_RECENT_FIRST);
            List<WeightedGame> kept = weightTeamGames(rows, today, config);
            games.addAll(kept);

            int last180 = (int) rows.stream().filter(r -> !r.getDate().isBefore(activeSince)).count();
            teams.add(buildStat(entry.getKey(), kept, last180, rows.get(0).getDate(), config));
        }

        IngestionReport report = new IngestionReport(accepted, missingScore, missingDate, unresolved, outOfWindow);
        log.info("📥 Agrégation : {} lignes retenues, {} ignorées -> {} équipes, {} matchs pondérés",
                accepted, report.skipped(), teams.size(), games.size());
        return new AggregationResult(teams, games, report);
    }

    /**
     * Second passage : buts pondérés par la force relative de l'adversaire.
     * Marquer contre un fort compte plus, encaisser contre un fort compte moins.
     *
     * La référence est la force moyenne des équipes passées (une cohorte).
     *
     * @param strength force courante par équipe ; un adversaire inconnu vaut la référence (facteur 1)
     */
    public List<TeamCohortStat> reaggregate(List<TeamCohortStat> teams,
                                            List<WeightedGame> games,
                                            Map<String, Double> strength,
                                            RankingConfig config) {
        if (strength.isEmpty() || teams.isEmpty()) return teams;
        double baseline = teams.stream()
                .mapToDouble(t -> strength.getOrDefault(t.getTeamId(), 0.0))
                .average()
                .orElse(0.0);
        if (baseline <= 0) {
            log.warn("⚠️ Force moyenne nulle : ajustement adverse ignoré");
            return teams;
        }

        Map<TeamKey, double[]> sums = new TreeMap<>(TEAM_ORDER);
        for (WeightedGame g : games) {
            double opp = strength.getOrDefault(g.getOpponentId(), baseline);
            double offFactor = StatMath.clip(opp / baseline, config.getOpponentAdjustClipMin(), config.getOpponentAdjustClipMax());
            double defFactor = opp <= 0 ? config.getOpponentAdjustClipMax()
                    : StatMath.clip(baseline / opp, config.getOpponentAdjustClipMin(), config.getOpponentAdjustClipMax());
            double[] acc = sums.computeIfAbsent(new TeamKey(g.getTeamId(), g.getCohort()), k -> new double[2]);
            acc[0] += g.getWeight() * g.getGoalsFor() * offFactor;
            acc[1] += g.getWeight() * g.getGoalsAgainst() * defFactor;
        }

        List<TeamCohortStat> out = new ArrayList<>(teams.size());
        for (TeamCohortStat t : teams) {
            double[] acc = sums.get(new TeamKey(t.getTeamId(), t.getCohort()));
            if (acc == null) {
                out.add(t);
                continue;
            }
            out.add(t.toBuilder()
                    .offRaw(acc[0])
                    .sadRaw(acc[1])
                    .defRaw(1.0 / (acc[1] + config.getRidgeGa()))
                    .build());
        }
        return out;
    }

    private List<WeightedGame> weightTeamGames(List<GameRecord> rows, LocalDate today, RankingConfig config) {
        // Garde-fou outliers sur toute la fenêtre, avant le plafond
        double[] gf = rows.stream().mapToDouble(GameRecord::getGoalsFor).toArray();
        double[] ga = rows.stream().mapToDouble(GameRecord::getGoalsAgainst).toArray();
        double[] gfClipped = StatMath.clipToZ(gf, config.getOutlierGuardZscore());
        double[] gaClipped = StatMath.clipToZ(ga, config.getOutlierGuardZscore());

        int n = Math.min(rows.size(), config.getMaxGamesForRank());
        double[] w = new double[n];
        double total = 0;
        for (int i = 0; i < n; i++) {
            w[i] = Math.exp(-config.getRecencyWeightDecay() * i);
            total += w[i];
        }

        List<WeightedGame> kept = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            GameRecord r = rows.get(i);
            double diff = StatMath.clip(gfClipped[i] - gaClipped[i], -config.getGoalDiffCap(), config.getGoalDiffCap());
            kept.add(WeightedGame.builder()
                    .gameId(r.getGameId())
                    .date(r.getDate())
                    .teamId(r.getTeamId())
                    .opponentId(r.getOpponentId())
                    .cohort(r.cohort())
                    .opponentAge(r.getOpponentAge())
                    .opponentGender(r.getOpponentGender())
                    .homeTeamId(r.getHomeTeamId())
                    .rawGoalsFor(r.getGoalsFor())
                    .rawGoalsAgainst(r.getGoalsAgainst())
                    .goalsFor(gfClipped[i])
                    .goalsAgainst(gaClipped[i])
                    .goalDiff(diff)
                    .rankRecency(i + 1)
                    .weight(w[i] / total)
                    .daysSinceGame(ChronoUnit.DAYS.between(r.getDate(), today))
                    .build());
        }
        return kept;
    }

    private TeamCohortStat buildStat(TeamKey key, List<WeightedGame> kept, int last180, LocalDate lastGame,
                                     RankingConfig config) {
        double off = 0;
        double sad = 0;
        for (WeightedGame g : kept) {
            off += g.getWeight() * g.getGoalsFor();
            sad += g.getWeight() * g.getGoalsAgainst();
        }
        return TeamCohortStat.builder()
                .teamId(key.teamId())
                .cohort(key.cohort())
                .gamesPlayed(kept.size())
                .gamesLast180Days(last180)
                .lastGameDate(lastGame)
                .offRaw(off)
                .sadRaw(sad)
                .defRaw(1.0 / (sad + config.getRidgeGa()))
                .build();
    }
}
