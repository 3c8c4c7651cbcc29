package com.tony.powerRank.engine.ml;

import com.tony.powerRank.config.MlConfig;
import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.config.ResidualModelType;
import com.tony.powerRank.engine.WeightedGame;
import com.tony.powerRank.model.TeamCohortStat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.tony.powerRank.engine.GameFixtures.TODAY;
import static com.tony.powerRank.engine.GameFixtures.U14_MALE;
import static com.tony.powerRank.engine.GameFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PredictiveResidualLayerTest {

    private static final int TEAMS = 10;

    private PredictiveResidualLayer layer;
    private RankingConfig config;

    @BeforeEach
    void setUp() {
        layer = new PredictiveResidualLayer();
        config = RankingConfig.defaults();
    }

    @Test
    @DisplayName("Devrait laisser le classement inchangé quand l'historique d'entraînement est trop court")
    void shouldPassThroughWithTooFewTrainingRows() {
        // ARRANGE : 4 matchs récents seulement
        List<TeamCohortStat> teams = cohort();
        List<WeightedGame> games = List.of(
                edge("g1", "T0", "T1", 2, 1), edge("g1", "T1", "T0", 2, -1),
                edge("g2", "T2", "T3", 3, 0), edge("g2", "T3", "T2", 3, 0));

        // ACT
        MlLayerResult result = layer.apply(teams, games, config);

        // ASSERT
        assertThat(result.applied()).isFalse();
        assertThat(result.gameResiduals()).isEmpty();
        assertThat(result.teams()).allSatisfy(t -> {
            assertThat(t.getPowerscoreMl()).isEqualTo(t.getPowerscoreCore());
            assertThat(t.getRankInCohortMl()).isEqualTo(t.getRankInCohort());
            assertThat(t.getMlNorm()).isZero();
        });
    }

    @Test
    @DisplayName("Devrait ignorer la couche quand elle est désactivée")
    void shouldPassThroughWhenDisabled() {
        RankingConfig disabled = config.toBuilder().ml(MlConfig.builder().enabled(false).build()).build();

        MlLayerResult result = layer.apply(cohort(), season(), disabled);

        assertThat(result.applied()).isFalse();
        assertThat(result.trainingRows()).isZero();
        assertThat(result.teams()).allSatisfy(t -> assertThat(t.getPowerscoreMl()).isEqualTo(t.getPowerscoreCore()));
    }

    @Test
    @DisplayName("Devrait faire remonter l'équipe qui bat systématiquement la prédiction")
    void shouldRewardConsistentOverperformer() {
        // ACT
        MlLayerResult result = layer.apply(cohort(), season(), config);

        // ASSERT
        assertThat(result.applied()).isTrue();
        assertThat(result.trainingRows()).isGreaterThanOrEqualTo(30);
        Map<String, TeamCohortStat> out = new HashMap<>();
        result.teams().forEach(t -> out.put(t.getTeamId(), t));
        assertThat(out.get("T0").getMlOverperf()).isPositive();
        assertThat(out.get("T0").getMlNorm()).isPositive();
        assertThat(out.get("T0").getRankInCohortMl()).isEqualTo(1);
        assertThat(result.teams()).allSatisfy(t -> {
            assertThat(t.getPowerscoreMl()).isBetween(0.0, 1.0);
            assertThat(Math.abs(t.getMlOverperf())).isLessThanOrEqualTo(3.5);
        });
        // Un résidu par match, côté domicile
        assertThat(result.gameResiduals()).extracting(r -> r.gameId()).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Devrait appliquer la couche avec le modèle de repli en forêt aléatoire")
    void shouldApplyWithRandomForestModel() {
        RankingConfig forest = config.toBuilder()
                .ml(config.getMl().toBuilder().model(ResidualModelType.RANDOM_FOREST).forestTrees(30).build())
                .build();

        MlLayerResult result = layer.apply(cohort(), season(), forest);

        assertThat(result.applied()).isTrue();
        assertThat(result.teams())
                .filteredOn(t -> t.getTeamId().equals("T0"))
                .singleElement()
                .satisfies(t -> assertThat(t.getRankInCohortMl()).isEqualTo(1));
    }

    @Test
    @DisplayName("Devrait mélanger core et signal ML avec la correction de plafond")
    void shouldBlendWithCeilingCorrection() {
        // ACT
        MlLayerResult result = layer.apply(cohort(), season(), config);

        // ASSERT : powerscore_ml = (core + alpha * ml_norm) / (1 + 0.5 * alpha)
        double alpha = config.getMl().getAlpha();
        assertThat(result.applied()).isTrue();
        assertThat(result.teams()).allSatisfy(t -> assertThat(t.getPowerscoreMl())
                .isCloseTo((t.getPowerscoreCore() + alpha * t.getMlNorm()) / (1 + 0.5 * alpha), within(1e-12)));
        TeamCohortStat top = result.teams().stream().filter(t -> t.getTeamId().equals("T0")).findFirst().orElseThrow();
        assertThat(top.getMlNorm()).isLessThanOrEqualTo(0.5);
        assertThat(top.getPowerscoreMl()).isLessThan(top.getPowerscoreCore() + alpha * top.getMlNorm());
    }

    @Test
    @DisplayName("Devrait exclure de l'entraînement les matchs datés exactement de la coupure")
    void shouldExcludeGamesOnCutoffDateFromTraining() {
        // ARRANGE : date max = J-1, coupure = J-31
        Map<String, Integer> recency = new HashMap<>();
        List<WeightedGame> games = new ArrayList<>();
        addGames(games, recency, "late", 1, TODAY.minusDays(1));
        addGames(games, recency, "cut", 5, TODAY.minusDays(31));
        for (int d = 0; d < 20; d++) {
            addGames(games, recency, "old" + d, 1, TODAY.minusDays(40L + d));
        }
        RankingConfig strict = config.toBuilder()
                .ml(config.getMl().toBuilder().minTrainingRows(41).build())
                .build();

        // ACT
        MlLayerResult applied = layer.apply(cohort(), games, config);
        MlLayerResult refused = layer.apply(cohort(), games, strict);

        // ASSERT : 20 matchs × 2 perspectives strictement avant la coupure
        assertThat(applied.applied()).isTrue();
        assertThat(applied.trainingRows()).isEqualTo(40);
        assertThat(refused.applied()).isFalse();
        assertThat(refused.trainingRows()).isEqualTo(40);
    }

    @Test
    @DisplayName("Devrait produire exactement le même résultat sur deux passages")
    void shouldBeDeterministic() {
        MlLayerResult first = layer.apply(cohort(), season(), config);
        MlLayerResult second = layer.apply(cohort(), season(), config);

        assertThat(second.teams()).isEqualTo(first.teams());
        assertThat(second.gameResiduals()).isEqualTo(first.gameResiduals());
    }

    private static List<TeamCohortStat> cohort() {
        List<TeamCohortStat> teams = new ArrayList<>();
        for (int i = 0; i < TEAMS; i++) {
            teams.add(TeamCohortStat.builder()
                    .teamId("T" + i)
                    .cohort(U14_MALE)
                    .gamesPlayed(20)
                    .powerscoreCore(0.5)
                    .sos(0.5)
                    .rankInCohort(i + 1)
                    .build());
        }
        return teams;
    }

    /**
     * 120 jours de matchs entre équipes de même force. T0 gagne tous ses matchs 4-0,
     * les autres font match nul.
     */
    private static List<WeightedGame> season() {
        Map<String, Integer> recency = new HashMap<>();
        List<WeightedGame> games = new ArrayList<>();
        for (int d = 0; d < 120; d++) {
            int home = d % TEAMS;
            int away = (d * 3 + 1) % TEAMS;
            if (home == away) continue;
            int margin = home == 0 ? 4 : away == 0 ? -4 : 0;
            LocalDate date = TODAY.minusDays(d + 1L);
            String id = String.format("s%03d", d);
            games.add(game(id, date, "T" + home, "T" + away, "T" + home, margin, recency));
            games.add(game(id, date, "T" + away, "T" + home, "T" + home, -margin, recency));
        }
        return games;
    }

    private static void addGames(List<WeightedGame> games, Map<String, Integer> recency,
                                 String prefix, int count, LocalDate date) {
        for (int k = 0; k < count; k++) {
            int home = k % TEAMS;
            int away = (k + 1) % TEAMS;
            String id = prefix + "-" + k;
            games.add(game(id, date, "T" + home, "T" + away, "T" + home, 1, recency));
            games.add(game(id, date, "T" + away, "T" + home, "T" + home, -1, recency));
        }
    }

    private static WeightedGame game(String id, LocalDate date, String team, String opponent, String home,
                                     int margin, Map<String, Integer> recency) {
        int rank = recency.merge(team, 1, Integer::sum);
        int goalsFor = Math.max(margin, 0);
        int goalsAgainst = Math.max(-margin, 0);
        return WeightedGame.builder()
                .gameId(id)
                .date(date)
                .teamId(team)
                .opponentId(opponent)
                .cohort(U14_MALE)
                .opponentAge(14)
                .opponentGender("male")
                .homeTeamId(home)
                .rawGoalsFor(goalsFor)
                .rawGoalsAgainst(goalsAgainst)
                .goalsFor(goalsFor)
                .goalsAgainst(goalsAgainst)
                .goalDiff(margin)
                .rankRecency(rank)
                .weight(1.0 / 30)
                .daysSinceGame(ChronoUnit.DAYS.between(date, TODAY))
                .build();
    }
}
