package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.model.GameRecord;
import com.tony.powerRank.model.TeamCohortStat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.tony.powerRank.engine.GameFixtures.TODAY;
import static com.tony.powerRank.engine.GameFixtures.match;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureAggregatorTest {

    private FeatureAggregator aggregator;
    private RankingConfig config;

    @BeforeEach
    void setUp() {
        aggregator = new FeatureAggregator();
        config = RankingConfig.defaults();
    }

    @Test
    @DisplayName("Devrait plafonner aux 30 matchs les plus récents avec des poids normalisés")
    void shouldCapToMostRecentGames() {
        // ARRANGE : 35 victoires 2-1 de A contre B
        List<GameRecord> records = new ArrayList<>();
        for (int i = 0; i < 35; i++) {
            records.addAll(match(String.format("g%02d", i), TODAY.minusDays(i + 1L), "A", "B", 2, 1));
        }

        // ACT
        AggregationResult result = aggregator.aggregate(records, TODAY, config);

        // ASSERT
        TeamCohortStat a = find(result.teams(), "A");
        assertThat(a.getGamesPlayed()).isEqualTo(30);
        assertThat(a.getGamesLast180Days()).isEqualTo(35);
        assertThat(a.getLastGameDate()).isEqualTo(TODAY.minusDays(1));
        assertThat(a.getOffRaw()).isCloseTo(2.0, within(1e-9));
        assertThat(a.getSadRaw()).isCloseTo(1.0, within(1e-9));
        assertThat(a.getDefRaw()).isCloseTo(1.0 / 1.25, within(1e-9));

        List<WeightedGame> aGames = result.games().stream().filter(g -> g.getTeamId().equals("A")).toList();
        assertThat(aGames).hasSize(30);
        assertThat(aGames.get(0).getRankRecency()).isEqualTo(1);
        assertThat(aGames.get(0).getWeight()).isGreaterThan(aGames.get(29).getWeight());
        assertThat(aGames.stream().mapToDouble(WeightedGame::getWeight).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(result.report().accepted()).isEqualTo(70);
    }

    @Test
    @DisplayName("Devrait compter les lignes incomplètes ou hors fenêtre sans échouer")
    void shouldCountSkippedRows() {
        // ARRANGE
        GameRecord ok = match("ok", TODAY.minusDays(3), "A", "B", 1, 0).get(0);
        List<GameRecord> records = List.of(
                ok,
                ok.toBuilder().gameId("noScore").goalsFor(null).build(),
                ok.toBuilder().gameId("noDate").date(null).build(),
                ok.toBuilder().gameId("noTeam").teamId(null).build(),
                ok.toBuilder().gameId("noAge").age(null).build(),
                ok.toBuilder().gameId("old").date(TODAY.minusDays(400)).build(),
                ok.toBuilder().gameId("future").date(TODAY.plusDays(2)).build());

        // ACT
        AggregationResult result = aggregator.aggregate(records, TODAY, config);

        // ASSERT
        assertThat(result.report().accepted()).isEqualTo(1);
        assertThat(result.report().skippedMissingScore()).isEqualTo(1);
        assertThat(result.report().skippedMissingDate()).isEqualTo(1);
        assertThat(result.report().skippedUnresolvedTeam()).isEqualTo(2);
        assertThat(result.report().skippedOutOfWindow()).isEqualTo(2);
        assertThat(result.teams()).hasSize(1);
    }

    @Test
    @DisplayName("Devrait plafonner l'écart de buts sans toucher au score brut")
    void shouldCapGoalDifference() {
        // ACT
        AggregationResult result = aggregator.aggregate(match("big", TODAY.minusDays(2), "A", "B", 12, 0), TODAY, config);

        // ASSERT
        WeightedGame a = result.games().stream().filter(g -> g.getTeamId().equals("A")).findFirst().orElseThrow();
        WeightedGame b = result.games().stream().filter(g -> g.getTeamId().equals("B")).findFirst().orElseThrow();
        assertThat(a.getGoalDiff()).isEqualTo(6.0);
        assertThat(b.getGoalDiff()).isEqualTo(-6.0);
        assertThat(a.rawMargin()).isEqualTo(12);
        assertThat(a.isHomePerspective()).isTrue();
        assertThat(b.isHomePerspective()).isFalse();
    }

    @Test
    @DisplayName("Devrait valoriser les buts marqués contre un adversaire plus fort")
    void shouldAdjustForOpponentStrength() {
        // ARRANGE : A et B ont le même score, A contre un fort, B contre un faible
        List<GameRecord> records = new ArrayList<>();
        records.addAll(match("g1", TODAY.minusDays(5), "A", "S", 2, 1));
        records.addAll(match("g2", TODAY.minusDays(5), "B", "W", 2, 1));
        AggregationResult agg = aggregator.aggregate(records, TODAY, config);
        List<TeamCohortStat> ab = agg.teams().stream()
                .filter(t -> t.getTeamId().equals("A") || t.getTeamId().equals("B"))
                .toList();
        Map<String, Double> strength = Map.of("A", 0.5, "B", 0.5, "S", 0.9, "W", 0.1);

        // ACT
        List<TeamCohortStat> adjusted = aggregator.reaggregate(ab, agg.games(), strength, config);

        // ASSERT
        TeamCohortStat a = find(adjusted, "A");
        TeamCohortStat b = find(adjusted, "B");
        assertThat(a.getOffRaw()).isCloseTo(2.0 * 1.6, within(1e-9));
        assertThat(b.getOffRaw()).isCloseTo(2.0 * 0.4, within(1e-9));
        assertThat(a.getSadRaw()).isLessThan(b.getSadRaw());
        assertThat(a.getDefRaw()).isGreaterThan(b.getDefRaw());
    }

    private static TeamCohortStat find(List<TeamCohortStat> teams, String id) {
        return teams.stream().filter(t -> t.getTeamId().equals(id)).findFirst().orElseThrow();
    }
}
