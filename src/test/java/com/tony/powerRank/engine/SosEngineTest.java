package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.model.SampleFlag;
import com.tony.powerRank.model.TeamCohortStat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.tony.powerRank.engine.GameFixtures.edge;
import static com.tony.powerRank.engine.GameFixtures.team;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SosEngineTest {

    private SosEngine sosEngine;
    private RankingConfig config;

    @BeforeEach
    void setUp() {
        sosEngine = new SosEngine(new ScheduleConnectivityCalculator(), new ComponentFinder());
        config = RankingConfig.defaults();
    }

    @Test
    @DisplayName("Devrait donner le même SOS à des calendriers identiques et un SOS plus haut contre des adversaires plus forts")
    void shouldRewardHarderSchedule() {
        // ARRANGE : A, B, C jouent O1..O5 (0.3), D joue P1..P5 (0.8)
        List<TeamCohortStat> cohort = new ArrayList<>();
        List<WeightedGame> games = new ArrayList<>();
        for (String id : List.of("A", "B", "C", "D")) cohort.add(team(id, 0.5, 12));
        for (int k = 1; k <= 5; k++) {
            cohort.add(team("O" + k, 0.3, 12));
            cohort.add(team("P" + k, 0.8, 12));
            for (String id : List.of("A", "B", "C")) {
                games.add(edge(id + "-O" + k, id, "O" + k, k, 1));
            }
            games.add(edge("D-P" + k, "D", "P" + k, k, 1));
        }

        // ACT
        Map<String, TeamCohortStat> out = byId(sosEngine.compute(cohort, games, Map.of(), Map.of(), config).teams());

        // ASSERT
        assertThat(out.get("A").getSos()).isEqualTo(out.get("B").getSos()).isEqualTo(out.get("C").getSos());
        assertThat(out.get("A").getSos()).isCloseTo(0.3, within(1e-9));
        assertThat(out.get("D").getSos()).isCloseTo(0.8, within(1e-9));
        assertThat(out.get("D").getSos()).isGreaterThan(out.get("A").getSos());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 10})
    @DisplayName("Devrait contenir une bulle fermée sous 0.8 quel que soit le nombre de passes")
    void shouldDampClosedBubble(int iterations) {
        // ARRANGE : trois équipes d'Idaho très fortes qui ne jouent qu'entre elles
        List<TeamCohortStat> cohort = List.of(team("A", 0.95, 12), team("B", 0.95, 12), team("C", 0.95, 12));
        List<WeightedGame> games = List.of(
                edge("ab", "A", "B", 5, 1), edge("ab", "B", "A", 5, -1),
                edge("bc", "B", "C", 6, 1), edge("bc", "C", "B", 6, -1),
                edge("ca", "C", "A", 7, 1), edge("ca", "A", "C", 7, -1));
        Map<String, String> states = Map.of("A", "ID", "B", "ID", "C", "ID");
        RankingConfig damped = config.toBuilder().sosIterations(iterations).sosTransitivityLambda(0.5).build();
        RankingConfig undamped = damped.toBuilder()
                .scfEnabled(false)
                .pagerankDampeningEnabled(false)
                .isolationPenaltyEnabled(false)
                .build();

        // ACT
        List<TeamCohortStat> withDamping = sosEngine.compute(cohort, games, Map.of(), states, damped).teams();
        List<TeamCohortStat> withoutDamping = sosEngine.compute(cohort, games, Map.of(), states, undamped).teams();

        // ASSERT
        assertThat(withDamping).allSatisfy(t -> {
            assertThat(t.getSos()).isLessThanOrEqualTo(0.8);
            assertThat(t.isIsolated()).isTrue();
            assertThat(t.getScf()).isCloseTo(0.4, within(1e-12));
        });
        assertThat(withoutDamping).allSatisfy(t -> assertThat(t.getSos()).isGreaterThan(0.8));
    }

    @Test
    @DisplayName("Devrait utiliser la force globale puis la base des non classés pour les adversaires hors cohorte")
    void shouldFallBackForUnknownOpponents() {
        // ARRANGE
        List<TeamCohortStat> cohort = List.of(team("A", 0.5, 12), team("B", 0.5, 12));
        List<WeightedGame> games = List.of(edge("a1", "A", "GHOST", 3, 0), edge("b1", "B", "U15-TEAM", 3, 0));

        // ACT
        SosEngine.SosResult result = sosEngine.compute(cohort, games, Map.of("U15-TEAM", 0.9), Map.of(), config);

        // ASSERT
        Map<String, TeamCohortStat> out = byId(result.teams());
        assertThat(out.get("A").getSos()).isCloseTo(config.getUnrankedSosBase(), within(1e-12));
        assertThat(out.get("B").getSos()).isCloseTo(0.9, within(1e-12));
        assertThat(result.unrankedOpponents()).isEqualTo(1);
    }

    @Test
    @DisplayName("Devrait ne garder que les deux matchs les plus pondérés par adversaire")
    void shouldCapRepeatedOpponents() {
        // ARRANGE : 5 matchs contre R (0.9), 1 contre S (0.1), même date et même écart
        List<TeamCohortStat> cohort = List.of(team("A", 0.5, 12), team("R", 0.9, 12), team("S", 0.1, 12));
        List<WeightedGame> games = new ArrayList<>();
        for (int i = 0; i < 5; i++) games.add(edge("r" + i, "A", "R", 4, 1));
        games.add(edge("s0", "A", "S", 4, 1));

        // ACT
        SosEngine.SosResult result = sosEngine.compute(cohort, games, Map.of(), Map.of(), config);

        // ASSERT
        assertThat(result.edgesUsed()).isEqualTo(3);
        assertThat(byId(result.teams()).get("A").getSos()).isCloseTo((2 * 0.9 + 0.1) / 3, within(1e-9));
    }

    @Test
    @DisplayName("Devrait normaliser le SOS à l'intérieur de chaque composante connexe")
    void shouldNormalizePerComponent() {
        // ARRANGE : deux écosystèmes déconnectés, adversaires hors cohorte
        RankingConfig small = config.toBuilder().minComponentSizeForFullSos(1).minGamesForTopSos(1).build();
        List<TeamCohortStat> cohort = List.of(team("A", 0.5, 12), team("B", 0.5, 12),
                team("C", 0.5, 12), team("D", 0.5, 12));
        List<WeightedGame> games = List.of(
                edge("a1", "A", "X1", 3, 0), edge("a2", "A", "Z", 3, 0),
                edge("b1", "B", "X2", 3, 0), edge("b2", "B", "Z", 3, 0),
                edge("c1", "C", "Y1", 3, 0), edge("c2", "C", "W", 3, 0),
                edge("d1", "D", "Y2", 3, 0), edge("d2", "D", "W", 3, 0));
        Map<String, Double> global = Map.of("X1", 0.2, "X2", 0.6, "Z", 0.5, "Y1", 0.7, "Y2", 0.9, "W", 0.8);

        // ACT
        Map<String, TeamCohortStat> out = byId(sosEngine.compute(cohort, games, global, Map.of(), small).teams());

        // ASSERT
        assertThat(out.get("A").getSosNorm()).isEqualTo(0.0);
        assertThat(out.get("B").getSosNorm()).isEqualTo(1.0);
        assertThat(out.get("C").getSosNorm()).isEqualTo(0.0);
        assertThat(out.get("D").getSosNorm()).isEqualTo(1.0);
        assertThat(out.get("A").getComponentId()).isEqualTo(out.get("B").getComponentId());
        assertThat(out.get("A").getComponentId()).isNotEqualTo(out.get("C").getComponentId());
        assertThat(out.get("C").getComponentSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Devrait ramener vers 0.5 le SOS normalisé des équipes avec peu de matchs")
    void shouldShrinkLowSampleTeams() {
        // ARRANGE
        RankingConfig fullSize = config.toBuilder().minComponentSizeForFullSos(1).build();
        List<TeamCohortStat> cohort = List.of(team("A", 0.5, 12), team("B", 0.5, 5));
        List<WeightedGame> games = List.of(edge("a1", "A", "B", 3, 0), edge("b1", "B", "X", 3, 0),
                edge("b2", "B", "A", 3, 0));

        // ACT
        Map<String, TeamCohortStat> out = byId(sosEngine.compute(cohort, games, Map.of("X", 0.9), Map.of(), fullSize).teams());

        // ASSERT : B a le SOS le plus haut (1.0 avant shrink), facteur (5/10)^2
        assertThat(out.get("B").getSampleFlag()).isEqualTo(SampleFlag.LOW_SAMPLE);
        assertThat(out.get("B").getSosNorm()).isCloseTo(0.5 + 0.25 * 0.5, within(1e-12));
        assertThat(out.get("B").getSosRank()).isNull();
        assertThat(out.get("A").getSampleFlag()).isEqualTo(SampleFlag.OK);
        assertThat(out.get("A").getSosRank()).isEqualTo(1);
    }

    @Test
    @DisplayName("Devrait toujours produire des SOS dans [0,1]")
    void shouldStayWithinUnitInterval() {
        // ARRANGE : graphe aléatoire à graine fixe
        Random random = new Random(11);
        List<TeamCohortStat> cohort = new ArrayList<>();
        for (int i = 0; i < 40; i++) cohort.add(team("T" + i, random.nextDouble(), 1 + random.nextInt(25)));
        List<WeightedGame> games = new ArrayList<>();
        Map<String, String> states = new HashMap<>();
        String[] pool = {"CA", "ID", "NY", "TX", "FL"};
        for (int i = 0; i < 40; i++) states.put("T" + i, pool[random.nextInt(pool.length)]);
        for (int g = 0; g < 300; g++) {
            int a = random.nextInt(40);
            int b = random.nextInt(40);
            if (a == b) continue;
            long days = random.nextInt(300);
            int diff = random.nextInt(13) - 6;
            games.add(edge("g" + g, "T" + a, "T" + b, days, diff));
            games.add(edge("g" + g, "T" + b, "T" + a, days, -diff));
        }
        RankingConfig iterative = config.toBuilder().sosIterations(4).sosTransitivityLambda(0.3).build();

        // ACT
        List<TeamCohortStat> out = sosEngine.compute(cohort, games, Map.of(), states, iterative).teams();

        // ASSERT
        assertThat(out).hasSize(40).allSatisfy(t -> {
            assertThat(t.getSos()).isBetween(0.0, 1.0);
            assertThat(t.getSosRaw()).isBetween(0.0, 1.0);
            assertThat(t.getSosNorm()).isBetween(0.0, 1.0);
        });
    }

    private static Map<String, TeamCohortStat> byId(List<TeamCohortStat> teams) {
        Map<String, TeamCohortStat> map = new HashMap<>();
        teams.forEach(t -> map.put(t.getTeamId(), t));
        return map;
    }
}
