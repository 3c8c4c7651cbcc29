package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.model.SampleFlag;
import com.tony.powerRank.model.TeamCohortStat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Étape 3 : Strength of Schedule.
 * <p>
 * 1. Poids par match : récence × amortissement des écarts (blowouts).<br>
 * 2. Plafond de répétition par paire (équipe, adversaire).<br>
 * 3. Passe directe puis passes itératives (terme transitif à lambda).<br>
 * 4. Amortissement des bulles régionales (SCF + damping type PageRank) à chaque passe.<br>
 * 5. Normalisation par composante connexe, puis shrinkage des petits échantillons.
 * <p>
 * Travaille sur UNE cohorte.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SosEngine {

    private static final double GP_SOS_CORRELATION_WARN = 0.10;

    private static final Comparator<SosEdge> STRONGEST_FIRST = Comparator
            .comparingDouble(SosEdge::weight).reversed()
            .thenComparing(SosEdge::date, Comparator.reverseOrder())
            .thenComparing(SosEdge::gameId);

    private final ScheduleConnectivityCalculator connectivityCalculator;
    private final ComponentFinder componentFinder;

    record SosEdge(String opponentId, double weight, LocalDate date, String gameId) {
    }

    public record SosResult(List<TeamCohortStat> teams, int edgesUsed, int unrankedOpponents) {
    }

    /**
     * @param cohort         équipes de la cohorte (absStrength déjà calculée)
     * @param games          matchs (perspective) de ces équipes
     * @param globalStrength force des équipes des autres cohortes (adversaires inter-âge)
     * @param teamStates     équipe → état, pour le SCF
     */
    public SosResult compute(List<TeamCohortStat> cohort,
                             List<WeightedGame> games,
                             Map<String, Double> globalStrength,
                             Map<String, String> teamStates,
                             RankingConfig config) {
        int n = cohort.size();
        if (n == 0) return new SosResult(List.of(), 0, 0);
        String label = cohort.get(0).getCohort().toString();

        Map<String, Integer> index = new HashMap<>();
        List<String> teamIds = new ArrayList<>(n);
        Map<String, Double> local = new HashMap<>();
        for (TeamCohortStat t : cohort) {
            index.put(t.getTeamId(), teamIds.size());
            teamIds.add(t.getTeamId());
            local.put(t.getTeamId(), t.getAbsStrength());
        }
        List<WeightedGame> cohortGames = games.stream().filter(g -> index.containsKey(g.getTeamId())).toList();

        // 1-2. Arêtes pondérées + plafond de répétition
        List<List<SosEdge>> edges = buildEdges(cohortGames, index, n, config);
        int edgesUsed = edges.stream().mapToInt(List::size).sum();

        // Force de base : cohorte → autres cohortes → UNRANKED_SOS_BASE
        Set<String> unranked = new HashSet<>();
        double[][] oppStrength = new double[n][];
        for (int i = 0; i < n; i++) {
            List<SosEdge> list = edges.get(i);
            oppStrength[i] = new double[list.size()];
            for (int j = 0; j < list.size(); j++) {
                String opp = list.get(j).opponentId();
                Double s = local.get(opp);
                if (s == null) s = globalStrength.get(opp);
                if (s == null) {
                    unranked.add(opp);
                    s = config.getUnrankedSosBase();
                }
                oppStrength[i][j] = s;
            }
        }
        if (!unranked.isEmpty()) {
            log.warn("⚠️ [{}] {} adversaires sans force connue -> base {}", label, unranked.size(), config.getUnrankedSosBase());
        }

        // 3. Passe directe (fixe sur les forces de base)
        double[] direct = new double[n];
        for (int i = 0; i < n; i++) {
            direct[i] = weightedMean(edges.get(i), oppStrength[i], config.getUnrankedSosBase());
        }

        // 4. Connectivité + itérations ; l'amortissement est appliqué à chaque passe
        Map<String, ConnectivityProfile> profiles = connectivityCalculator.compute(cohortGames, teamStates, config);
        ConnectivityProfile[] profileOf = new ConnectivityProfile[n];
        for (int i = 0; i < n; i++) {
            profileOf[i] = profiles.getOrDefault(teamIds.get(i), ConnectivityProfile.neutral());
        }

        double[] raw = direct.clone();
        double[] sos = dampAll(raw, profileOf, config);
        logPass(label, 1, sos);
        for (int pass = 2; pass <= config.getSosIterations(); pass++) {
            raw = nextPass(direct, sos, edges, oppStrength, index, config);
            sos = dampAll(raw, profileOf, config);
            logPass(label, pass, sos);
        }

        // 5. Normalisation par composante connexe
        ComponentFinder.Components components = componentFinder.find(teamIds, cohortGames);
        double[] sosNorm = normalizeByComponent(sos, teamIds, components, config);

        // 6. Shrinkage faible échantillon
        SampleFlag[] flags = new SampleFlag[n];
        double[] gp = new double[n];
        for (int i = 0; i < n; i++) {
            int played = cohort.get(i).getGamesPlayed();
            gp[i] = played;
            flags[i] = SampleFlag.OK;
            if (played < config.getMinGamesForTopSos()) {
                double factor = Math.pow((double) played / config.getMinGamesForTopSos(), 2);
                sosNorm[i] = StatMath.clipUnit(StatMath.MIDPOINT + factor * (sosNorm[i] - StatMath.MIDPOINT));
                flags[i] = SampleFlag.LOW_SAMPLE;
            }
        }
        checkGpSosCorrelation(label, gp, sosNorm);

        // 7. Rang SOS (équipes avec assez de matchs)
        Integer[] sosRank = rankSos(cohort, sosNorm, config);

        List<TeamCohortStat> out = new ArrayList<>(n);
        int isolated = 0;
        for (int i = 0; i < n; i++) {
            ConnectivityProfile p = profileOf[i];
            if (p.isolated()) isolated++;
            String teamId = teamIds.get(i);
            out.add(cohort.get(i).toBuilder()
                    .sosRaw(StatMath.clipUnit(raw[i]))
                    .sos(sos[i])
                    .sosNorm(sosNorm[i])
                    .sosRank(sosRank[i])
                    .scf(p.scf())
                    .bridgeGames(p.bridgeGames())
                    .uniqueOpponentStates(p.uniqueStates())
                    .isolated(p.isolated())
                    .componentId(components.componentOf().get(teamId))
                    .componentSize(components.sizeOf(teamId))
                    .sampleFlag(flags[i])
                    .build());
        }
        log.info("🔗 [{}] SOS : {} équipes, {} composantes, {} isolées, {} arêtes", label, n, components.count(), isolated, edgesUsed);
        return new SosResult(out, edgesUsed, unranked.size());
    }

    List<List<SosEdge>> buildEdges(List<WeightedGame> games, Map<String, Integer> index, int n, RankingConfig config) {
        // (équipe → adversaire → arêtes), ordre stable
        List<Map<String, List<SosEdge>>> byPair = new ArrayList<>(n);
        for (int i = 0; i < n; i++) byPair.add(new TreeMap<>());

        for (WeightedGame g : games) {
            double wGame = Math.exp(-config.getRecencyDecayRate() * g.getDaysSinceGame());
            double kAdapt = Math.exp(-config.getAdaptK() * Math.abs(g.getGoalDiff()));
            byPair.get(index.get(g.getTeamId()))
                    .computeIfAbsent(g.getOpponentId(), k -> new ArrayList<>())
                    .add(new SosEdge(g.getOpponentId(), wGame * kAdapt, g.getDate(), g.getGameId()));
        }

        List<List<SosEdge>> edges = new ArrayList<>(n);
        for (Map<String, List<SosEdge>> pairs : byPair) {
            List<SosEdge> kept = new ArrayList<>();
            for (List<SosEdge> pair : pairs.values()) {
                pair.sort(STRONGEST_FIRST);
                kept.addAll(pair.subList(0, Math.min(pair.size(), config.getSosRepeatCap())));
            }
            edges.add(kept);
        }
        return edges;
    }

    /**
     * Une passe : (graphe, forces précédentes) → nouvelles valeurs brutes.
     * Le terme transitif ne suit que les arêtes de l'équipe : il ne traverse jamais de composante.
     */
    double[] nextPass(double[] direct, double[] previous, List<List<SosEdge>> edges,
                      double[][] oppStrength, Map<String, Integer> index, RankingConfig config) {
        double lambda = config.getSosTransitivityLambda();
        double[] next = new double[direct.length];
        for (int i = 0; i < direct.length; i++) {
            if (lambda == 0.0) {
                next[i] = direct[i];
                continue;
            }
            List<SosEdge> list = edges.get(i);
            double[] neighbour = new double[list.size()];
            for (int j = 0; j < list.size(); j++) {
                Integer opp = index.get(list.get(j).opponentId());
                neighbour[j] = opp != null ? previous[opp] : oppStrength[i][j];
            }
            double transitive = weightedMean(list, neighbour, config.getUnrankedSosBase());
            next[i] = (1 - lambda) * direct[i] + lambda * transitive;
        }
        return next;
    }

    double[] dampAll(double[] raw, ConnectivityProfile[] profiles, RankingConfig config) {
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = damp(raw[i], profiles[i], config);
        }
        return out;
    }

    /**
     * Amortissement vers 0.5 : SCF pour tous, damping PageRank (alpha) en plus pour les isolés,
     * puis plafond d'isolement. Résultat dans [0,1].
     */
    double damp(double value, ConnectivityProfile profile, RankingConfig config) {
        double v = StatMath.MIDPOINT + profile.scf() * (value - StatMath.MIDPOINT);
        if (profile.isolated() && config.isPagerankDampeningEnabled()) {
            v = StatMath.MIDPOINT + config.getPagerankAlpha() * (v - StatMath.MIDPOINT);
        }
        if (config.isIsolationPenaltyEnabled() && profile.isolated()
                && profile.bridgeGames() < config.getMinBridgeGames()) {
            v = Math.min(v, config.getIsolationSosCap());
        }
        return StatMath.clipUnit(v);
    }

    /**
     * Percentile étalé [0,1] à l'intérieur de chaque composante.
     * Les petites composantes sont ramenées vers 0.5 (facteur taille / seuil).
     */
    double[] normalizeByComponent(double[] sos, List<String> teamIds,
                                  ComponentFinder.Components components, RankingConfig config) {
        Map<Integer, List<Integer>> members = new TreeMap<>();
        for (int i = 0; i < teamIds.size(); i++) {
            members.computeIfAbsent(components.componentOf().get(teamIds.get(i)), k -> new ArrayList<>()).add(i);
        }

        double[] out = new double[sos.length];
        for (List<Integer> idx : members.values()) {
            double[] values = idx.stream().mapToDouble(i -> sos[i]).toArray();
            double[] pct = StatMath.spreadPercentile(values);
            double factor = Math.min(1.0, (double) idx.size() / config.getMinComponentSizeForFullSos());
            for (int k = 0; k < idx.size(); k++) {
                out[idx.get(k)] = StatMath.clipUnit(StatMath.MIDPOINT + factor * (pct[k] - StatMath.MIDPOINT));
            }
        }
        return out;
    }

    private Integer[] rankSos(List<TeamCohortStat> cohort, double[] sosNorm, RankingConfig config) {
        Integer[] ranks = new Integer[cohort.size()];
        List<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < cohort.size(); i++) {
            if (cohort.get(i).getGamesPlayed() >= config.getMinGamesForSosRank()) eligible.add(i);
        }
        if (eligible.isEmpty()) return ranks;
        // Rang "min" sur les valeurs négées = rang décroissant
        double[] negated = eligible.stream().mapToDouble(i -> -sosNorm[i]).toArray();
        double[] r = StatMath.minRanks(negated);
        for (int k = 0; k < eligible.size(); k++) {
            ranks[eligible.get(k)] = (int) r[k];
        }
        return ranks;
    }

    private void checkGpSosCorrelation(String label, double[] gp, double[] sosNorm) {
        if (gp.length < 3 || StatMath.std(gp) == 0 || StatMath.std(sosNorm) == 0) return;
        double r = new PearsonsCorrelation().correlation(gp, sosNorm);
        if (Math.abs(r) > GP_SOS_CORRELATION_WARN) {
            log.warn("⚠️ [{}] Corrélation matchs joués / SOS élevée : r = {}", label, String.format("%.3f", r));
        } else {
            log.debug("[{}] Corrélation matchs joués / SOS : r = {}", label, String.format("%.3f", r));
        }
    }

    private static double weightedMean(List<SosEdge> edges, double[] values, double fallback) {
        double num = 0;
        double den = 0;
        for (int j = 0; j < edges.size(); j++) {
            num += values[j] * edges.get(j).weight();
            den += edges.get(j).weight();
        }
        return den > 0 ? num / den : fallback;
    }

    private void logPass(String label, int pass, double[] sos) {
        if (!log.isDebugEnabled()) return;
        double[] sorted = sos.clone();
        Arrays.sort(sorted);
        log.debug("🔄 [{}] Passe SOS {} : moyenne {} min {} max {}", label, pass,
                String.format("%.3f", StatMath.mean(sos)), String.format("%.3f", sorted[0]),
                String.format("%.3f", sorted[sorted.length - 1]));
    }
}
