package com.tony.powerRank.engine;

import com.tony.powerRank.config.RankingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Calcule le SCF de chaque équipe à partir des états de ses adversaires.
 * Une équipe qui ne joue que dans son état (bulle fermée) obtient un SCF bas,
 * ce qui amortit son SOS vers 0.5.
 */
@Service
@Slf4j
public class ScheduleConnectivityCalculator {

    public static final String UNKNOWN = "UNKNOWN";

    // Bonus de diversité régionale : +0.1 par région supplémentaire, plafonné.
    // Les états seuls plafonnent à 1 - REGION_BONUS_MAX : une seule région ne sature jamais le SCF.
    private static final double REGION_BONUS_STEP = 0.1;
    private static final double REGION_BONUS_MAX = 0.2;

    // Découpage Census (9 divisions)
    public static final Map<String, String> STATE_TO_REGION = buildRegions();

    private static Map<String, String> buildRegions() {
        Map<String, String> m = new HashMap<>();
        put(m, "pacific", "CA", "OR", "WA", "AK", "HI");
        put(m, "mountain", "MT", "ID", "WY", "NV", "UT", "CO", "AZ", "NM");
        put(m, "west_north_central", "ND", "SD", "NE", "KS", "MN", "IA", "MO");
        put(m, "west_south_central", "TX", "OK", "AR", "LA");
        put(m, "east_north_central", "WI", "MI", "IL", "IN", "OH");
        put(m, "east_south_central", "KY", "TN", "MS", "AL");
        put(m, "south_atlantic", "WV", "VA", "MD", "DE", "DC", "NC", "SC", "GA", "FL");
        put(m, "middle_atlantic", "NY", "PA", "NJ");
        put(m, "new_england", "CT", "RI", "MA", "VT", "NH", "ME");
        return Map.copyOf(m);
    }

    private static void put(Map<String, String> m, String region, String... states) {
        for (String s : states) m.put(s, region);
    }

    /**
     * @param games      matchs (perspective) de la cohorte
     * @param teamStates équipe → code état ; vide = SCF désactivé pour ce passage
     * @return profil par équipe de la cohorte, dans l'ordre des équipes
     */
    public Map<String, ConnectivityProfile> compute(List<WeightedGame> games,
                                                    Map<String, String> teamStates,
                                                    RankingConfig config) {
        // équipe → (adversaire → nb de matchs), ordre stable
        Map<String, Map<String, Integer>> schedule = new TreeMap<>();
        for (WeightedGame g : games) {
            schedule.computeIfAbsent(g.getTeamId(), k -> new TreeMap<>())
                    .merge(g.getOpponentId(), 1, Integer::sum);
        }

        Map<String, ConnectivityProfile> result = new LinkedHashMap<>();
        if (!config.isScfEnabled() || teamStates == null || teamStates.isEmpty()) {
            schedule.keySet().forEach(t -> result.put(t, ConnectivityProfile.neutral()));
            return result;
        }

        for (Map.Entry<String, Map<String, Integer>> entry : schedule.entrySet()) {
            result.put(entry.getKey(), profile(entry.getKey(), entry.getValue(), teamStates, config));
        }

        long isolated = result.values().stream().filter(ConnectivityProfile::isolated).count();
        log.debug("🌐 SCF : {} équipes, {} isolées", result.size(), isolated);
        return result;
    }

    ConnectivityProfile profile(String teamId, Map<String, Integer> opponents,
                                Map<String, String> teamStates, RankingConfig config) {
        String homeState = stateOf(teamStates, teamId);
        Set<String> states = new HashSet<>();
        Set<String> regions = new HashSet<>();
        int bridgeGames = 0;

        for (Map.Entry<String, Integer> opp : opponents.entrySet()) {
            String oppState = stateOf(teamStates, opp.getKey());
            if (UNKNOWN.equals(oppState)) continue;
            states.add(oppState);
            String region = STATE_TO_REGION.get(oppState);
            if (region != null) regions.add(region);
            if (!oppState.equals(homeState)) {
                bridgeGames += opp.getValue();
            }
        }

        double diversity = Math.min(states.size() / config.getScfDiversityDivisor(), 1.0);
        double regionBonus = regions.size() > 1
                ? Math.min((regions.size() - 1) * REGION_BONUS_STEP, REGION_BONUS_MAX)
                : 0.0;
        double scf = Math.max(config.getScfFloor(),
                Math.min(1.0, diversity * (1.0 - REGION_BONUS_MAX) + regionBonus));

        boolean isolated = bridgeGames < config.getMinBridgeGames()
                || states.size() < config.getScfMinUniqueStates();
        return new ConnectivityProfile(scf, states.size(), regions.size(), bridgeGames, isolated);
    }

    private static String stateOf(Map<String, String> teamStates, String teamId) {
        if (teamStates == null) return UNKNOWN;
        String state = teamStates.get(teamId);
        return state == null || state.isBlank() ? UNKNOWN : state.trim().toUpperCase();
    }
}
