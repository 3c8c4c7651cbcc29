package com.tony.powerRank.engine;

import com.tony.powerRank.model.GameRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Entrée d'un passage du moteur : un passage est une fonction pure de (matchs, config, today).
 *
 * @param teamStates     équipe → code état (SCF) ; peut être vide
 * @param providerFilter provider chargé, null = tous ; fait partie de la clé de cache
 */
public record RankingInput(List<GameRecord> games,
                           Map<String, String> teamStates,
                           LocalDate today,
                           String providerFilter) {

    public RankingInput {
        games = games == null ? List.of() : games;
        teamStates = teamStates == null ? Map.of() : teamStates;
    }
}
