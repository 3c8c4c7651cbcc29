package com.tony.powerRank.service;

import com.tony.powerRank.model.Game;
import com.tony.powerRank.model.GameRecord;
import com.tony.powerRank.model.Team;
import com.tony.powerRank.model.dto.IngestionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Game (entité) → deux GameRecord, un par perspective.
 * Les matchs incomplets sont comptés dans l'IngestionReport, jamais rejetés en erreur.
 */
@Component
@Slf4j
public class GameRecordMapper {

    public record MappingResult(List<GameRecord> records, IngestionReport report) {
    }

    public MappingResult toRecords(List<Game> games) {
        List<GameRecord> records = new ArrayList<>(games.size() * 2);
        int accepted = 0;
        int missingScore = 0;
        int missingDate = 0;
        int unresolved = 0;

        for (Game g : games) {
            if (!isResolved(g.getHomeTeam()) || !isResolved(g.getAwayTeam())) {
                unresolved++;
                continue;
            }
            if (g.getGameDate() == null) {
                missingDate++;
                continue;
            }
            if (!g.isPlayed()) {
                missingScore++;
                continue;
            }
            accepted++;
            records.add(perspective(g, g.getHomeTeam(), g.getAwayTeam(), g.getHomeScore(), g.getAwayScore()));
            records.add(perspective(g, g.getAwayTeam(), g.getHomeTeam(), g.getAwayScore(), g.getHomeScore()));
        }

        IngestionReport report = new IngestionReport(accepted, missingScore, missingDate, unresolved, 0);
        if (report.skipped() > 0) {
            log.warn("⚠️ {} matchs ignorés (score manquant : {}, date manquante : {}, équipe non résolue : {})",
                    report.skipped(), missingScore, missingDate, unresolved);
        }
        return new MappingResult(records, report);
    }

    /**
     * Équipe → code état, pour le SCF. Les équipes sans état sont absentes.
     */
    public Map<String, String> teamStates(List<Game> games) {
        Map<String, String> states = new TreeMap<>();
        for (Game g : games) {
            putState(states, g.getHomeTeam());
            putState(states, g.getAwayTeam());
        }
        return states;
    }

    private GameRecord perspective(Game g, Team team, Team opponent, Integer goalsFor, Integer goalsAgainst) {
        return GameRecord.builder()
                .gameId(g.getGameUid())
                .date(g.getGameDate())
                .teamId(team.getId())
                .opponentId(opponent.getId())
                .age(team.getAge())
                .gender(team.getGender())
                .opponentAge(opponent.getAge())
                .opponentGender(opponent.getGender())
                .goalsFor(goalsFor)
                .goalsAgainst(goalsAgainst)
                .homeTeamId(g.getHomeTeam().getId())
                .build();
    }

    private static boolean isResolved(Team team) {
        return team != null && team.getId() != null && team.getAge() != null && team.getGender() != null;
    }

    private static void putState(Map<String, String> states, Team team) {
        if (team != null && team.getId() != null && team.getStateCode() != null && !team.getStateCode().isBlank()) {
            states.put(team.getId(), team.getStateCode().trim().toUpperCase());
        }
    }
}
