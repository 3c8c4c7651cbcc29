package com.tony.powerRank.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.powerRank.model.Game;
import com.tony.powerRank.model.Team;
import com.tony.powerRank.repository.GameRepository;
import com.tony.powerRank.repository.TeamRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.Reader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Import CSV de matchs déjà résolus (identifiants d'équipe maîtres).
 * Idempotent sur game_uid : un match existant est mis à jour, jamais dupliqué.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameImportService {

    private final TeamRepository teamRepository;
    private final GameRepository gameRepository;

    @Transactional
    public String importGames(Reader reader) {
        long start = System.currentTimeMillis();
        List<GameCsvRow> rows = new CsvToBeanBuilder<GameCsvRow>(reader)
                .withType(GameCsvRow.class)
                .withSeparator(',')
                .withIgnoreLeadingWhiteSpace(true)
                .withIgnoreEmptyLine(true)
                .build()
                .parse();
        log.info("🚀 Import CSV : {} lignes lues", rows.size());

        // Caches locaux pour éviter une requête par ligne
        List<String> teamIds = rows.stream()
                .flatMap(r -> Stream.of(r.getHomeTeamId(), r.getAwayTeamId()))
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        Map<String, Team> teamCache = teamRepository.findByIdIn(teamIds).stream()
                .collect(Collectors.toMap(Team::getId, Function.identity(), (a, b) -> a, HashMap::new));
        Map<String, Game> gameCache = gameRepository.findByGameUidIn(
                        rows.stream().map(GameCsvRow::getGameUid).filter(Objects::nonNull).distinct().toList())
                .stream()
                .collect(Collectors.toMap(Game::getGameUid, Function.identity(), (a, b) -> a, HashMap::new));

        ImportStats stats = new ImportStats();
        Map<String, Team> touchedTeams = new LinkedHashMap<>();
        Map<String, Game> touchedGames = new LinkedHashMap<>();
        for (GameCsvRow row : rows) {
            try {
                processRow(row, teamCache, gameCache, touchedTeams, touchedGames, stats);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                stats.skippedCount++;
                log.warn("Ligne ignorée ({}) : {}", row.getGameUid(), e.getMessage());
            }
        }

        teamRepository.saveAll(touchedTeams.values());
        gameRepository.saveAll(touchedGames.values());

        return String.format("✅ Import : %d nouveaux, %d maj, %d inchangés, %d ignorés (%d ms).",
                stats.importedCount, stats.updatedCount, stats.unchangedCount, stats.skippedCount,
                System.currentTimeMillis() - start);
    }

    private void processRow(GameCsvRow row, Map<String, Team> teamCache, Map<String, Game> gameCache,
                            Map<String, Team> touchedTeams, Map<String, Game> touchedGames, ImportStats stats) {
        if (isBlank(row.getGameUid())) throw new IllegalArgumentException("game_uid manquant");
        if (isBlank(row.getHomeTeamId()) || isBlank(row.getAwayTeamId())) {
            throw new IllegalArgumentException("identifiant d'équipe manquant");
        }
        if (row.getHomeTeamId().equals(row.getAwayTeamId())) {
            throw new IllegalArgumentException("une équipe ne peut pas jouer contre elle-même");
        }

        Team home = upsertTeam(teamCache, touchedTeams, row.getHomeTeamId(), row.getHomeTeamName(),
                row.getHomeClub(), row.getHomeState(), row.getHomeAge(), row.getHomeGender());
        Team away = upsertTeam(teamCache, touchedTeams, row.getAwayTeamId(), row.getAwayTeamName(),
                row.getAwayClub(), row.getAwayState(), row.getAwayAge(), row.getAwayGender());
        LocalDate date = isBlank(row.getGameDate()) ? null : LocalDate.parse(row.getGameDate().trim());

        Game game = gameCache.get(row.getGameUid());
        if (game == null) {
            game = new Game(row.getGameUid(), home, away, date);
            game.setHomeScore(row.getHomeScore());
            game.setAwayScore(row.getAwayScore());
            game.setProvider(row.getProvider());
            gameCache.put(game.getGameUid(), game);
            touchedGames.put(game.getGameUid(), game);
            stats.importedCount++;
            return;
        }

        // Smart update : seuls les champs modifiés déclenchent une écriture
        boolean changed = !Objects.equals(game.getHomeScore(), row.getHomeScore())
                || !Objects.equals(game.getAwayScore(), row.getAwayScore())
                || !Objects.equals(game.getGameDate(), date)
                || !Objects.equals(game.getHomeTeam(), home)
                || !Objects.equals(game.getAwayTeam(), away);
        if (!changed) {
            stats.unchangedCount++;
            return;
        }
        game.setHomeTeam(home);
        game.setAwayTeam(away);
        game.setGameDate(date);
        game.setHomeScore(row.getHomeScore());
        game.setAwayScore(row.getAwayScore());
        if (row.getProvider() != null) game.setProvider(row.getProvider());
        touchedGames.put(game.getGameUid(), game);
        stats.updatedCount++;
    }

    private Team upsertTeam(Map<String, Team> cache, Map<String, Team> touched, String id, String name,
                            String club, String state, Integer age, String gender) {
        Team team = cache.get(id);
        if (team == null) {
            team = new Team(id, isBlank(name) ? id : name.trim(), age, normalizeGender(gender));
            cache.put(id, team);
            touched.put(id, team);
        }
        if (!isBlank(name) && !name.trim().equals(team.getName())) {
            team.setName(name.trim());
            touched.put(id, team);
        }
        if (!isBlank(club) && !club.trim().equals(team.getClub())) {
            team.setClub(club.trim());
            touched.put(id, team);
        }
        if (!isBlank(state) && !state.trim().toUpperCase().equals(team.getStateCode())) {
            team.setStateCode(state.trim().toUpperCase());
            touched.put(id, team);
        }
        if (age != null && !age.equals(team.getAge())) {
            team.setAge(age);
            touched.put(id, team);
        }
        String g = normalizeGender(gender);
        if (g != null && !g.equals(team.getGender())) {
            team.setGender(g);
            touched.put(id, team);
        }
        return team;
    }

    private static String normalizeGender(String gender) {
        return isBlank(gender) ? null : gender.trim().toLowerCase();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static class ImportStats { int importedCount = 0; int updatedCount = 0; int unchangedCount = 0; int skippedCount = 0; }

    @Data
    public static class GameCsvRow {
        @CsvBindByName(column = "game_uid") private String gameUid;
        @CsvBindByName(column = "game_date") private String gameDate;
        @CsvBindByName(column = "provider") private String provider;
        @CsvBindByName(column = "home_team_id") private String homeTeamId;
        @CsvBindByName(column = "home_team_name") private String homeTeamName;
        @CsvBindByName(column = "home_club") private String homeClub;
        @CsvBindByName(column = "home_state") private String homeState;
        @CsvBindByName(column = "home_age") private Integer homeAge;
        @CsvBindByName(column = "home_gender") private String homeGender;
        @CsvBindByName(column = "away_team_id") private String awayTeamId;
        @CsvBindByName(column = "away_team_name") private String awayTeamName;
        @CsvBindByName(column = "away_club") private String awayClub;
        @CsvBindByName(column = "away_state") private String awayState;
        @CsvBindByName(column = "away_age") private Integer awayAge;
        @CsvBindByName(column = "away_gender") private String awayGender;
        @CsvBindByName(column = "home_score") private Integer homeScore;
        @CsvBindByName(column = "away_score") private Integer awayScore;
    }
}
