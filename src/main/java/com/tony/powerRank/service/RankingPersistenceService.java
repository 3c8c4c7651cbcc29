package com.tony.powerRank.service;

import com.tony.powerRank.model.Game;
import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.TeamRanking;
import com.tony.powerRank.model.dto.BatchWriteSummary;
import com.tony.powerRank.model.dto.GameResidual;
import com.tony.powerRank.repository.GameRepository;
import com.tony.powerRank.repository.TeamRankingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Écriture des résultats : classement courant (upsert par équipe) et résidus par match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingPersistenceService {

    private final TeamRankingRepository rankingRepository;
    private final GameRepository gameRepository;
    private final BatchWriter batchWriter;

    public BatchWriteSummary saveRankings(List<TeamCohortStat> teams) {
        LocalDateTime now = LocalDateTime.now();
        return batchWriter.write("team_ranking", teams, batch -> {
            Map<String, TeamRanking> existing = rankingRepository
                    .findByTeamIdIn(batch.stream().map(TeamCohortStat::getTeamId).toList())
                    .stream()
                    .collect(Collectors.toMap(TeamRanking::getTeamId, Function.identity(), (a, b) -> a));

            List<TeamRanking> toSave = new ArrayList<>(batch.size());
            for (TeamCohortStat t : batch) {
                TeamRanking r = existing.computeIfAbsent(t.getTeamId(), TeamRanking::new);
                apply(r, t);
                r.setLastCalculated(now);
                toSave.add(r);
            }
            rankingRepository.saveAll(toSave);
        });
    }

    public BatchWriteSummary saveGameResiduals(List<GameResidual> residuals) {
        return batchWriter.write("game_residual", residuals, batch -> {
            Map<String, Double> byUid = batch.stream()
                    .collect(Collectors.toMap(GameResidual::gameId, GameResidual::residual, (a, b) -> a));
            List<Game> games = gameRepository.findByGameUidIn(byUid.keySet());
            games.forEach(g -> g.setMlOverperformance(byUid.get(g.getGameUid())));
            gameRepository.saveAll(games);
        });
    }

    static void apply(TeamRanking r, TeamCohortStat t) {
        r.setAge(t.age());
        r.setGender(t.gender());
        r.setGamesPlayed(t.getGamesPlayed());
        r.setGamesLast180Days(t.getGamesLast180Days());
        r.setLastGameDate(t.getLastGameDate());
        r.setStatus(t.getStatus());
        r.setSampleFlag(t.getSampleFlag());

        r.setOffRaw(t.getOffRaw());
        r.setDefRaw(t.getDefRaw());
        r.setOffShrunk(t.getOffShrunk());
        r.setDefShrunk(t.getDefShrunk());
        r.setOffNorm(t.getOffNorm());
        r.setDefNorm(t.getDefNorm());
        r.setAbsStrength(t.getAbsStrength());

        r.setSosRaw(t.getSosRaw());
        r.setSos(t.getSos());
        r.setSosNorm(t.getSosNorm());
        r.setSosRank(t.getSosRank());
        r.setScf(t.getScf());
        r.setBridgeGames(t.getBridgeGames());
        r.setIsolated(t.isIsolated());
        r.setComponentId(t.getComponentId());
        r.setComponentSize(t.getComponentSize());

        r.setPerfCentered(t.getPerfCentered());
        r.setPowerscoreCore(t.getPowerscoreCore());
        r.setProvisionalMult(t.getProvisionalMult());
        r.setPowerscoreAdj(t.getPowerscoreAdj());
        r.setPowerScoreFinal(t.getPowerScoreFinal());
        r.setMlOverperf(t.getMlOverperf());
        r.setMlNorm(t.getMlNorm());
        r.setPowerscoreMl(t.getPowerscoreMl());

        r.setRankInCohort(t.getRankInCohort());
        r.setRankInCohortMl(t.getRankInCohortMl());
        r.setRankChange7d(t.getRankChange7d());
        r.setRankChange30d(t.getRankChange30d());
    }
}
