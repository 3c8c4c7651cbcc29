package com.tony.powerRank.service;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.engine.RankingEngine;
import com.tony.powerRank.engine.RankingInput;
import com.tony.powerRank.model.Game;
import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.BatchWriteSummary;
import com.tony.powerRank.model.dto.RankingRunResult;
import com.tony.powerRank.model.dto.RecalculationReport;
import com.tony.powerRank.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Recalcul complet : chargement → GameRecord → moteur → deltas de rang → persistance.
 * Chaque lot d'écriture a sa propre transaction : un lot en échec n'annule pas les autres.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    private final GameRepository gameRepository;
    private final GameRecordMapper mapper;
    private final RankingEngine engine;
    private final RankHistoryService historyService;
    private final RankingPersistenceService persistenceService;
    private final RankingConfig config;

    public RecalculationReport recalculate(LocalDate today, String providerFilter, boolean forceRebuild) {
        long start = System.currentTimeMillis();
        log.info("🚀 Recalcul des classements au {} (provider : {}, forceRebuild : {})",
                today, providerFilter == null ? "tous" : providerFilter, forceRebuild);

        // 1. Chargement de la fenêtre
        LocalDate from = today.minusDays(config.getWindowDays());
        List<Game> games = new ArrayList<>(providerFilter == null
                ? gameRepository.findInWindow(from, today)
                : gameRepository.findInWindowByProvider(from, today, providerFilter));
        List<Game> undated = gameRepository.findUndated();
        if (providerFilter != null) {
            undated = undated.stream().filter(g -> providerFilter.equals(g.getProvider())).toList();
        }
        games.addAll(undated);

        GameRecordMapper.MappingResult mapping = mapper.toRecords(games);

        // 2. Moteur
        RankingRunResult result = engine.run(
                new RankingInput(mapping.records(), mapper.teamStates(games), today, providerFilter),
                config, forceRebuild);

        // 3. Historique + persistance
        List<TeamCohortStat> teams = historyService.applyRankChanges(result.getTeams(), today);
        BatchWriteSummary rankings = persistenceService.saveRankings(teams);
        BatchWriteSummary snapshots = historyService.saveSnapshot(teams, today);
        BatchWriteSummary residuals = persistenceService.saveGameResiduals(result.getGameResiduals());

        long cohorts = teams.stream().map(TeamCohortStat::getCohort).distinct().count();
        long ranked = teams.stream().filter(t -> t.getRankInCohort() != null).count();
        long duration = System.currentTimeMillis() - start;
        log.info("✅ Recalcul terminé : {} équipes ({} classées) sur {} cohortes en {} ms",
                teams.size(), ranked, cohorts, duration);

        return RecalculationReport.builder()
                .date(today)
                .teamsRanked((int) ranked)
                .cohorts((int) cohorts)
                .gamesUsed(result.getGamesUsed())
                .ingestion(mapping.report())
                .mlStatus(result.getMlStatus())
                .fromCache(result.isFromCache())
                .rankings(rankings)
                .snapshots(snapshots)
                .residuals(residuals)
                .durationMs(duration)
                .build();
    }
}
