package com.tony.powerRank.service;

import com.tony.powerRank.config.RankingConfig;
import com.tony.powerRank.config.RankingProperties;
import com.tony.powerRank.model.RankingSnapshot;
import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.BatchWriteSummary;
import com.tony.powerRank.repository.RankingSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Historique des rangs : photo quotidienne et deltas 7 j / 30 j.
 * delta = rang historique - rang courant (positif = progression).
 */
@Service
@Slf4j
public class RankHistoryService {

    public static final int SHORT_WINDOW_DAYS = 7;
    public static final int LONG_WINDOW_DAYS = 30;

    private final RankingSnapshotRepository snapshotRepository;
    private final BatchWriter batchWriter;
    private final int toleranceDays;
    private final int lookupBatchSize;

    @Autowired
    public RankHistoryService(RankingSnapshotRepository snapshotRepository,
                              BatchWriter batchWriter,
                              RankingConfig config,
                              RankingProperties props) {
        this(snapshotRepository, batchWriter, config.getHistoryToleranceDays(), props.getHistory().getLookupBatchSize());
    }

    public RankHistoryService(RankingSnapshotRepository snapshotRepository,
                              BatchWriter batchWriter,
                              int toleranceDays,
                              int lookupBatchSize) {
        this.snapshotRepository = snapshotRepository;
        this.batchWriter = batchWriter;
        this.toleranceDays = toleranceDays;
        this.lookupBatchSize = Math.max(1, lookupBatchSize);
    }

    /**
     * Upsert d'une ligne par équipe pour la date donnée : relancer le même jour écrase.
     */
    public BatchWriteSummary saveSnapshot(List<TeamCohortStat> teams, LocalDate date) {
        return batchWriter.write("ranking_snapshot", teams, batch -> {
            Map<String, RankingSnapshot> existing = snapshotRepository
                    .findBySnapshotDateAndTeamIdIn(date, batch.stream().map(TeamCohortStat::getTeamId).toList())
                    .stream()
                    .collect(Collectors.toMap(RankingSnapshot::getTeamId, Function.identity(), (a, b) -> a));

            List<RankingSnapshot> toSave = new ArrayList<>(batch.size());
            for (TeamCohortStat t : batch) {
                RankingSnapshot s = existing.computeIfAbsent(t.getTeamId(), id -> new RankingSnapshot(id, date));
                s.setAge(t.age());
                s.setGender(t.gender());
                s.setRankInCohort(t.getRankInCohort());
                s.setRankInCohortMl(t.getRankInCohortMl());
                s.setPowerScoreFinal(t.getPowerScoreFinal());
                s.setPowerscoreMl(t.getPowerscoreMl());
                toSave.add(s);
            }
            snapshotRepository.saveAll(toSave);
        });
    }

    /**
     * Rang de chaque équipe il y a daysAgo jours : photo la plus proche de la date cible
     * dans ± toleranceDays. Équipe absente de la map = aucune photo dans la tolérance.
     * Un lot de lecture en échec est journalisé et ignoré.
     */
    public Map<String, Integer> getHistoricalRanks(Collection<String> teamIds, int daysAgo, LocalDate referenceDate) {
        LocalDate target = referenceDate.minusDays(daysAgo);
        LocalDate from = target.minusDays(toleranceDays);
        LocalDate to = target.plusDays(toleranceDays);

        List<String> ids = new ArrayList<>(new LinkedHashSet<>(teamIds));
        Map<String, RankingSnapshot> nearest = new HashMap<>();
        for (int start = 0; start < ids.size(); start += lookupBatchSize) {
            List<String> batch = ids.subList(start, Math.min(ids.size(), start + lookupBatchSize));
            try {
                for (RankingSnapshot s : snapshotRepository.findByTeamIdInAndSnapshotDateBetween(batch, from, to)) {
                    if (s.effectiveRank() == null) continue;
                    nearest.merge(s.getTeamId(), s, (current, candidate) -> closer(current, candidate, target));
                }
            } catch (RuntimeException e) {
                log.warn("⚠️ Lecture historique ignorée pour un lot de {} équipes : {}", batch.size(), e.getMessage());
            }
        }

        Map<String, Integer> ranks = new HashMap<>();
        nearest.forEach((teamId, s) -> ranks.put(teamId, s.effectiveRank()));
        return ranks;
    }

    /**
     * Ajoute rankChange7d / rankChange30d à chaque équipe.
     */
    public List<TeamCohortStat> applyRankChanges(List<TeamCohortStat> teams, LocalDate referenceDate) {
        Set<String> ids = teams.stream().map(TeamCohortStat::getTeamId).collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, Integer> ranks7 = getHistoricalRanks(ids, SHORT_WINDOW_DAYS, referenceDate);
        Map<String, Integer> ranks30 = getHistoricalRanks(ids, LONG_WINDOW_DAYS, referenceDate);

        List<TeamCohortStat> out = new ArrayList<>(teams.size());
        for (TeamCohortStat t : teams) {
            Integer current = t.effectiveRank();
            out.add(t.toBuilder()
                    .rankChange7d(delta(ranks7.get(t.getTeamId()), current))
                    .rankChange30d(delta(ranks30.get(t.getTeamId()), current))
                    .build());
        }
        log.info("📈 Deltas de rang : {} équipes avec historique 7 j, {} avec historique 30 j",
                ranks7.size(), ranks30.size());
        return out;
    }

    /**
     * Purge des photos antérieures à (today - daysToKeep).
     */
    public int cleanupOldSnapshots(int daysToKeep, LocalDate today) {
        LocalDate cutoff = today.minusDays(daysToKeep);
        int deleted = snapshotRepository.deleteOlderThan(cutoff);
        log.info("🧹 {} photos de classement antérieures au {} supprimées", deleted, cutoff);
        return deleted;
    }

    static Integer delta(Integer historical, Integer current) {
        if (historical == null || current == null) return null;
        return historical - current;
    }

    // À distance égale, la photo la plus ancienne est conservée
    private static RankingSnapshot closer(RankingSnapshot a, RankingSnapshot b, LocalDate target) {
        long da = Math.abs(ChronoUnit.DAYS.between(target, a.getSnapshotDate()));
        long db = Math.abs(ChronoUnit.DAYS.between(target, b.getSnapshotDate()));
        if (da != db) return da < db ? a : b;
        return a.getSnapshotDate().isBefore(b.getSnapshotDate()) ? a : b;
    }
}
