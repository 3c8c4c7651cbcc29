package com.tony.powerRank.job;

import com.tony.powerRank.config.RankingProperties;
import com.tony.powerRank.model.dto.RecalculationReport;
import com.tony.powerRank.service.RankHistoryService;
import com.tony.powerRank.service.RankingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

@Component
@RequiredArgsConstructor
@Slf4j
public class DailyRankingJob {

    private final RankingService rankingService;
    private final RankHistoryService historyService;
    private final RankingProperties props;

    /**
     * JOB 1 : recalcul quotidien des classements (+ photo du jour).
     * Les imports de la nuit doivent être passés avant.
     */
    @Scheduled(cron = "${ranking.job.cron:0 0 6 * * *}")
    public void recalculateRankings() {
        if (!props.getJob().isEnabled()) return;
        log.info("⏰ [CRON] Démarrage automatique : recalcul des classements...");
        try {
            RecalculationReport report = rankingService.recalculate(
                    LocalDate.now(), props.getJob().getProviderFilter(), false);
            log.info("✅ [CRON] {} équipes classées sur {} cohortes, ML {}",
                    report.getTeamsRanked(), report.getCohorts(), report.getMlStatus());
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du recalcul des classements", e);
        }
    }

    /**
     * JOB 2 : purge des photos au-delà de la rétention.
     */
    @Scheduled(cron = "${ranking.job.cleanup-cron:0 30 6 * * SUN}")
    public void cleanupSnapshots() {
        if (!props.getJob().isEnabled()) return;
        log.info("⏰ [CRON] Purge de l'historique des classements...");
        try {
            historyService.cleanupOldSnapshots(props.getHistory().getRetentionDays(), LocalDate.now());
        } catch (Exception e) {
            log.error("❌ [CRON] Echec de la purge de l'historique", e);
        }
    }
}
