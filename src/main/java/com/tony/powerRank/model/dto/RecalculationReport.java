package com.tony.powerRank.model.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Bilan d'un recalcul complet (moteur + persistance).
 */
@Value
@Builder
public class RecalculationReport {
    LocalDate date;
    int teamsRanked;
    int cohorts;
    int gamesUsed;
    IngestionReport ingestion;
    String mlStatus;
    boolean fromCache;
    BatchWriteSummary rankings;
    BatchWriteSummary snapshots;
    BatchWriteSummary residuals;
    long durationMs;
}
