package com.tony.powerRank.model.dto;

/**
 * Comptage des lignes acceptées / ignorées lors de la préparation des GameRecord.
 * Une ligne incomplète n'est jamais fatale : elle est comptée ici.
 */
public record IngestionReport(int accepted,
                              int skippedMissingScore,
                              int skippedMissingDate,
                              int skippedUnresolvedTeam,
                              int skippedOutOfWindow) {

    public static IngestionReport empty() {
        return new IngestionReport(0, 0, 0, 0, 0);
    }

    public int skipped() {
        return skippedMissingScore + skippedMissingDate + skippedUnresolvedTeam + skippedOutOfWindow;
    }

    public IngestionReport plus(IngestionReport other) {
        return new IngestionReport(
                accepted + other.accepted,
                skippedMissingScore + other.skippedMissingScore,
                skippedMissingDate + other.skippedMissingDate,
                skippedUnresolvedTeam + other.skippedUnresolvedTeam,
                skippedOutOfWindow + other.skippedOutOfWindow);
    }
}
