package com.tony.powerRank.model.dto;

/**
 * Bilan d'une écriture par lots : un lot en échec est compté, pas propagé.
 */
public record BatchWriteSummary(String label, int batches, int written, int failedBatches, int failedRows) {

    public boolean hasFailures() {
        return failedBatches > 0;
    }
}
