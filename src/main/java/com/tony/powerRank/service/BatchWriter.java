package com.tony.powerRank.service;

import com.tony.powerRank.config.RankingProperties;
import com.tony.powerRank.model.dto.BatchWriteSummary;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Écriture par lots bornés, chaque lot sous Retry (backoff exponentiel).
 * Un lot qui échoue encore après les tentatives est journalisé et sauté : le passage continue.
 */
@Component
@Slf4j
public class BatchWriter {

    private final Retry retry;
    private final int batchSize;

    @Autowired
    public BatchWriter(Retry persistenceRetry, RankingProperties props) {
        this(persistenceRetry, props.getPersistence().getBatchSize());
    }

    public BatchWriter(Retry retry, int batchSize) {
        this.retry = retry;
        this.batchSize = Math.max(1, batchSize);
    }

    public <T> BatchWriteSummary write(String label, List<T> rows, Consumer<List<T>> writer) {
        int batches = 0;
        int written = 0;
        int failedBatches = 0;
        int failedRows = 0;

        for (int from = 0; from < rows.size(); from += batchSize) {
            List<T> batch = rows.subList(from, Math.min(rows.size(), from + batchSize));
            batches++;
            try {
                Retry.decorateRunnable(retry, () -> writer.accept(batch)).run();
                written += batch.size();
            } catch (RuntimeException e) {
                failedBatches++;
                failedRows += batch.size();
                log.error("❌ [{}] Lot {} ({} lignes) abandonné après {} tentatives : {}",
                        label, batches, batch.size(), retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            }
        }

        BatchWriteSummary summary = new BatchWriteSummary(label, batches, written, failedBatches, failedRows);
        if (summary.hasFailures()) {
            log.warn("⚠️ [{}] {} / {} lots en échec ({} lignes non écrites)", label, failedBatches, batches, failedRows);
        } else {
            log.info("💾 [{}] {} lignes écrites en {} lots", label, written, batches);
        }
        return summary;
    }
}
