package com.psl.search.embed;

import com.psl.search.store.PaperRecord;
import com.psl.search.store.PaperRepository;
import com.psl.search.store.VectorLiteral;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Background embedding of persisted records. {@link #schedule} only enqueues; the dedicated worker thread selects
 * unembedded rows, embeds them in batches and commits each batch on its own.
 */
@Service
public class EmbeddingBackfillService {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingBackfillService.class);

    private final ExecutorService executor;
    private final PaperRepository repository;
    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    public EmbeddingBackfillService(
        @Qualifier("embeddingBackfillExecutor") ExecutorService executor,
        PaperRepository repository,
        EmbeddingProvider embeddingProvider,
        EmbeddingProperties properties,
        TransactionTemplate transactionTemplate,
        MeterRegistry meterRegistry
    ) {
        this.executor = executor;
        this.repository = repository;
        this.embeddingProvider = embeddingProvider;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Fire-and-forget. Returns whether the work was accepted by the queue.
     */
    public boolean schedule(Collection<Long> recordIds) {
        if (!properties.getBackfill().isEnabled()) {
            return false;
        }
        List<Long> ids = recordIds == null ? List.of() : List.copyOf(recordIds);
        try {
            executor.execute(() -> runSafely(ids));
            meterRegistry.counter("search.embedding.backfill.scheduled.total", "result", "accepted").increment();
            return true;
        } catch (RejectedExecutionException e) {
            logger.warn("embedding_backfill_rejected ids={} reason=queue_full", ids.size());
            meterRegistry.counter("search.embedding.backfill.scheduled.total", "result", "rejected").increment();
            return false;
        }
    }

    public BackfillReport run(List<Long> preferredIds) {
        int maxRecords = Math.max(1, properties.getBackfill().getMaxRecords());
        int batchSize = Math.max(1, properties.getBackfill().getBatchSize());
        List<Long> selected = repository.findUnembeddedIds(preferredIds, maxRecords);
        BackfillReport report = new BackfillReport(selected.size());
        if (selected.isEmpty()) {
            return report;
        }
        logger.info("embedding_backfill_start selected={} batch_size={}", selected.size(), batchSize);
        for (int start = 0; start < selected.size(); start += batchSize) {
            List<Long> batchIds = selected.subList(start, Math.min(selected.size(), start + batchSize));
            embedBatch(batchIds, report);
        }
        logger.info(
            "embedding_backfill_done selected={} embedded={} failed={}",
            report.getSelected(),
            report.getEmbedded(),
            report.getFailed()
        );
        return report;
    }

    private void embedBatch(List<Long> batchIds, BackfillReport report) {
        List<PaperRecord> records = repository.findByIds(new ArrayList<>(batchIds));
        if (records.isEmpty()) {
            return;
        }
        List<String> texts = new ArrayList<>(records.size());
        for (PaperRecord record : records) {
            texts.add(EmbeddingTextBuilder.forPaper(record));
        }
        List<List<Double>> vectors;
        try {
            vectors = embeddingProvider.embedBatch(texts);
        } catch (EmbeddingUnavailableException e) {
            logger.warn("embedding_backfill_batch_failed size={} reason={}", records.size(), e.getMessage());
            report.failed += records.size();
            meterRegistry.counter("search.embedding.backfill.records.total", "result", "failed").increment(records.size());
            return;
        }
        Map<Long, String> literals = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            literals.put(records.get(i).getId(), VectorLiteral.of(vectors.get(i)));
        }
        try {
            transactionTemplate.executeWithoutResult(status -> repository.updateEmbeddings(literals));
            report.embedded += literals.size();
            meterRegistry.counter("search.embedding.backfill.records.total", "result", "embedded").increment(literals.size());
        } catch (DataAccessException e) {
            logger.warn("embedding_backfill_commit_failed size={} error={}", literals.size(), e.getMessage());
            report.failed += literals.size();
            meterRegistry.counter("search.embedding.backfill.records.total", "result", "failed").increment(literals.size());
        }
    }

    private void runSafely(List<Long> ids) {
        try {
            run(ids);
        } catch (RuntimeException e) {
            logger.error("embedding_backfill_run_failed ids={}", ids.size(), e);
        }
    }

    public static class BackfillReport {
        private final int selected;
        private int embedded;
        private int failed;

        BackfillReport(int selected) {
            this.selected = selected;
        }

        public int getSelected() {
            return selected;
        }

        public int getEmbedded() {
            return embedded;
        }

        public int getFailed() {
            return failed;
        }
    }
}
