package com.psl.search.embed;

import com.psl.search.store.PaperRepository;
import io.micrometer.core.instrument.Metrics;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep so records whose embedding failed earlier are retried.
 */
@Component
public class EmbeddingBackfillScheduler {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingBackfillScheduler.class);

    private final EmbeddingBackfillService backfillService;
    private final PaperRepository paperRepository;
    private final EmbeddingProperties properties;

    public EmbeddingBackfillScheduler(
        EmbeddingBackfillService backfillService,
        PaperRepository paperRepository,
        EmbeddingProperties properties
    ) {
        this.backfillService = backfillService;
        this.paperRepository = paperRepository;
        this.properties = properties;
    }

    @Scheduled(
        fixedDelayString = "${embedding.backfill.sweep-delay-ms:300000}",
        initialDelayString = "${embedding.backfill.sweep-initial-delay-ms:60000}"
    )
    public void sweepUnembedded() {
        if (!properties.getBackfill().isEnabled()) {
            return;
        }
        long backlog;
        try {
            backlog = paperRepository.countUnembedded();
        } catch (DataAccessException e) {
            logger.warn("embedding_backfill_sweep_skipped error={}", e.getMessage());
            return;
        }
        if (backlog == 0) {
            return;
        }
        boolean accepted = backfillService.schedule(List.of());
        logger.info("embedding_backfill_sweep backlog={} accepted={}", backlog, accepted);
        Metrics.counter("search.embedding.backfill.sweep.total", "accepted", String.valueOf(accepted)).increment();
    }
}
