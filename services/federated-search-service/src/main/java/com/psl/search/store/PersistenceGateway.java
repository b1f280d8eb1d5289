package com.psl.search.store;

import com.psl.search.merge.TitleNormalizer;
import com.psl.search.provider.RawCandidate;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Insert-or-return-existing for candidates. Identity resolution order: DOI, provider id of the same provider,
 * normalized title. Existing rows are returned untouched; filling their gaps is {@link #backfillMissingFields}.
 */
@Service
public class PersistenceGateway {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceGateway.class);

    private final PaperRepository repository;
    private final MeterRegistry meterRegistry;

    public PersistenceGateway(PaperRepository repository, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.meterRegistry = meterRegistry;
    }

    public PaperRecord upsert(RawCandidate candidate, String category) {
        String normalizedTitle = TitleNormalizer.normalize(candidate.getTitle());
        if (normalizedTitle.isEmpty()) {
            throw new IllegalArgumentException("title is required");
        }
        PaperRecord existing = resolve(candidate, normalizedTitle);
        if (existing != null) {
            meterRegistry.counter("search.store.upsert.total", "result", "existing").increment();
            return existing;
        }
        PaperRecord record = PaperRecord.fromCandidate(candidate, category);
        Long id = repository.insertIfAbsent(record, normalizedTitle);
        if (id != null) {
            record.setId(id);
            meterRegistry.counter("search.store.upsert.total", "result", "inserted").increment();
            return record;
        }
        // lost an insert race; the winner's row is visible now
        existing = resolve(candidate, normalizedTitle);
        if (existing == null) {
            throw new IllegalStateException("insert conflict without a matching row");
        }
        meterRegistry.counter("search.store.upsert.total", "result", "conflict").increment();
        return existing;
    }

    /**
     * Persists each candidate independently. A candidate that cannot be stored is returned without an id.
     */
    public List<PaperRecord> upsertAll(List<RawCandidate> candidates, String category) {
        List<PaperRecord> records = new ArrayList<>(candidates.size());
        for (RawCandidate candidate : candidates) {
            try {
                records.add(upsert(candidate, category));
            } catch (DataAccessException | IllegalStateException | IllegalArgumentException e) {
                logger.warn("store_upsert_failed provider={} error={}", candidate.getProvider(), e.getMessage());
                meterRegistry.counter("search.store.upsert.total", "result", "failed").increment();
                records.add(PaperRecord.fromCandidate(candidate, category));
            }
        }
        return records;
    }

    /**
     * Maintenance path: fills columns that are still null on the stored row. Never called during search.
     */
    public boolean backfillMissingFields(long id, RawCandidate observed) {
        int updated = repository.fillMissingFields(id, PaperRecord.fromCandidate(observed, null));
        return updated > 0;
    }

    private PaperRecord resolve(RawCandidate candidate, String normalizedTitle) {
        PaperRecord found = repository.findByDoi(TitleNormalizer.normalizeDoi(candidate.getDoi()));
        if (found == null) {
            found = repository.findByProviderId(candidate.getProvider(), candidate.getProviderId());
        }
        if (found == null) {
            found = repository.findByNormalizedTitle(normalizedTitle);
        }
        return found;
    }
}
