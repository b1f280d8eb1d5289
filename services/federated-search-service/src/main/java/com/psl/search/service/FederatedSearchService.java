package com.psl.search.service;

import com.psl.search.api.dto.AggregateSearchResponse;
import com.psl.search.api.dto.ImportResponse;
import com.psl.search.api.dto.PaperHit;
import com.psl.search.api.dto.ProviderCallView;
import com.psl.search.api.dto.SearchMetadata;
import com.psl.search.cache.QueryPopularityTracker;
import com.psl.search.cache.ResultCacheService;
import com.psl.search.embed.EmbeddingBackfillService;
import com.psl.search.embed.EmbeddingService;
import com.psl.search.embed.EmbeddingUnavailableException;
import com.psl.search.execution.ExecutionProperties;
import com.psl.search.execution.FanOutExecutor;
import com.psl.search.execution.FanOutResult;
import com.psl.search.execution.QueryAssignment;
import com.psl.search.merge.PaperDeduplicator;
import com.psl.search.merge.TitleNormalizer;
import com.psl.search.provider.ProviderRegistry;
import com.psl.search.provider.RawCandidate;
import com.psl.search.query.QueryExpansion;
import com.psl.search.query.QueryExpansionGateway;
import com.psl.search.ranking.PaperRanker;
import com.psl.search.ranking.QualityFilter;
import com.psl.search.ranking.RankingProperties;
import com.psl.search.ranking.ScoredPaper;
import com.psl.search.routing.CategoryCatalog;
import com.psl.search.routing.CategoryRouter;
import com.psl.search.routing.RoutePlan;
import com.psl.search.routing.SearchMode;
import com.psl.search.store.PaperRecord;
import com.psl.search.store.PaperRepository;
import com.psl.search.store.PersistenceGateway;
import com.psl.search.store.ScoredRecord;
import com.psl.search.store.VectorLiteral;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Entry point for federated search. Only {@link InvalidSearchRequestException} escapes; every provider, store,
 * cache or embedding failure degrades the response instead.
 */
@Service
public class FederatedSearchService {
    private static final Logger logger = LoggerFactory.getLogger(FederatedSearchService.class);

    private final CategoryRouter router;
    private final CategoryCatalog catalog;
    private final ProviderRegistry providerRegistry;
    private final FanOutExecutor fanOutExecutor;
    private final QueryExpansionGateway queryExpansionGateway;
    private final PaperDeduplicator deduplicator;
    private final PersistenceGateway persistenceGateway;
    private final PaperRepository paperRepository;
    private final PaperRanker ranker;
    private final RankingProperties rankingProperties;
    private final EmbeddingService embeddingService;
    private final EmbeddingBackfillService backfillService;
    private final ResultCacheService resultCache;
    private final QueryPopularityTracker popularityTracker;
    private final ExecutorService searchExecutor;
    private final ExecutionProperties executionProperties;
    private final SearchRequestProperties requestProperties;
    private final MeterRegistry meterRegistry;

    public FederatedSearchService(
        CategoryRouter router,
        CategoryCatalog catalog,
        ProviderRegistry providerRegistry,
        FanOutExecutor fanOutExecutor,
        QueryExpansionGateway queryExpansionGateway,
        PaperDeduplicator deduplicator,
        PersistenceGateway persistenceGateway,
        PaperRepository paperRepository,
        PaperRanker ranker,
        RankingProperties rankingProperties,
        EmbeddingService embeddingService,
        EmbeddingBackfillService backfillService,
        ResultCacheService resultCache,
        QueryPopularityTracker popularityTracker,
        @Qualifier("fanOutExecutorService") ExecutorService searchExecutor,
        ExecutionProperties executionProperties,
        SearchRequestProperties requestProperties,
        MeterRegistry meterRegistry
    ) {
        this.router = router;
        this.catalog = catalog;
        this.providerRegistry = providerRegistry;
        this.fanOutExecutor = fanOutExecutor;
        this.queryExpansionGateway = queryExpansionGateway;
        this.deduplicator = deduplicator;
        this.persistenceGateway = persistenceGateway;
        this.paperRepository = paperRepository;
        this.ranker = ranker;
        this.rankingProperties = rankingProperties;
        this.embeddingService = embeddingService;
        this.backfillService = backfillService;
        this.resultCache = resultCache;
        this.popularityTracker = popularityTracker;
        this.searchExecutor = searchExecutor;
        this.executionProperties = executionProperties;
        this.requestProperties = requestProperties;
        this.meterRegistry = meterRegistry;
    }

    public AggregateSearchResponse aggregateSearch(AggregateSearchCommand command) {
        long started = System.nanoTime();
        ValidatedSearch search = validate(command);
        RoutePlan plan = router.route(search.query, search.category, search.mode);
        int limit = Math.min(search.limit, plan.getMaxResults());
        boolean cacheable = command.isUseCache() && search.sources.isEmpty() && search.rankBy == RankBy.RELEVANCE;

        long popularity = popularityTracker.record(search.query);
        if (cacheable) {
            Optional<ResultCacheService.CachedResponse> cached =
                resultCache.get(search.query, plan.getCategoryId(), plan.getMode());
            if (cached.isPresent() && cached.get().getResponse() != null) {
                if (coversLimit(cached.get().getResponse(), limit)) {
                    return serveFromCache(cached.get().getResponse(), limit, started);
                }
                logger.info("result_cache_entry_too_short category={} limit={}", plan.getCategoryId(), limit);
            }
        }

        List<Double> queryVector = embedQuery(search.query);
        CompletableFuture<List<ScoredRecord>> localFuture = CompletableFuture.completedFuture(List.of());
        QueryExpansion expansion = null;
        FanOutResult fanOut;
        if (!search.sources.isEmpty()) {
            fanOut = fanOutExecutor.broadcast(search.query, search.sources, limit);
        } else if (plan.getMode() == SearchMode.FAST) {
            if (queryVector != null) {
                localFuture = startLocalSearch(search.query, queryVector, plan.getCategoryId(), limit);
            }
            fanOut = fanOutExecutor.cascade(search.query, plan.getProviders(), limit);
        } else {
            expansion = queryExpansionGateway.expand(search.query);
            fanOut = fanOutExecutor.fanOut(assign(expansion.getQueries(), plan.getProviders()), limit);
        }
        List<ScoredRecord> localHits = awaitLocal(localFuture);

        List<RawCandidate> fresh = QualityFilter.filter(
            withoutLocalDuplicates(deduplicator.deduplicate(fanOut.getCandidates()), localHits)
        );
        List<PaperRecord> persisted = persistenceGateway.upsertAll(fresh, plan.getCategoryId());

        List<PaperRecord> merged = new ArrayList<>();
        Map<Long, Double> indexScores = new HashMap<>();
        Set<Long> seenIds = new HashSet<>();
        for (ScoredRecord hit : localHits) {
            if (seenIds.add(hit.getRecord().getId())) {
                merged.add(hit.getRecord());
                indexScores.put(hit.getRecord().getId(), hit.getScore());
            }
        }
        for (PaperRecord record : persisted) {
            if (record.getId() == null || seenIds.add(record.getId())) {
                merged.add(record);
            }
        }

        List<ScoredPaper> ranked;
        String ranking;
        if (search.rankBy == RankBy.CITATIONS || queryVector == null) {
            ranked = ranker.rankByCitations(merged, limit);
            ranking = "citations";
        } else {
            indexScores.putAll(storedIndexScores(persisted, queryVector, search.query, indexScores.keySet()));
            ranked = ranker.rankHybrid(
                search.query,
                queryVector,
                merged,
                indexScores,
                limit,
                rankingProperties.getExternalMinScore()
            );
            ranking = "hybrid";
        }

        Duration ttl = resultCache.resolveTtl(popularity);
        AggregateSearchResponse response = buildResponse(search.query, plan, ranked, fanOut, localHits.size());
        SearchMetadata metadata = response.getMetadata();
        metadata.setRanking(ranking);
        metadata.setResultLimit(limit);
        metadata.setExpandedQueries(expansion == null ? List.of(search.query) : expansion.getQueries());
        metadata.setExpansionMethod(expansion == null ? null : expansion.getMethod());
        metadata.setCacheTtlSeconds(cacheable ? ttl.getSeconds() : null);
        metadata.setTookMs(elapsedMs(started));

        List<Long> unembedded = unembeddedIds(ranked);
        if (!unembedded.isEmpty()) {
            scheduleEmbeddingBackfill(unembedded);
        }
        if (cacheable) {
            resultCache.put(search.query, plan.getCategoryId(), plan.getMode(), response, ttl);
        }
        meterRegistry.counter(
            "search.aggregate.requests.total",
            "mode", plan.getMode().value(),
            "result", ranked.isEmpty() ? "empty" : "ok"
        ).increment();
        logger.info(
            "aggregate_search_done category={} mode={} papers={} sources={} api_calls={} fallbacks={} took_ms={}",
            plan.getCategoryId(),
            plan.getMode().value(),
            ranked.size(),
            fanOut.getSourcesUsed(),
            fanOut.getApiCalls(),
            fanOut.getFallbacksActivated(),
            metadata.getTookMs()
        );
        return response;
    }

    /**
     * Manual import: stores the acceptable papers under {@code category}, fills gaps on rows that already
     * existed, queues embedding and drops the category's cached result pages.
     */
    public ImportResponse importPapers(String category, List<RawCandidate> candidates) {
        String categoryId = category == null || category.isBlank() ? CategoryCatalog.GENERAL : category.trim();
        if (!catalog.contains(categoryId)) {
            throw new InvalidSearchRequestException("unknown_category", "Unknown category: " + categoryId);
        }
        if (candidates == null || candidates.isEmpty()) {
            throw new InvalidSearchRequestException("papers_required", "At least one paper is required");
        }
        List<RawCandidate> accepted = QualityFilter.filter(deduplicator.deduplicate(candidates));
        List<PaperRecord> records = persistenceGateway.upsertAll(accepted, categoryId);

        List<Long> ids = new ArrayList<>();
        int fieldsBackfilled = 0;
        for (int i = 0; i < records.size(); i++) {
            PaperRecord record = records.get(i);
            if (!record.isPersisted()) {
                continue;
            }
            ids.add(record.getId());
            try {
                if (persistenceGateway.backfillMissingFields(record.getId(), accepted.get(i))) {
                    fieldsBackfilled++;
                }
            } catch (DataAccessException e) {
                logger.warn("import_backfill_failed id={} error={}", record.getId(), e.getMessage());
            }
        }

        ImportResponse response = new ImportResponse();
        response.setCategory(categoryId);
        response.setReceived(candidates.size());
        response.setAccepted(accepted.size());
        response.setRejected(candidates.size() - accepted.size());
        response.setPersisted(ids.size());
        response.setFieldsBackfilled(fieldsBackfilled);
        response.setIds(ids);
        response.setEmbeddingScheduled(!ids.isEmpty() && scheduleEmbeddingBackfill(ids));
        response.setCacheEntriesInvalidated(resultCache.invalidateCategory(categoryId));
        logger.info(
            "import_done category={} received={} accepted={} persisted={}",
            categoryId,
            candidates.size(),
            accepted.size(),
            ids.size()
        );
        return response;
    }

    /**
     * Fire-and-forget; returns whether the work was queued. With no ids the worker sweeps any unembedded rows.
     */
    public boolean scheduleEmbeddingBackfill(Collection<Long> recordIds) {
        return backfillService.schedule(recordIds == null ? List.of() : recordIds);
    }

    public long invalidateCategory(String category) {
        if (category == null || !catalog.contains(category)) {
            throw new InvalidSearchRequestException("unknown_category", "Unknown category: " + category);
        }
        return resultCache.invalidateCategory(category);
    }

    private ValidatedSearch validate(AggregateSearchCommand command) {
        String query = command.getQuery() == null ? "" : command.getQuery().trim();
        if (query.isEmpty()) {
            throw new InvalidSearchRequestException("query_required", "query must not be blank");
        }
        if (query.length() > requestProperties.getMaxQueryLength()) {
            throw new InvalidSearchRequestException("query_too_long", "query exceeds "
                + requestProperties.getMaxQueryLength() + " characters");
        }
        if (command.getCategory() != null && !catalog.contains(command.getCategory())) {
            throw new InvalidSearchRequestException("unknown_category", "Unknown category: " + command.getCategory());
        }
        SearchMode mode = null;
        if (command.getMode() != null) {
            mode = SearchMode.fromValue(command.getMode()).orElseThrow(
                () -> new InvalidSearchRequestException("unknown_mode", "Unknown mode: " + command.getMode())
            );
        }
        RankBy rankBy = RankBy.fromValue(command.getRankBy()).orElseThrow(
            () -> new InvalidSearchRequestException("unknown_rank_by", "Unknown rank_by: " + command.getRankBy())
        );
        List<String> sources = new ArrayList<>(new LinkedHashSet<>(command.getSources()));
        for (String source : sources) {
            if (source == null || !providerRegistry.contains(source)) {
                throw new InvalidSearchRequestException("unknown_source", "Unknown source: " + source);
            }
        }
        int limit = command.getLimit() == null ? requestProperties.getDefaultLimit() : command.getLimit();
        if (limit < 1) {
            throw new InvalidSearchRequestException("invalid_limit", "limit must be positive");
        }
        return new ValidatedSearch(query, command.getCategory(), mode, rankBy, sources, limit);
    }

    /**
     * A cached page serves a request when it already holds {@code limit} papers, or when it was built for a
     * limit at least as large (fewer papers then means the providers had no more).
     */
    static boolean coversLimit(AggregateSearchResponse cached, int limit) {
        int size = cached.getPapers() == null ? 0 : cached.getPapers().size();
        if (size >= limit) {
            return true;
        }
        Integer builtFor = cached.getMetadata() == null ? null : cached.getMetadata().getResultLimit();
        return builtFor != null && builtFor >= limit;
    }

    private AggregateSearchResponse serveFromCache(AggregateSearchResponse cached, int limit, long started) {
        if (cached.getPapers() != null && cached.getPapers().size() > limit) {
            cached.setPapers(new ArrayList<>(cached.getPapers().subList(0, limit)));
            cached.setTotal(limit);
            if (cached.getMetadata() != null) {
                cached.getMetadata().setResultLimit(limit);
            }
        }
        cached.setFromCache(true);
        SearchMetadata metadata = cached.getMetadata() == null ? new SearchMetadata() : cached.getMetadata();
        metadata.setApiCalls(0);
        metadata.setFallbacksActivated(0);
        metadata.setProviderOutcomes(List.of());
        metadata.setTookMs(elapsedMs(started));
        cached.setMetadata(metadata);
        meterRegistry.counter("search.aggregate.requests.total", "mode", String.valueOf(cached.getMode()), "result", "cache")
            .increment();
        logger.info("aggregate_search_cache_hit category={} mode={} papers={}",
            cached.getCategory(), cached.getMode(), cached.getTotal());
        return cached;
    }

    private List<Double> embedQuery(String query) {
        try {
            return embeddingService.embed(query);
        } catch (EmbeddingUnavailableException e) {
            logger.warn("query_embedding_unavailable reason={}", e.getMessage());
            return null;
        }
    }

    private CompletableFuture<List<ScoredRecord>> startLocalSearch(
        String query,
        List<Double> queryVector,
        String category,
        int limit
    ) {
        try {
            return CompletableFuture.supplyAsync(() -> paperRepository.hybridSearch(
                VectorLiteral.of(queryVector),
                query,
                category,
                rankingProperties.getSemanticWeight(),
                rankingProperties.getKeywordWeight(),
                rankingProperties.getLocalMinScore(),
                limit
            ), searchExecutor);
        } catch (RejectedExecutionException e) {
            logger.warn("local_search_rejected category={}", category);
            return CompletableFuture.completedFuture(List.of());
        }
    }

    private List<ScoredRecord> awaitLocal(CompletableFuture<List<ScoredRecord>> future) {
        try {
            return future.get(Math.max(1L, executionProperties.getDeadlineMs()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("local_search_timeout");
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("local_search_failed error={}", cause.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    /**
     * Pairs queries with providers in order. Providers left over once the variations run out get the original query.
     */
    static List<QueryAssignment> assign(List<String> queries, List<String> providers) {
        List<QueryAssignment> assignments = new ArrayList<>(providers.size());
        for (int i = 0; i < providers.size(); i++) {
            String query = i < queries.size() ? queries.get(i) : queries.get(0);
            assignments.add(new QueryAssignment(query, providers.get(i)));
        }
        return assignments;
    }

    static List<RawCandidate> withoutLocalDuplicates(List<RawCandidate> candidates, List<ScoredRecord> localHits) {
        if (localHits.isEmpty()) {
            return candidates;
        }
        Set<String> dois = new HashSet<>();
        Set<String> titles = new HashSet<>();
        for (ScoredRecord hit : localHits) {
            String doi = TitleNormalizer.normalizeDoi(hit.getRecord().getDoi());
            if (doi != null) {
                dois.add(doi);
            }
            titles.add(TitleNormalizer.normalize(hit.getRecord().getTitle()));
        }
        List<RawCandidate> remaining = new ArrayList<>(candidates.size());
        for (RawCandidate candidate : candidates) {
            String doi = TitleNormalizer.normalizeDoi(candidate.getDoi());
            if (doi != null && dois.contains(doi)) {
                continue;
            }
            if (titles.contains(TitleNormalizer.normalize(candidate.getTitle()))) {
                continue;
            }
            remaining.add(candidate);
        }
        return remaining;
    }

    private Map<Long, Double> storedIndexScores(
        List<PaperRecord> persisted,
        List<Double> queryVector,
        String query,
        Set<Long> alreadyScored
    ) {
        List<Long> embeddedIds = new ArrayList<>();
        for (PaperRecord record : persisted) {
            if (record.isPersisted() && record.isEmbedded() && !alreadyScored.contains(record.getId())) {
                embeddedIds.add(record.getId());
            }
        }
        if (embeddedIds.isEmpty()) {
            return Map.of();
        }
        try {
            return paperRepository.indexScores(
                embeddedIds,
                VectorLiteral.of(queryVector),
                query,
                rankingProperties.getSemanticWeight(),
                rankingProperties.getKeywordWeight()
            );
        } catch (DataAccessException e) {
            logger.warn("index_scores_failed ids={} error={}", embeddedIds.size(), e.getMessage());
            return Map.of();
        }
    }

    private AggregateSearchResponse buildResponse(
        String query,
        RoutePlan plan,
        List<ScoredPaper> ranked,
        FanOutResult fanOut,
        int localHits
    ) {
        List<PaperHit> hits = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            hits.add(PaperHit.from(ranked.get(i), i + 1));
        }
        List<ProviderCallView> calls = new ArrayList<>();
        for (FanOutResult.ProviderCall call : fanOut.getCalls()) {
            calls.add(ProviderCallView.from(call));
        }

        SearchMetadata metadata = new SearchMetadata();
        metadata.setApiCalls(fanOut.getApiCalls());
        metadata.setFallbacksActivated(fanOut.getFallbacksActivated());
        metadata.setLocalHits(localHits);
        metadata.setCategoryInferred(plan.isCategoryInferred());
        metadata.setModeInferred(plan.isModeInferred());
        metadata.setProviderOutcomes(calls);

        AggregateSearchResponse response = new AggregateSearchResponse();
        response.setQuery(query);
        response.setCategory(plan.getCategoryId());
        response.setMode(plan.getMode().value());
        response.setPapers(hits);
        response.setTotal(hits.size());
        response.setSourcesUsed(fanOut.getSourcesUsed());
        response.setFromCache(false);
        response.setMetadata(metadata);
        if (hits.isEmpty()) {
            response.setExplanation(explainEmpty(fanOut));
        }
        return response;
    }

    static String explainEmpty(FanOutResult fanOut) {
        if (fanOut.getCalls().isEmpty()) {
            return "No provider could be queried for this search.";
        }
        StringJoiner tried = new StringJoiner(", ");
        for (FanOutResult.ProviderCall call : fanOut.getCalls()) {
            tried.add(call.getProvider() + " (" + call.getOutcome() + ")");
        }
        return "No provider returned usable results. Tried: " + tried;
    }

    private static List<Long> unembeddedIds(List<ScoredPaper> ranked) {
        List<Long> ids = new ArrayList<>();
        for (ScoredPaper paper : ranked) {
            PaperRecord record = paper.getRecord();
            if (record.isPersisted() && !record.isEmbedded()) {
                ids.add(record.getId());
            }
        }
        return ids;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static final class ValidatedSearch {
        private final String query;
        private final String category;
        private final SearchMode mode;
        private final RankBy rankBy;
        private final List<String> sources;
        private final int limit;

        private ValidatedSearch(
            String query,
            String category,
            SearchMode mode,
            RankBy rankBy,
            List<String> sources,
            int limit
        ) {
            this.query = query;
            this.category = category;
            this.mode = mode;
            this.rankBy = rankBy;
            this.sources = sources;
            this.limit = limit;
        }
    }
}
