package com.psl.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.api.dto.AggregateSearchRequest;
import com.psl.search.api.dto.AggregateSearchResponse;
import com.psl.search.api.dto.ImportResponse;
import com.psl.search.api.dto.PaperHit;
import com.psl.search.api.dto.SearchMetadata;
import com.psl.search.cache.CacheBackend;
import com.psl.search.cache.CacheProperties;
import com.psl.search.cache.InMemoryCacheBackend;
import com.psl.search.cache.QueryPopularityTracker;
import com.psl.search.cache.ResultCacheService;
import com.psl.search.embed.EmbeddingBackfillService;
import com.psl.search.embed.EmbeddingService;
import com.psl.search.embed.EmbeddingUnavailableException;
import com.psl.search.execution.ExecutionProperties;
import com.psl.search.execution.FanOutExecutor;
import com.psl.search.execution.QueryAssignment;
import com.psl.search.merge.PaperDeduplicator;
import com.psl.search.provider.ProviderAdapter;
import com.psl.search.provider.ProviderOutcome;
import com.psl.search.provider.ProviderRegistry;
import com.psl.search.provider.RawCandidate;
import com.psl.search.query.QueryExpansion;
import com.psl.search.query.QueryExpansionGateway;
import com.psl.search.ranking.PaperRanker;
import com.psl.search.ranking.RankingProperties;
import com.psl.search.routing.CategoryCatalog;
import com.psl.search.routing.CategoryRouter;
import com.psl.search.routing.RoutingProperties;
import com.psl.search.store.PaperRecord;
import com.psl.search.store.PaperRepository;
import com.psl.search.store.PersistenceGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class FederatedSearchServiceTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(6);
    private final AtomicLong nextId = new AtomicLong(100L);

    private ProviderAdapter arxiv;
    private ProviderAdapter semanticScholar;
    private ProviderAdapter openAlex;
    private QueryExpansionGateway expansionGateway;
    private PersistenceGateway persistenceGateway;
    private PaperRepository paperRepository;
    private EmbeddingService embeddingService;
    private EmbeddingBackfillService backfillService;
    private FederatedSearchService service;

    @BeforeEach
    void setUp() {
        arxiv = adapter("arxiv");
        semanticScholar = adapter("semantic_scholar");
        openAlex = adapter("openalex");
        expansionGateway = mock(QueryExpansionGateway.class);
        persistenceGateway = mock(PersistenceGateway.class);
        paperRepository = mock(PaperRepository.class);
        embeddingService = mock(EmbeddingService.class);
        backfillService = mock(EmbeddingBackfillService.class);

        when(embeddingService.embed(anyString())).thenReturn(List.of(1.0, 0.0));
        when(backfillService.schedule(any())).thenReturn(true);
        when(persistenceGateway.upsertAll(anyList(), anyString())).thenAnswer(invocation -> {
            List<RawCandidate> candidates = invocation.getArgument(0);
            String category = invocation.getArgument(1);
            List<PaperRecord> records = new ArrayList<>();
            for (RawCandidate candidate : candidates) {
                PaperRecord record = PaperRecord.fromCandidate(candidate, category);
                record.setId(nextId.incrementAndGet());
                records.add(record);
            }
            return records;
        });

        service = newService(new InMemoryCacheBackend(1000));
    }

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void cascadeFallsThroughTimeoutAndServesRepeatFromCache() {
        when(arxiv.search(anyString(), anyInt())).thenReturn(ProviderOutcome.err("arxiv", "timeout", 30000));
        when(semanticScholar.search(anyString(), anyInt()))
            .thenReturn(ProviderOutcome.ok("semantic_scholar", semanticScholarPapers(), 40));

        AggregateSearchResponse first = service.aggregateSearch(AggregateSearchCommand.of("machine learning"));

        assertEquals("ai_cs", first.getCategory());
        assertEquals("fast", first.getMode());
        assertEquals(11, first.getTotal());
        assertThat(first.getPapers()).hasSize(11);
        assertEquals(List.of("semantic_scholar"), first.getSourcesUsed());
        assertFalse(first.isFromCache());
        assertNull(first.getExplanation());
        assertEquals(2, first.getMetadata().getApiCalls());
        assertEquals(1, first.getMetadata().getFallbacksActivated());
        assertEquals("hybrid", first.getMetadata().getRanking());
        assertThat(first.getMetadata().getProviderOutcomes())
            .extracting(call -> call.getProvider() + "=" + call.getOutcome())
            .containsExactly("arxiv=err:timeout", "semantic_scholar=ok:12");
        assertThat(first.getPapers()).extracting(PaperHit::getRank)
            .containsExactlyElementsOf(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11));
        assertThat(first.getPapers()).filteredOn(hit -> "10.5555/dup".equalsIgnoreCase(hit.getDoi())).hasSize(1);
        verify(openAlex, never()).search(anyString(), anyInt());
        verify(backfillService).schedule(anyList());

        AggregateSearchResponse second = service.aggregateSearch(AggregateSearchCommand.of("Machine Learning"));

        assertTrue(second.isFromCache());
        assertEquals(11, second.getTotal());
        assertEquals(0, second.getMetadata().getApiCalls());
        assertThat(second.getPapers()).extracting(PaperHit::getTitle)
            .containsExactlyElementsOf(first.getPapers().stream().map(PaperHit::getTitle).toList());
        verify(semanticScholar, times(1)).search(anyString(), anyInt());
        verify(arxiv, times(1)).search(anyString(), anyInt());
    }

    @Test
    void unreachableCacheBackendFallsBackToLiveSearch() {
        CacheBackend down = mock(CacheBackend.class);
        when(down.name()).thenReturn("redis");
        when(down.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        when(down.increment(anyString(), any())).thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
            .when(down).set(anyString(), anyString(), any());
        FederatedSearchService degraded = newService(down);
        when(arxiv.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok("arxiv", List.of(
            candidate("Neural machine translation survey", null, 9),
            candidate("Neural machine translation at scale", null, 4)
        ), 1));

        AggregateSearchResponse first = degraded.aggregateSearch(AggregateSearchCommand.of("machine learning translation"));
        AggregateSearchResponse second = degraded.aggregateSearch(AggregateSearchCommand.of("machine learning translation"));

        assertEquals(2, first.getTotal());
        assertEquals(List.of("arxiv"), first.getSourcesUsed());
        assertFalse(first.isFromCache());
        assertFalse(second.isFromCache());
        assertEquals(2, second.getTotal());
        verify(arxiv, times(2)).search(anyString(), anyInt());
    }

    @Test
    void everyProviderFailingYieldsExplainedEmptyResponse() {
        when(arxiv.search(anyString(), anyInt())).thenReturn(ProviderOutcome.err("arxiv", "timeout", 1));
        when(semanticScholar.search(anyString(), anyInt()))
            .thenReturn(ProviderOutcome.err("semantic_scholar", "http_429", 1));
        when(openAlex.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok("openalex", List.of(), 1));

        AggregateSearchResponse response = service.aggregateSearch(AggregateSearchCommand.of("deep learning"));

        assertEquals(0, response.getTotal());
        assertThat(response.getSourcesUsed()).isEmpty();
        assertEquals(
            "No provider returned usable results. Tried: arxiv (err:timeout), semantic_scholar (err:http_429), "
                + "openalex (empty)",
            response.getExplanation()
        );

        AggregateSearchResponse repeat = service.aggregateSearch(AggregateSearchCommand.of("deep learning"));
        assertFalse(repeat.isFromCache());
        verify(backfillService, never()).schedule(anyList());
    }

    @Test
    void embeddingOutageFallsBackToCitationOrder() {
        when(embeddingService.embed(anyString())).thenThrow(new EmbeddingUnavailableException("embed_circuit_open"));
        when(arxiv.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok("arxiv", List.of(
            candidate("Convolutional networks revisited", null, 5),
            candidate("Convolutional networks at scale", null, 50)
        ), 1));

        AggregateSearchResponse response = service.aggregateSearch(AggregateSearchCommand.of("convolutional"));

        assertEquals("citations", response.getMetadata().getRanking());
        assertThat(response.getPapers()).extracting(PaperHit::getCitationCount).containsExactly(50, 5);
        verify(paperRepository, never()).hybridSearch(any(), any(), any(), anyDouble(), anyDouble(), anyDouble(), anyInt());
    }

    @Test
    void expandModeSpreadsQueriesAcrossProviders() {
        when(expansionGateway.expand("how do transformers work"))
            .thenReturn(QueryExpansion.originalOnly("how do transformers work", "disabled"));
        when(arxiv.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok("arxiv", List.of(), 1));
        when(semanticScholar.search(anyString(), anyInt()))
            .thenReturn(ProviderOutcome.ok("semantic_scholar", List.of(candidate("Transformers explained simply", null, 3)), 1));
        when(openAlex.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok("openalex", List.of(), 1));

        AggregateSearchResponse response = service.aggregateSearch(AggregateSearchCommand.of("how do transformers work"));

        assertEquals("expand", response.getMode());
        assertEquals(3, response.getMetadata().getApiCalls());
        assertEquals("fallback", response.getMetadata().getExpansionMethod());
        assertEquals(List.of("how do transformers work"), response.getMetadata().getExpandedQueries());
        assertEquals(1, response.getTotal());
    }

    @Test
    void explicitSourcesBypassCacheAndRouting() {
        when(openAlex.search(anyString(), anyInt()))
            .thenReturn(ProviderOutcome.ok("openalex", List.of(candidate("Soil carbon in grasslands", null, 1)), 1));
        AggregateSearchCommand command = new AggregateSearchCommand(
            "soil carbon", null, null, 5, List.of("openalex"), null, true);

        AggregateSearchResponse first = service.aggregateSearch(command);
        AggregateSearchResponse second = service.aggregateSearch(command);

        assertEquals(List.of("openalex"), first.getSourcesUsed());
        assertFalse(second.isFromCache());
        assertNull(first.getMetadata().getCacheTtlSeconds());
        verify(openAlex, times(2)).search(anyString(), anyInt());
        verify(arxiv, never()).search(anyString(), anyInt());
    }

    @Test
    void invalidInputIsTheOnlyError() {
        assertCode("query_required", AggregateSearchCommand.of("   "));
        assertCode("query_too_long", AggregateSearchCommand.of("x".repeat(501)));
        assertCode("unknown_category", new AggregateSearchCommand("q", "astrology", null, null, null, null, true));
        assertCode("unknown_mode", new AggregateSearchCommand("q", null, "turbo", null, null, null, true));
        assertCode("unknown_rank_by", new AggregateSearchCommand("q", null, null, null, null, "vibes", true));
        assertCode("unknown_source", new AggregateSearchCommand("q", null, null, null, List.of("bing"), null, true));
        AggregateSearchRequest nullSource = new AggregateSearchRequest();
        nullSource.setQuery("q");
        nullSource.setSources(Arrays.asList("arxiv", null));
        assertCode("unknown_source", AggregateSearchCommand.from(nullSource));
        assertCode("invalid_limit", new AggregateSearchCommand("q", null, null, 0, null, null, true));
    }

    @Test
    void limitIsClampedToRequest() {
        List<RawCandidate> many = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            many.add(candidate("Reinforcement learning paper " + i, null, i));
        }
        when(arxiv.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok("arxiv", many, 1));

        AggregateSearchResponse response = service.aggregateSearch(
            new AggregateSearchCommand("reinforcement learning", null, null, 3, null, "citations", true));

        assertEquals(3, response.getTotal());
        assertThat(response.getPapers()).extracting(PaperHit::getCitationCount).containsExactly(7, 6, 5);
    }

    @Test
    void cachedPageShorterThanLargerLimitIsRefetched() {
        List<RawCandidate> many = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            many.add(candidate("Reinforcement learning paper " + i, null, i));
        }
        when(arxiv.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok("arxiv", many, 1));

        AggregateSearchResponse small = service.aggregateSearch(
            new AggregateSearchCommand("reinforcement learning", null, null, 3, null, null, true));
        AggregateSearchResponse larger = service.aggregateSearch(
            new AggregateSearchCommand("reinforcement learning", null, null, 8, null, null, true));
        AggregateSearchResponse smaller = service.aggregateSearch(
            new AggregateSearchCommand("reinforcement learning", null, null, 5, null, null, true));

        assertEquals(3, small.getTotal());
        assertEquals(Integer.valueOf(3), small.getMetadata().getResultLimit());
        assertFalse(larger.isFromCache());
        assertEquals(8, larger.getTotal());
        assertTrue(smaller.isFromCache());
        assertEquals(5, smaller.getTotal());
        verify(arxiv, times(2)).search(anyString(), anyInt());
    }

    @Test
    void shortCachedPageStillServesWhenBuiltForLargerLimit() {
        AggregateSearchResponse exhausted = new AggregateSearchResponse();
        exhausted.setPapers(List.of(new PaperHit(), new PaperHit()));
        SearchMetadata metadata = new SearchMetadata();
        metadata.setResultLimit(20);
        exhausted.setMetadata(metadata);

        assertTrue(FederatedSearchService.coversLimit(exhausted, 10));
        metadata.setResultLimit(5);
        assertFalse(FederatedSearchService.coversLimit(exhausted, 10));
        assertTrue(FederatedSearchService.coversLimit(exhausted, 2));
        exhausted.setMetadata(null);
        assertFalse(FederatedSearchService.coversLimit(exhausted, 3));
    }

    @Test
    void importStoresSchedulesAndInvalidates() {
        when(persistenceGateway.backfillMissingFields(anyLong(), any())).thenReturn(true);
        List<RawCandidate> papers = List.of(
            candidate("Imported paper about wheat", null, 0),
            candidate("bad", null, 0)
        );

        ImportResponse response = service.importPapers("agriculture_animal", papers);

        assertEquals("agriculture_animal", response.getCategory());
        assertEquals(2, response.getReceived());
        assertEquals(1, response.getAccepted());
        assertEquals(1, response.getRejected());
        assertEquals(1, response.getPersisted());
        assertEquals(1, response.getFieldsBackfilled());
        assertTrue(response.isEmbeddingScheduled());
        verify(backfillService).schedule(eq(response.getIds()));
    }

    @Test
    void importRejectsUnknownCategoryAndEmptyBatch() {
        assertThatThrownBy(() -> service.importPapers("astrology", List.of(candidate("Some valid title", null, 0))))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.importPapers(null, List.of()))
            .isInstanceOf(InvalidSearchRequestException.class)
            .extracting(e -> ((InvalidSearchRequestException) e).getCode())
            .isEqualTo("papers_required");
    }

    @Test
    void emptyBackfillRequestMeansSweep() {
        assertTrue(service.scheduleEmbeddingBackfill(null));
        verify(backfillService).schedule(List.of());
    }

    @Test
    void assignmentPadsProvidersWithOriginalQuery() {
        List<QueryAssignment> assignments = FederatedSearchService.assign(
            List.of("original", "variation"), List.of("pubmed", "europe_pmc", "crossref"));

        assertThat(assignments).extracting(QueryAssignment::toString)
            .containsExactly("pubmed:original", "europe_pmc:variation", "crossref:original");
    }

    private FederatedSearchService newService(CacheBackend cacheBackend) {
        RoutingProperties routingProperties = new RoutingProperties();
        CategoryCatalog catalog = new CategoryCatalog(routingProperties);
        ProviderRegistry registry = new ProviderRegistry(List.of(arxiv, semanticScholar, openAlex));
        ExecutionProperties executionProperties = new ExecutionProperties();
        executionProperties.setDeadlineMs(5000);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        CacheProperties cacheProperties = new CacheProperties();
        RankingProperties rankingProperties = new RankingProperties();

        return new FederatedSearchService(
            new CategoryRouter(catalog, routingProperties),
            catalog,
            registry,
            new FanOutExecutor(pool, registry, executionProperties, meterRegistry),
            expansionGateway,
            new PaperDeduplicator(),
            persistenceGateway,
            paperRepository,
            new PaperRanker(rankingProperties, embeddingService),
            rankingProperties,
            embeddingService,
            backfillService,
            new ResultCacheService(cacheBackend, cacheProperties, new ObjectMapper(), meterRegistry),
            new QueryPopularityTracker(cacheBackend, cacheProperties),
            pool,
            executionProperties,
            new SearchRequestProperties(),
            meterRegistry
        );
    }

    private void assertCode(String code, AggregateSearchCommand command) {
        assertThatThrownBy(() -> service.aggregateSearch(command))
            .isInstanceOf(InvalidSearchRequestException.class)
            .extracting(e -> ((InvalidSearchRequestException) e).getCode())
            .isEqualTo(code);
    }

    private static List<RawCandidate> semanticScholarPapers() {
        List<RawCandidate> papers = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String title = "Machine learning study number " + i;
            String doi = "10.5555/s" + i;
            if (i == 3) {
                title = "Machine Learning Duplicate Study";
                doi = "10.5555/DUP";
            } else if (i == 7) {
                title = "machine learning duplicate study";
                doi = "10.5555/dup";
            }
            papers.add(candidate(title, doi, i));
        }
        return papers;
    }

    private static RawCandidate candidate(String title, String doi, int citations) {
        RawCandidate candidate = new RawCandidate();
        candidate.setTitle(title);
        candidate.setDoi(doi);
        candidate.setAuthors(List.of("A. Researcher"));
        candidate.setCitationCount(citations);
        return candidate;
    }

    private static ProviderAdapter adapter(String id) {
        ProviderAdapter adapter = mock(ProviderAdapter.class);
        when(adapter.id()).thenReturn(id);
        when(adapter.isEnabled()).thenReturn(true);
        when(adapter.search(anyString(), anyInt())).thenReturn(ProviderOutcome.ok(id, List.of(), 1));
        return adapter;
    }
}
