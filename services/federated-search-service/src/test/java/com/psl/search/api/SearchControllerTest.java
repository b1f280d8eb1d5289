package com.psl.search.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.psl.search.api.dto.AggregateSearchResponse;
import com.psl.search.api.dto.ImportResponse;
import com.psl.search.api.dto.PaperHit;
import com.psl.search.api.dto.SearchMetadata;
import com.psl.search.provider.ProviderAdapter;
import com.psl.search.provider.ProviderRegistry;
import com.psl.search.routing.CategoryCatalog;
import com.psl.search.routing.CategoryRouter;
import com.psl.search.routing.RouteSuggestion;
import com.psl.search.routing.SearchCategory;
import com.psl.search.routing.SearchMode;
import com.psl.search.service.FederatedSearchService;
import com.psl.search.service.InvalidSearchRequestException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    private static final SearchCategory AI_CS = new SearchCategory(
        "ai_cs",
        "AI & Computer Science",
        "Machine learning, AI, computer vision, NLP",
        List.of("arxiv", "semantic_scholar", "openalex"),
        List.of("machine learning", "deep learning", "AI", "neural network", "computer vision", "NLP"),
        100
    );

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FederatedSearchService searchService;

    @MockBean
    private CategoryRouter router;

    @MockBean
    private CategoryCatalog catalog;

    @MockBean
    private ProviderRegistry providerRegistry;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void searchReturnsRankedPapersWithRequestIds() throws Exception {
        PaperHit hit = new PaperHit();
        hit.setId(7L);
        hit.setTitle("Attention Is All You Need");
        hit.setAbstractText("The dominant sequence transduction models...");
        hit.setArxivId("1706.03762");
        hit.setCitationCount(90000);
        hit.setRank(1);
        hit.setScore(0.91);
        hit.setScoreSource("index");
        SearchMetadata metadata = new SearchMetadata();
        metadata.setApiCalls(2);
        metadata.setRanking("hybrid");
        AggregateSearchResponse response = new AggregateSearchResponse();
        response.setQuery("transformers");
        response.setCategory("ai_cs");
        response.setMode("fast");
        response.setPapers(List.of(hit));
        response.setTotal(1);
        response.setSourcesUsed(List.of("arxiv"));
        response.setMetadata(metadata);
        when(searchService.aggregateSearch(any())).thenReturn(response);

        mockMvc.perform(post("/search")
                .header("x-trace-id", "trace-1")
                .header("x-request-id", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"transformers\",\"limit\":5,\"rank_by\":\"relevance\",\"use_cache\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.request_id").value("req-1"))
            .andExpect(jsonPath("$.papers[0].title").value("Attention Is All You Need"))
            .andExpect(jsonPath("$.papers[0].abstract").value("The dominant sequence transduction models..."))
            .andExpect(jsonPath("$.papers[0].arxiv_id").value("1706.03762"))
            .andExpect(jsonPath("$.papers[0].citation_count").value(90000))
            .andExpect(jsonPath("$.papers[0].score_source").value("index"))
            .andExpect(jsonPath("$.sources_used[0]").value("arxiv"))
            .andExpect(jsonPath("$.from_cache").value(false))
            .andExpect(jsonPath("$.explanation").doesNotExist())
            .andExpect(jsonPath("$.metadata.api_calls").value(2));

        verify(searchService).aggregateSearch(argThat(command ->
            "transformers".equals(command.getQuery())
                && Integer.valueOf(5).equals(command.getLimit())
                && !command.isUseCache()));
    }

    @Test
    void invalidSearchMapsToBadRequest() throws Exception {
        when(searchService.aggregateSearch(any()))
            .thenThrow(new InvalidSearchRequestException("query_required", "query must not be blank"));

        mockMvc.perform(post("/search")
                .header("x-request-id", "req-9")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("query_required"))
            .andExpect(jsonPath("$.request_id").value("req-9"))
            .andExpect(jsonPath("$.trace_id").isNotEmpty());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void suggestDescribesRoute() throws Exception {
        when(router.suggest("how do transformers work")).thenReturn(new RouteSuggestion(
            "how do transformers work",
            SearchMode.EXPAND,
            AI_CS,
            "Detected as question or complex academic query"
        ));

        mockMvc.perform(get("/search/suggest").param("q", " how do transformers work "))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.suggested_mode").value("expand"))
            .andExpect(jsonPath("$.detected_category").value("ai_cs"))
            .andExpect(jsonPath("$.source_hierarchy[0]").value("arxiv"));
    }

    @Test
    void suggestRequiresQuery() throws Exception {
        mockMvc.perform(get("/search/suggest").param("q", " "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("query_required"));
        mockMvc.perform(get("/search/suggest"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void categoriesListsCatalog() throws Exception {
        when(catalog.all()).thenReturn(List.of(AI_CS));

        mockMvc.perform(get("/categories"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.categories[0].id").value("ai_cs"))
            .andExpect(jsonPath("$.categories[0].max_results").value(100))
            .andExpect(jsonPath("$.categories[0].keywords.length()").value(5));
    }

    @Test
    void providersShowCircuitState() throws Exception {
        ProviderAdapter adapter = mock(ProviderAdapter.class);
        when(adapter.id()).thenReturn("arxiv");
        when(adapter.displayName()).thenReturn("arXiv");
        when(adapter.isEnabled()).thenReturn(true);
        when(adapter.circuitState()).thenReturn("open");
        when(providerRegistry.all()).thenReturn(List.of(adapter));

        mockMvc.perform(get("/providers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.providers[0].id").value("arxiv"))
            .andExpect(jsonPath("$.providers[0].circuit_state").value("open"));
    }

    @Test
    void importDelegatesToService() throws Exception {
        ImportResponse response = new ImportResponse();
        response.setCategory("ai_cs");
        response.setReceived(1);
        response.setAccepted(1);
        response.setPersisted(1);
        response.setIds(List.of(55L));
        response.setEmbeddingScheduled(true);
        when(searchService.importPapers(eq("ai_cs"), anyList())).thenReturn(response);

        mockMvc.perform(post("/papers/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\":\"ai_cs\",\"papers\":[{\"title\":\"Imported title here\","
                    + "\"authors\":[\"A. Author\"],\"doi\":\"10.1/x\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ids[0]").value(55))
            .andExpect(jsonPath("$.embedding_scheduled").value(true));
    }

    @Test
    void backfillIsAcceptedAsync() throws Exception {
        when(searchService.scheduleEmbeddingBackfill(List.of(1L, 2L))).thenReturn(true);

        mockMvc.perform(post("/papers/embeddings/backfill")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ids\":[1,2]}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.accepted").value(true))
            .andExpect(jsonPath("$.requested").value(2));
    }

    @Test
    void invalidateCategoryReportsDeletedEntries() throws Exception {
        when(searchService.invalidateCategory("ai_cs")).thenReturn(4L);

        mockMvc.perform(delete("/internal/cache/categories/ai_cs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.category").value("ai_cs"))
            .andExpect(jsonPath("$.deleted").value(4));
    }
}
