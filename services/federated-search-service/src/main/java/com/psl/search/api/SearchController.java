package com.psl.search.api;

import com.psl.search.api.dto.AggregateSearchRequest;
import com.psl.search.api.dto.AggregateSearchResponse;
import com.psl.search.api.dto.BackfillRequest;
import com.psl.search.api.dto.CategoryView;
import com.psl.search.api.dto.ErrorResponse;
import com.psl.search.api.dto.ImportRequest;
import com.psl.search.api.dto.ImportResponse;
import com.psl.search.api.dto.ProviderView;
import com.psl.search.provider.ProviderAdapter;
import com.psl.search.provider.ProviderRegistry;
import com.psl.search.routing.CategoryCatalog;
import com.psl.search.routing.CategoryRouter;
import com.psl.search.routing.RouteSuggestion;
import com.psl.search.routing.SearchCategory;
import com.psl.search.service.AggregateSearchCommand;
import com.psl.search.service.FederatedSearchService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private final FederatedSearchService searchService;
    private final CategoryRouter router;
    private final CategoryCatalog catalog;
    private final ProviderRegistry providerRegistry;

    public SearchController(
        FederatedSearchService searchService,
        CategoryRouter router,
        CategoryCatalog catalog,
        ProviderRegistry providerRegistry
    ) {
        this.searchService = searchService;
        this.router = router;
        this.catalog = catalog;
        this.providerRegistry = providerRegistry;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) AggregateSearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }
        AggregateSearchResponse response = searchService.aggregateSearch(AggregateSearchCommand.from(request));
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/search/suggest")
    public ResponseEntity<?> suggest(
        @RequestParam("q") String query,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        if (query == null || query.isBlank()) {
            return ResponseEntity.badRequest().body(new ErrorResponse(
                "query_required",
                "q must not be blank",
                RequestIdUtil.resolveOrGenerate(traceIdHeader),
                RequestIdUtil.resolveOrGenerate(requestIdHeader)
            ));
        }
        RouteSuggestion suggestion = router.suggest(query.trim());
        return ResponseEntity.ok(suggestion);
    }

    @GetMapping("/categories")
    public Map<String, Object> categories() {
        List<CategoryView> views = new ArrayList<>();
        for (SearchCategory category : catalog.all()) {
            views.add(CategoryView.from(category));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("categories", views);
        body.put("total", views.size());
        return body;
    }

    @GetMapping("/providers")
    public Map<String, Object> providers() {
        List<ProviderView> views = new ArrayList<>();
        for (ProviderAdapter adapter : providerRegistry.all()) {
            views.add(ProviderView.from(adapter));
        }
        return Map.of("providers", views);
    }

    @PostMapping("/papers/import")
    public ResponseEntity<ImportResponse> importPapers(@RequestBody ImportRequest request) {
        ImportResponse response = searchService.importPapers(request.getCategory(), request.getPapers());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/papers/embeddings/backfill")
    public ResponseEntity<Map<String, Object>> scheduleBackfill(@RequestBody(required = false) BackfillRequest request) {
        List<Long> ids = request == null || request.getIds() == null ? List.of() : request.getIds();
        boolean accepted = searchService.scheduleEmbeddingBackfill(ids);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accepted", accepted);
        body.put("requested", ids.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @DeleteMapping("/internal/cache/categories/{category}")
    public Map<String, Object> invalidateCategory(@PathVariable("category") String category) {
        long deleted = searchService.invalidateCategory(category);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", category);
        body.put("deleted", deleted);
        return body;
    }
}
