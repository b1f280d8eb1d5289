package com.psl.search.provider.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.provider.AbstractHttpProviderAdapter;
import com.psl.search.provider.ProviderProperties;
import com.psl.search.provider.RawCandidate;
import com.psl.search.resilience.ResilienceRegistry;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class SemanticScholarAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "semantic_scholar";
    private static final String FIELDS =
        "paperId,title,abstract,authors,year,publicationDate,citationCount,venue,openAccessPdf,externalIds";
    private static final int MAX_LIMIT = 100;

    public SemanticScholarAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "Semantic Scholar", "https://api.semanticscholar.org", 100,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/graph/v1/paper/search")
            .queryParam("query", "{query}")
            .queryParam("limit", Math.min(limit, MAX_LIMIT))
            .queryParam("fields", FIELDS)
            .encode()
            .buildAndExpand(query)
            .toUri();
        HttpHeaders headers = new HttpHeaders();
        if (source.getApiKey() != null && !source.getApiKey().isBlank()) {
            headers.add("x-api-key", source.getApiKey());
        }
        JsonNode data = getJson(uri, headers).path("data");
        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode paper : data) {
            String title = text(paper, "title");
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title);
            candidate.setAbstractText(text(paper, "abstract"));
            List<String> authors = new ArrayList<>();
            for (JsonNode author : paper.path("authors")) {
                String name = text(author, "name");
                if (name != null) {
                    authors.add(name);
                }
            }
            candidate.setAuthors(authors);
            candidate.setProviderId(text(paper, "paperId"));
            JsonNode externalIds = paper.path("externalIds");
            candidate.setDoi(text(externalIds, "DOI"));
            candidate.setArxivId(text(externalIds, "ArXiv"));
            candidate.setPublicationYear(integer(paper, "year"));
            candidate.setPublicationDate(isoDate(text(paper, "publicationDate")));
            candidate.setVenue(text(paper, "venue"));
            candidate.setCitationCount(integer(paper, "citationCount"));
            candidate.setPdfUrl(text(paper.path("openAccessPdf"), "url"));
            candidates.add(candidate);
        }
        return candidates;
    }
}
