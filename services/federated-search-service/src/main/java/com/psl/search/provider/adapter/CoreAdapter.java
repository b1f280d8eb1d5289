package com.psl.search.provider.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.provider.AbstractHttpProviderAdapter;
import com.psl.search.provider.ProviderProperties;
import com.psl.search.provider.ProviderUnavailableException;
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
public class CoreAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "core";
    private static final int MAX_LIMIT = 100;

    public CoreAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "CORE", "https://api.core.ac.uk/v3", 50,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        if (source.getApiKey() == null || source.getApiKey().isBlank()) {
            throw new ProviderUnavailableException("api_key_missing");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/search/works")
            .queryParam("q", "{query}")
            .queryParam("limit", Math.min(limit, MAX_LIMIT))
            .encode()
            .buildAndExpand(query)
            .toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(source.getApiKey());

        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode work : getJson(uri, headers).path("results")) {
            String title = text(work, "title");
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title);
            candidate.setAbstractText(text(work, "abstract"));
            List<String> authors = new ArrayList<>();
            for (JsonNode author : work.path("authors")) {
                String name = text(author, "name");
                if (name != null) {
                    authors.add(name);
                }
            }
            candidate.setAuthors(authors);
            candidate.setProviderId(text(work, "id"));
            candidate.setDoi(bareDoi(text(work, "doi")));
            String published = text(work, "publishedDate");
            candidate.setPublicationDate(isoDate(published));
            Integer year = integer(work, "yearPublished");
            candidate.setPublicationYear(year == null ? yearOf(published) : year);
            String venue = text(work.path("journals").path(0), "title");
            candidate.setVenue(venue == null ? text(work, "publisher") : venue);
            candidate.setCitationCount(integer(work, "citationCount"));
            candidate.setPdfUrl(text(work, "downloadUrl"));
            candidates.add(candidate);
        }
        return candidates;
    }
}
