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
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class EuropePmcAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "europe_pmc";
    private static final int MAX_LIMIT = 1000;

    public EuropePmcAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "Europe PMC", "https://www.ebi.ac.uk/europepmc/webservices/rest", 100,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/search")
            .queryParam("query", "{query}")
            .queryParam("format", "json")
            .queryParam("resultType", "core")
            .queryParam("pageSize", Math.min(limit, MAX_LIMIT))
            .encode()
            .buildAndExpand(query)
            .toUri();
        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode result : getJson(uri, null).path("resultList").path("result")) {
            String title = text(result, "title");
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title.endsWith(".") ? title.substring(0, title.length() - 1) : title);
            candidate.setAbstractText(stripMarkup(text(result, "abstractText")));
            candidate.setAuthors(splitAuthors(text(result, "authorString")));
            candidate.setDoi(text(result, "doi"));
            candidate.setProviderId(text(result, "id"));
            candidate.setPublicationYear(integer(result, "pubYear"));
            candidate.setPublicationDate(isoDate(text(result, "firstPublicationDate")));
            String venue = text(result.path("journalInfo").path("journal"), "title");
            candidate.setVenue(venue == null ? text(result, "journalTitle") : venue);
            candidate.setCitationCount(integer(result, "citedByCount"));
            for (JsonNode url : result.path("fullTextUrlList").path("fullTextUrl")) {
                if ("pdf".equalsIgnoreCase(text(url, "documentStyle"))) {
                    candidate.setPdfUrl(text(url, "url"));
                    break;
                }
            }
            candidates.add(candidate);
        }
        return candidates;
    }

    static List<String> splitAuthors(String authorString) {
        List<String> authors = new ArrayList<>();
        if (authorString == null) {
            return authors;
        }
        String trimmed = authorString.endsWith(".")
            ? authorString.substring(0, authorString.length() - 1)
            : authorString;
        for (String part : trimmed.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                authors.add(name);
            }
        }
        return authors;
    }
}
