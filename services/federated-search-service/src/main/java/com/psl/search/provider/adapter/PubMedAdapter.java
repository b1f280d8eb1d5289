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

/**
 * NCBI E-utilities: esearch for PMIDs, then esummary for metadata.
 */
@Component
public class PubMedAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "pubmed";
    private static final int MAX_LIMIT = 200;

    public PubMedAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "PubMed", "https://eutils.ncbi.nlm.nih.gov/entrez/eutils", 60,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        UriComponentsBuilder search = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/esearch.fcgi")
            .queryParam("db", "pubmed")
            .queryParam("term", "{query}")
            .queryParam("retmax", Math.min(limit, MAX_LIMIT))
            .queryParam("retmode", "json");
        withApiKey(search);
        List<String> ids = new ArrayList<>();
        for (JsonNode id : getJson(search.encode().buildAndExpand(query).toUri(), null)
            .path("esearchresult").path("idlist")) {
            ids.add(id.asText());
        }
        if (ids.isEmpty()) {
            return List.of();
        }

        UriComponentsBuilder summary = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/esummary.fcgi")
            .queryParam("db", "pubmed")
            .queryParam("id", String.join(",", ids))
            .queryParam("retmode", "json");
        withApiKey(summary);
        URI summaryUri = summary.encode().build().toUri();
        JsonNode result = getJson(summaryUri, null).path("result");

        List<RawCandidate> candidates = new ArrayList<>();
        for (String pmid : ids) {
            JsonNode doc = result.path(pmid);
            String title = text(doc, "title");
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title.endsWith(".") ? title.substring(0, title.length() - 1) : title);
            List<String> authors = new ArrayList<>();
            for (JsonNode author : doc.path("authors")) {
                String name = text(author, "name");
                if (name != null) {
                    authors.add(name);
                }
            }
            candidate.setAuthors(authors);
            candidate.setProviderId(pmid);
            for (JsonNode articleId : doc.path("articleids")) {
                if ("doi".equals(text(articleId, "idtype"))) {
                    candidate.setDoi(text(articleId, "value"));
                }
            }
            String pubDate = text(doc, "sortpubdate");
            candidate.setPublicationYear(yearOf(pubDate == null ? text(doc, "pubdate") : pubDate));
            if (pubDate != null) {
                candidate.setPublicationDate(isoDate(pubDate.replace('/', '-')));
            }
            String venue = text(doc, "fulljournalname");
            candidate.setVenue(venue == null ? text(doc, "source") : venue);
            candidates.add(candidate);
        }
        return candidates;
    }

    private void withApiKey(UriComponentsBuilder builder) {
        if (source.getApiKey() != null && !source.getApiKey().isBlank()) {
            builder.queryParam("api_key", source.getApiKey());
        }
    }
}
