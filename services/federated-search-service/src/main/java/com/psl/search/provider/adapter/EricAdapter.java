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
public class EricAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "eric";
    private static final String FIELDS = "id,title,description,author,publicationdateyear,source,url,e_fulltextauth";
    private static final int MAX_LIMIT = 200;

    public EricAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "ERIC", "https://api.ies.ed.gov/eric", 100,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/")
            .queryParam("search", "{query}")
            .queryParam("rows", Math.min(limit, MAX_LIMIT))
            .queryParam("format", "json")
            .queryParam("fields", FIELDS)
            .encode()
            .buildAndExpand(query)
            .toUri();
        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode doc : getJson(uri, null).path("response").path("docs")) {
            String title = text(doc, "title");
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title);
            candidate.setAbstractText(text(doc, "description"));
            List<String> authors = new ArrayList<>();
            for (JsonNode author : doc.path("author")) {
                String name = author.asText().trim();
                if (!name.isEmpty()) {
                    authors.add(name);
                }
            }
            candidate.setAuthors(authors);
            String ericId = text(doc, "id");
            candidate.setProviderId(ericId);
            candidate.setPublicationYear(integer(doc, "publicationdateyear"));
            candidate.setVenue(text(doc, "source"));
            if (ericId != null && doc.path("e_fulltextauth").asInt(0) == 1) {
                candidate.setPdfUrl("https://files.eric.ed.gov/fulltext/" + ericId + ".pdf");
            }
            candidates.add(candidate);
        }
        return candidates;
    }
}
