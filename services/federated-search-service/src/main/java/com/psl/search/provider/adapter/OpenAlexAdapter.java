package com.psl.search.provider.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.provider.AbstractHttpProviderAdapter;
import com.psl.search.provider.ProviderProperties;
import com.psl.search.provider.RawCandidate;
import com.psl.search.resilience.ResilienceRegistry;
import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class OpenAlexAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "openalex";
    private static final int MAX_LIMIT = 200;

    public OpenAlexAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "OpenAlex", "https://api.openalex.org", 500,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/works")
            .queryParam("search", "{query}")
            .queryParam("per-page", Math.min(limit, MAX_LIMIT));
        if (properties.getMailto() != null && !properties.getMailto().isBlank()) {
            builder.queryParam("mailto", properties.getMailto());
        }
        URI uri = builder.encode().buildAndExpand(query).toUri();
        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode work : getJson(uri, null).path("results")) {
            String title = text(work, "title");
            if (title == null) {
                title = text(work, "display_name");
            }
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title);
            candidate.setAbstractText(rebuildAbstract(work.path("abstract_inverted_index")));
            List<String> authors = new ArrayList<>();
            for (JsonNode authorship : work.path("authorships")) {
                String name = text(authorship.path("author"), "display_name");
                if (name != null) {
                    authors.add(name);
                }
            }
            candidate.setAuthors(authors);
            candidate.setProviderId(text(work, "id"));
            candidate.setDoi(bareDoi(text(work, "doi")));
            candidate.setPublicationDate(isoDate(text(work, "publication_date")));
            candidate.setPublicationYear(integer(work, "publication_year"));
            candidate.setVenue(text(work.path("primary_location").path("source"), "display_name"));
            candidate.setCitationCount(integer(work, "cited_by_count"));
            candidate.setPdfUrl(text(work.path("open_access"), "oa_url"));
            candidates.add(candidate);
        }
        return candidates;
    }

    static String rebuildAbstract(JsonNode invertedIndex) {
        if (invertedIndex == null || !invertedIndex.isObject() || invertedIndex.isEmpty()) {
            return null;
        }
        Map<Integer, String> positions = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = invertedIndex.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            for (JsonNode position : field.getValue()) {
                positions.put(position.asInt(), field.getKey());
            }
        }
        return String.join(" ", positions.values());
    }
}
