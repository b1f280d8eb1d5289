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
public class CrossrefAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "crossref";
    private static final int MAX_LIMIT = 1000;

    public CrossrefAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "Crossref", "https://api.crossref.org", 500,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/works")
            .queryParam("query", "{query}")
            .queryParam("rows", Math.min(limit, MAX_LIMIT));
        if (properties.getMailto() != null && !properties.getMailto().isBlank()) {
            builder.queryParam("mailto", properties.getMailto());
        }
        URI uri = builder.encode().buildAndExpand(query).toUri();
        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode item : getJson(uri, null).path("message").path("items")) {
            String title = first(item.path("title"));
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title);
            candidate.setAbstractText(stripMarkup(text(item, "abstract")));
            List<String> authors = new ArrayList<>();
            for (JsonNode author : item.path("author")) {
                String given = text(author, "given");
                String family = text(author, "family");
                String name = given == null ? family : family == null ? given : given + " " + family;
                if (name != null) {
                    authors.add(name);
                }
            }
            candidate.setAuthors(authors);
            candidate.setDoi(text(item, "DOI"));
            candidate.setProviderId(text(item, "DOI"));
            JsonNode parts = item.path("issued").path("date-parts").path(0);
            if (parts.size() > 0 && parts.get(0).canConvertToInt()) {
                candidate.setPublicationYear(parts.get(0).asInt());
                if (parts.size() >= 3) {
                    candidate.setPublicationDate(String.format(
                        "%04d-%02d-%02d", parts.get(0).asInt(), parts.get(1).asInt(), parts.get(2).asInt()));
                }
            }
            candidate.setVenue(first(item.path("container-title")));
            candidate.setCitationCount(integer(item, "is-referenced-by-count"));
            for (JsonNode link : item.path("link")) {
                if ("application/pdf".equals(text(link, "content-type"))) {
                    candidate.setPdfUrl(text(link, "URL"));
                    break;
                }
            }
            candidates.add(candidate);
        }
        return candidates;
    }

    private static String first(JsonNode array) {
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        String value = array.get(0).asText().trim();
        return value.isEmpty() ? null : value;
    }
}
