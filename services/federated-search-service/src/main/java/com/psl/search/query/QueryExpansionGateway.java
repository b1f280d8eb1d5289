package com.psl.search.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Asks an OpenAI-compatible chat-completions endpoint for academic rephrasings of the query.
 * Any failure degrades to the original query alone.
 */
@Component
public class QueryExpansionGateway {
    private static final Logger logger = LoggerFactory.getLogger(QueryExpansionGateway.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final QueryExpansionProperties properties;
    private final ObjectMapper objectMapper;

    public QueryExpansionGateway(
        @Qualifier("queryExpansionRestTemplate") RestTemplate restTemplate,
        QueryExpansionProperties properties,
        ObjectMapper objectMapper
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public QueryExpansion expand(String query) {
        if (!properties.isEnabled()) {
            return QueryExpansion.originalOnly(query, "disabled");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            return QueryExpansion.originalOnly(query, "base_url_missing");
        }
        try {
            String content = complete(buildPrompt(query));
            List<String> variations = parseVariations(content);
            return new QueryExpansion(merge(query, variations, properties.getMaxVariations()), "llm", null);
        } catch (ResourceAccessException e) {
            logger.warn("query_expansion_unavailable error={}", e.getMessage());
            return QueryExpansion.originalOnly(query, "timeout");
        } catch (HttpStatusCodeException e) {
            logger.warn("query_expansion_http_error status={}", e.getStatusCode().value());
            return QueryExpansion.originalOnly(query, "http_" + e.getStatusCode().value());
        } catch (RestClientException | QueryExpansionFormatException e) {
            logger.warn("query_expansion_failed error={}", e.getMessage());
            return QueryExpansion.originalOnly(query, "invalid_response");
        }
    }

    private String complete(String prompt) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "user");
        message.put("content", prompt);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("messages", List.of(message));
        body.put("temperature", properties.getTemperature());
        body.put("max_tokens", properties.getMaxTokens());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        ResponseEntity<JsonNode> response = restTemplate.exchange(
            buildUrl("/v1/chat/completions"),
            HttpMethod.POST,
            new HttpEntity<>(body, headers),
            JsonNode.class
        );
        JsonNode root = response.getBody();
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new QueryExpansionFormatException("missing message content");
        }
        return content.asText();
    }

    List<String> parseVariations(String content) {
        String trimmed = content == null ? "" : content.trim();
        int start = trimmed.indexOf('[');
        int end = trimmed.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new QueryExpansionFormatException("no json array in completion");
        }
        try {
            return objectMapper.readValue(trimmed.substring(start, end + 1), STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new QueryExpansionFormatException("completion is not a string array");
        }
    }

    static List<String> merge(String original, List<String> variations, int maxVariations) {
        List<String> queries = new ArrayList<>();
        queries.add(original);
        List<String> seen = new ArrayList<>();
        seen.add(original.trim().toLowerCase(Locale.ROOT));
        for (String variation : variations) {
            if (queries.size() > maxVariations) {
                break;
            }
            if (variation == null || variation.isBlank()) {
                continue;
            }
            String key = variation.trim().toLowerCase(Locale.ROOT);
            if (!seen.contains(key)) {
                seen.add(key);
                queries.add(variation.trim());
            }
        }
        return queries;
    }

    static String buildPrompt(String query) {
        return "You are an expert academic research assistant. A user wants to find research papers about: \""
            + query + "\"\n\n"
            + "Generate 4 specific, well-formed academic search queries (8-12 words each) that cover different "
            + "aspects of the topic and suit databases like arXiv, PubMed or Semantic Scholar.\n\n"
            + "Respond with ONLY a JSON array of strings. No other text.";
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    static class QueryExpansionFormatException extends RuntimeException {
        QueryExpansionFormatException(String message) {
            super(message);
        }
    }
}
