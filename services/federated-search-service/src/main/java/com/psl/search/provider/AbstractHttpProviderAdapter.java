package com.psl.search.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.ratelimit.RateLimiter;
import com.psl.search.ratelimit.TokenBucketRateLimiter;
import com.psl.search.resilience.CircuitBreaker;
import com.psl.search.resilience.ResilienceRegistry;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Shared plumbing for HTTP providers: enablement, circuit breaker, token bucket and error mapping.
 * Subclasses only build the request and map the response into {@link RawCandidate}s.
 */
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {
    private static final Logger logger = LoggerFactory.getLogger(AbstractHttpProviderAdapter.class);
    private static final Pattern YEAR = Pattern.compile("(19|20)\\d{2}");
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");

    private final String id;
    private final String displayName;
    private final String defaultBaseUrl;
    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;
    protected final ProviderProperties properties;
    protected final ProviderProperties.Source source;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker breaker;

    protected AbstractHttpProviderAdapter(
        String id,
        String displayName,
        String defaultBaseUrl,
        int defaultRatePerMinute,
        RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        this.id = id;
        this.displayName = displayName;
        this.defaultBaseUrl = defaultBaseUrl;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.source = properties.source(id);
        int rate = source.getRatePerMinute() == null ? defaultRatePerMinute : source.getRatePerMinute();
        int burst = source.getBurst() == null ? Math.max(1, rate / 6) : source.getBurst();
        this.rateLimiter = new TokenBucketRateLimiter(rate, burst);
        this.breaker = resilienceRegistry.providerBreaker(id);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public boolean isEnabled() {
        return source.isEnabled();
    }

    @Override
    public String circuitState() {
        return breaker.state();
    }

    @Override
    public final ProviderOutcome search(String query, int limit) {
        long started = System.nanoTime();
        if (!isEnabled()) {
            return ProviderOutcome.err(id, "disabled", elapsedMs(started));
        }
        if (!breaker.allowRequest()) {
            return ProviderOutcome.err(id, "circuit_open", elapsedMs(started));
        }
        try {
            if (!rateLimiter.tryAcquire(properties.getRateLimitWaitMs())) {
                logger.warn("provider_rate_limited provider={}", id);
                return ProviderOutcome.err(id, "rate_limited", elapsedMs(started));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderOutcome.err(id, "interrupted", elapsedMs(started));
        }
        String reason;
        try {
            List<RawCandidate> candidates = fetch(query, Math.max(1, limit));
            breaker.recordSuccess();
            for (RawCandidate candidate : candidates) {
                candidate.setProvider(id);
            }
            return ProviderOutcome.ok(id, candidates, elapsedMs(started));
        } catch (ProviderUnavailableException e) {
            reason = e.getMessage();
        } catch (ResourceAccessException e) {
            reason = e.getCause() instanceof SocketTimeoutException ? "timeout" : "unreachable";
        } catch (HttpStatusCodeException e) {
            reason = "http_" + e.getStatusCode().value();
        } catch (RestClientException e) {
            reason = "client_error";
        }
        breaker.recordFailure();
        logger.warn("provider_call_failed provider={} reason={} query_len={}", id, reason, query.length());
        return ProviderOutcome.err(id, reason, elapsedMs(started));
    }

    protected abstract List<RawCandidate> fetch(String query, int limit);

    protected String baseUrl() {
        String base = source.getBaseUrl() == null || source.getBaseUrl().isBlank()
            ? defaultBaseUrl
            : source.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    protected String getText(URI uri, HttpHeaders headers) {
        ResponseEntity<String> response = restTemplate.exchange(
            uri,
            HttpMethod.GET,
            new HttpEntity<>(headers == null ? new HttpHeaders() : headers),
            String.class
        );
        String body = response.getBody();
        return body == null ? "" : body;
    }

    protected JsonNode getJson(URI uri, HttpHeaders headers) {
        String body = getText(uri, headers);
        if (body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException("invalid_json", e);
        }
    }

    protected static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    protected static Integer integer(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.canConvertToInt()) {
            return value.asInt();
        }
        try {
            return Integer.parseInt(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected static Integer yearOf(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(value);
        return matcher.find() ? Integer.parseInt(matcher.group()) : null;
    }

    /**
     * Returns an ISO date when the value carries a full calendar date, otherwise null so only the year is kept.
     */
    protected static String isoDate(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10)).toString();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    protected static String stripMarkup(String value) {
        if (value == null) {
            return null;
        }
        String stripped = TAGS.matcher(value).replaceAll(" ").replaceAll("\\s+", " ").trim();
        return stripped.isEmpty() ? null : stripped;
    }

    protected static String bareDoi(String value) {
        if (value == null) {
            return null;
        }
        String doi = value.trim();
        int idx = doi.toLowerCase(Locale.ROOT).indexOf("doi.org/");
        if (idx >= 0) {
            doi = doi.substring(idx + "doi.org/".length());
        }
        return doi.isEmpty() ? null : doi;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
