package com.psl.search.embed;

import com.psl.search.resilience.CircuitBreaker;
import com.psl.search.resilience.ResilienceRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Cache-first embedding. The request path calls {@link #embed}; the background backfill calls {@link #embedBatch}.
 * Both end in {@link #compute}, so the model is only ever reached through the circuit breaker.
 */
@Component
public class EmbeddingService implements EmbeddingProvider {
    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final ResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        ResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        return cacheService.get(text).orElseGet(() -> computeAndCache(text));
    }

    /**
     * Cached vector only; never calls the model.
     */
    public Optional<List<Double>> cached(String text) {
        return cacheService.get(text);
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        List<Integer> missingIdx = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            Optional<List<Double>> hit = cacheService.get(texts.get(i));
            vectors.add(hit.orElse(null));
            if (hit.isEmpty()) {
                missingIdx.add(i);
                missing.add(texts.get(i));
            }
        }
        if (missing.isEmpty()) {
            return vectors;
        }
        List<List<Double>> computed = compute(missing);
        for (int i = 0; i < missing.size(); i++) {
            vectors.set(missingIdx.get(i), computed.get(i));
            cacheService.put(missing.get(i), computed.get(i));
        }
        return vectors;
    }

    private List<Double> computeAndCache(String text) {
        List<Double> vector = compute(List.of(text)).get(0);
        cacheService.put(text, vector);
        return vector;
    }

    List<List<Double>> compute(List<String> texts) {
        if (properties.getMode() == EmbeddingMode.HTTP) {
            CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
            if (!breaker.allowRequest()) {
                throw new EmbeddingUnavailableException("embed_circuit_open");
            }
            try {
                List<List<Double>> vectors = embeddingGateway.embed(texts);
                breaker.recordSuccess();
                return vectors;
            } catch (EmbeddingUnavailableException ex) {
                breaker.recordFailure();
                throw ex;
            }
        }
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(toyEmbedder.embed(text));
        }
        return vectors;
    }
}
