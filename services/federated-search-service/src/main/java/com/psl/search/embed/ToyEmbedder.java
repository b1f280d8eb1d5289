package com.psl.search.embed;

import com.psl.search.cache.CacheKeyUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Deterministic feature-hashing embedder for local runs and tests. Texts sharing words get similar vectors.
 */
@Component
public class ToyEmbedder {
    private final int dimension;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.dimension = Math.max(8, properties.getDimension());
    }

    public List<Double> embed(String text) {
        double[] values = new double[dimension];
        String[] tokens = text == null ? new String[0] : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            String hash = CacheKeyUtil.sha256(token);
            int bucket = (int) (Long.parseLong(hash.substring(0, 8), 16) % dimension);
            double sign = Character.digit(hash.charAt(8), 16) % 2 == 0 ? 1.0 : -1.0;
            values[bucket] += sign;
        }
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }
}
