package com.psl.search.ranking;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class VectorMath {
    private VectorMath() {
    }

    public static double cosine(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Share of distinct query terms that also appear in the text. Stands in for cosine similarity
     * when no vector exists for the text.
     */
    public static double termOverlap(String query, String text) {
        Set<String> queryTerms = terms(query);
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> textTerms = terms(text);
        int hits = 0;
        for (String term : queryTerms) {
            if (textTerms.contains(term)) {
                hits++;
            }
        }
        return (double) hits / queryTerms.size();
    }

    static Set<String> terms(String text) {
        Set<String> terms = new HashSet<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                terms.add(token);
            }
        }
        return terms;
    }
}
