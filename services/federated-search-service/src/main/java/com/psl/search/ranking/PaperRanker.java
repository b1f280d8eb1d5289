package com.psl.search.ranking;

import com.psl.search.embed.EmbeddingService;
import com.psl.search.embed.EmbeddingTextBuilder;
import com.psl.search.ranking.ScoredPaper.ScoreSource;
import com.psl.search.store.PaperRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Orders merged records. Both orderings use a stable sort so equal scores keep their merge order.
 */
@Component
public class PaperRanker {
    private static final Comparator<ScoredPaper> BY_SCORE_DESC =
        Comparator.comparingDouble(ScoredPaper::getScore).reversed();

    private final RankingProperties properties;
    private final EmbeddingService embeddingService;

    public PaperRanker(RankingProperties properties, EmbeddingService embeddingService) {
        this.properties = properties;
        this.embeddingService = embeddingService;
    }

    public List<ScoredPaper> rankByCitations(List<PaperRecord> papers, int limit) {
        List<ScoredPaper> scored = new ArrayList<>(papers.size());
        for (PaperRecord paper : papers) {
            scored.add(new ScoredPaper(paper, paper.getCitationCount(), ScoreSource.CITATIONS));
        }
        scored.sort(BY_SCORE_DESC);
        return truncate(scored, limit);
    }

    /**
     * Hybrid score {@code semanticWeight * cos(q, v) + keywordWeight * keywordMatch}. A precomputed index score
     * wins when present; otherwise the semantic term comes from an already cached embedding, and failing that
     * from term overlap. The model is never called from here.
     */
    public List<ScoredPaper> rankHybrid(
        String query,
        List<Double> queryVector,
        List<PaperRecord> papers,
        Map<Long, Double> indexScores,
        int limit,
        double minScore
    ) {
        List<ScoredPaper> scored = new ArrayList<>(papers.size());
        for (PaperRecord paper : papers) {
            ScoredPaper candidate = score(query, queryVector, paper, indexScores);
            if (candidate.getScore() >= minScore) {
                scored.add(candidate);
            }
        }
        scored.sort(BY_SCORE_DESC);
        return truncate(scored, limit);
    }

    ScoredPaper score(String query, List<Double> queryVector, PaperRecord paper, Map<Long, Double> indexScores) {
        if (paper.getId() != null && indexScores != null) {
            Double indexed = indexScores.get(paper.getId());
            if (indexed != null) {
                return new ScoredPaper(paper, indexed, ScoreSource.INDEX);
            }
        }
        double keyword = keywordMatch(query, paper) ? 1.0 : 0.0;
        Optional<List<Double>> cached = queryVector == null
            ? Optional.empty()
            : embeddingService.cached(EmbeddingTextBuilder.forPaper(paper));
        double semantic;
        ScoreSource source;
        if (cached.isPresent()) {
            semantic = VectorMath.cosine(queryVector, cached.get());
            source = ScoreSource.CACHED_EMBEDDING;
        } else {
            semantic = VectorMath.termOverlap(query, textOf(paper));
            source = ScoreSource.TERM_OVERLAP;
        }
        double score = properties.getSemanticWeight() * semantic + properties.getKeywordWeight() * keyword;
        return new ScoredPaper(paper, score, source);
    }

    static boolean keywordMatch(String query, PaperRecord paper) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return contains(paper.getTitle(), needle) || contains(paper.getAbstractText(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String textOf(PaperRecord paper) {
        String title = paper.getTitle() == null ? "" : paper.getTitle();
        String abstractText = paper.getAbstractText() == null ? "" : paper.getAbstractText();
        return title + " " + abstractText;
    }

    private static List<ScoredPaper> truncate(List<ScoredPaper> scored, int limit) {
        if (limit >= 0 && scored.size() > limit) {
            return new ArrayList<>(scored.subList(0, limit));
        }
        return scored;
    }
}
