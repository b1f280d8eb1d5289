package com.psl.search.ranking;

import com.psl.search.store.PaperRecord;

public class ScoredPaper {
    private final PaperRecord record;
    private final double score;
    private final ScoreSource source;

    public ScoredPaper(PaperRecord record, double score, ScoreSource source) {
        this.record = record;
        this.score = score;
        this.source = source;
    }

    public PaperRecord getRecord() {
        return record;
    }

    public double getScore() {
        return score;
    }

    public ScoreSource getSource() {
        return source;
    }

    public enum ScoreSource {
        INDEX,
        CACHED_EMBEDDING,
        TERM_OVERLAP,
        CITATIONS
    }
}
