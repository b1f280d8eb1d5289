package com.psl.search.store;

public class ScoredRecord {
    private final PaperRecord record;
    private final double score;

    public ScoredRecord(PaperRecord record, double score) {
        this.record = record;
        this.score = score;
    }

    public PaperRecord getRecord() {
        return record;
    }

    public double getScore() {
        return score;
    }
}
