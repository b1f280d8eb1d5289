package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ImportResponse {
    private String category;
    private int received;
    private int accepted;
    private int rejected;
    private int persisted;

    @JsonProperty("fields_backfilled")
    private int fieldsBackfilled;

    private List<Long> ids;

    @JsonProperty("embedding_scheduled")
    private boolean embeddingScheduled;

    @JsonProperty("cache_entries_invalidated")
    private long cacheEntriesInvalidated;

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public int getReceived() {
        return received;
    }

    public void setReceived(int received) {
        this.received = received;
    }

    public int getAccepted() {
        return accepted;
    }

    public void setAccepted(int accepted) {
        this.accepted = accepted;
    }

    public int getRejected() {
        return rejected;
    }

    public void setRejected(int rejected) {
        this.rejected = rejected;
    }

    public int getPersisted() {
        return persisted;
    }

    public void setPersisted(int persisted) {
        this.persisted = persisted;
    }

    public int getFieldsBackfilled() {
        return fieldsBackfilled;
    }

    public void setFieldsBackfilled(int fieldsBackfilled) {
        this.fieldsBackfilled = fieldsBackfilled;
    }

    public List<Long> getIds() {
        return ids;
    }

    public void setIds(List<Long> ids) {
        this.ids = ids;
    }

    public boolean isEmbeddingScheduled() {
        return embeddingScheduled;
    }

    public void setEmbeddingScheduled(boolean embeddingScheduled) {
        this.embeddingScheduled = embeddingScheduled;
    }

    public long getCacheEntriesInvalidated() {
        return cacheEntriesInvalidated;
    }

    public void setCacheEntriesInvalidated(long cacheEntriesInvalidated) {
        this.cacheEntriesInvalidated = cacheEntriesInvalidated;
    }
}
