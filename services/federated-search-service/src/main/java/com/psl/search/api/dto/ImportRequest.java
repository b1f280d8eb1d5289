package com.psl.search.api.dto;

import com.psl.search.provider.RawCandidate;
import java.util.List;

public class ImportRequest {
    private String category;
    private List<RawCandidate> papers;

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public List<RawCandidate> getPapers() {
        return papers;
    }

    public void setPapers(List<RawCandidate> papers) {
        this.papers = papers;
    }
}
