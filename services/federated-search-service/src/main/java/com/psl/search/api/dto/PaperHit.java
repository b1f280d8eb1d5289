package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.psl.search.ranking.ScoredPaper;
import com.psl.search.store.PaperRecord;
import java.util.List;
import java.util.Locale;

public class PaperHit {
    private Long id;
    private String title;

    @JsonProperty("abstract")
    private String abstractText;

    private List<String> authors;
    private String doi;

    @JsonProperty("arxiv_id")
    private String arxivId;

    private String provider;

    @JsonProperty("publication_date")
    private String publicationDate;

    @JsonProperty("publication_year")
    private Integer publicationYear;

    private String venue;

    @JsonProperty("citation_count")
    private int citationCount;

    @JsonProperty("pdf_url")
    private String pdfUrl;

    private String category;
    private double score;
    private int rank;

    @JsonProperty("score_source")
    private String scoreSource;

    public static PaperHit from(ScoredPaper scored, int rank) {
        PaperRecord record = scored.getRecord();
        PaperHit hit = new PaperHit();
        hit.id = record.getId();
        hit.title = record.getTitle();
        hit.abstractText = record.getAbstractText();
        hit.authors = record.getAuthors();
        hit.doi = record.getDoi();
        hit.arxivId = record.getArxivId();
        hit.provider = record.getProvider();
        hit.publicationDate = record.getPublicationDate();
        hit.publicationYear = record.getPublicationYear();
        hit.venue = record.getVenue();
        hit.citationCount = record.getCitationCount();
        hit.pdfUrl = record.getPdfUrl();
        hit.category = record.getCategory();
        hit.score = scored.getScore();
        hit.rank = rank;
        hit.scoreSource = scored.getSource().name().toLowerCase(Locale.ROOT);
        return hit;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getAbstractText() {
        return abstractText;
    }

    public void setAbstractText(String abstractText) {
        this.abstractText = abstractText;
    }

    public List<String> getAuthors() {
        return authors;
    }

    public void setAuthors(List<String> authors) {
        this.authors = authors;
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = doi;
    }

    public String getArxivId() {
        return arxivId;
    }

    public void setArxivId(String arxivId) {
        this.arxivId = arxivId;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getPublicationDate() {
        return publicationDate;
    }

    public void setPublicationDate(String publicationDate) {
        this.publicationDate = publicationDate;
    }

    public Integer getPublicationYear() {
        return publicationYear;
    }

    public void setPublicationYear(Integer publicationYear) {
        this.publicationYear = publicationYear;
    }

    public String getVenue() {
        return venue;
    }

    public void setVenue(String venue) {
        this.venue = venue;
    }

    public int getCitationCount() {
        return citationCount;
    }

    public void setCitationCount(int citationCount) {
        this.citationCount = citationCount;
    }

    public String getPdfUrl() {
        return pdfUrl;
    }

    public void setPdfUrl(String pdfUrl) {
        this.pdfUrl = pdfUrl;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public String getScoreSource() {
        return scoreSource;
    }

    public void setScoreSource(String scoreSource) {
        this.scoreSource = scoreSource;
    }
}
