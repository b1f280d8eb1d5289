package com.psl.search.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.psl.search.provider.RawCandidate;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PaperRecord {
    private Long id;
    private String title;
    @JsonProperty("abstract")
    private String abstractText;
    private List<String> authors = new ArrayList<>();
    private String doi;
    @JsonProperty("arxiv_id")
    private String arxivId;
    private String provider;
    @JsonProperty("provider_id")
    private String providerId;
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
    private boolean embedded;

    public static PaperRecord fromCandidate(RawCandidate candidate, String category) {
        PaperRecord record = new PaperRecord();
        record.title = candidate.getTitle() == null ? null : candidate.getTitle().trim();
        record.abstractText = candidate.getAbstractText();
        record.authors = candidate.getAuthors() == null ? new ArrayList<>() : new ArrayList<>(candidate.getAuthors());
        record.doi = candidate.getDoi();
        record.arxivId = candidate.getArxivId();
        record.provider = candidate.getProvider();
        record.providerId = candidate.getProviderId();
        record.publicationDate = candidate.getPublicationDate();
        record.publicationYear = candidate.getPublicationYear();
        record.venue = candidate.getVenue();
        record.citationCount = candidate.citationCountOrZero();
        record.pdfUrl = candidate.getPdfUrl();
        record.category = category;
        return record;
    }

    public boolean isPersisted() {
        return id != null;
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
        this.authors = authors == null ? new ArrayList<>() : authors;
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

    public String getProviderId() {
        return providerId;
    }

    public void setProviderId(String providerId) {
        this.providerId = providerId;
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

    public boolean isEmbedded() {
        return embedded;
    }

    public void setEmbedded(boolean embedded) {
        this.embedded = embedded;
    }
}
