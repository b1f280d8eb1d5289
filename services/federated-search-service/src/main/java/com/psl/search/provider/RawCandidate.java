package com.psl.search.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * Paper metadata as returned by one provider, normalized into a single shape at the adapter boundary.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawCandidate {
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
    private Integer citationCount;
    @JsonProperty("pdf_url")
    private String pdfUrl;

    public RawCandidate copy() {
        RawCandidate copy = new RawCandidate();
        copy.title = title;
        copy.abstractText = abstractText;
        copy.authors = authors == null ? new ArrayList<>() : new ArrayList<>(authors);
        copy.doi = doi;
        copy.arxivId = arxivId;
        copy.provider = provider;
        copy.providerId = providerId;
        copy.publicationDate = publicationDate;
        copy.publicationYear = publicationYear;
        copy.venue = venue;
        copy.citationCount = citationCount;
        copy.pdfUrl = pdfUrl;
        return copy;
    }

    public int citationCountOrZero() {
        return citationCount == null ? 0 : Math.max(0, citationCount);
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

    public Integer getCitationCount() {
        return citationCount;
    }

    public void setCitationCount(Integer citationCount) {
        this.citationCount = citationCount;
    }

    public String getPdfUrl() {
        return pdfUrl;
    }

    public void setPdfUrl(String pdfUrl) {
        this.pdfUrl = pdfUrl;
    }
}
