package com.psl.search.merge;

import com.psl.search.provider.RawCandidate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Collapses candidates describing the same paper. Input order is significant: the first occurrence of a paper is
 * the "existing" record, later matches only fill its gaps. Callers pass candidates in fan-out assignment order.
 */
@Component
public class PaperDeduplicator {

    public List<RawCandidate> deduplicate(List<RawCandidate> candidatesInScanOrder) {
        List<RawCandidate> accepted = new ArrayList<>();
        Map<String, RawCandidate> byDoi = new HashMap<>();
        Map<String, RawCandidate> byTitle = new HashMap<>();
        for (RawCandidate incoming : candidatesInScanOrder) {
            if (incoming == null) {
                continue;
            }
            String doi = TitleNormalizer.normalizeDoi(incoming.getDoi());
            String title = TitleNormalizer.normalize(incoming.getTitle());

            RawCandidate existing = doi == null ? null : byDoi.get(doi);
            if (existing == null && !title.isEmpty()) {
                existing = byTitle.get(title);
            }
            if (existing == null) {
                RawCandidate copy = incoming.copy();
                accepted.add(copy);
                index(copy, byDoi, byTitle);
                continue;
            }
            merge(existing, incoming);
            index(existing, byDoi, byTitle);
        }
        return accepted;
    }

    /**
     * Fills fields missing on {@code existing} from {@code incoming}. Present fields are never replaced, except
     * citation count which keeps the larger value.
     */
    void merge(RawCandidate existing, RawCandidate incoming) {
        if (isBlank(existing.getAbstractText())) {
            existing.setAbstractText(incoming.getAbstractText());
        }
        if ((existing.getAuthors() == null || existing.getAuthors().isEmpty())
            && incoming.getAuthors() != null && !incoming.getAuthors().isEmpty()) {
            existing.setAuthors(new ArrayList<>(incoming.getAuthors()));
        }
        if (isBlank(existing.getDoi())) {
            existing.setDoi(incoming.getDoi());
        }
        if (isBlank(existing.getArxivId())) {
            existing.setArxivId(incoming.getArxivId());
        }
        if (isBlank(existing.getPublicationDate())) {
            existing.setPublicationDate(incoming.getPublicationDate());
        }
        if (existing.getPublicationYear() == null) {
            existing.setPublicationYear(incoming.getPublicationYear());
        }
        if (isBlank(existing.getVenue())) {
            existing.setVenue(incoming.getVenue());
        }
        if (isBlank(existing.getPdfUrl())) {
            existing.setPdfUrl(incoming.getPdfUrl());
        }
        if (incoming.getCitationCount() != null
            && (existing.getCitationCount() == null || incoming.getCitationCount() > existing.getCitationCount())) {
            existing.setCitationCount(incoming.getCitationCount());
        }
    }

    private static void index(RawCandidate candidate, Map<String, RawCandidate> byDoi, Map<String, RawCandidate> byTitle) {
        String doi = TitleNormalizer.normalizeDoi(candidate.getDoi());
        if (doi != null) {
            byDoi.putIfAbsent(doi, candidate);
        }
        String title = TitleNormalizer.normalize(candidate.getTitle());
        if (!title.isEmpty()) {
            byTitle.putIfAbsent(title, candidate);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
