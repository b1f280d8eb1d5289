package com.psl.search.ranking;

import com.psl.search.provider.RawCandidate;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops provider noise: a usable title plus either a real abstract or at least one author.
 */
public final class QualityFilter {
    static final int MIN_TITLE_LENGTH = 10;
    static final int MIN_ABSTRACT_LENGTH = 50;

    private QualityFilter() {
    }

    public static boolean accept(RawCandidate candidate) {
        if (candidate == null || candidate.getTitle() == null) {
            return false;
        }
        if (candidate.getTitle().trim().length() < MIN_TITLE_LENGTH) {
            return false;
        }
        String abstractText = candidate.getAbstractText();
        boolean hasAbstract = abstractText != null && abstractText.trim().length() >= MIN_ABSTRACT_LENGTH;
        boolean hasAuthors = candidate.getAuthors() != null && !candidate.getAuthors().isEmpty();
        return hasAbstract || hasAuthors;
    }

    public static List<RawCandidate> filter(List<RawCandidate> candidates) {
        List<RawCandidate> accepted = new ArrayList<>(candidates.size());
        for (RawCandidate candidate : candidates) {
            if (accept(candidate)) {
                accepted.add(candidate);
            }
        }
        return accepted;
    }
}
