package com.psl.search.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.psl.search.provider.RawCandidate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityFilterTest {

    @Test
    void titleWithoutAbstractOrAuthorsIsRejected() {
        RawCandidate candidate = candidate("A forty character title about proteins!!", null, List.of());

        assertFalse(QualityFilter.accept(candidate));
    }

    @Test
    void authorsAloneAreEnough() {
        RawCandidate candidate = candidate(
            "A forty character title about proteins!!",
            null,
            List.of("A. One", "B. Two", "C. Three", "D. Four", "E. Five")
        );

        assertTrue(QualityFilter.accept(candidate));
    }

    @Test
    void abstractMustBeSubstantial() {
        assertFalse(QualityFilter.accept(candidate("Valid length title", "too short", List.of())));
        assertTrue(QualityFilter.accept(candidate("Valid length title", "x".repeat(50), List.of())));
        assertFalse(QualityFilter.accept(candidate("Valid length title", "   " + "x".repeat(49) + "   ", null)));
    }

    @Test
    void shortOrMissingTitleIsRejected() {
        assertFalse(QualityFilter.accept(candidate("  Short  ", "x".repeat(80), List.of("Someone"))));
        assertFalse(QualityFilter.accept(candidate(null, "x".repeat(80), List.of("Someone"))));
        assertFalse(QualityFilter.accept(null));
        assertTrue(QualityFilter.accept(candidate("0123456789", null, List.of("Someone"))));
    }

    @Test
    void filterKeepsOrder() {
        List<RawCandidate> input = new ArrayList<>();
        input.add(candidate("First acceptable title", null, List.of("x")));
        input.add(candidate("nope", null, List.of("x")));
        input.add(candidate("Second acceptable title", "y".repeat(60), null));

        assertThat(QualityFilter.filter(input)).extracting(RawCandidate::getTitle)
            .containsExactly("First acceptable title", "Second acceptable title");
    }

    private static RawCandidate candidate(String title, String abstractText, List<String> authors) {
        RawCandidate candidate = new RawCandidate();
        candidate.setTitle(title);
        candidate.setAbstractText(abstractText);
        candidate.setAuthors(authors);
        return candidate;
    }
}
