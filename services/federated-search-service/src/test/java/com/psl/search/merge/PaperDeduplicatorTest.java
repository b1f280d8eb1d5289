package com.psl.search.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.psl.search.provider.RawCandidate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PaperDeduplicatorTest {

    private final PaperDeduplicator deduplicator = new PaperDeduplicator();

    @Test
    void collapsesDoiMatchesCaseInsensitively() {
        RawCandidate first = candidate("Attention Is All You Need", "10.5555/ABC", 10);
        RawCandidate second = candidate("attention is all you need (preprint)", "10.5555/abc", 90);

        List<RawCandidate> merged = deduplicator.deduplicate(List.of(first, second));

        assertEquals(1, merged.size());
        assertEquals("Attention Is All You Need", merged.get(0).getTitle());
        assertEquals(90, merged.get(0).getCitationCount());
    }

    @Test
    void collapsesNormalizedTitlesWhenDoiMissing() {
        RawCandidate first = candidate("Deep Residual Learning: for Image Recognition", null, 5);
        RawCandidate second = candidate("deep residual learning for image recognition", "10.1109/cvpr.2016.90", 3);

        List<RawCandidate> merged = deduplicator.deduplicate(List.of(first, second));

        assertEquals(1, merged.size());
        assertEquals("10.1109/cvpr.2016.90", merged.get(0).getDoi());
        assertEquals(5, merged.get(0).getCitationCount());
    }

    @Test
    void mergeFillsOnlyMissingFields() {
        RawCandidate existing = candidate("A Study of Graph Neural Networks", "10.1/x", 4);
        existing.setVenue("NeurIPS");
        existing.setAuthors(new ArrayList<>());
        RawCandidate incoming = candidate("A Study of Graph Neural Networks", "10.1/x", 2);
        incoming.setVenue("arXiv");
        incoming.setAbstractText("We study message passing.");
        incoming.setAuthors(List.of("Ada Lovelace"));
        incoming.setArxivId("2101.00001");
        incoming.setPdfUrl("https://arxiv.org/pdf/2101.00001");

        RawCandidate merged = deduplicator.deduplicate(List.of(existing, incoming)).get(0);

        assertEquals("NeurIPS", merged.getVenue());
        assertEquals("We study message passing.", merged.getAbstractText());
        assertEquals(List.of("Ada Lovelace"), merged.getAuthors());
        assertEquals("2101.00001", merged.getArxivId());
        assertEquals("https://arxiv.org/pdf/2101.00001", merged.getPdfUrl());
        assertEquals(4, merged.getCitationCount());
    }

    @Test
    void keepsFirstOccurrenceOrder() {
        List<RawCandidate> input = List.of(
            candidate("Paper number one on topic", null, 1),
            candidate("Paper number two on topic", null, 1),
            candidate("PAPER NUMBER ONE ON TOPIC", null, 1),
            candidate("Paper number three on topic", null, 1)
        );

        List<RawCandidate> merged = deduplicator.deduplicate(input);

        assertThat(merged).extracting(RawCandidate::getTitle).containsExactly(
            "Paper number one on topic",
            "Paper number two on topic",
            "Paper number three on topic"
        );
    }

    @Test
    void isIdempotent() {
        List<RawCandidate> input = List.of(
            candidate("Transformers for Vision", "10.1/tv", 7),
            candidate("transformers for vision", null, 9),
            candidate("Diffusion Models Beat GANs", "10.1/dm", 3),
            candidate("Something Entirely Different", "10.1/TV", 1)
        );

        List<RawCandidate> once = deduplicator.deduplicate(input);
        List<RawCandidate> twice = deduplicator.deduplicate(once);

        assertThat(twice).usingRecursiveFieldByFieldElementComparator().containsExactlyElementsOf(once);
    }

    @Test
    void doesNotMutateInput() {
        RawCandidate first = candidate("Federated Learning at Scale", "10.1/fl", 1);
        RawCandidate second = candidate("Federated Learning at Scale", "10.1/fl", 50);
        second.setVenue("MLSys");

        deduplicator.deduplicate(List.of(first, second));

        assertNull(first.getVenue());
        assertEquals(1, first.getCitationCount());
    }

    private static RawCandidate candidate(String title, String doi, int citations) {
        RawCandidate candidate = new RawCandidate();
        candidate.setTitle(title);
        candidate.setDoi(doi);
        candidate.setCitationCount(citations);
        candidate.setProvider("semantic_scholar");
        return candidate;
    }
}
