package com.psl.search.embed;

import com.psl.search.store.PaperRecord;
import java.util.List;

public final class EmbeddingTextBuilder {
    private static final int MAX_AUTHORS = 5;

    private EmbeddingTextBuilder() {
    }

    /**
     * Title, first five authors, abstract. The same text is used for cache keys and stored vectors.
     */
    public static String forPaper(PaperRecord record) {
        StringBuilder text = new StringBuilder();
        append(text, record.getTitle());
        List<String> authors = record.getAuthors();
        if (authors != null && !authors.isEmpty()) {
            append(text, String.join(", ", authors.subList(0, Math.min(MAX_AUTHORS, authors.size()))));
        }
        append(text, record.getAbstractText());
        return text.toString();
    }

    private static void append(StringBuilder text, String part) {
        if (part == null || part.isBlank()) {
            return;
        }
        if (text.length() > 0) {
            text.append(". ");
        }
        text.append(part.trim());
    }
}
