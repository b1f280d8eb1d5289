package com.psl.search.merge;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TitleNormalizer {
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}\\s]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private TitleNormalizer() {
    }

    /**
     * Folds case, accents, punctuation and whitespace. Returns an empty string for null input.
     */
    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        String value = Normalizer.normalize(title, Normalizer.Form.NFKD);
        value = MARKS.matcher(value).replaceAll("");
        value = value.toLowerCase(Locale.ROOT);
        value = NON_ALNUM.matcher(value).replaceAll(" ");
        return SPACES.matcher(value).replaceAll(" ").trim();
    }

    public static String normalizeDoi(String doi) {
        if (doi == null) {
            return null;
        }
        String value = doi.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("https://doi.org/")) {
            value = value.substring("https://doi.org/".length());
        } else if (value.startsWith("http://dx.doi.org/")) {
            value = value.substring("http://dx.doi.org/".length());
        } else if (value.startsWith("doi:")) {
            value = value.substring("doi:".length());
        }
        return value.isEmpty() ? null : value;
    }
}
