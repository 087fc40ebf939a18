package com.featureflow.core.registry;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns free text into a kebab-case feature slug.
 * <p>
 * Deterministic and idempotent: feeding a slug back in returns it unchanged.
 */
public final class SlugGenerator {

    public static final String FALLBACK = "feature";

    private SlugGenerator() {}

    /**
     * @param text      free-text description or short name
     * @param wordLimit maximum number of words kept; 0 or less keeps every word
     */
    public static String slug(String text, int wordLimit) {
        if (text == null) {
            return FALLBACK;
        }
        String collapsed = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (collapsed.isEmpty()) {
            return FALLBACK;
        }
        if (wordLimit <= 0) {
            return collapsed;
        }
        return Arrays.stream(collapsed.split("-"))
                .limit(wordLimit)
                .collect(Collectors.joining("-"));
    }
}
