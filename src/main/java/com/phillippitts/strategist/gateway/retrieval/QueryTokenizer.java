package com.phillippitts.strategist.gateway.retrieval;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits query text into lowercase keyword tokens.
 *
 * <p>Rules:
 * <ul>
 *   <li>split on anything that is not a Unicode letter or digit</li>
 *   <li>lowercase (root locale)</li>
 *   <li>drop tokens shorter than {@value #MIN_TOKEN_LENGTH} characters</li>
 *   <li>deduplicate, keeping first-seen order</li>
 * </ul>
 */
public final class QueryTokenizer {

    static final int MIN_TOKEN_LENGTH = 3;

    private QueryTokenizer() {
        // Prevent instantiation
    }

    /**
     * @param text input text (may be null or blank)
     * @return immutable list of keyword tokens (empty if none)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+");
        Set<String> tokens = new LinkedHashSet<>();
        for (String part : parts) {
            if (part.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }
}
