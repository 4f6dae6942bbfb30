package com.docqa.util;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared normalization for queries and chunk texts: lowercase, strip punctuation,
 * split on whitespace. Letters and digits of any script are kept.
 */
@Component
public class Tokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\p{M}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // zero-width non-joiner, common inside Persian words
    private static final String ZWNJ = "\u200C";

    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String normalized = normalize(text);
        return Arrays.stream(WHITESPACE.split(normalized))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toList());
    }

    /**
     * Lowercases and replaces punctuation and ZWNJ with spaces.
     */
    public String normalize(String text) {
        String lowered = text.toLowerCase(Locale.ROOT).replace(ZWNJ, " ");
        return NON_WORD.matcher(lowered).replaceAll(" ").trim();
    }
}
