package com.example.smarttask.suggestion;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns free text into keyword tokens: lowercased, punctuation stripped, short tokens and stop
 * words dropped. Order and duplicates are preserved so callers can count frequencies.
 */
@Component
public class KeywordExtractor {

    // letters, digits and underscore only; combining marks and joiners split words
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final int MIN_KEYWORD_LENGTH = 3;

    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with",
            "are", "was", "were", "been",
            "have", "has", "had", "does", "did",
            "will", "would", "could", "should"
    );

    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");

        List<String> keywords = new ArrayList<>();
        for (String token : WHITESPACE.split(cleaned)) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.codePointCount(0, token.length()) < MIN_KEYWORD_LENGTH) {
                continue;
            }
            if (STOP_WORDS.contains(token)) {
                continue;
            }
            keywords.add(token);
        }
        return keywords;
    }
}
