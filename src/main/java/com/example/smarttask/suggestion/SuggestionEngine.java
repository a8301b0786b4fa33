package com.example.smarttask.suggestion;

import com.example.smarttask.config.SuggestionProperties;
import com.example.smarttask.dao.TaskTextDao;
import com.example.smarttask.model.TaskSuggestion;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Mines the current task titles and descriptions for recurring keywords and combines the most
 * frequent ones with phrase templates into new task-title suggestions.
 *
 * <p>Stateless: every call reads a fresh snapshot through {@link TaskTextDao}. An empty result
 * means "nothing to go on"; substituting defaults is up to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuggestionEngine {

    static final String PLACEHOLDER = "{}";

    private final TaskTextDao taskTextDao;
    private final KeywordExtractor keywordExtractor;
    private final SuggestionProperties properties;

    public List<TaskSuggestion> generateSuggestions() {
        List<String> titles = taskTextDao.listTitles();
        if (titles.isEmpty()) {
            // descriptions are not consulted when there are no titles
            return List.of();
        }

        List<String> keywords = new ArrayList<>();
        for (String title : titles) {
            keywords.addAll(keywordExtractor.extract(title));
        }
        for (String description : taskTextDao.listDescriptions()) {
            keywords.addAll(keywordExtractor.extract(description));
        }

        if (keywords.isEmpty()) {
            log.debug("No keywords found in {} task titles", titles.size());
            return List.of();
        }

        List<String> topKeywords = rankKeywords(keywords, properties.getTopKeywords());
        log.debug("Top keywords: {}", topKeywords);

        List<TaskSuggestion> suggestions = new ArrayList<>();
        Set<String> generated = new HashSet<>();
        for (String keyword : topKeywords) {
            String formatted = formatKeyword(keyword);
            int madeForKeyword = 0;
            for (String template : properties.getTemplates()) {
                if (madeForKeyword >= properties.getPerKeyword()) {
                    break;
                }
                String title = template.replace(PLACEHOLDER, formatted);
                if (generated.add(title)) {
                    suggestions.add(new TaskSuggestion(title));
                    madeForKeyword++;
                }
            }
        }
        return suggestions;
    }

    /**
     * The {@code limit} most frequent distinct keywords. Equal counts keep first-occurrence order.
     */
    static List<String> rankKeywords(List<String> keywords, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String keyword : keywords) {
            counts.merge(keyword, 1, Integer::sum);
        }
        // stable sort over insertion order
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /** {@code "project-plan"} becomes {@code "Project Plan"}. */
    static String formatKeyword(String keyword) {
        return Arrays.stream(keyword.split("-", -1))
                .map(SuggestionEngine::capitalize)
                .collect(Collectors.joining(" "));
    }

    private static String capitalize(String part) {
        if (part.isEmpty()) {
            return part;
        }
        int first = part.codePointAt(0);
        int firstLength = Character.charCount(first);
        return titleCase(first) + part.substring(firstLength);
    }

    /**
     * Full case mapping: {@code ß} becomes {@code Ss}, {@code ﬁ} becomes {@code Fi}. Single
     * code point mappings use the title-case form ({@code ǆ} becomes {@code ǅ}).
     */
    private static String titleCase(int codePoint) {
        String upper = new String(Character.toChars(codePoint)).toUpperCase(Locale.ROOT);
        if (upper.codePointCount(0, upper.length()) <= 1) {
            return new String(Character.toChars(Character.toTitleCase(codePoint)));
        }
        int head = upper.codePointAt(0);
        int headLength = Character.charCount(head);
        return new String(Character.toChars(head)) + upper.substring(headLength).toLowerCase(Locale.ROOT);
    }
}
