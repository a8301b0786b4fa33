package com.example.smarttask.service;

import com.example.smarttask.config.SuggestionProperties;
import com.example.smarttask.model.TaskSuggestion;
import com.example.smarttask.suggestion.SuggestionEngine;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Serves smart suggestions, falling back to fixed defaults when existing tasks offer no keywords. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SmartSuggestionService {

    private final SuggestionEngine engine;
    private final SuggestionProperties properties;

    @Transactional(readOnly = true)
    public List<TaskSuggestion> suggest() {
        List<TaskSuggestion> suggestions = engine.generateSuggestions();
        if (suggestions.isEmpty()) {
            log.debug("No keyword patterns found; returning {} default suggestions", properties.getDefaults().size());
            return properties.getDefaults().stream().map(TaskSuggestion::new).toList();
        }
        log.debug("Generated {} smart suggestions", suggestions.size());
        return suggestions;
    }
}
