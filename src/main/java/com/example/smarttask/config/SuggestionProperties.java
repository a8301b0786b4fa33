package com.example.smarttask.config;

import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "suggestions")
@Validated
public class SuggestionProperties {

    @Min(1)
    private int topKeywords = 5;

    @Min(1)
    private int perKeyword = 3;

    /** Phrase patterns, each with a single {@code {}} placeholder for the formatted keyword. */
    private final List<String> templates = new ArrayList<>(List.of(
            "Follow-up on {}",
            "Finalize {}",
            "Plan next steps for {}",
            "Schedule meeting for {}",
            "Prepare report regarding {}",
            "Start working on {}"
    ));

    /** Returned when the existing tasks yield no keyword at all. */
    private final List<String> defaults = new ArrayList<>(List.of(
            "Weekly Planning Session",
            "Project Status Review",
            "Team Meeting Preparation"
    ));

    public int getTopKeywords() {
        return topKeywords;
    }

    public void setTopKeywords(int topKeywords) {
        this.topKeywords = topKeywords;
    }

    public int getPerKeyword() {
        return perKeyword;
    }

    public void setPerKeyword(int perKeyword) {
        this.perKeyword = perKeyword;
    }

    public List<String> getTemplates() {
        return templates;
    }

    public void setTemplates(List<String> templates) {
        this.templates.clear();
        if (templates != null) {
            this.templates.addAll(templates);
        }
    }

    public List<String> getDefaults() {
        return defaults;
    }

    public void setDefaults(List<String> defaults) {
        this.defaults.clear();
        if (defaults != null) {
            this.defaults.addAll(defaults);
        }
    }
}
