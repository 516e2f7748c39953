package com.jumbo.companion.service.template;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk shape of the template catalog.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogDocument(String version, List<Entry> templates) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
            String id,
            String category,
            @JsonProperty("emotion_tags") List<String> emotionTags,
            @JsonProperty("base_text") @JsonAlias("base_template") String baseText,
            List<String> variations,
            @JsonProperty("follow_up_questions") List<String> followUpQuestions,
            @JsonProperty("context_requirements") List<String> contextRequirements,
            @JsonAlias("personality_tone") String tone,
            @JsonAlias("usage_weight") Double weight
    ) {
    }
}
