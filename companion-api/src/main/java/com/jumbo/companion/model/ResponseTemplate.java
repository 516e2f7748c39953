package com.jumbo.companion.model;

import java.util.List;
import java.util.Set;

/**
 * A pre-authored response pattern. Loaded once per catalog version and never mutated.
 */
public record ResponseTemplate(
        String id,
        String category,
        Set<Emotion> emotionTags,
        String baseText,
        List<String> variations,
        List<String> followUpQuestions,
        Set<ContextRequirement> contextRequirements,
        Tone tone,
        double weight
) {

    public ResponseTemplate {
        emotionTags = Set.copyOf(emotionTags);
        variations = List.copyOf(variations);
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
        contextRequirements = contextRequirements == null ? Set.of() : Set.copyOf(contextRequirements);
    }

    public boolean isTaggedWith(Emotion emotion) {
        return emotionTags.contains(emotion);
    }

    public boolean requirementsSatisfiedBy(UserContext context, List<String> mentionedNames) {
        return contextRequirements.stream().allMatch(requirement -> requirement.isSatisfiedBy(context, mentionedNames));
    }
}
