package com.jumbo.companion.service.template;

import com.jumbo.companion.model.ContextRequirement;
import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.ResponseTemplate;
import com.jumbo.companion.model.Tone;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public class TemplateValidator {

    private static final double DEFAULT_WEIGHT = 1.0;

    public ResponseTemplate validate(CatalogDocument.Entry entry) {
        if (entry == null) {
            throw new InvalidTemplateException(null, "Template entry is null");
        }
        String id = entry.id();
        if (isBlank(id)) {
            throw new InvalidTemplateException(null, "Missing required field: id");
        }
        if (isBlank(entry.category())) {
            throw new InvalidTemplateException(id, "Missing required field: category");
        }
        if (isBlank(entry.baseText())) {
            throw new InvalidTemplateException(id, "Missing required field: base_text");
        }
        Set<Emotion> emotions = emotionTags(id, entry.emotionTags());
        List<String> variations = nonBlank(entry.variations());
        if (variations.isEmpty()) {
            throw new InvalidTemplateException(id, "variations must not be empty");
        }
        return new ResponseTemplate(
                id.trim(),
                entry.category().trim().toLowerCase(Locale.ROOT),
                emotions,
                entry.baseText().trim(),
                variations,
                nonBlank(entry.followUpQuestions()),
                requirements(id, entry.contextRequirements()),
                tone(id, entry.tone()),
                entry.weight() == null || entry.weight() <= 0 ? DEFAULT_WEIGHT : entry.weight()
        );
    }

    private Set<Emotion> emotionTags(String id, List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            throw new InvalidTemplateException(id, "emotion_tags must not be empty");
        }
        Set<Emotion> emotions = EnumSet.noneOf(Emotion.class);
        for (String tag : tags) {
            emotions.add(Emotion.fromTag(tag)
                    .orElseThrow(() -> new InvalidTemplateException(id, "Unknown emotion tag: " + tag)));
        }
        return emotions;
    }

    private Set<ContextRequirement> requirements(String id, List<String> keys) {
        Set<ContextRequirement> requirements = EnumSet.noneOf(ContextRequirement.class);
        if (keys == null) {
            return requirements;
        }
        for (String key : keys) {
            requirements.add(ContextRequirement.fromKey(key)
                    .orElseThrow(() -> new InvalidTemplateException(id, "Unknown context requirement: " + key)));
        }
        return requirements;
    }

    private Tone tone(String id, String value) {
        if (isBlank(value)) {
            return Tone.EMPATHETIC;
        }
        try {
            return Tone.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidTemplateException(id, "Invalid tone: " + value);
        }
    }

    private List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
