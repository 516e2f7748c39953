package com.jumbo.companion.service.template;

import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.ResponseTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, indexed snapshot of one catalog version.
 */
public final class TemplateCatalog {

    private final String version;
    private final Map<String, ResponseTemplate> byId;
    private final Map<Emotion, List<ResponseTemplate>> byEmotion;
    private final Map<String, List<ResponseTemplate>> byCategory;

    public TemplateCatalog(String version, Collection<ResponseTemplate> templates) {
        this.version = version;
        Map<String, ResponseTemplate> ids = new LinkedHashMap<>();
        Map<Emotion, List<ResponseTemplate>> emotions = new EnumMap<>(Emotion.class);
        Map<String, List<ResponseTemplate>> categories = new LinkedHashMap<>();
        for (ResponseTemplate template : templates) {
            ids.put(template.id(), template);
            for (Emotion emotion : template.emotionTags()) {
                emotions.computeIfAbsent(emotion, key -> new ArrayList<>()).add(template);
            }
            categories.computeIfAbsent(template.category(), key -> new ArrayList<>()).add(template);
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.byEmotion = freeze(emotions);
        this.byCategory = freeze(categories);
    }

    public String version() {
        return version;
    }

    public int size() {
        return byId.size();
    }

    public Collection<ResponseTemplate> templates() {
        return byId.values();
    }

    public Optional<ResponseTemplate> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<ResponseTemplate> taggedWith(Emotion emotion) {
        return byEmotion.getOrDefault(emotion, List.of());
    }

    public List<ResponseTemplate> inCategory(String category) {
        return byCategory.getOrDefault(category, List.of());
    }

    private static <K> Map<K, List<ResponseTemplate>> freeze(Map<K, List<ResponseTemplate>> index) {
        Map<K, List<ResponseTemplate>> frozen = new LinkedHashMap<>();
        index.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(frozen);
    }
}
