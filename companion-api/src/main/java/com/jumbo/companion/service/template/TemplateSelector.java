package com.jumbo.companion.service.template;

import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.MessageAnalysis;
import com.jumbo.companion.model.ResponseTemplate;
import com.jumbo.companion.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks qualifying templates with rotation and a deterministic tie-break. Ranking never mutates usage;
 * {@link #commit} records the choice once the turn is decided.
 */
@Component
public class TemplateSelector {

    private static final Logger log = LoggerFactory.getLogger(TemplateSelector.class);

    private final TemplateStore templateStore;
    private final UsageTracker usageTracker;
    private final VariationPicker variationPicker;
    private final int rotationWindow;

    public TemplateSelector(TemplateStore templateStore,
                            UsageTracker usageTracker,
                            VariationPicker variationPicker,
                            @Value("${companion.templates.rotation-window:3}") int rotationWindow) {
        this.templateStore = templateStore;
        this.usageTracker = usageTracker;
        this.variationPicker = variationPicker;
        this.rotationWindow = Math.max(0, rotationWindow);
    }

    /**
     * Templates tagged with the analysed emotion whose requirements the context satisfies. Neutral
     * templates are returned only when no emotion-specific template qualifies. The whole emotion pool is
     * returned so the rotation window spans every template of the emotion.
     */
    public List<ResponseTemplate> qualifying(MessageAnalysis analysis, UserContext context) {
        TemplateCatalog catalog = templateStore.catalog();
        List<String> mentioned = analysis.mentionedNames();
        List<ResponseTemplate> tagged = satisfiable(catalog.taggedWith(analysis.emotion()), context, mentioned);
        if (tagged.isEmpty() && analysis.emotion() != Emotion.NEUTRAL) {
            tagged = satisfiable(catalog.taggedWith(Emotion.NEUTRAL), context, mentioned);
        }
        return tagged;
    }

    public Optional<TemplateChoice> rank(MessageAnalysis analysis, UserContext context, String userId) {
        List<ResponseTemplate> candidates = qualifying(analysis, context);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        UsageTracker.Snapshot usage = usageTracker.snapshot(userId);
        List<String> window = usage.rotationWindow(rotationWindow);
        List<ResponseTemplate> fresh = candidates.stream()
                .filter(template -> !window.contains(template.id()))
                .toList();
        boolean reset = fresh.isEmpty();
        if (reset) {
            log.debug("All {} candidates for user {} are inside the rotation window, lifting exclusion",
                    candidates.size(), userId);
            fresh = candidates;
        }
        String intentCategory = analysis.intent().category();
        ResponseTemplate best = fresh.stream()
                .min(Comparator.comparingDouble(TemplateSelector::score).reversed()
                        .thenComparingInt(template -> usage.recentUses(template.id()))
                        .thenComparing(template -> !template.category().equals(intentCategory))
                        .thenComparing(ResponseTemplate::id))
                .orElseThrow();
        int variation = variationPicker.pick(best, userId, usage.turnIndex());
        return Optional.of(new TemplateChoice(best, variation, score(best), best.contextRequirements().size(), reset));
    }

    /**
     * Same ranking as {@link #rank}; kept as the entry point the pipeline names when it intends to use the
     * result. Usage is still recorded separately through {@link #commit}.
     */
    public Optional<TemplateChoice> choose(MessageAnalysis analysis, UserContext context, String userId) {
        Optional<TemplateChoice> choice = rank(analysis, context, userId);
        choice.ifPresent(value -> log.debug("Chose template {} variation {} for user {}",
                value.templateId(), value.variationIndex(), userId));
        return choice;
    }

    public void commit(String userId, TemplateChoice choice, boolean followUpUsed) {
        usageTracker.recordTemplate(userId, choice.templateId(), followUpUsed);
    }

    static double score(ResponseTemplate template) {
        return template.weight() * (1 + template.contextRequirements().size());
    }

    private static List<ResponseTemplate> satisfiable(List<ResponseTemplate> templates,
                                                      UserContext context,
                                                      List<String> mentioned) {
        return templates.stream()
                .filter(template -> template.requirementsSatisfiedBy(context, mentioned))
                .toList();
    }
}
