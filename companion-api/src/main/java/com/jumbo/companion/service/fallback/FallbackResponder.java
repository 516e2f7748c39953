package com.jumbo.companion.service.fallback;

import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.FallbackReason;
import com.jumbo.companion.model.UserContext;
import com.jumbo.companion.service.personalization.Personalizer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static answers for turns that cannot use a template or the LLM. The text is picked by user and turn so
 * repeated fallbacks vary while staying reproducible.
 */
@Component
public class FallbackResponder {

    public static final String GENERIC_MESSAGE = "I'm here with you. Tell me a little more about what's on your mind.";

    private static final List<String> CRISIS = List.of(
            "[NAME], I'm really glad you told me. You deserve support right now from someone who can be there "
                    + "in person. Please reach out to a local crisis line or emergency services, or someone you trust. "
                    + "I'm here to keep talking with you too.",
            "What you're feeling matters, [NAME], and you don't have to carry it alone. Please contact a crisis "
                    + "helpline or emergency services now, or reach out to someone close to you. I'm still here with you.");

    private static final List<String> OVERLOAD = List.of(
            "I'm still here, [NAME]. Give me a moment and tell me more about how you're doing.",
            "I want to give you my full attention. Could you share a bit more about what's going on?",
            "Thank you for your patience, [NAME]. I'm listening, so take your time.");

    private static final Map<Emotion, List<String>> BY_EMOTION = new EnumMap<>(Map.of(
            Emotion.SADNESS, List.of(
                    "I understand you're going through something, [NAME]. What's on your mind?",
                    "I'm sorry things feel heavy right now. I'm here with you.",
                    "That sounds really hard, [NAME]. Do you want to tell me more?"),
            Emotion.ANXIETY, List.of(
                    "Take a breath, [NAME]. I'm here to listen. What's worrying you?",
                    "It makes sense to feel uneasy. Let's take it one step at a time."),
            Emotion.ANGER, List.of(
                    "I sense some frustration, [NAME]. What happened?",
                    "That sounds really frustrating. I'm listening if you want to let it out."),
            Emotion.HAPPINESS, List.of(
                    "That's wonderful, [NAME]! What's making you feel this way?",
                    "I love hearing that. Tell me more!"),
            Emotion.NEUTRAL, List.of(
                    "I'm listening, [NAME]. What would you like to talk about?",
                    "I'm here. What's been on your mind lately?")));

    private final Personalizer personalizer;

    public FallbackResponder(Personalizer personalizer) {
        this.personalizer = personalizer;
    }

    public String respond(FallbackReason reason, Emotion emotion, UserContext context, String userId, int turnIndex) {
        if (reason == FallbackReason.INTERNAL_ERROR) {
            return GENERIC_MESSAGE;
        }
        List<String> options = switch (reason) {
            case CRISIS -> CRISIS;
            case OVERLOAD -> OVERLOAD;
            default -> BY_EMOTION.getOrDefault(emotion, BY_EMOTION.get(Emotion.NEUTRAL));
        };
        String chosen = options.get(index(userId, turnIndex, options.size()));
        UserContext effective = context == null ? UserContext.empty(userId, "") : context;
        String text = personalizer.personalize(chosen, effective, List.of()).text();
        return text == null || text.isBlank() ? GENERIC_MESSAGE : text;
    }

    static int index(String userId, int turnIndex, int size) {
        int hash = userId == null ? 0 : userId.hashCode();
        return Math.floorMod(hash * 31 + turnIndex, size);
    }
}
