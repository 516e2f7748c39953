package com.jumbo.companion.service.analysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

class TopicDetector {

    private static final Map<String, List<String>> TOPICS = Map.of(
            "work", List.of("work", "job", "boss", "office", "career", "colleague", "meeting", "deadline", "shift"),
            "family", List.of("family", "mom", "mum", "dad", "mother", "father", "brother", "sister", "parents", "kids"),
            "relationships", List.of("boyfriend", "girlfriend", "partner", "wife", "husband", "relationship",
                    "breakup", "dating", "friend", "friends"),
            "health", List.of("health", "sick", "doctor", "pain", "hospital", "ill", "illness", "medication"),
            "school", List.of("school", "exam", "exams", "class", "college", "homework", "study", "university"),
            "money", List.of("money", "rent", "debt", "bills", "salary", "loan", "afford"),
            "sleep", List.of("sleep", "insomnia", "nightmare", "nightmares", "asleep", "awake", "rest"));

    Set<String> detect(Tokens tokens) {
        Set<String> topics = new LinkedHashSet<>();
        TOPICS.forEach((topic, keywords) -> {
            if (keywords.stream().anyMatch(tokens.words()::contains)) {
                topics.add(topic);
            }
        });
        return topics;
    }
}
