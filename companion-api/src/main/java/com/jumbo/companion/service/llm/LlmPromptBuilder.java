package com.jumbo.companion.service.llm;

import com.jumbo.companion.model.ConversationMessage;
import com.jumbo.companion.model.MessageAnalysis;
import com.jumbo.companion.model.UserContext;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class LlmPromptBuilder {

    static final String SYSTEM_PROMPT = "You are Jumbo, a warm and patient companion. Reply in two or three short "
            + "sentences, reflect the user's feelings, never give medical or legal advice and end with one gentle question.";

    public LlmPrompt build(MessageAnalysis analysis, UserContext context) {
        StringBuilder builder = new StringBuilder();
        context.name().ifPresent(name -> builder.append("The user likes to be called ").append(name).append(".\n"));
        if (!context.recentEmotions().isEmpty()) {
            builder.append("Recent emotions: ").append(String.join(", ", context.recentEmotions())).append(".\n");
        }
        if (!context.keyRelationships().isEmpty()) {
            builder.append("People in their life: ")
                    .append(context.keyRelationships().entrySet().stream()
                            .map(entry -> entry.getKey() + " (" + entry.getValue() + ")")
                            .collect(Collectors.joining(", ")))
                    .append(".\n");
        }
        if (context.messageCount() > 1) {
            builder.append("Messages so far this session: ").append(context.messageCount()).append(".\n");
        }
        // The last entry is the current message, already sent below.
        int previous = context.recentMessages().size() - 1;
        if (previous > 0) {
            builder.append("Earlier messages:\n");
            for (ConversationMessage message : context.recentMessages().subList(0, previous)) {
                builder.append("- ").append(message.text()).append('\n');
            }
        }
        builder.append("Detected emotion: ").append(analysis.emotion().tag()).append('\n');
        builder.append("Message:\n").append(analysis.rawText() == null ? "" : analysis.rawText().trim());
        return new LlmPrompt(SYSTEM_PROMPT, builder.toString());
    }
}
