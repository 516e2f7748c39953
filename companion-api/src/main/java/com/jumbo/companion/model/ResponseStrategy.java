package com.jumbo.companion.model;

import java.util.Objects;

/**
 * The response method chosen for a turn. Exactly one variant is selected per turn.
 */
public sealed interface ResponseStrategy
        permits ResponseStrategy.Template, ResponseStrategy.Llm, ResponseStrategy.Fallback {

    StrategyKind kind();

    static ResponseStrategy template(String templateId) {
        return new Template(templateId);
    }

    static ResponseStrategy llm() {
        return new Llm();
    }

    static ResponseStrategy fallback(FallbackReason reason) {
        return new Fallback(reason);
    }

    record Template(String templateId) implements ResponseStrategy {
        public Template {
            Objects.requireNonNull(templateId, "templateId");
        }

        @Override
        public StrategyKind kind() {
            return StrategyKind.TEMPLATE;
        }
    }

    record Llm() implements ResponseStrategy {
        @Override
        public StrategyKind kind() {
            return StrategyKind.LLM;
        }
    }

    record Fallback(FallbackReason reason) implements ResponseStrategy {
        public Fallback {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public StrategyKind kind() {
            return StrategyKind.FALLBACK;
        }
    }
}
