package com.jumbo.companion.model;

public enum StrategyKind {
    TEMPLATE,
    LLM,
    FALLBACK
}
