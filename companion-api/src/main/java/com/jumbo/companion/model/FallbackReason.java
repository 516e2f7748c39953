package com.jumbo.companion.model;

public enum FallbackReason {
    OVERLOAD,
    NO_TEMPLATE,
    CRISIS,
    LLM_UNAVAILABLE,
    STORE_UNAVAILABLE,
    INTERNAL_ERROR
}
