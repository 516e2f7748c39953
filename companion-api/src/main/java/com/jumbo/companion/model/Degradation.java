package com.jumbo.companion.model;

/**
 * Non-fatal conditions absorbed during a turn. Each one is reported in the reply metadata.
 */
public enum Degradation {
    ANALYSIS_DEGRADED,
    CONTEXT_READ_FAILED,
    BUDGET_EXCEEDED,
    NO_QUALIFYING_TEMPLATE,
    EXTERNAL_SERVICE_UNAVAILABLE
}
