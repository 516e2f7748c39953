package com.jumbo.companion.model;

public enum Tone {
    EMPATHETIC,
    ENCOURAGING,
    GENTLE,
    SUPPORTIVE,
    CURIOUS,
    VALIDATING,
    CALMING
}
