package com.jumbo.companion.service.personalization;

public record PersonalizedText(String text, int memoriesUsed, boolean followUpUsed) {
}
