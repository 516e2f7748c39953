package com.jumbo.companion.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatSubmission(
        @NotBlank String userId,
        @NotBlank String sessionId,
        @NotBlank @Size(max = 4000) String message
) {
}
