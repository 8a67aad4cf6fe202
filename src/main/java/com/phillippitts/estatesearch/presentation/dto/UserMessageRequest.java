package com.phillippitts.estatesearch.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/sessions/{sessionId}/messages}.
 */
public record UserMessageRequest(
        @NotBlank(message = "text must not be blank")
        @Size(max = 4000, message = "text must be at most 4000 characters")
        String text
) {
}
