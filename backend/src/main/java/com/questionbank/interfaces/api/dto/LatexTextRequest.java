package com.questionbank.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;

public record LatexTextRequest(
        @NotEmpty(message = "Text is required")
        String text
) {}
