package com.questionbank.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {}
