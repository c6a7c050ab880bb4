package com.questionbank.interfaces.api.dto;

public record LatexFixResponse(
        boolean success,
        String fixedText
) {}
