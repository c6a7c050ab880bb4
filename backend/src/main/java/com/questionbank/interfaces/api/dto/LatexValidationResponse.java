package com.questionbank.interfaces.api.dto;

import com.questionbank.domain.latex.model.LatexIssue;
import com.questionbank.domain.latex.model.LatexValidationResult;

import java.util.List;

public record LatexValidationResponse(
        boolean valid,
        List<String> errors,
        List<String> warnings
) {
    public static LatexValidationResponse from(LatexValidationResult result) {
        return new LatexValidationResponse(
                result.valid(),
                result.errors().stream().map(LatexIssue::message).toList(),
                result.warnings().stream().map(LatexIssue::message).toList());
    }
}
