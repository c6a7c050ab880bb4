package com.questionbank.interfaces.api.dto;

import com.questionbank.domain.latex.model.LatexStats;

public record LatexStatsResponse(
        int totalDelimiters,
        int inlineMath,
        int displayMath,
        int latexCommands,
        boolean hasIssues
) {
    public static LatexStatsResponse from(LatexStats stats) {
        return new LatexStatsResponse(
                stats.totalDelimiters(),
                stats.inlineMathCount(),
                stats.displayMathCount(),
                stats.commandCount(),
                stats.hasIssues());
    }
}
