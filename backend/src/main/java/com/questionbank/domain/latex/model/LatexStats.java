package com.questionbank.domain.latex.model;

/**
 * Counts reported by the dashboard's LaTeX inspector.
 */
public record LatexStats(
        int inlineMathCount,
        int displayMathCount,
        int commandCount,
        int totalDelimiters,
        boolean hasIssues
) {}
