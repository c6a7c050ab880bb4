package com.questionbank.domain.latex.model;

/**
 * A single problem found by the LaTeX validator.
 *
 * @param type        the kind of problem
 * @param severity    ERROR makes the text invalid, WARNING is informational
 * @param message     human-readable description shown in the dashboard
 * @param matchedText the text that triggered the issue (nullable)
 */
public record LatexIssue(
        LatexIssueType type,
        Severity severity,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }
}
