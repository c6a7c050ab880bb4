package com.questionbank.domain.latex.model;

import java.util.List;

/**
 * Result of LaTeX validation.
 *
 * @param valid  true if no ERROR-level issues were found
 * @param issues all issues, errors and warnings
 */
public record LatexValidationResult(
        boolean valid,
        List<LatexIssue> issues
) {
    public List<LatexIssue> errors() {
        return issues.stream().filter(i -> i.severity() == LatexIssue.Severity.ERROR).toList();
    }

    public List<LatexIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == LatexIssue.Severity.WARNING).toList();
    }
}
