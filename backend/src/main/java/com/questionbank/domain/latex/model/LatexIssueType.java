package com.questionbank.domain.latex.model;

public enum LatexIssueType {
    UNMATCHED_DOLLAR,
    UNBALANCED_BRACES,
    UNDELIMITED_COMMANDS
}
