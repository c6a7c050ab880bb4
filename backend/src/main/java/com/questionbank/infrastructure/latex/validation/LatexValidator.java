package com.questionbank.infrastructure.latex.validation;

import com.questionbank.domain.latex.model.LatexIssue;
import com.questionbank.domain.latex.model.LatexIssue.Severity;
import com.questionbank.domain.latex.model.LatexIssueType;
import com.questionbank.domain.latex.model.LatexStats;
import com.questionbank.domain.latex.model.LatexValidationResult;
import com.questionbank.infrastructure.latex.preprocessing.MathSpanProtector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only checks over question text: delimiter parity, brace balance, and
 * commands left outside math. Also computes the counts shown by the dashboard.
 */
@Slf4j
@Component
public class LatexValidator {

    private static final Pattern COMMAND = Pattern.compile("\\\\[a-zA-Z]+");

    public LatexValidationResult validate(String text) {
        if (text == null || text.isEmpty()) {
            return new LatexValidationResult(true, List.of());
        }

        List<LatexIssue> issues = new ArrayList<>();

        // Rule 1: every unescaped $ has a partner
        int dollars = countUnescapedDollars(text);
        if (dollars % 2 != 0) {
            issues.add(new LatexIssue(
                    LatexIssueType.UNMATCHED_DOLLAR,
                    Severity.ERROR,
                    "Unmatched $ delimiters",
                    null));
        }

        // Rule 2: braces balance, escaped braces excluded
        int depth = braceDepth(text);
        if (depth != 0) {
            issues.add(new LatexIssue(
                    LatexIssueType.UNBALANCED_BRACES,
                    Severity.ERROR,
                    "Unmatched braces",
                    depth > 0 ? "{" : "}"));
        }

        // Rule 3: commands but no math delimiters at all
        Matcher command = COMMAND.matcher(text);
        if (command.find() && !MathSpanProtector.EXISTING_MATH.matcher(text).find()) {
            issues.add(new LatexIssue(
                    LatexIssueType.UNDELIMITED_COMMANDS,
                    Severity.WARNING,
                    "Contains LaTeX commands but no delimiters",
                    command.group()));
        }

        boolean valid = issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
        if (!valid) {
            log.debug("LaTeX validation failed: {}", issues.stream().map(LatexIssue::type).toList());
        }
        return new LatexValidationResult(valid, issues);
    }

    public LatexStats stats(String text) {
        if (text == null || text.isEmpty()) {
            return new LatexStats(0, 0, 0, 0, false);
        }

        int inline = 0;
        int display = 0;
        Matcher math = MathSpanProtector.EXISTING_MATH.matcher(text);
        while (math.find()) {
            if (math.group("display") != null) {
                display++;
            } else {
                inline++;
            }
        }

        int commands = 0;
        Matcher command = COMMAND.matcher(text);
        while (command.find()) {
            commands++;
        }

        LatexValidationResult validation = validate(text);
        boolean hasIssues = !validation.issues().isEmpty();
        return new LatexStats(inline, display, commands, inline + display, hasIssues);
    }

    /**
     * Count dollars not escaped by an odd run of backslashes.
     */
    static int countUnescapedDollars(String text) {
        int count = 0;
        int backslashes = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '$' && backslashes % 2 == 0) {
                count++;
            }
            backslashes = c == '\\' ? backslashes + 1 : 0;
        }
        return count;
    }

    /**
     * @return open minus close braces; a negative running depth counts as unbalanced
     */
    static int braceDepth(String text) {
        int depth = 0;
        int backslashes = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (backslashes % 2 == 0) {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth < 0) {
                        return depth;
                    }
                }
            }
            backslashes = c == '\\' ? backslashes + 1 : 0;
        }
        return depth;
    }
}
