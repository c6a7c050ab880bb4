package com.questionbank.infrastructure.latex.preprocessing;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites alternative math delimiters into dollar form:
 * - {@code \[ ... \]} to {@code $$ ... $$}
 * - {@code \( ... \)} to {@code $ ... $}
 * - bare math environments wrapped in {@code $$ ... $$}
 */
@Component
public class DelimiterNormalizer {

    public static final List<String> MATH_ENVIRONMENTS = List.of(
            "equation", "equation*",
            "align", "align*", "aligned",
            "alignat", "alignat*",
            "gather", "gather*", "gathered",
            "multline", "multline*",
            "flalign", "flalign*",
            "eqnarray", "eqnarray*"
    );

    // "\\[" is a line break with spacing, not an opening bracket.
    // Brackets around a dollar or an escaped dollar are left as they are.
    private static final Pattern DISPLAY_BRACKETS = Pattern.compile(
            "(?<!\\\\)\\\\\\[([^$\\x{E004}]+?)(?<!\\\\)\\\\\\]"
    );

    private static final Pattern INLINE_PARENS = Pattern.compile(
            "(?<!\\\\)\\\\\\([ \\t]*([^\\n$\\x{E004}]+?)[ \\t]*(?<!\\\\)\\\\\\)"
    );

    // Longest names first so "align*" is not cut to "align"
    private static final String ENVIRONMENT_NAMES = MATH_ENVIRONMENTS.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

    // Delimited regions are matched first so environments inside them are skipped
    private static final Pattern ENVIRONMENT_SCAN = Pattern.compile(
            "(?<wrapped>\\$\\$?[ \\t]*\\\\begin\\{(?<wname>" + ENVIRONMENT_NAMES + ")\\}[\\s\\S]*?\\\\end\\{\\k<wname>\\}[ \\t]*\\$\\$?)"
                    + "|(?<display>\\$\\$[^$]+?\\$\\$)"
                    + "|(?<inline>\\$[^$\\n]+?\\$)"
                    + "|(?<bare>(?<!\\\\)\\\\begin\\{(?<name>" + ENVIRONMENT_NAMES + ")\\}[\\s\\S]*?\\\\end\\{\\k<name>\\})"
    );

    /**
     * Normalize math delimiters. Idempotent.
     *
     * @param text raw question text
     * @return text using only dollar delimiters for math
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. \[ ... \] → $$ ... $$
        String result = DISPLAY_BRACKETS.matcher(text)
                .replaceAll(m -> Matcher.quoteReplacement("$$" + m.group(1) + "$$"));

        // 2. \( ... \) → $ ... $ (blanks inside the markers dropped)
        result = INLINE_PARENS.matcher(result)
                .replaceAll(m -> Matcher.quoteReplacement("$" + m.group(1) + "$"));

        // 3. Bare environments → $$ ... $$
        return wrapBareEnvironments(result);
    }

    private String wrapBareEnvironments(String text) {
        Matcher matcher = ENVIRONMENT_SCAN.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 8);
        while (matcher.find()) {
            String found = matcher.group();
            String replacement = matcher.group("bare") != null ? "$$" + found + "$$" : found;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
