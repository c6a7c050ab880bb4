package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.preprocessing.SpanTable;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Wraps a bare equation: a left-hand side (command, identifier or inline span),
 * optional braced scripts, {@code =}, and a right-hand side that stops before a
 * clause keyword, a line end or a sentence terminator.
 * <p>
 * A candidate is wrapped only if it carries markup or is a short symbolic
 * equation such as {@code v = u + a t}; plain prose like {@code x = 5} stays.
 * </p>
 */
public class EquationRule implements WrapRule {

    private static final Pattern MARKUP = Pattern.compile(
            "\\\\[a-zA-Z]+|[_^]\\{|" + SpanTable.INLINE_PLACEHOLDER_REGEX
    );

    // one-letter unknown, an arithmetic operator on the right, no words of three letters or more
    private static final Pattern SYMBOLIC = Pattern.compile(
            "[a-zA-Z]\\d*[ \\t]*=[ \\t]*(?![\\s\\S]*[a-zA-Z]{3})[\\s\\S]*[+\\-*/×·][\\s\\S]*"
    );

    private final Pattern equation;

    public EquationRule(List<String> clauseKeywords) {
        String keywords = clauseKeywords.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.equation = Pattern.compile(
                // a command or identifier left-hand side never starts inside a word or after a backslash
                "(?:(?<!\\\\)" + SpanTable.INLINE_PLACEHOLDER_REGEX
                        + "|(?<![\\\\\\w])(?:\\\\[a-zA-Z]+|[a-zA-Z_]\\w*))"
                        + "(?:[_^]\\{[^}\\n]+\\})*"
                        + "[ \\t]*=[ \\t]*"
                        + "(?:(?!\\b(?:" + keywords + ")\\b)[^\\n$\\x{E002}\\x{E003}])+?:?"
                        + "(?=\\s+(?:" + keywords + ")\\b|\\s*\\n|[.!?;](?:\\s|$)|$)"
        );
    }

    @Override
    public String name() {
        return "equation";
    }

    @Override
    public String apply(String text, SpanTable spans) {
        if (text == null || text.indexOf('=') < 0) {
            return text;
        }
        return equation.matcher(text).replaceAll(m -> Matcher.quoteReplacement(
                accepts(m.group()) ? spans.wrapInline(m.group()) : m.group()));
    }

    boolean accepts(String candidate) {
        return MARKUP.matcher(candidate).find() || SYMBOLIC.matcher(candidate).matches();
    }
}
