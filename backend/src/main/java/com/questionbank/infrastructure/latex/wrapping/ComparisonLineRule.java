package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.preprocessing.SpanTable;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Wraps a whole line that reads as a formula: markup, then a comparison
 * operator, then more markup, e.g. {@code x^{2} + y^{2} = r^{2}}.
 * <p>
 * Lines that already hold math or look like prose are left alone.
 * </p>
 */
public class ComparisonLineRule implements WrapRule {

    private final Pattern sentenceOpener;

    public ComparisonLineRule(List<String> sentenceOpeners) {
        String configured = sentenceOpeners.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.sentenceOpener = Pattern.compile(
                "^(?:[A-Z][a-z]{2,}|[a-z]{2,}" + (configured.isEmpty() ? "" : "|" + configured) + ")\\s"
        );
    }

    @Override
    public String name() {
        return "comparison-line";
    }

    @Override
    public String apply(String text, SpanTable spans) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(wrapLine(lines[i], spans));
        }
        return sb.toString();
    }

    private String wrapLine(String line, SpanTable spans) {
        if (line.indexOf('$') >= 0 || SpanTable.containsPlaceholder(line)) {
            return line;
        }
        if (!hasComparisonBetweenMarkup(line)) {
            return line;
        }
        String trimmed = line.strip();
        if (sentenceOpener.matcher(trimmed).find()) {
            return line;
        }

        int start = line.indexOf(trimmed);
        int end = start + trimmed.length();
        return line.substring(0, start) + spans.wrapInline(trimmed) + line.substring(end);
    }

    boolean hasComparisonBetweenMarkup(String line) {
        Matcher markup = LatexMarkup.MARKUP_TOKEN.matcher(line);
        int firstEnd = -1;
        int lastStart = -1;
        while (markup.find()) {
            if (firstEnd < 0) {
                firstEnd = markup.end();
            }
            lastStart = markup.start();
        }
        if (firstEnd < 0 || lastStart < firstEnd) {
            return false;
        }
        for (int i = firstEnd; i < lastStart; i++) {
            char c = line.charAt(i);
            if (c == '<' || c == '>' || c == '=') {
                return true;
            }
        }
        return false;
    }
}
