package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.preprocessing.SpanTable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps angles in degree notation: first a command followed by an angle
 * ({@code \angle 30^{\circ}}), then any remaining standalone {@code 30^{\circ}}.
 */
public class DegreeNotationRule implements WrapRule {

    private static final Pattern COMMAND_DEGREE = Pattern.compile(
            "\\\\[a-zA-Z]+[ \\t]+" + LatexMarkup.DEGREE
    );

    private static final Pattern STANDALONE_DEGREE = Pattern.compile("(?<![\\d.])" + LatexMarkup.DEGREE);

    @Override
    public String name() {
        return "degree";
    }

    @Override
    public String apply(String text, SpanTable spans) {
        if (text == null || text.indexOf('^') < 0) {
            return text;
        }
        String result = COMMAND_DEGREE.matcher(text)
                .replaceAll(m -> wrapUnlessEscaped(text, m.start(), m.group(), spans));
        return STANDALONE_DEGREE.matcher(result)
                .replaceAll(m -> wrapUnlessEscaped(result, m.start(), m.group(), spans));
    }

    private static String wrapUnlessEscaped(String text, int start, String found, SpanTable spans) {
        boolean escaped = LatexMarkup.precedingBackslashes(text, start) % 2 == 1;
        return Matcher.quoteReplacement(escaped ? found : spans.wrapInline(found));
    }
}
