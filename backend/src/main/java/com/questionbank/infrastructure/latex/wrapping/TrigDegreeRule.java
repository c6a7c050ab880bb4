package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.preprocessing.SpanTable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps a trigonometric command applied to an angle in degrees, e.g. {@code \cos 45^{\circ}}.
 */
public class TrigDegreeRule implements WrapRule {

    private static final Pattern TRIG_DEGREE = Pattern.compile(
            "\\\\(?:" + LatexMarkup.TRIG_COMMANDS + ")[ \\t]*" + LatexMarkup.DEGREE
    );

    @Override
    public String name() {
        return "trig-degree";
    }

    @Override
    public String apply(String text, SpanTable spans) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        // an odd run of backslashes before the command escapes it
        return TRIG_DEGREE.matcher(text).replaceAll(m -> Matcher.quoteReplacement(
                LatexMarkup.precedingBackslashes(text, m.start()) % 2 == 1
                        ? m.group()
                        : spans.wrapInline(m.group())));
    }
}
