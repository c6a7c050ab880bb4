package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.preprocessing.SpanTable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps an identifier carrying braced sub/superscripts, e.g. {@code x_{1}} or {@code a^{2}_{n}}.
 */
public class ScriptedIdentifierRule implements WrapRule {

    private static final Pattern IDENTIFIER_BEFORE_SCRIPT = Pattern.compile(
            "(?<!\\\\)\\b[a-zA-Z_]\\w*?(?=[_^]\\{)"
    );

    @Override
    public String name() {
        return "scripted-identifier";
    }

    @Override
    public String apply(String text, SpanTable spans) {
        if (text == null || text.indexOf('{') < 0) {
            return text;
        }

        Matcher matcher = IDENTIFIER_BEFORE_SCRIPT.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 16);
        int cursor = 0;
        while (matcher.find()) {
            if (matcher.start() < cursor) {
                continue;
            }
            int end = LatexMarkup.scanScripts(text, matcher.end());
            if (end == matcher.end()) {
                continue;
            }
            String region = text.substring(matcher.start(), end);
            if (!LatexMarkup.canWrap(region)) {
                continue;
            }
            sb.append(text, cursor, matcher.start()).append(spans.wrapInline(region));
            cursor = end;
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }
}
