package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.preprocessing.SpanTable;

/**
 * Wraps each remaining backslash command together with its balanced arguments
 * and braced scripts, e.g. {@code \frac{a}{b}} or {@code \sqrt[3]{x}_{1}}.
 */
public class CommandRule implements WrapRule {

    @Override
    public String name() {
        return "command";
    }

    @Override
    public String apply(String text, SpanTable spans) {
        if (text == null || text.indexOf('\\') < 0) {
            return text;
        }

        StringBuilder sb = new StringBuilder(text.length() + 16);
        int cursor = 0;
        int i = text.indexOf('\\');
        while (i >= 0) {
            int end = LatexMarkup.scanCommand(text, i);
            // "\\name" is a line break followed by text
            if (end < 0 || LatexMarkup.precedingBackslashes(text, i) % 2 == 1) {
                i = text.indexOf('\\', i + 1);
                continue;
            }
            String region = text.substring(i, end);
            if (LatexMarkup.canWrap(region)) {
                sb.append(text, cursor, i).append(spans.wrapInline(region));
                cursor = end;
            }
            i = text.indexOf('\\', end);
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }
}
