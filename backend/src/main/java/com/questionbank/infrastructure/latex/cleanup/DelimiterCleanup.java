package com.questionbank.infrastructure.latex.cleanup;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tidy-up of inline delimiters around merging. {@link #fixNestedDegrees} runs
 * before the merge, {@link #clean} after it. Display and literal spans are
 * still masked in both.
 */
@Component
public class DelimiterCleanup {

    // $30^{$\circ$}$
    private static final Pattern NESTED_DEGREE_WRAPPED = Pattern.compile(
            "\\$(\\d+)[ \\t]*\\^[ \\t]*\\{\\$\\\\circ\\$\\}\\$"
    );

    // 30^{$\circ$}, not after a decimal point or an escaping backslash
    private static final Pattern NESTED_DEGREE_BARE = Pattern.compile(
            "(?<![\\d.$\\\\])(\\d+)[ \\t]*\\^[ \\t]*\\{\\$\\\\circ\\$\\}(?!\\$)"
    );

    private static final Pattern INLINE_SPAN = Pattern.compile("\\$([^$\\n]+?)\\$");

    private static final Pattern LINE_END_AHEAD = Pattern.compile("[ \\t\\r]*\\n");

    // The first marker must not be one escaped in step 2
    private static final Pattern EMPTY_PAIR = Pattern.compile("(?<!\\\\)\\$[ \\t]*\\$");

    /**
     * Turn a degree whose {@code \circ} was wrapped on its own into one span.
     * Runs before merging so the merger sees the repaired span.
     */
    public String fixNestedDegrees(String text) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        String result = NESTED_DEGREE_WRAPPED.matcher(text)
                .replaceAll(m -> Matcher.quoteReplacement("$" + m.group(1) + "^{\\circ}$"));
        return NESTED_DEGREE_BARE.matcher(result)
                .replaceAll(m -> Matcher.quoteReplacement("$" + m.group(1) + "^{\\circ}$"));
    }

    /**
     * Clean up the merged document.
     *
     * @param text merged text, display math still masked
     * @return text in which every unescaped dollar belongs to a one-line pair
     */
    public String clean(String text) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }

        // 1. A colon closing a line belongs to the span it follows
        String result = moveTrailingColons(text);

        // 2. Escape dollars that no pair claims
        result = escapeUnpaired(result);

        // 3. Empty pairs and "$$" between touching spans collapse to a space.
        //    Each match removes two consecutive markers, so pairing is kept.
        result = EMPTY_PAIR.matcher(result).replaceAll(" ");

        return result;
    }

    /**
     * {@code $expr$:} followed by a line end becomes {@code $expr:$}.
     */
    String moveTrailingColons(String text) {
        if (text.indexOf(':') < 0) {
            return text;
        }
        Matcher matcher = INLINE_SPAN.matcher(text);
        Matcher lineEnd = LINE_END_AHEAD.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        int cursor = 0;
        while (matcher.find()) {
            int end = matcher.end();
            if (end < text.length() && text.charAt(end) == ':'
                    && lineEnd.region(end + 1, text.length()).lookingAt()) {
                sb.append(text, cursor, matcher.start())
                        .append('$').append(matcher.group(1)).append(":$");
                cursor = end + 1;
            }
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }

    String escapeUnpaired(String text) {
        Matcher matcher = INLINE_SPAN.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 8);
        int cursor = 0;
        while (matcher.find()) {
            sb.append(text.substring(cursor, matcher.start()).replace("$", "\\$"));
            sb.append(matcher.group());
            cursor = matcher.end();
        }
        sb.append(text.substring(cursor).replace("$", "\\$"));
        return sb.toString();
    }
}
