package com.questionbank.infrastructure.latex.preprocessing;

import com.questionbank.domain.latex.model.ProtectedSpanKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks text that the repair rules must never touch.
 * <p>
 * Two passes, run at different points of the pipeline:
 * <ol>
 *   <li>{@link #shieldLiterals}: escaped dollars and private-use characters</li>
 *   <li>{@link #protectExisting}: math that already has delimiters</li>
 * </ol>
 */
@Slf4j
@Component
public class MathSpanProtector {

    // Escaped backslash pairs are skipped so that "\\$" keeps its dollar active
    private static final Pattern LITERALS = Pattern.compile(
            "\\\\\\\\|\\\\\\$|[\\x{E000}-\\x{E01F}]"
    );

    private static final String ESCAPED_DOLLAR = "\\$";

    /**
     * Existing delimited math. At each position the alternatives are tried in
     * priority order: {@code \[..\]}, {@code $$..$$}, {@code \(..\)}, {@code $..$}.
     * Inline content never crosses a newline; display content never holds a dollar.
     */
    public static final Pattern EXISTING_MATH = Pattern.compile(
            "(?<display>(?<!\\\\)\\\\\\[[^$\\x{E004}]+?(?<!\\\\)\\\\\\]|\\$\\$[^$]+?\\$\\$)"
                    + "|(?<inline>(?<!\\\\)\\\\\\([^\\n$\\x{E004}]+?(?<!\\\\)\\\\\\)|\\$[^$\\n]+?\\$)"
    );

    /**
     * Protect escaped dollars ({@code \$}) and characters of the placeholder range.
     */
    public String shieldLiterals(String text, SpanTable spans) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        Matcher matcher = LITERALS.matcher(text);
        StringBuilder sb = new StringBuilder();
        int shielded = 0;
        while (matcher.find()) {
            String found = matcher.group();
            String replacement = found;
            if (!"\\\\".equals(found)) {
                replacement = spans.protect(ProtectedSpanKind.LITERAL, found, found);
                shielded++;
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);

        if (shielded > 0) {
            log.debug("Shielded {} literal characters", shielded);
        }
        return sb.toString();
    }

    /**
     * Replace every already-delimited math span with a placeholder. A dollar that
     * no span claims is shielded as an escaped literal, so the delimiters added by
     * the wrap rules can never pair with it.
     *
     * @param text  text after delimiter normalization
     * @param spans the call's span table
     * @return masked text, free of active dollars
     */
    public String protectExisting(String text, SpanTable spans) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        Matcher matcher = EXISTING_MATH.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        int before = spans.size();
        int cursor = 0;
        int stray = 0;
        while (matcher.find()) {
            stray += appendShieldingStrayDollars(sb, text, cursor, matcher.start(), spans);
            String found = matcher.group();
            if (matcher.group("display") != null) {
                sb.append(spans.protect(ProtectedSpanKind.DISPLAY_MATH, found, found));
            } else {
                sb.append(spans.protect(ProtectedSpanKind.INLINE_MATH, found, inlineBody(found)));
            }
            cursor = matcher.end();
        }
        stray += appendShieldingStrayDollars(sb, text, cursor, text.length(), spans);

        log.debug("Protected {} existing math spans, escaped {} stray dollars",
                spans.size() - before - stray, stray);
        return sb.toString();
    }

    private static int appendShieldingStrayDollars(StringBuilder sb, String text, int from, int to, SpanTable spans) {
        int shielded = 0;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c == '$') {
                sb.append(spans.protect(ProtectedSpanKind.LITERAL, ESCAPED_DOLLAR, ESCAPED_DOLLAR));
                shielded++;
            } else {
                sb.append(c);
            }
        }
        return shielded;
    }

    private static String inlineBody(String span) {
        if (span.startsWith("\\(")) {
            return span.substring(2, span.length() - 2);
        }
        return span.substring(1, span.length() - 1);
    }
}
