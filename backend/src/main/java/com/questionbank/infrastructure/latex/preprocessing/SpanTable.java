package com.questionbank.infrastructure.latex.preprocessing;

import com.questionbank.domain.latex.model.ProtectedSpan;
import com.questionbank.domain.latex.model.ProtectedSpanKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Append-only table of the spans masked during one repair call.
 * <p>
 * A placeholder is an opening sentinel, the span id written with private-use
 * "digit" characters (U+E010 to U+E019), and a closing sentinel. Every character
 * of a placeholder lies in U+E000 to U+E01F, a range that is shielded from the
 * input before any placeholder is issued.
 * </p>
 * Not thread-safe; create one per call.
 */
public final class SpanTable {

    private static final char DIGIT_ZERO = '\uE010';

    /** Any character a placeholder may be built from. */
    public static final Pattern RESERVED_CHARS = Pattern.compile("[\\x{E000}-\\x{E01F}]");

    public static final String INLINE_PLACEHOLDER_REGEX = "\\x{E000}[\\x{E010}-\\x{E019}]+\\x{E001}";

    public static final Pattern INLINE_PLACEHOLDER = Pattern.compile(INLINE_PLACEHOLDER_REGEX);

    public static final Pattern ANY_PLACEHOLDER = Pattern.compile(
            "[\\x{E000}\\x{E002}\\x{E004}][\\x{E010}-\\x{E019}]+[\\x{E001}\\x{E003}\\x{E005}]"
    );

    private final List<ProtectedSpan> spans = new ArrayList<>();

    /**
     * Register a span and return the placeholder that stands in for it.
     */
    public String protect(ProtectedSpanKind kind, String text, String body) {
        int id = spans.size();
        String placeholder = placeholderFor(kind, id);
        spans.add(new ProtectedSpan(id, kind, text, body, placeholder));
        return placeholder;
    }

    /**
     * Wrap a region of the masked document in inline delimiters and protect it.
     * Inline placeholders inside the region are absorbed: their bodies are
     * inlined so the result never nests delimiters.
     *
     * @param region masked text to wrap
     * @return placeholder of the new inline span
     */
    public String wrapInline(String region) {
        String body = absorbInline(region);
        // a body ending in an odd backslash run would escape the closing delimiter
        if (endsWithOddBackslashes(body)) {
            body = body + " ";
        }
        return protect(ProtectedSpanKind.INLINE_MATH, "$" + body + "$", body);
    }

    /**
     * Replace every inline placeholder in {@code region} by the body of its span.
     */
    public String absorbInline(String region) {
        Matcher matcher = INLINE_PLACEHOLDER.matcher(region);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            ProtectedSpan span = find(matcher.group()).orElse(null);
            String replacement = span != null ? span.body() : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public Optional<ProtectedSpan> find(String placeholder) {
        int id = decodeId(placeholder);
        if (id < 0 || id >= spans.size()) {
            return Optional.empty();
        }
        ProtectedSpan span = spans.get(id);
        return span.placeholder().equals(placeholder) ? Optional.of(span) : Optional.empty();
    }

    public int size() {
        return spans.size();
    }

    public List<ProtectedSpan> spans() {
        return Collections.unmodifiableList(spans);
    }

    public static boolean containsPlaceholder(CharSequence text) {
        return RESERVED_CHARS.matcher(text).find();
    }

    static String placeholderFor(ProtectedSpanKind kind, int id) {
        String digits = Integer.toString(id);
        StringBuilder sb = new StringBuilder(digits.length() + 2);
        sb.append(kind.open());
        for (int i = 0; i < digits.length(); i++) {
            sb.append((char) (DIGIT_ZERO + (digits.charAt(i) - '0')));
        }
        sb.append(kind.close());
        return sb.toString();
    }

    static int decodeId(String placeholder) {
        if (placeholder == null || placeholder.length() < 3) {
            return -1;
        }
        int id = 0;
        for (int i = 1; i < placeholder.length() - 1; i++) {
            int digit = placeholder.charAt(i) - DIGIT_ZERO;
            if (digit < 0 || digit > 9) {
                return -1;
            }
            id = id * 10 + digit;
        }
        return id;
    }

    private static boolean endsWithOddBackslashes(String s) {
        int run = 0;
        for (int i = s.length() - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
            run++;
        }
        return run % 2 == 1;
    }
}
