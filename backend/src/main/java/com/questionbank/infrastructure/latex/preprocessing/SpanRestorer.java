package com.questionbank.infrastructure.latex.preprocessing;

import com.questionbank.domain.latex.model.ProtectedSpan;
import com.questionbank.domain.latex.model.ProtectedSpanKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Puts protected spans back in place of their placeholders.
 * <p>
 * Inline spans come back before the merge phase; display and literal spans stay
 * masked until the very end so that cleanup cannot alter them.
 * </p>
 */
@Slf4j
@Component
public class SpanRestorer {

    // Display spans may contain literal placeholders, so literals go last
    private static final List<ProtectedSpanKind> FULL_ORDER = List.of(
            ProtectedSpanKind.INLINE_MATH,
            ProtectedSpanKind.DISPLAY_MATH,
            ProtectedSpanKind.LITERAL
    );

    public String restoreInline(String text, SpanTable spans) {
        return restore(text, spans, ProtectedSpanKind.INLINE_MATH);
    }

    public String restoreAll(String text, SpanTable spans) {
        String result = text;
        for (ProtectedSpanKind kind : FULL_ORDER) {
            result = restore(result, spans, kind);
        }
        return result;
    }

    /**
     * Restore the placeholders of one kind. Unknown placeholders are left in place.
     */
    public String restore(String text, SpanTable spans, ProtectedSpanKind kind) {
        if (text == null || spans.size() == 0) {
            return text;
        }

        Matcher matcher = SpanTable.ANY_PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String placeholder = matcher.group();
            if (ProtectedSpanKind.fromOpen(placeholder.charAt(0)) != kind) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(placeholder));
                continue;
            }
            Optional<ProtectedSpan> span = spans.find(placeholder);
            if (span.isPresent()) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(span.get().text()));
            } else {
                log.warn("Placeholder of kind {} not found in span table (length={})", kind, placeholder.length());
                matcher.appendReplacement(sb, Matcher.quoteReplacement(placeholder));
            }
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
